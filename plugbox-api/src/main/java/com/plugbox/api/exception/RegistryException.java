package com.plugbox.api.exception;

public class RegistryException extends PlugBoxException {

    public RegistryException(String message) {
        super(ErrorKind.REGISTRY, message);
    }

    public RegistryException(String message, Throwable cause) {
        super(ErrorKind.REGISTRY, message, cause);
    }
}
