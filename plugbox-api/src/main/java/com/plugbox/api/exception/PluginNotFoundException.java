package com.plugbox.api.exception;

public class PluginNotFoundException extends PlugBoxException {

    public PluginNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public PluginNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
