package com.plugbox.api.exception;

public class PluginAlreadyInstalledException extends PlugBoxException {

    public PluginAlreadyInstalledException(String message) {
        super(ErrorKind.ALREADY_INSTALLED, message);
    }

    public PluginAlreadyInstalledException(String message, Throwable cause) {
        super(ErrorKind.ALREADY_INSTALLED, message, cause);
    }
}
