package com.plugbox.api.exception;

/**
 * 插件未处于 enabled 状态
 */
public class PluginNotAvailableException extends PlugBoxException {

    public PluginNotAvailableException(String message) {
        super(ErrorKind.NOT_AVAILABLE, message);
    }

    public PluginNotAvailableException(String message, Throwable cause) {
        super(ErrorKind.NOT_AVAILABLE, message, cause);
    }
}
