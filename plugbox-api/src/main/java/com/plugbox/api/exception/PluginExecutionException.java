package com.plugbox.api.exception;

/**
 * 插件方法自身抛出的异常
 */
public class PluginExecutionException extends PlugBoxException {

    public PluginExecutionException(String message) {
        super(ErrorKind.PLUGIN_ERROR, message);
    }

    public PluginExecutionException(String message, Throwable cause) {
        super(ErrorKind.PLUGIN_ERROR, message, cause);
    }
}
