package com.plugbox.api.exception;

/**
 * 清单或持久化状态校验失败
 */
public class ValidationException extends PlugBoxException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
