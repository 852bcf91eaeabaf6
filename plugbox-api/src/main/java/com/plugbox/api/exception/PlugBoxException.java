package com.plugbox.api.exception;

import lombok.Getter;

/**
 * PlugBox 基础异常
 *
 * @author PlugBox
 */
@Getter
public class PlugBoxException extends RuntimeException {

    private final ErrorKind kind;

    public PlugBoxException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlugBoxException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
