package com.plugbox.api.exception;

/**
 * RPC 调用在截止时间内未收到响应
 */
public class SandboxTimeoutException extends PlugBoxException {

    public SandboxTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public SandboxTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
