package com.plugbox.api.exception;

/**
 * 沙箱已销毁，挂起的请求全部以此异常拒绝
 */
public class SandboxTerminatedException extends PlugBoxException {

    public SandboxTerminatedException(String message) {
        super(ErrorKind.SANDBOX_TERMINATED, message);
    }

    public SandboxTerminatedException(String message, Throwable cause) {
        super(ErrorKind.SANDBOX_TERMINATED, message, cause);
    }
}
