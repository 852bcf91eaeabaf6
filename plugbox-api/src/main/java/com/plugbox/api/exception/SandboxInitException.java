package com.plugbox.api.exception;

/**
 * 沙箱启动失败（类加载失败、入口类不合法等）
 */
public class SandboxInitException extends PlugBoxException {

    public SandboxInitException(String message) {
        super(ErrorKind.SANDBOX_INIT_FAILURE, message);
    }

    public SandboxInitException(String message, Throwable cause) {
        super(ErrorKind.SANDBOX_INIT_FAILURE, message, cause);
    }
}
