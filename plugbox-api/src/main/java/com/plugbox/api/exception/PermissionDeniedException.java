package com.plugbox.api.exception;

/**
 * 权限拒绝异常
 * 当插件尝试执行未经授权的操作时抛出此异常。
 */
public class PermissionDeniedException extends PlugBoxException {

    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(ErrorKind.PERMISSION_DENIED, message, cause);
    }
}
