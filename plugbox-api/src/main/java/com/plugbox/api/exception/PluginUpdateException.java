package com.plugbox.api.exception;

/**
 * 升级失败
 * 升级 = 卸载 + 安装，非原子操作。抛出此异常时旧版本已被卸载，插件处于未安装状态。
 */
public class PluginUpdateException extends PlugBoxException {

    public PluginUpdateException(String message) {
        super(ErrorKind.UPDATE_INCOMPLETE, message);
    }

    public PluginUpdateException(String message, Throwable cause) {
        super(ErrorKind.UPDATE_INCOMPLETE, message, cause);
    }
}
