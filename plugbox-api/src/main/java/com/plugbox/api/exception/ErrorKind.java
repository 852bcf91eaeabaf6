package com.plugbox.api.exception;

/**
 * 错误类型
 * 对外暴露的稳定错误分类，宿主 UI/CLI 依据此枚举展示或重试。
 *
 * @author PlugBox
 */
public enum ErrorKind {
    /** 清单或状态不合法 */
    VALIDATION,
    /** 未授予能力 */
    PERMISSION_DENIED,
    /** 路径越界（安全违规） */
    PATH_TRAVERSAL,
    /** RPC 超时 */
    TIMEOUT,
    /** 沙箱启动失败 */
    SANDBOX_INIT_FAILURE,
    /** 沙箱已销毁 */
    SANDBOX_TERMINATED,
    /** 插件不存在 */
    NOT_FOUND,
    /** 插件未启用 */
    NOT_AVAILABLE,
    /** 插件已安装 */
    ALREADY_INSTALLED,
    /** 插件代码自身抛出的异常 */
    PLUGIN_ERROR,
    /** 注册中心异常 */
    REGISTRY,
    /** 文件读写异常 */
    IO,
    /** 升级中途失败，插件已被移除 */
    UPDATE_INCOMPLETE,
    /** 宿主未提供该能力的实现 */
    UNSUPPORTED,
    INTERNAL
}
