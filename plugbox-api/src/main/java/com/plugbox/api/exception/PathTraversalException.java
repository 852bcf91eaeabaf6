package com.plugbox.api.exception;

/**
 * 路径越界异常
 * 解析后的路径逃逸出插件私有目录，按安全违规处理，而不是普通 IO 错误。
 */
public class PathTraversalException extends PlugBoxException {

    public PathTraversalException(String message) {
        super(ErrorKind.PATH_TRAVERSAL, message);
    }

    public PathTraversalException(String message, Throwable cause) {
        super(ErrorKind.PATH_TRAVERSAL, message, cause);
    }
}
