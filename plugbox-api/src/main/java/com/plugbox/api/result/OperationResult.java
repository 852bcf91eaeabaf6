package com.plugbox.api.result;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PlugBoxException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 宿主侧操作结果信封
 * 每个对外操作都返回成功结果或带稳定错误类型的失败结果，不向宿主抛出异常。
 *
 * @param <T> 数据类型
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {

    private final boolean success;
    private final T data;
    private final ErrorKind errorKind;
    private final String message;

    public static <T> OperationResult<T> ok(T data) {
        return new OperationResult<>(true, data, null, null);
    }

    public static OperationResult<Void> ok() {
        return new OperationResult<>(true, null, null, null);
    }

    public static <T> OperationResult<T> error(ErrorKind kind, String message) {
        return new OperationResult<>(false, null, kind, message);
    }

    public static <T> OperationResult<T> error(PlugBoxException e) {
        return error(e.getKind(), e.getMessage());
    }

    @Override
    public String toString() {
        return success
                ? "OperationResult{success, data=" + data + "}"
                : "OperationResult{error=" + errorKind + ", message='" + message + "'}";
    }
}
