package com.plugbox.core.sandbox;

import java.util.List;

/**
 * 宿主与插件工作线程之间的消息
 */
public sealed interface SandboxMessage {

    String id();

    /**
     * 保留方法名，分派到插件生命周期钩子
     */
    String METHOD_INITIALIZE = "initialize";
    String METHOD_CLEANUP = "cleanup";
    String METHOD_CONFIG_CHANGED = "configChanged";

    /**
     * 生命周期钩子只能由 PluginManager 驱动
     */
    static boolean isReserved(String method) {
        return METHOD_INITIALIZE.equals(method) || METHOD_CLEANUP.equals(method) || METHOD_CONFIG_CHANGED.equals(method);
    }

    /**
     * 调用请求
     */
    record Request(String id, String method, List<Object> args) implements SandboxMessage {
        public Request {
            args = args == null ? List.of() : args;
        }
    }

    /**
     * 调用结果，error 非空表示失败
     *
     * @param allocatedBytes 本次调用在工作线程上分配的字节数，JVM 不支持时为 null
     */
    record Response(String id, Object result, Throwable error, Long allocatedBytes) implements SandboxMessage {

        public static Response success(String id, Object result, Long allocatedBytes) {
            return new Response(id, result, null, allocatedBytes);
        }

        public static Response failure(String id, Throwable error) {
            return new Response(id, null, error, null);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
