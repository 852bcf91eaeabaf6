package com.plugbox.api.plugin;

import java.util.List;
import java.util.Map;

/**
 * 插件入口接口
 * 清单 main 指向的类必须实现此接口，并提供公开的无参构造器。
 * <p>
 * 所有方法都在插件自己的工作线程上执行，不会占用宿主线程。
 * </p>
 *
 * @author PlugBox
 */
public interface SandboxedPlugin {

    /**
     * 启用时调用
     *
     * @param api 受权限闸门保护的宿主能力
     */
    default void initialize(PluginApi api) throws Exception {
        // Default empty implementation
    }

    /**
     * 禁用时调用，用于释放资源
     */
    default void cleanup() throws Exception {
        // Default empty implementation
    }

    /**
     * 配置变更通知
     *
     * @param patch 本次合并进配置的键值
     */
    default void configChanged(Map<String, Object> patch) throws Exception {
        // Default empty implementation
    }

    /**
     * 执行插件方法
     *
     * @param method 方法名
     * @param args   参数列表
     * @return 执行结果
     */
    Object invoke(String method, List<Object> args) throws Exception;
}
