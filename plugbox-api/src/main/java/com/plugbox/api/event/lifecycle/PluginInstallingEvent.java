package com.plugbox.api.event.lifecycle;

/**
 * 安装前置事件
 * 场景：安全审查、配额检查。监听器抛出异常即可拦截安装
 */
public class PluginInstallingEvent extends PluginLifecycleEvent {
    public PluginInstallingEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
