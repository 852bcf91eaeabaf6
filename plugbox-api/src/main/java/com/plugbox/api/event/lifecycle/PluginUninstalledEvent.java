package com.plugbox.api.event.lifecycle;

/**
 * 卸载完成事件
 * 场景：清理外部配置
 */
public class PluginUninstalledEvent extends PluginLifecycleEvent {
    public PluginUninstalledEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
