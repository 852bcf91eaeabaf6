package com.plugbox.api.event.lifecycle;

/**
 * 启用完成事件
 */
public class PluginEnabledEvent extends PluginLifecycleEvent {
    public PluginEnabledEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
