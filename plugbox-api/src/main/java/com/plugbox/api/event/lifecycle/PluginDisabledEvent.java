package com.plugbox.api.event.lifecycle;

/**
 * 禁用完成事件
 */
public class PluginDisabledEvent extends PluginLifecycleEvent {
    public PluginDisabledEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
