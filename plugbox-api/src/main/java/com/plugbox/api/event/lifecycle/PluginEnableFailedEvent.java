package com.plugbox.api.event.lifecycle;

import com.plugbox.api.exception.ErrorKind;

/**
 * 启用失败事件
 */
public class PluginEnableFailedEvent extends PluginFailureEvent {
    public PluginEnableFailedEvent(String pluginId, String version, ErrorKind errorKind, String error) {
        super(pluginId, version, errorKind, error);
    }
}
