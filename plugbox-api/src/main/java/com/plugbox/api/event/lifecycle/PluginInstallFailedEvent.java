package com.plugbox.api.event.lifecycle;

import com.plugbox.api.exception.ErrorKind;

/**
 * 安装失败事件
 */
public class PluginInstallFailedEvent extends PluginFailureEvent {
    public PluginInstallFailedEvent(String pluginId, String version, ErrorKind errorKind, String error) {
        super(pluginId, version, errorKind, error);
    }
}
