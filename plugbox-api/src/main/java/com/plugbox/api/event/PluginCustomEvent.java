package com.plugbox.api.event;

import lombok.Getter;

/**
 * 插件通过 PluginApi.emit 发布的自定义事件
 */
@Getter
public class PluginCustomEvent extends AbstractPlugBoxEvent {
    private final String pluginId;
    private final String name;
    private final Object data;

    public PluginCustomEvent(String pluginId, String name, Object data) {
        super();
        this.pluginId = pluginId;
        this.name = name;
        this.data = data;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + pluginId + " event=" + name;
    }
}
