package com.plugbox.api.event.lifecycle;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 配置变更事件
 */
@Getter
public class PluginConfigChangedEvent extends PluginLifecycleEvent {
    private final Map<String, Object> patch;

    public PluginConfigChangedEvent(String pluginId, String version, Map<String, Object> patch) {
        super(pluginId, version);
        this.patch = Collections.unmodifiableMap(new LinkedHashMap<>(patch));
    }
}
