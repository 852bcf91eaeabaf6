package com.plugbox.core.plugin;

import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.state.PluginState;
import com.plugbox.api.state.PluginStatus;
import com.plugbox.core.sandbox.PluginSandbox;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 已安装插件的运行时记录
 * 状态的读写都在本对象的监视器下进行。
 */
@Getter
class InstalledPlugin {

    private final PluginManifest manifest;
    private final Path directory;
    private final PluginState state;

    @Setter
    private volatile PluginSandbox sandbox;

    InstalledPlugin(PluginManifest manifest, Path directory, PluginState state) {
        this.manifest = manifest;
        this.directory = directory;
        this.state = state;
    }

    String getId() {
        return manifest.getId();
    }

    synchronized PluginStatus status() {
        return state.getStatus();
    }

    synchronized PluginState snapshot() {
        return state.copy();
    }

    /**
     * 默认配置合并覆盖项
     */
    synchronized Map<String, Object> effectiveConfig() {
        Map<String, Object> merged = new LinkedHashMap<>(manifest.getDefaultConfig());
        merged.putAll(state.getConfig());
        return Collections.unmodifiableMap(merged);
    }
}
