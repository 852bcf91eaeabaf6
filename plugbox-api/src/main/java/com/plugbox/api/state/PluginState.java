package com.plugbox.api.state;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 插件持久化状态，对应插件目录下的 state.yml
 * <p>
 * 只由 PluginManager 持有和修改；沙箱只返回结果或异常，由 Manager 合并进状态。
 * 对外暴露时一律返回 {@link #copy()}。
 * </p>
 */
@Data
@NoArgsConstructor
public class PluginState {

    private String id;
    private PluginStatus status = PluginStatus.INSTALLED;

    /**
     * 当前安装的版本
     */
    private String version;
    private Instant installedAt;

    /**
     * 仅在 ENABLED 时存在
     */
    private Instant enabledAt;
    private String lastError;

    /**
     * 覆盖清单 defaultConfig 的配置项
     */
    private Map<String, Object> config = new LinkedHashMap<>();
    private PluginMetrics metrics = new PluginMetrics();

    /**
     * 首次安装时的初始状态
     */
    public static PluginState installed(String id, String version, Instant installedAt) {
        PluginState state = new PluginState();
        state.id = id;
        state.version = version;
        state.installedAt = installedAt;
        state.status = PluginStatus.INSTALLED;
        return state;
    }

    public PluginState copy() {
        PluginState copy = new PluginState();
        copy.id = this.id;
        copy.status = this.status;
        copy.version = this.version;
        copy.installedAt = this.installedAt;
        copy.enabledAt = this.enabledAt;
        copy.lastError = this.lastError;
        copy.config = this.config != null ? new LinkedHashMap<>(this.config) : new LinkedHashMap<>();
        copy.metrics = this.metrics != null ? this.metrics.copy() : new PluginMetrics();
        return copy;
    }
}
