package com.plugbox.core.state;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.ValidationException;
import com.plugbox.api.state.PluginMetrics;
import com.plugbox.api.state.PluginState;
import com.plugbox.api.state.PluginStatus;
import com.plugbox.core.loader.YamlDescriptors;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 插件状态持久化
 * <p>
 * 状态文件与插件同目录 (state.yml)。加载时做结构校验：
 * 文件缺失视为“从未配置”，文件损坏或状态值未知时回退为默认 installed 状态，
 * 保证坏状态永远不会阻止宿主启动。
 * </p>
 */
@Slf4j
public class PluginStateStore {

    public static final String STATE_FILE = "state.yml";

    private final Path pluginsRoot;
    private final Clock clock;

    public PluginStateStore(Path pluginsRoot, Clock clock) {
        this.pluginsRoot = pluginsRoot;
        this.clock = clock;
    }

    /**
     * 读取状态
     *
     * @param pluginId        插件ID
     * @param fallbackVersion 回退默认状态时使用的版本（通常为清单版本）
     */
    public PluginState load(String pluginId, String fallbackVersion) {
        return read(pluginId).orElseGet(() -> defaultState(pluginId, fallbackVersion));
    }

    /**
     * 读取并校验状态文件，缺失或损坏时返回 empty
     */
    public Optional<PluginState> read(String pluginId) {
        Path file = stateFile(pluginId);
        Map<String, Object> raw;
        try {
            raw = YamlDescriptors.read(file);
        } catch (NoSuchFileException e) {
            log.debug("[{}] No state file, treating as never configured", pluginId);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[{}] Unreadable state file {}, falling back to default: {}", pluginId, file, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(fromMap(pluginId, raw));
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Invalid state file, falling back to default: {}", pluginId, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(PluginState state) {
        Path file = stateFile(state.getId());
        try {
            YamlDescriptors.write(file, toMap(state));
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to persist state of plugin " + state.getId(), e);
        } catch (IllegalArgumentException | YAMLException e) {
            throw new ValidationException("State of plugin " + state.getId() + " is not storable: " + e.getMessage(), e);
        }
    }

    public PluginState defaultState(String pluginId, String version) {
        return PluginState.installed(pluginId, version, clock.instant());
    }

    private Path stateFile(String pluginId) {
        return pluginsRoot.resolve(pluginId).resolve(STATE_FILE);
    }

    // ==================== 序列化 ====================

    static Map<String, Object> toMap(PluginState state) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", state.getId());
        raw.put("status", state.getStatus().value());
        raw.put("version", state.getVersion());
        raw.put("installedAt", String.valueOf(state.getInstalledAt()));
        if (state.getEnabledAt() != null) {
            raw.put("enabledAt", state.getEnabledAt().toString());
        }
        if (state.getLastError() != null) {
            raw.put("lastError", state.getLastError());
        }
        raw.put("config", new LinkedHashMap<>(state.getConfig()));

        PluginMetrics metrics = state.getMetrics();
        Map<String, Object> rawMetrics = new LinkedHashMap<>();
        if (metrics.getLoadTime() != null) {
            rawMetrics.put("loadTime", metrics.getLoadTime());
        }
        if (metrics.getMemoryUsage() != null) {
            rawMetrics.put("memoryUsage", metrics.getMemoryUsage());
        }
        rawMetrics.put("executionCount", metrics.getExecutionCount());
        rawMetrics.put("errorCount", metrics.getErrorCount());
        raw.put("metrics", rawMetrics);
        return raw;
    }

    static PluginState fromMap(String expectedId, Map<String, Object> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("state file is empty");
        }
        Object id = raw.get("id");
        if (!expectedId.equals(id)) {
            throw new IllegalArgumentException("state references plugin " + id + " instead of " + expectedId);
        }
        PluginStatus status = PluginStatus.fromValue(String.valueOf(raw.get("status")))
                .orElseThrow(() -> new IllegalArgumentException("unknown status " + raw.get("status")));
        if (status == PluginStatus.LOADING) {
            // enable 中途被打断，按未启用处理
            status = PluginStatus.INSTALLED;
        }
        if (!(raw.get("version") instanceof String version)) {
            throw new IllegalArgumentException("version must be a string");
        }

        PluginState state = new PluginState();
        state.setId(expectedId);
        state.setStatus(status);
        state.setVersion(version);
        state.setInstalledAt(instant(raw.get("installedAt"), "installedAt"));
        if (status == PluginStatus.ENABLED && raw.get("enabledAt") != null) {
            state.setEnabledAt(instant(raw.get("enabledAt"), "enabledAt"));
        }
        if (raw.get("lastError") != null) {
            state.setLastError(String.valueOf(raw.get("lastError")));
        }
        if (raw.get("config") instanceof Map<?, ?> config) {
            config.forEach((k, v) -> state.getConfig().put(String.valueOf(k), v));
        } else if (raw.get("config") != null) {
            throw new IllegalArgumentException("config must be a mapping");
        }
        if (raw.get("metrics") instanceof Map<?, ?> metrics) {
            state.getMetrics().setLoadTime(longValue(metrics.get("loadTime")));
            state.getMetrics().setMemoryUsage(longValue(metrics.get("memoryUsage")));
            Long executions = longValue(metrics.get("executionCount"));
            Long errors = longValue(metrics.get("errorCount"));
            state.getMetrics().setExecutionCount(executions == null ? 0 : executions);
            state.getMetrics().setErrorCount(errors == null ? 0 : errors);
        }
        return state;
    }

    private static Instant instant(Object raw, String field) {
        if (raw == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        try {
            return Instant.parse(String.valueOf(raw));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " is not an ISO-8601 instant: " + raw);
        }
    }

    private static Long longValue(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException("metric must be numeric: " + raw);
    }
}
