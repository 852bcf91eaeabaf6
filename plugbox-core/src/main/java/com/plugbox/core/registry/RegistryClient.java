package com.plugbox.core.registry;

import com.plugbox.api.event.RegistrySyncedEvent;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.RegistryException;
import com.plugbox.api.registry.PluginSummary;
import com.plugbox.api.registry.SearchOptions;
import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.spi.RegistryTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 注册中心客户端
 * <p>
 * 读操作前先确认缓存新鲜度，超过窗口才同步；同步失败只记录日志，继续使用旧缓存
 * （可能为空）。同步成功时整个缓存被替换。
 * </p>
 */
@Slf4j
public class RegistryClient {

    private final RegistryTransport transport;
    private final Duration freshness;
    private final Clock clock;
    private final EventBus eventBus;

    /**
     * 插件ID -> 元数据，目录顺序；同步时整体替换，lastSync 即全部条目的同步时间
     */
    private volatile Map<String, PluginSummary> cache = Collections.emptyMap();
    private volatile Instant lastSync;

    public RegistryClient(RegistryTransport transport, PlugBoxConfig config, Clock clock, EventBus eventBus) {
        this.transport = transport;
        this.freshness = config.getRegistryFreshness();
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /**
     * 按名称、描述、标签做不区分大小写的子串匹配
     */
    public List<PluginSummary> search(String query, SearchOptions options) {
        SearchOptions opts = options != null ? options : SearchOptions.defaults();
        int limit = opts.getLimit() == null
                ? PlugBoxConfig.MAX_SEARCH_RESULTS
                : Math.min(opts.getLimit(), PlugBoxConfig.MAX_SEARCH_RESULTS);
        if (limit <= 0) {
            return List.of();
        }
        ensureSync();

        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<PluginSummary> results = new ArrayList<>();
        for (PluginSummary summary : cache.values()) {
            if (matchesQuery(summary, needle)
                    && (opts.getCategory() == null || summary.getCategories().contains(opts.getCategory()))
                    && (opts.getType() == null || opts.getType().equalsIgnoreCase(summary.getType()))) {
                results.add(summary);
                if (results.size() >= limit) {
                    break;
                }
            }
        }
        return results;
    }

    /**
     * 先查缓存，缓存没有再直接问传输层
     */
    public Optional<PluginSummary> getPlugin(String pluginId) {
        ensureSync();
        PluginSummary cached = cache.get(pluginId);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            return transport.getPlugin(pluginId);
        } catch (RuntimeException e) {
            throw wrap("Failed to look up plugin " + pluginId, e);
        }
    }

    public List<String> getVersions(String pluginId) {
        ensureSync();
        try {
            return List.copyOf(transport.getVersions(pluginId));
        } catch (RuntimeException e) {
            throw wrap("Failed to list versions of plugin " + pluginId, e);
        }
    }

    public byte[] downloadPlugin(String pluginId, String version) {
        ensureSync();
        log.info("[{}] Downloading version {}", pluginId, version);
        byte[] archive;
        try {
            archive = transport.download(pluginId, version);
        } catch (RuntimeException e) {
            throw wrap("Failed to download plugin " + pluginId + "@" + version, e);
        }
        if (archive == null || archive.length == 0) {
            throw new RegistryException("Registry returned an empty package for " + pluginId + "@" + version);
        }
        return archive;
    }

    /**
     * 强制同步
     */
    public void refresh() {
        lastSync = null;
        ensureSync();
    }

    public Optional<Instant> getLastSync() {
        return Optional.ofNullable(lastSync);
    }

    // ==================== 内部方法 ====================

    private synchronized void ensureSync() {
        Instant now = clock.instant();
        if (lastSync != null && Duration.between(lastSync, now).compareTo(freshness) <= 0) {
            return;
        }
        try {
            List<PluginSummary> catalog = transport.search("");
            Map<String, PluginSummary> fresh = new LinkedHashMap<>();
            for (PluginSummary summary : catalog) {
                fresh.put(summary.getId(), summary);
            }
            cache = Collections.unmodifiableMap(fresh);
            lastSync = now;
            log.info("Registry synced: {} plugin(s)", fresh.size());
            eventBus.publishQuietly(new RegistrySyncedEvent(fresh.size()));
        } catch (RuntimeException e) {
            // 不更新 lastSync，下次读取会重试
            log.warn("Registry sync failed, serving {} cached entr(ies): {}", cache.size(), e.getMessage());
        }
    }

    private static boolean matchesQuery(PluginSummary summary, String needle) {
        if (needle.isEmpty()) {
            return true;
        }
        if (contains(summary.getName(), needle) || contains(summary.getDescription(), needle)) {
            return true;
        }
        for (String tag : summary.getTags()) {
            if (contains(tag, needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static PlugBoxException wrap(String message, RuntimeException e) {
        if (e instanceof PlugBoxException pbe) {
            return pbe;
        }
        return new RegistryException(message + ": " + e.getMessage(), e);
    }
}
