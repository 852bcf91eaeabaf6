package com.plugbox.core.fixture;

import com.plugbox.api.registry.PluginSummary;
import com.plugbox.core.spi.RegistryTransport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存注册中心，最后发布的版本即为目录中的最新版本
 */
public class InMemoryRegistry implements RegistryTransport {

    private final Map<String, PluginSummary> catalog = new LinkedHashMap<>();
    private final Map<String, Map<String, byte[]>> packages = new LinkedHashMap<>();
    private final AtomicInteger searchCalls = new AtomicInteger();
    private volatile boolean failing;

    public synchronized InMemoryRegistry publish(String id, String version, byte[] archive) {
        catalog.put(id, PluginSummary.builder()
                .id(id)
                .name("Plugin " + id)
                .description("Test plugin " + id)
                .type("tool")
                .version(version)
                .build());
        packages.computeIfAbsent(id, k -> new LinkedHashMap<>()).put(version, archive);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int searchCalls() {
        return searchCalls.get();
    }

    @Override
    public synchronized List<PluginSummary> search(String query) {
        searchCalls.incrementAndGet();
        checkAvailable();
        return new ArrayList<>(catalog.values());
    }

    @Override
    public synchronized Optional<PluginSummary> getPlugin(String pluginId) {
        checkAvailable();
        return Optional.ofNullable(catalog.get(pluginId));
    }

    @Override
    public synchronized List<String> getVersions(String pluginId) {
        checkAvailable();
        return new ArrayList<>(packages.getOrDefault(pluginId, Map.of()).keySet());
    }

    @Override
    public synchronized byte[] download(String pluginId, String version) {
        checkAvailable();
        return packages.getOrDefault(pluginId, Map.of()).get(version);
    }

    private void checkAvailable() {
        if (failing) {
            throw new IllegalStateException("registry unreachable");
        }
    }
}
