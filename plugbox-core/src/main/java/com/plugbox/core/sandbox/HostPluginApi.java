package com.plugbox.core.sandbox;

import com.plugbox.api.event.PluginCustomEvent;
import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.plugin.PluginApi;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.security.SandboxPathResolver;
import com.plugbox.core.spi.HostServices;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * PluginApi 的宿主实现
 * <p>
 * 不做任何权限判断，只由 PermissionGate 代理后交给插件。
 * 未提供的协作方返回 UNSUPPORTED。
 * </p>
 */
@Slf4j
public class HostPluginApi implements PluginApi {

    private final PluginManifest manifest;
    private final Supplier<Map<String, Object>> configView;
    private final HostServices services;
    private final SandboxPathResolver pathResolver;
    private final EventBus eventBus;

    public HostPluginApi(PluginManifest manifest,
                         Supplier<Map<String, Object>> configView,
                         HostServices services,
                         SandboxPathResolver pathResolver,
                         EventBus eventBus) {
        this.manifest = manifest;
        this.configView = configView;
        this.services = services != null ? services : HostServices.none();
        this.pathResolver = pathResolver;
        this.eventBus = eventBus;
    }

    @Override
    public String getPluginId() {
        return manifest.getId();
    }

    @Override
    public PluginManifest getManifest() {
        return manifest;
    }

    @Override
    public Map<String, Object> getConfig() {
        return configView.get();
    }

    @Override
    public void emit(String event, Object data) {
        eventBus.publishQuietly(new PluginCustomEvent(manifest.getId(), event, data));
    }

    @Override
    public String createAgent(Map<String, Object> config) {
        return require(services.getAgentRuntime(), "agent runtime").createAgent(manifest.getId(), config);
    }

    @Override
    public Object executeAgent(String agentId, Map<String, Object> task) {
        return require(services.getAgentRuntime(), "agent runtime").executeAgent(agentId, task);
    }

    @Override
    public void stopAgent(String agentId) {
        require(services.getAgentRuntime(), "agent runtime").stopAgent(agentId);
    }

    @Override
    public Object executeModel(String modelId, String prompt, Map<String, Object> options) {
        return require(services.getModelManager(), "model manager").execute(modelId, prompt, options);
    }

    @Override
    public String storeMemory(String content, String type, Map<String, Object> metadata) {
        return require(services.getMemoryEngine(), "memory engine").store(manifest.getId(), content, type, metadata);
    }

    @Override
    public List<Map<String, Object>> searchMemory(String query, Map<String, Object> options) {
        return require(services.getMemoryEngine(), "memory engine").search(manifest.getId(), query, options);
    }

    @Override
    public void registerPanel(Map<String, Object> panel) {
        require(services.getUiBridge(), "ui bridge").registerPanel(manifest.getId(), panel);
    }

    @Override
    public void registerCommand(Map<String, Object> command) {
        require(services.getUiBridge(), "ui bridge").registerCommand(manifest.getId(), command);
    }

    @Override
    public void registerMenuItem(Map<String, Object> item) {
        require(services.getUiBridge(), "ui bridge").registerMenuItem(manifest.getId(), item);
    }

    @Override
    public void showNotification(Map<String, Object> notification) {
        require(services.getUiBridge(), "ui bridge").showNotification(manifest.getId(), notification);
    }

    @Override
    public String readFile(String path) {
        Path file = pathResolver.resolve(path);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new PlugBoxException(ErrorKind.NOT_FOUND, "File not found: " + pathResolver.relativize(file));
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to read " + pathResolver.relativize(file), e);
        }
    }

    @Override
    public void writeFile(String path, String content) {
        Path file = pathResolver.resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("[{}] Wrote {}", manifest.getId(), pathResolver.relativize(file));
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to write " + pathResolver.relativize(file), e);
        }
    }

    @Override
    public Map<String, Object> fetch(String url, Map<String, Object> options) {
        return require(services.getNetworkGateway(), "network gateway").fetch(url, options);
    }

    private <T> T require(T service, String name) {
        if (service == null) {
            throw new PlugBoxException(ErrorKind.UNSUPPORTED, "Host does not provide a " + name);
        }
        return service;
    }
}
