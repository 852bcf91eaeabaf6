package com.plugbox.core.manifest;

import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.manifest.PluginPermissions;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 清单序列化：{@link PluginManifest} -> plugin.yml 原始结构
 * 与 {@link ManifestValidator#validate} 互逆。
 */
public final class ManifestWriter {

    private ManifestWriter() {
    }

    public static Map<String, Object> toMap(PluginManifest manifest) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", manifest.getId());
        raw.put("name", manifest.getName());
        raw.put("version", manifest.getVersion());
        raw.put("description", manifest.getDescription());
        putIfPresent(raw, "author", manifest.getAuthor());
        putIfPresent(raw, "homepage", manifest.getHomepage());
        putIfPresent(raw, "repository", manifest.getRepository());
        putIfPresent(raw, "license", manifest.getLicense());
        raw.put("type", manifest.getType().value());
        raw.put("categories", manifest.getCategories());
        raw.put("tags", manifest.getTags());
        raw.put("engine", Map.of("host", manifest.getEngineRange()));
        if (!manifest.getDependencies().isEmpty()) {
            raw.put("dependencies", new LinkedHashMap<>(manifest.getDependencies()));
        }
        raw.put("capabilities", manifest.getCapabilities().stream().toList());
        raw.put("permissions", permissionsToMap(manifest.getPermissions()));
        raw.put("main", manifest.getMain());
        putIfPresent(raw, "worker", manifest.getWorker());
        putIfPresent(raw, "ui", manifest.getUi());
        if (!manifest.getConfigSchema().isEmpty()) {
            raw.put("configSchema", new LinkedHashMap<>(manifest.getConfigSchema()));
        }
        if (!manifest.getDefaultConfig().isEmpty()) {
            raw.put("defaultConfig", new LinkedHashMap<>(manifest.getDefaultConfig()));
        }
        return raw;
    }

    private static Map<String, Object> permissionsToMap(PluginPermissions permissions) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("filesystem", Map.of(
                "read", permissions.getFilesystem().read(),
                "write", permissions.getFilesystem().write()));
        raw.put("network", Map.of(
                "domains", permissions.getNetwork().domains(),
                "external", permissions.getNetwork().external()));
        raw.put("agents", Map.of(
                "create", permissions.getAgents().create(),
                "execute", permissions.getAgents().execute(),
                "manage", permissions.getAgents().manage()));
        raw.put("models", Map.of(
                "access", permissions.getModels().access(),
                "execute", permissions.getModels().execute()));
        raw.put("memory", Map.of(
                "read", permissions.getMemory().read(),
                "write", permissions.getMemory().write()));
        raw.put("ui", Map.of(
                "panels", permissions.getUi().panels(),
                "menus", permissions.getUi().menus(),
                "commands", permissions.getUi().commands(),
                "notifications", permissions.getUi().notifications()));
        return raw;
    }

    private static void putIfPresent(Map<String, Object> raw, String key, String value) {
        if (value != null) {
            raw.put(key, value);
        }
    }
}
