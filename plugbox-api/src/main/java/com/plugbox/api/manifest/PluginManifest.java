package com.plugbox.api.manifest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 插件清单，对应插件目录下的 plugin.yml
 * <p>
 * 加载后不可变。只能由 {@code ManifestValidator} 从原始结构构建，保证字段已校验。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PluginManifest {

    // === 基础元数据 ===
    String id;
    String name;
    String version;
    String description;
    String author;
    String homepage;
    String repository;
    String license;

    PluginType type;
    @Singular
    List<String> categories;
    @Singular
    List<String> tags;

    /**
     * 宿主版本要求 (semver range)
     */
    String engineRange;

    /**
     * 依赖插件 id -> semver range，仅作记录，不做解析安装
     */
    @Singular
    Map<String, String> dependencies;

    // === 能力与权限 ===
    @Singular
    Set<String> capabilities;
    @Builder.Default
    PluginPermissions permissions = PluginPermissions.none();

    // === 入口 ===
    /**
     * 入口类全限定名，必须实现 SandboxedPlugin
     */
    String main;
    String worker;
    String ui;

    // === 配置 ===
    @Singular("configSchemaEntry")
    Map<String, Map<String, Object>> configSchema;
    @Singular("defaultConfigEntry")
    Map<String, Object> defaultConfig;

    @Override
    public String toString() {
        return String.format("PluginManifest{id='%s', version='%s', type=%s}", id, version, type);
    }
}
