package com.plugbox.core.manifest;

import com.plugbox.api.exception.ValidationException;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.manifest.PluginPermissions;
import com.plugbox.api.manifest.PluginType;
import com.plugbox.api.security.Capabilities;
import com.plugbox.api.security.PermissionCategory;

import java.nio.file.FileSystems;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 插件清单校验器
 * <p>
 * 纯函数：输入为 plugin.yml 解析出的原始结构，输出不可变的 {@link PluginManifest}。
 * 所有问题汇总后一次性抛出 {@link ValidationException}。
 * </p>
 */
public class ManifestValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9._-]{0,127}$");
    private static final Pattern CLASS_NAME_PATTERN =
            Pattern.compile("^[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*$");

    private final SemverVersion hostVersion;

    public ManifestValidator(String hostVersion) {
        this.hostVersion = SemverVersion.parse(hostVersion)
                .orElseThrow(() -> new IllegalArgumentException("Invalid host version: " + hostVersion));
    }

    public PluginManifest validate(Map<String, ?> raw) {
        if (raw == null) {
            throw new ValidationException("Manifest is empty");
        }
        Issues issues = new Issues();
        PluginManifest.PluginManifestBuilder builder = PluginManifest.builder();

        // === 基础元数据 ===
        String id = requiredString(raw, "id", issues);
        if (id != null && !ID_PATTERN.matcher(id).matches()) {
            issues.add("id", "must match " + ID_PATTERN.pattern());
        }
        builder.id(id);
        builder.name(requiredString(raw, "name", issues));

        String version = requiredString(raw, "version", issues);
        if (version != null && !SemverVersion.isValid(version)) {
            issues.add("version", "is not a semantic version: " + version);
        }
        builder.version(version);
        builder.description(requiredString(raw, "description", issues));
        builder.author(optionalString(raw, "author", issues));
        builder.homepage(optionalString(raw, "homepage", issues));
        builder.repository(optionalString(raw, "repository", issues));
        builder.license(optionalString(raw, "license", issues));

        String type = requiredString(raw, "type", issues);
        if (type != null) {
            Optional<PluginType> pluginType = PluginType.fromValue(type);
            if (pluginType.isEmpty()) {
                issues.add("type", "must be one of tool, agent, ui, integration, workflow but was " + type);
            }
            builder.type(pluginType.orElse(null));
        }
        builder.categories(stringList(raw.get("categories"), "categories", issues));
        builder.tags(stringList(raw.get("tags"), "tags", issues));

        // === 宿主兼容性 ===
        builder.engineRange(validateEngine(raw.get("engine"), issues));

        Map<String, ?> dependencies = map(raw.get("dependencies"), "dependencies", issues);
        dependencies.forEach((depId, range) -> {
            if (!(range instanceof String rangeText)) {
                issues.add("dependencies." + depId, "must be a version range string");
                return;
            }
            try {
                SemverRange.parse(rangeText);
                builder.dependency(depId, rangeText);
            } catch (ValidationException e) {
                issues.add("dependencies." + depId, e.getMessage());
            }
        });

        // === 能力与权限 ===
        List<String> capabilities = requiredStringList(raw, "capabilities", issues);
        builder.capabilities(capabilities);
        PluginPermissions permissions = validatePermissions(raw.get("permissions"), issues);
        builder.permissions(permissions);
        for (PermissionCategory category : grantedCategories(permissions)) {
            if (!Capabilities.covers(capabilities, category.capability())) {
                issues.add("permissions", "grants " + category + " but capability '"
                        + category.capability() + "' is not declared");
            }
        }

        // === 入口 ===
        String main = requiredString(raw, "main", issues);
        if (main != null && !CLASS_NAME_PATTERN.matcher(main).matches()) {
            issues.add("main", "is not a valid class name: " + main);
        }
        builder.main(main);
        builder.worker(optionalString(raw, "worker", issues));
        builder.ui(optionalString(raw, "ui", issues));

        // === 配置 ===
        Map<String, ?> schema = map(raw.get("configSchema"), "configSchema", issues);
        schema.forEach((key, descriptor) -> {
            Map<String, ?> descriptorMap = map(descriptor, "configSchema." + key, issues);
            Object schemaType = descriptorMap.get("type");
            if (schemaType != null && ConfigSchemaValidator.ConfigType.fromValue(String.valueOf(schemaType)).isEmpty()) {
                issues.add("configSchema." + key + ".type", "unknown type " + schemaType);
            }
            builder.configSchemaEntry(key, Collections.unmodifiableMap(new LinkedHashMap<String, Object>(descriptorMap)));
        });
        Map<String, ?> defaults = map(raw.get("defaultConfig"), "defaultConfig", issues);
        defaults.forEach(builder::defaultConfigEntry);

        issues.throwIfAny();
        return builder.build();
    }

    /**
     * 已授予的权限类别
     */
    public static Set<PermissionCategory> grantedCategories(PluginPermissions permissions) {
        EnumSet<PermissionCategory> granted = EnumSet.noneOf(PermissionCategory.class);
        if (!permissions.getFilesystem().read().isEmpty()) granted.add(PermissionCategory.FILESYSTEM_READ);
        if (!permissions.getFilesystem().write().isEmpty()) granted.add(PermissionCategory.FILESYSTEM_WRITE);
        if (permissions.getNetwork().external() || !permissions.getNetwork().domains().isEmpty()) {
            granted.add(PermissionCategory.NETWORK);
        }
        if (permissions.getAgents().create()) granted.add(PermissionCategory.AGENT_CREATE);
        if (permissions.getAgents().execute()) granted.add(PermissionCategory.AGENT_EXECUTE);
        if (permissions.getAgents().manage()) granted.add(PermissionCategory.AGENT_MANAGE);
        if (permissions.getModels().execute() || !permissions.getModels().access().isEmpty()) {
            granted.add(PermissionCategory.MODEL_EXECUTE);
        }
        if (permissions.getMemory().read()) granted.add(PermissionCategory.MEMORY_READ);
        if (permissions.getMemory().write()) granted.add(PermissionCategory.MEMORY_WRITE);
        if (permissions.getUi().panels()) granted.add(PermissionCategory.UI_PANELS);
        if (permissions.getUi().menus()) granted.add(PermissionCategory.UI_MENUS);
        if (permissions.getUi().commands()) granted.add(PermissionCategory.UI_COMMANDS);
        if (permissions.getUi().notifications()) granted.add(PermissionCategory.UI_NOTIFICATIONS);
        return granted;
    }

    // ==================== 内部方法 ====================

    private String validateEngine(Object engine, Issues issues) {
        if (engine == null) {
            issues.add("engine", "is required");
            return null;
        }
        Map<String, ?> engineMap = map(engine, "engine", issues);
        String range = requiredString(engineMap, "host", issues, "engine.host");
        if (range == null) {
            return null;
        }
        try {
            if (!SemverRange.parse(range).satisfiedBy(hostVersion)) {
                // 宿主版本不满足时拒绝安装
                issues.add("engine.host", "requires " + range + " but host version is " + hostVersion);
            }
        } catch (ValidationException e) {
            issues.add("engine.host", e.getMessage());
        }
        return range;
    }

    private PluginPermissions validatePermissions(Object raw, Issues issues) {
        Map<String, ?> permissions = map(raw, "permissions", issues);
        PluginPermissions.PluginPermissionsBuilder builder = PluginPermissions.builder();

        if (permissions.containsKey("filesystem")) {
            Map<String, ?> fs = map(permissions.get("filesystem"), "permissions.filesystem", issues);
            List<String> read = globList(fs.get("read"), "permissions.filesystem.read", issues);
            List<String> write = globList(fs.get("write"), "permissions.filesystem.write", issues);
            builder.filesystem(new PluginPermissions.Filesystem(read, write));
        }
        if (permissions.containsKey("network")) {
            Map<String, ?> net = map(permissions.get("network"), "permissions.network", issues);
            List<String> domains = stringList(net.get("domains"), "permissions.network.domains", issues);
            List<String> normalized = domains.stream().map(d -> d.toLowerCase(Locale.ROOT)).toList();
            builder.network(new PluginPermissions.Network(normalized,
                    bool(net.get("external"), "permissions.network.external", issues)));
        }
        if (permissions.containsKey("agents")) {
            Map<String, ?> agents = map(permissions.get("agents"), "permissions.agents", issues);
            builder.agents(new PluginPermissions.Agents(
                    bool(agents.get("create"), "permissions.agents.create", issues),
                    bool(agents.get("execute"), "permissions.agents.execute", issues),
                    bool(agents.get("manage"), "permissions.agents.manage", issues)));
        }
        if (permissions.containsKey("models")) {
            Map<String, ?> models = map(permissions.get("models"), "permissions.models", issues);
            builder.models(new PluginPermissions.Models(
                    stringList(models.get("access"), "permissions.models.access", issues),
                    bool(models.get("execute"), "permissions.models.execute", issues)));
        }
        if (permissions.containsKey("memory")) {
            Map<String, ?> memory = map(permissions.get("memory"), "permissions.memory", issues);
            builder.memory(new PluginPermissions.Memory(
                    bool(memory.get("read"), "permissions.memory.read", issues),
                    bool(memory.get("write"), "permissions.memory.write", issues)));
        }
        if (permissions.containsKey("ui")) {
            Map<String, ?> ui = map(permissions.get("ui"), "permissions.ui", issues);
            builder.ui(new PluginPermissions.Ui(
                    bool(ui.get("panels"), "permissions.ui.panels", issues),
                    bool(ui.get("menus"), "permissions.ui.menus", issues),
                    bool(ui.get("commands"), "permissions.ui.commands", issues),
                    bool(ui.get("notifications"), "permissions.ui.notifications", issues)));
        }
        return builder.build();
    }

    private List<String> globList(Object raw, String field, Issues issues) {
        List<String> globs = stringList(raw, field, issues);
        for (String glob : globs) {
            if (glob.isBlank() || glob.startsWith("/") || glob.contains("..")) {
                issues.add(field, "glob must be relative to the plugin directory: " + glob);
                continue;
            }
            try {
                FileSystems.getDefault().getPathMatcher("glob:" + glob);
            } catch (PatternSyntaxException e) {
                issues.add(field, "invalid glob " + glob);
            }
        }
        return globs;
    }

    private static String requiredString(Map<String, ?> raw, String key, Issues issues) {
        return requiredString(raw, key, issues, key);
    }

    private static String requiredString(Map<String, ?> raw, String key, Issues issues, String field) {
        Object value = raw.get(key);
        if (value == null) {
            issues.add(field, "is required");
            return null;
        }
        if (!(value instanceof String text) || text.isBlank()) {
            issues.add(field, "must be a non-blank string");
            return null;
        }
        return text;
    }

    private static String optionalString(Map<String, ?> raw, String key, Issues issues) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            issues.add(key, "must be a string");
            return null;
        }
        return text;
    }

    private static List<String> requiredStringList(Map<String, ?> raw, String key, Issues issues) {
        if (raw.get(key) == null) {
            issues.add(key, "is required");
            return List.of();
        }
        return stringList(raw.get(key), key, issues);
    }

    private static List<String> stringList(Object raw, String field, Issues issues) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            issues.add(field, "must be a list");
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof String text) {
                result.add(text);
            } else {
                issues.add(field, "must only contain strings");
                return List.of();
            }
        }
        return result;
    }

    private static boolean bool(Object raw, String field, Issues issues) {
        if (raw == null) {
            return false;
        }
        if (!(raw instanceof Boolean value)) {
            issues.add(field, "must be a boolean");
            return false;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> map(Object raw, String field, Issues issues) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            issues.add(field, "must be an object");
            return Map.of();
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                issues.add(field, "keys must be strings");
                return Map.of();
            }
        }
        return (Map<String, ?>) map;
    }

    /**
     * 问题收集器
     */
    private static final class Issues {
        private final List<String> messages = new ArrayList<>();

        void add(String field, String message) {
            messages.add(field + " " + message);
        }

        void throwIfAny() {
            if (!messages.isEmpty()) {
                throw new ValidationException("Invalid manifest: " + String.join("; ", messages));
            }
        }
    }
}
