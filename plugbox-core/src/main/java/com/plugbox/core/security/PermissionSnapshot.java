package com.plugbox.core.security;

import com.plugbox.api.manifest.PluginPermissions;
import com.plugbox.api.security.PermissionCategory;

import java.net.URI;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 冻结的权限快照
 * <p>
 * 沙箱创建时从清单复制一次，之后不可变；插件持有的任何对象都无法放宽它。
 * glob 在构造时预编译。
 * </p>
 */
public final class PermissionSnapshot {

    private final Set<PermissionCategory> granted;
    private final List<PathMatcher> readMatchers;
    private final List<PathMatcher> writeMatchers;
    private final List<String> domains;
    private final boolean external;
    private final List<String> modelAccess;

    private PermissionSnapshot(PluginPermissions permissions) {
        this.granted = effectiveGrants(permissions);
        this.readMatchers = compile(permissions.getFilesystem().read());
        this.writeMatchers = compile(permissions.getFilesystem().write());
        this.domains = permissions.getNetwork().domains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .toList();
        this.external = permissions.getNetwork().external();
        this.modelAccess = List.copyOf(permissions.getModels().access());
    }

    public static PermissionSnapshot of(PluginPermissions permissions) {
        return new PermissionSnapshot(permissions == null ? PluginPermissions.none() : permissions);
    }

    /**
     * 实际生效的类别：文件以存在至少一条 glob 为准，网络以 external 为准，模型以 execute 为准
     */
    private static Set<PermissionCategory> effectiveGrants(PluginPermissions p) {
        Set<PermissionCategory> categories = EnumSet.noneOf(PermissionCategory.class);
        if (!p.getFilesystem().read().isEmpty()) categories.add(PermissionCategory.FILESYSTEM_READ);
        if (!p.getFilesystem().write().isEmpty()) categories.add(PermissionCategory.FILESYSTEM_WRITE);
        if (p.getNetwork().external()) categories.add(PermissionCategory.NETWORK);
        if (p.getAgents().create()) categories.add(PermissionCategory.AGENT_CREATE);
        if (p.getAgents().execute()) categories.add(PermissionCategory.AGENT_EXECUTE);
        if (p.getAgents().manage()) categories.add(PermissionCategory.AGENT_MANAGE);
        if (p.getModels().execute()) categories.add(PermissionCategory.MODEL_EXECUTE);
        if (p.getMemory().read()) categories.add(PermissionCategory.MEMORY_READ);
        if (p.getMemory().write()) categories.add(PermissionCategory.MEMORY_WRITE);
        if (p.getUi().panels()) categories.add(PermissionCategory.UI_PANELS);
        if (p.getUi().menus()) categories.add(PermissionCategory.UI_MENUS);
        if (p.getUi().commands()) categories.add(PermissionCategory.UI_COMMANDS);
        if (p.getUi().notifications()) categories.add(PermissionCategory.UI_NOTIFICATIONS);
        return categories;
    }

    public boolean isGranted(PermissionCategory category) {
        return granted.contains(category);
    }

    /**
     * @param relativePath 已规范化、相对插件目录的路径
     */
    public boolean canRead(Path relativePath) {
        return matches(readMatchers, relativePath);
    }

    public boolean canWrite(Path relativePath) {
        return matches(writeMatchers, relativePath);
    }

    /**
     * 需要 external 且主机名精确或后缀匹配
     */
    public boolean canFetch(String url) {
        if (!external || url == null) {
            return false;
        }
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (String domain : domains) {
            if (normalized.equals(domain) || normalized.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    public boolean canUseModel(String modelId) {
        if (!isGranted(PermissionCategory.MODEL_EXECUTE) || modelId == null) {
            return false;
        }
        return modelAccess.contains("*") || modelAccess.contains(modelId);
    }

    private static boolean matches(List<PathMatcher> matchers, Path relativePath) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> globs) {
        return globs.stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    @Override
    public String toString() {
        return "PermissionSnapshot" + granted;
    }
}
