package com.plugbox.api.security;

/**
 * 统一能力标签常量
 * <p>
 * 清单 capabilities 中声明的标签。每一项权限授予都必须落在已声明能力的范围内，
 * {@code <group>:*} 覆盖整个分组。
 * </p>
 */
public final class Capabilities {

    public static final String WILDCARD_SUFFIX = ":*";

    // ==================== 文件 ====================
    public static final String FILESYSTEM_READ = "filesystem:read";
    public static final String FILESYSTEM_WRITE = "filesystem:write";

    // ==================== 网络 ====================
    /**
     * HTTP 出站请求
     */
    public static final String NETWORK_FETCH = "network:fetch";

    // ==================== Agent ====================
    public static final String AGENTS_CREATE = "agents:create";
    public static final String AGENTS_EXECUTE = "agents:execute";
    public static final String AGENTS_MANAGE = "agents:manage";

    // ==================== 模型 ====================
    public static final String MODELS_EXECUTE = "models:execute";

    // ==================== 记忆 ====================
    public static final String MEMORY_READ = "memory:read";
    public static final String MEMORY_WRITE = "memory:write";

    // ==================== UI ====================
    public static final String UI_PANELS = "ui:panels";
    public static final String UI_MENUS = "ui:menus";
    public static final String UI_COMMANDS = "ui:commands";
    public static final String UI_NOTIFICATIONS = "ui:notifications";

    private Capabilities() {
        // 防止实例化
    }

    /**
     * 已声明的能力集合是否覆盖给定标签
     */
    public static boolean covers(Iterable<String> declared, String capability) {
        String group = capability.substring(0, capability.indexOf(':'));
        for (String tag : declared) {
            if (tag.equals(capability) || tag.equals(group + WILDCARD_SUFFIX)) {
                return true;
            }
        }
        return false;
    }
}
