package com.plugbox.api.security;

/**
 * 权限类别
 * 每个受控的插件 API 方法都标注一个类别，由权限闸门统一检查。
 */
public enum PermissionCategory {
    FILESYSTEM_READ(Capabilities.FILESYSTEM_READ),
    FILESYSTEM_WRITE(Capabilities.FILESYSTEM_WRITE),
    NETWORK(Capabilities.NETWORK_FETCH),
    AGENT_CREATE(Capabilities.AGENTS_CREATE),
    AGENT_EXECUTE(Capabilities.AGENTS_EXECUTE),
    AGENT_MANAGE(Capabilities.AGENTS_MANAGE),
    MODEL_EXECUTE(Capabilities.MODELS_EXECUTE),
    MEMORY_READ(Capabilities.MEMORY_READ),
    MEMORY_WRITE(Capabilities.MEMORY_WRITE),
    UI_PANELS(Capabilities.UI_PANELS),
    UI_MENUS(Capabilities.UI_MENUS),
    UI_COMMANDS(Capabilities.UI_COMMANDS),
    UI_NOTIFICATIONS(Capabilities.UI_NOTIFICATIONS);

    private final String capability;

    PermissionCategory(String capability) {
        this.capability = capability;
    }

    /**
     * 授予该类别权限所需声明的能力标签
     */
    public String capability() {
        return capability;
    }

    /**
     * 是否为需要先做路径规范化的文件类别
     */
    public boolean isFilesystem() {
        return this == FILESYSTEM_READ || this == FILESYSTEM_WRITE;
    }
}
