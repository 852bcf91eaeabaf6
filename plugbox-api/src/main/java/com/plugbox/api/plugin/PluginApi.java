package com.plugbox.api.plugin;

import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.security.PermissionCategory;
import com.plugbox.api.security.RequiresPermission;

import java.util.List;
import java.util.Map;

/**
 * 暴露给插件的宿主能力
 * <p>
 * 遵循零信任原则：插件拿到的是权限闸门代理，标注了 {@link RequiresPermission} 的方法
 * 在未授权时同步抛出 PermissionDeniedException。
 * </p>
 *
 * @author PlugBox
 */
public interface PluginApi {

    // ==================== 基础 ====================

    String getPluginId();

    PluginManifest getManifest();

    /**
     * 当前生效配置（默认值合并覆盖项后的快照）
     */
    Map<String, Object> getConfig();

    /**
     * 发布插件自定义事件
     */
    void emit(String event, Object data);

    // ==================== Agent ====================

    @RequiresPermission(PermissionCategory.AGENT_CREATE)
    String createAgent(Map<String, Object> config);

    @RequiresPermission(PermissionCategory.AGENT_EXECUTE)
    Object executeAgent(String agentId, Map<String, Object> task);

    @RequiresPermission(PermissionCategory.AGENT_MANAGE)
    void stopAgent(String agentId);

    // ==================== 模型 ====================

    @RequiresPermission(PermissionCategory.MODEL_EXECUTE)
    Object executeModel(String modelId, String prompt, Map<String, Object> options);

    // ==================== 记忆 ====================

    @RequiresPermission(PermissionCategory.MEMORY_WRITE)
    String storeMemory(String content, String type, Map<String, Object> metadata);

    @RequiresPermission(PermissionCategory.MEMORY_READ)
    List<Map<String, Object>> searchMemory(String query, Map<String, Object> options);

    // ==================== UI ====================

    @RequiresPermission(PermissionCategory.UI_PANELS)
    void registerPanel(Map<String, Object> panel);

    @RequiresPermission(PermissionCategory.UI_COMMANDS)
    void registerCommand(Map<String, Object> command);

    @RequiresPermission(PermissionCategory.UI_MENUS)
    void registerMenuItem(Map<String, Object> item);

    @RequiresPermission(PermissionCategory.UI_NOTIFICATIONS)
    void showNotification(Map<String, Object> notification);

    // ==================== 文件（限定在插件目录内） ====================

    @RequiresPermission(PermissionCategory.FILESYSTEM_READ)
    String readFile(String path);

    @RequiresPermission(PermissionCategory.FILESYSTEM_WRITE)
    void writeFile(String path, String content);

    // ==================== 网络 ====================

    @RequiresPermission(PermissionCategory.NETWORK)
    Map<String, Object> fetch(String url, Map<String, Object> options);
}
