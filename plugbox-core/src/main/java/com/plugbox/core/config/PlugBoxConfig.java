package com.plugbox.core.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * PlugBox Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，宿主启动时构建一次，显式传入各组件。
 * 不提供静态全局实例。
 */
@Value
@Builder(toBuilder = true)
public class PlugBoxConfig {

    /**
     * 注册中心检索结果的硬上限
     */
    public static final int MAX_SEARCH_RESULTS = 50;

    // ================= 环境 =================

    /**
     * 插件存放根目录，每个插件一个子目录
     */
    @Builder.Default
    Path pluginsRoot = Path.of("plugins");

    /**
     * 宿主版本，用于匹配清单 engine.host 范围
     */
    @Builder.Default
    String hostVersion = "1.0.0";

    /**
     * 启动时是否恢复已安装插件
     */
    @Builder.Default
    boolean restoreOnStartup = true;

    // ================= 沙箱 =================

    /**
     * RPC 默认超时
     */
    @Builder.Default
    Duration rpcTimeout = Duration.ofSeconds(30);

    /**
     * 沙箱加载入口类的超时
     */
    @Builder.Default
    Duration sandboxInitTimeout = Duration.ofSeconds(10);

    /**
     * 每个插件工作线程池的最大并发
     */
    @Builder.Default
    int workerPoolSize = 4;

    /**
     * 每个插件工作线程池的排队上限，满载时快速失败
     */
    @Builder.Default
    int workerQueueCapacity = 100;

    // ================= 注册中心 =================

    /**
     * 注册中心缓存新鲜度窗口
     */
    @Builder.Default
    Duration registryFreshness = Duration.ofHours(24);

    public static PlugBoxConfig defaults() {
        return PlugBoxConfig.builder().build();
    }
}
