package com.plugbox.runtime;

import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.host.PluginHostService;
import com.plugbox.core.plugin.PluginManager;
import com.plugbox.core.registry.RegistryClient;
import com.plugbox.core.spi.HostServices;
import com.plugbox.core.spi.PluginPackageVerifier;
import com.plugbox.core.spi.RegistryTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * PlugBox Native 启动器
 * 宿主应用通过此类一键组装并启动框架，每次调用得到一个独立的运行时。
 */
@Slf4j
public final class NativePlugBox {

    private NativePlugBox() {
    }

    /**
     * 启动 PlugBox（无安装包验证器）
     */
    public static PlugBoxRuntime start(PlugBoxConfig config, HostServices hostServices, RegistryTransport transport) {
        return start(config, hostServices, transport, List.of());
    }

    public static PlugBoxRuntime start(PlugBoxConfig config,
                                       HostServices hostServices,
                                       RegistryTransport transport,
                                       List<PluginPackageVerifier> verifiers) {
        return start(config, hostServices, transport, verifiers, Clock.systemUTC(), true);
    }

    /**
     * 启动 PlugBox（完整参数）
     *
     * @param registerShutdownHook 是否在 JVM 退出时自动关闭
     */
    public static PlugBoxRuntime start(PlugBoxConfig config,
                                       HostServices hostServices,
                                       RegistryTransport transport,
                                       List<PluginPackageVerifier> verifiers,
                                       Clock clock,
                                       boolean registerShutdownHook) {
        long start = System.currentTimeMillis();
        log.info("Starting PlugBox Native Runtime (host {}, plugins at {})...",
                config.getHostVersion(), config.getPluginsRoot().toAbsolutePath());

        // 准备基础设施
        EventBus eventBus = new EventBus();
        RegistryClient registry = new RegistryClient(transport, config, clock, eventBus);

        // 组装 PluginManager
        PluginManager pluginManager = new PluginManager(config, registry, hostServices, verifiers, eventBus, clock);
        PluginHostService hostService = new PluginHostService(pluginManager);

        PlugBoxRuntime runtime = new PlugBoxRuntime(config, eventBus, registry, pluginManager, hostService);

        // 恢复已安装插件
        int restored;
        try {
            restored = pluginManager.initialize();
        } catch (RuntimeException e) {
            pluginManager.shutdown();
            throw e;
        }

        if (registerShutdownHook) {
            runtime.registerShutdownHook();
        }
        log.info("PlugBox Native started in {} ms, {} plugin(s) restored", System.currentTimeMillis() - start, restored);
        return runtime;
    }
}
