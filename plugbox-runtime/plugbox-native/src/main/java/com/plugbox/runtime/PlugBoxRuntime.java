package com.plugbox.runtime;

import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.host.PluginHostService;
import com.plugbox.core.plugin.PluginManager;
import com.plugbox.core.registry.RegistryClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次启动得到的运行时上下文
 * 宿主持有并显式传递，关闭时终止所有沙箱。
 */
@Slf4j
@Getter
public class PlugBoxRuntime implements AutoCloseable {

    private final PlugBoxConfig config;
    private final EventBus eventBus;
    private final RegistryClient registry;
    private final PluginManager pluginManager;
    private final PluginHostService hostService;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private Thread shutdownHook;

    PlugBoxRuntime(PlugBoxConfig config, EventBus eventBus, RegistryClient registry,
                   PluginManager pluginManager, PluginHostService hostService) {
        this.config = config;
        this.eventBus = eventBus;
        this.registry = registry;
        this.pluginManager = pluginManager;
        this.hostService = hostService;
    }

    void registerShutdownHook() {
        shutdownHook = new Thread(() -> {
            log.info("PlugBox shutting down...");
            shutdownInternal();
        }, "plugbox-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM 正在关闭，钩子会自行执行
                return;
            }
        }
        shutdownInternal();
    }

    private void shutdownInternal() {
        if (closed.compareAndSet(false, true)) {
            pluginManager.shutdown();
        }
    }
}
