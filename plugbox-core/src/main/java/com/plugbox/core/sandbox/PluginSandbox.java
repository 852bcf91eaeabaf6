package com.plugbox.core.sandbox;

import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.PluginNotAvailableException;
import com.plugbox.api.exception.SandboxInitException;
import com.plugbox.api.exception.SandboxTerminatedException;
import com.plugbox.api.exception.SandboxTimeoutException;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.plugin.PluginApi;
import com.plugbox.api.plugin.SandboxedPlugin;
import com.plugbox.core.classloader.PluginClassLoader;
import com.plugbox.core.classloader.PluginLoaderFactory;
import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.security.PermissionGate;
import com.plugbox.core.security.PermissionSnapshot;
import com.plugbox.core.security.SandboxPathResolver;
import com.plugbox.core.spi.HostServices;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 插件执行沙箱
 * <p>
 * 持有插件的类加载器、工作线程与冻结的权限快照，对外只暴露异步 RPC：
 * 每个请求分配不可猜测的关联ID，登记到挂起表并设置截止时间；
 * 匹配的响应、超时、终止三者之一会把它从挂起表中移除，迟到的响应直接丢弃。
 * </p>
 */
@Slf4j
public class PluginSandbox {

    @Getter
    private final String pluginId;
    private final PluginManifest manifest;
    private final Path pluginDir;
    private final PlugBoxConfig config;
    private final HostServices hostServices;
    private final EventBus eventBus;
    private final Supplier<Map<String, Object>> configView;
    private final ScheduledExecutorService timeoutScheduler;
    private final PluginLoaderFactory loaderFactory;

    private final CorrelationIdGenerator idGenerator = new CorrelationIdGenerator();
    private final ConcurrentHashMap<String, PendingRequest> pending = new ConcurrentHashMap<>();

    @Getter
    private final PermissionSnapshot permissions;

    private volatile SandboxState state = SandboxState.UNINITIALIZED;
    private PluginClassLoader classLoader;
    private SandboxWorker worker;

    public PluginSandbox(PluginManifest manifest,
                         Path pluginDir,
                         PlugBoxConfig config,
                         HostServices hostServices,
                         EventBus eventBus,
                         Supplier<Map<String, Object>> configView,
                         ScheduledExecutorService timeoutScheduler,
                         PluginLoaderFactory loaderFactory) {
        this.pluginId = manifest.getId();
        this.manifest = manifest;
        this.pluginDir = pluginDir;
        this.config = config;
        this.hostServices = hostServices;
        this.eventBus = eventBus;
        this.configView = configView;
        this.timeoutScheduler = timeoutScheduler;
        this.loaderFactory = loaderFactory;
        this.permissions = PermissionSnapshot.of(manifest.getPermissions());
    }

    public SandboxState getState() {
        return state;
    }

    /**
     * 加载入口类并启动工作线程
     *
     * @throws SandboxInitException 任何失败；已创建的资源全部释放，状态置为 TERMINATED
     */
    public void initialize() {
        synchronized (this) {
            if (state != SandboxState.UNINITIALIZED) {
                throw new SandboxInitException("Sandbox of plugin " + pluginId + " cannot initialize from " + state);
            }
            state = SandboxState.INITIALIZING;
        }
        long start = System.currentTimeMillis();
        try {
            classLoader = loaderFactory.create(pluginId, pluginDir, SandboxedPlugin.class.getClassLoader());
            worker = new SandboxWorker(pluginId, classLoader, config, this::onResponse);
            worker.start();

            SandboxedPlugin instance = worker.instantiate(manifest.getMain(), config.getSandboxInitTimeout().toMillis());
            SandboxPathResolver pathResolver = new SandboxPathResolver(pluginDir);
            PluginApi api = PermissionGate.protect(pluginId,
                    new HostPluginApi(manifest, configView, hostServices, pathResolver, eventBus),
                    permissions, pathResolver);
            worker.bind(instance, api);

            synchronized (this) {
                if (state != SandboxState.INITIALIZING) {
                    throw new SandboxInitException("Sandbox of plugin " + pluginId + " was terminated during initialization");
                }
                state = SandboxState.READY;
            }
            log.info("[{}] Sandbox ready in {}ms ({})", pluginId, System.currentTimeMillis() - start, permissions);
        } catch (RuntimeException e) {
            releaseResources();
            state = SandboxState.TERMINATED;
            log.error("[{}] Sandbox initialization failed: {}", pluginId, e.getMessage());
            if (e instanceof SandboxInitException sie) {
                throw sie;
            }
            throw new SandboxInitException("Failed to initialize sandbox of plugin " + pluginId + ": " + e.getMessage(), e);
        }
    }

    /**
     * 异步调用插件方法，使用默认超时
     */
    public CompletableFuture<Object> execute(String method, List<Object> args) {
        return call(method, args, config.getRpcTimeout()).thenApply(SandboxMessage.Response::result);
    }

    /**
     * 异步调用插件方法，返回完整响应（含分配字节数）
     * 正常完成的 future 一定是成功响应；插件错误、超时、终止都以异常完成。
     */
    public CompletableFuture<SandboxMessage.Response> call(String method, List<Object> args, Duration timeout) {
        SandboxState current = state;
        if (current == SandboxState.TERMINATED) {
            return CompletableFuture.failedFuture(
                    new SandboxTerminatedException("Sandbox of plugin " + pluginId + " is terminated"));
        }
        if (current != SandboxState.READY) {
            return CompletableFuture.failedFuture(
                    new PluginNotAvailableException("Sandbox of plugin " + pluginId + " is " + current));
        }

        String id = idGenerator.next();
        CompletableFuture<SandboxMessage.Response> future = new CompletableFuture<>();
        PendingRequest entry = new PendingRequest(method, future);
        pending.put(id, entry);
        entry.deadline = timeoutScheduler.schedule(() -> onTimeout(id, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);

        try {
            worker.post(new SandboxMessage.Request(id, method, args));
        } catch (PlugBoxException e) {
            if (pending.remove(id) != null) {
                entry.deadline.cancel(false);
                future.completeExceptionally(e);
            }
        }
        return future;
    }

    /**
     * 终止沙箱：停止工作线程、关闭类加载器、拒绝所有挂起请求。幂等。
     */
    public void terminate() {
        synchronized (this) {
            if (state == SandboxState.TERMINATED) {
                return;
            }
            state = SandboxState.TERMINATED;
        }

        // 先拒绝挂起请求，再中断工作线程，被中断的插件回包只会被丢弃
        int rejected = 0;
        for (String id : pending.keySet()) {
            PendingRequest entry = pending.remove(id);
            if (entry != null) {
                entry.cancelDeadline();
                entry.future.completeExceptionally(new SandboxTerminatedException(
                        "Sandbox of plugin " + pluginId + " terminated while " + entry.method + " was pending"));
                rejected++;
            }
        }
        releaseResources();
        log.info("[{}] Sandbox terminated, {} pending request(s) rejected", pluginId, rejected);
    }

    /**
     * 当前挂起请求数
     */
    public int pendingCount() {
        return pending.size();
    }

    // ==================== 内部方法 ====================

    private void onResponse(SandboxMessage.Response response) {
        PendingRequest entry = pending.remove(response.id());
        if (entry == null || state == SandboxState.TERMINATED) {
            log.debug("[{}] Dropping late response {}", pluginId, response.id());
            return;
        }
        entry.cancelDeadline();
        if (response.isSuccess()) {
            entry.future.complete(response);
        } else {
            entry.future.completeExceptionally(response.error());
        }
    }

    private void onTimeout(String id, Duration timeout) {
        PendingRequest entry = pending.remove(id);
        if (entry == null) {
            return;
        }
        log.warn("[{}] {} timed out after {}ms", pluginId, entry.method, timeout.toMillis());
        entry.future.completeExceptionally(new SandboxTimeoutException(
                "Plugin " + pluginId + " did not answer " + entry.method + " within " + timeout.toMillis() + "ms"));
    }

    private void releaseResources() {
        if (worker != null) {
            worker.shutdown();
        }
        if (classLoader != null) {
            try {
                classLoader.close();
            } catch (IOException e) {
                log.warn("[{}] Failed to close classloader: {}", pluginId, e.getMessage());
            }
        }
    }

    private static final class PendingRequest {
        private final String method;
        private final CompletableFuture<SandboxMessage.Response> future;
        private volatile ScheduledFuture<?> deadline;

        private PendingRequest(String method, CompletableFuture<SandboxMessage.Response> future) {
            this.method = method;
            this.future = future;
        }

        private void cancelDeadline() {
            ScheduledFuture<?> d = deadline;
            if (d != null) {
                d.cancel(false);
            }
        }
    }
}
