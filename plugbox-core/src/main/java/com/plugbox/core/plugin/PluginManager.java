package com.plugbox.core.plugin;

import com.plugbox.api.event.lifecycle.*;
import com.plugbox.api.exception.*;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.api.registry.PluginSummary;
import com.plugbox.api.registry.SearchOptions;
import com.plugbox.api.state.PluginState;
import com.plugbox.api.state.PluginStatus;
import com.plugbox.core.classloader.DefaultPluginLoaderFactory;
import com.plugbox.core.classloader.PluginLoaderFactory;
import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.installer.PluginArchiveExtractor;
import com.plugbox.core.loader.InstalledPluginLoader;
import com.plugbox.core.loader.PluginManifestLoader;
import com.plugbox.core.manifest.ConfigSchemaValidator;
import com.plugbox.core.manifest.ManifestValidator;
import com.plugbox.core.registry.RegistryClient;
import com.plugbox.core.sandbox.PluginSandbox;
import com.plugbox.core.sandbox.SandboxMessage;
import com.plugbox.core.sandbox.SandboxState;
import com.plugbox.core.spi.HostServices;
import com.plugbox.core.spi.PluginPackageVerifier;
import com.plugbox.core.state.PluginStateStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * 插件生命周期管理器
 * 职责：
 * 1. 插件的安装、卸载、更新 (Install/Uninstall/Update)
 * 2. 启用与禁用 (Enable/Disable)
 * 3. 调用路由与指标记录 (Execute)
 * 4. 配置与状态持久化
 * 5. 资源的全局管控 (Shutdown)
 * <p>
 * 同一插件的生命周期操作由该插件的读写锁串行化（写锁），执行只在路由期间持有读锁，
 * 不同插件互不阻塞。
 * </p>
 */
@Slf4j
public class PluginManager {

    private final PlugBoxConfig config;
    private final RegistryClient registry;
    private final HostServices hostServices;
    private final List<PluginPackageVerifier> verifiers;
    private final EventBus eventBus;
    private final Clock clock;

    private final PluginManifestLoader manifestLoader;
    private final PluginStateStore stateStore;
    private final PluginArchiveExtractor extractor = new PluginArchiveExtractor();
    private final PluginLoaderFactory loaderFactory;

    // 插件表：Key=PluginId
    private final Map<String, InstalledPlugin> plugins = new ConcurrentHashMap<>();

    // 每个插件一把锁，创建后不再移除
    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    // 所有沙箱共享的 RPC 超时调度器
    private final ScheduledExecutorService timeoutScheduler;

    // 调用完成后的指标记录放在宿主线程上，不占用插件线程
    private final ExecutorService completionExecutor;

    private final AtomicInteger completionThreadNumber = new AtomicInteger(1);

    public PluginManager(PlugBoxConfig config,
                         RegistryClient registry,
                         HostServices hostServices,
                         List<PluginPackageVerifier> verifiers,
                         EventBus eventBus,
                         Clock clock) {
        this(config, registry, hostServices, verifiers, eventBus, clock, new DefaultPluginLoaderFactory());
    }

    public PluginManager(PlugBoxConfig config,
                         RegistryClient registry,
                         HostServices hostServices,
                         List<PluginPackageVerifier> verifiers,
                         EventBus eventBus,
                         Clock clock,
                         PluginLoaderFactory loaderFactory) {
        this.config = config;
        this.registry = registry;
        this.hostServices = hostServices != null ? hostServices : HostServices.none();
        this.verifiers = verifiers != null ? List.copyOf(verifiers) : Collections.emptyList();
        this.eventBus = eventBus;
        this.clock = clock;
        this.loaderFactory = loaderFactory;
        this.manifestLoader = new PluginManifestLoader(new ManifestValidator(config.getHostVersion()));
        this.stateStore = new PluginStateStore(config.getPluginsRoot(), clock);

        this.timeoutScheduler = newTimeoutScheduler();
        this.completionExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "plugbox-completion-" + completionThreadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 调用正常完成后截止任务会被取消，取消即出队，不再持有沙箱引用
     */
    static ScheduledThreadPoolExecutor newTimeoutScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "plugbox-rpc-timeout");
            thread.setDaemon(true); // 守护线程，不阻碍 JVM 关闭
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    // ==================== 启动与关闭 ====================

    /**
     * 启动恢复：逐个加载插件目录，恢复之前启用的插件
     *
     * @return 成功加载的插件数
     */
    public int initialize() {
        if (!config.isRestoreOnStartup()) {
            log.info("Startup restore disabled");
            return 0;
        }
        try {
            Files.createDirectories(config.getPluginsRoot());
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Cannot create plugins root " + config.getPluginsRoot(), e);
        }
        return new InstalledPluginLoader(config, this).scanAndLoad();
    }

    /**
     * 全局关闭：终止所有沙箱，保留持久化状态
     */
    public void shutdown() {
        log.info("Shutting down PluginManager...");
        for (InstalledPlugin plugin : plugins.values()) {
            terminateQuietly(plugin);
        }
        plugins.clear();
        timeoutScheduler.shutdownNow();
        completionExecutor.shutdown();
        log.info("PluginManager shutdown complete.");
    }

    // ==================== 安装 / 卸载 / 更新 ====================

    /**
     * 从注册中心安装插件
     *
     * @param version 为 null 时安装最新版本
     * @return 安装后的状态
     */
    public PluginState install(String pluginId, String version) {
        requireId(pluginId);
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            if (plugins.containsKey(pluginId)) {
                throw new PluginAlreadyInstalledException("Plugin " + pluginId + " is already installed");
            }
            return doInstall(pluginId, version);
        } finally {
            lock.unlock();
        }
    }

    private PluginState doInstall(String pluginId, String requestedVersion) {
        Path dir = pluginDir(pluginId);
        String version = requestedVersion;
        PluginSandbox sandbox = null;
        try {
            PluginSummary summary = registry.getPlugin(pluginId)
                    .orElseThrow(() -> new PluginNotFoundException("Plugin " + pluginId + " is not in the registry"));
            if (version == null) {
                version = summary.getVersion();
            } else if (!registry.getVersions(pluginId).contains(version)) {
                throw new PluginNotFoundException("Plugin " + pluginId + " has no published version " + version);
            }
            log.info("[{}] Installing version {}", pluginId, version);

            // 前置钩子，监听器可抛异常拦截
            eventBus.publish(new PluginInstallingEvent(pluginId, version));

            if (Files.exists(dir)) {
                log.warn("[{}] Removing leftover directory {}", pluginId, dir);
                deleteRecursively(dir);
            }

            byte[] archive = registry.downloadPlugin(pluginId, version);
            verify(pluginId, version, archive);
            extractor.extract(archive, dir);

            PluginManifest manifest = manifestLoader.load(dir);
            if (!manifest.getId().equals(pluginId)) {
                throw new ValidationException("Package manifest declares id " + manifest.getId()
                        + " but " + pluginId + " was requested");
            }
            if (!manifest.getVersion().equals(version)) {
                log.warn("[{}] Registry version {} differs from manifest version {}", pluginId, version, manifest.getVersion());
            }

            PluginState state = PluginState.installed(pluginId, manifest.getVersion(), clock.instant());
            state.getConfig().putAll(manifest.getDefaultConfig());
            InstalledPlugin plugin = new InstalledPlugin(manifest, dir, state);

            sandbox = newSandbox(plugin);
            sandbox.initialize();
            plugin.setSandbox(sandbox);

            persist(plugin);
            plugins.put(pluginId, plugin);

            eventBus.publishQuietly(new PluginInstalledEvent(pluginId, manifest.getVersion()));
            log.info("[{}] Installed version {}", pluginId, manifest.getVersion());
            return plugin.snapshot();
        } catch (RuntimeException e) {
            PlugBoxException failure = asPlugBoxException(e);
            log.error("[{}] Install failed: {}", pluginId, failure.getMessage());
            if (sandbox != null) {
                sandbox.terminate();
            }
            deleteQuietly(dir);
            eventBus.publishQuietly(new PluginInstallFailedEvent(pluginId, version, failure.getKind(), failure.getMessage()));
            throw failure;
        }
    }

    /**
     * 卸载插件，不存在时为空操作
     * 沙箱与清理问题只记录日志，不向上抛出。
     */
    public void uninstall(String pluginId) {
        requireId(pluginId);
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            InstalledPlugin plugin = plugins.get(pluginId);
            if (plugin == null) {
                log.debug("[{}] Not installed, nothing to uninstall", pluginId);
                return;
            }
            log.info("[{}] Uninstalling", pluginId);
            if (plugin.status() == PluginStatus.ENABLED) {
                try {
                    doDisable(plugin);
                } catch (RuntimeException e) {
                    log.warn("[{}] Disable before uninstall failed: {}", pluginId, e.getMessage());
                }
            }
            // 先摘除注册，在途调用的指标不再落盘
            plugins.remove(pluginId);
            terminateQuietly(plugin);
            deleteQuietly(plugin.getDirectory());
            eventBus.publishQuietly(new PluginUninstalledEvent(pluginId, plugin.getManifest().getVersion()));
            log.info("[{}] Uninstalled", pluginId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 先卸载再安装，非原子：安装失败时插件已不存在，以 UPDATE_INCOMPLETE 明确告知调用方。
     * 配置覆盖项沿用，之前启用的插件会重新启用。
     */
    public PluginState updatePlugin(String pluginId, String version) {
        requireId(pluginId);
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            InstalledPlugin current = requirePlugin(pluginId);
            PluginState previous = current.snapshot();
            boolean wasEnabled = previous.getStatus() == PluginStatus.ENABLED;

            uninstall(pluginId);
            try {
                doInstall(pluginId, version);
            } catch (PlugBoxException e) {
                throw new PluginUpdateException("Plugin " + pluginId + " " + previous.getVersion()
                        + " was removed but the new version could not be installed: " + e.getMessage(), e);
            }

            InstalledPlugin updated = plugins.get(pluginId);
            synchronized (updated) {
                updated.getState().getConfig().putAll(previous.getConfig());
            }
            persist(updated);
            if (wasEnabled) {
                enable(pluginId);
            }
            log.info("[{}] Updated {} -> {}", pluginId, previous.getVersion(), updated.getManifest().getVersion());
            return updated.snapshot();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 启用 / 禁用 ====================

    /**
     * 启用插件：状态置为 loading，调用插件 initialize 钩子
     * 失败时状态为 error 并记录 lastError，持久化后重新抛出。已启用时为空操作。
     */
    public PluginState enable(String pluginId) {
        requireId(pluginId);
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            InstalledPlugin plugin = requirePlugin(pluginId);
            synchronized (plugin) {
                if (plugin.getState().getStatus() == PluginStatus.ENABLED) {
                    return plugin.getState().copy();
                }
                plugin.getState().setStatus(PluginStatus.LOADING);
                plugin.getState().setLastError(null);
            }
            persist(plugin);

            try {
                PluginSandbox sandbox = plugin.getSandbox();
                if (sandbox == null || sandbox.getState() == SandboxState.TERMINATED) {
                    sandbox = newSandbox(plugin);
                    plugin.setSandbox(sandbox);
                    sandbox.initialize();
                }
                await(sandbox.call(SandboxMessage.METHOD_INITIALIZE, List.of(), config.getRpcTimeout()));

                synchronized (plugin) {
                    plugin.getState().setStatus(PluginStatus.ENABLED);
                    plugin.getState().setEnabledAt(clock.instant());
                }
                persist(plugin);
                eventBus.publishQuietly(new PluginEnabledEvent(pluginId, plugin.getManifest().getVersion()));
                log.info("[{}] Enabled", pluginId);
                return plugin.snapshot();
            } catch (RuntimeException e) {
                PlugBoxException failure = asPlugBoxException(e);
                log.error("[{}] Enable failed: {}", pluginId, failure.getMessage());
                synchronized (plugin) {
                    plugin.getState().setStatus(PluginStatus.ERROR);
                    plugin.getState().setLastError(failure.getMessage());
                    plugin.getState().setEnabledAt(null);
                }
                persistQuietly(plugin);
                // 半初始化的插件实例不再复用，下次启用重建沙箱
                terminateQuietly(plugin);
                plugin.setSandbox(null);
                eventBus.publishQuietly(new PluginEnableFailedEvent(pluginId, plugin.getManifest().getVersion(),
                        failure.getKind(), failure.getMessage()));
                throw failure;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 禁用插件：enabled 时调用 cleanup 钩子，error 可直接转为 disabled；其他状态为空操作
     * 钩子失败只记录日志。
     */
    public PluginState disable(String pluginId) {
        requireId(pluginId);
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            InstalledPlugin plugin = requirePlugin(pluginId);
            PluginStatus status = plugin.status();
            if (status != PluginStatus.ENABLED && status != PluginStatus.ERROR) {
                log.debug("[{}] Disable ignored in status {}", pluginId, status);
                return plugin.snapshot();
            }
            doDisable(plugin);
            return plugin.snapshot();
        } finally {
            lock.unlock();
        }
    }

    private void doDisable(InstalledPlugin plugin) {
        String pluginId = plugin.getId();
        PluginSandbox sandbox = plugin.getSandbox();
        if (plugin.status() == PluginStatus.ENABLED && sandbox != null) {
            try {
                await(sandbox.call(SandboxMessage.METHOD_CLEANUP, List.of(), config.getRpcTimeout()));
            } catch (RuntimeException e) {
                log.warn("[{}] Cleanup hook failed: {}", pluginId, e.getMessage());
            }
        }
        synchronized (plugin) {
            plugin.getState().setStatus(PluginStatus.DISABLED);
            plugin.getState().setEnabledAt(null);
        }
        persist(plugin);
        eventBus.publishQuietly(new PluginDisabledEvent(pluginId, plugin.getManifest().getVersion()));
        log.info("[{}] Disabled", pluginId);
    }

    // ==================== 执行 ====================

    /**
     * 调用插件方法
     * <p>
     * 未安装以 PluginNotFoundException 失败，未启用以 PluginNotAvailableException 失败，
     * 生命周期钩子名 (initialize / cleanup / configChanged) 以 ValidationException 失败。
     * 成功时 executionCount+1 并记录耗时与分配字节数；失败时 errorCount+1 并记录 lastError。
     * </p>
     */
    public CompletableFuture<Object> executePlugin(String pluginId, String method, List<Object> args) {
        if (pluginId == null || pluginId.isBlank()) {
            return CompletableFuture.failedFuture(new ValidationException("Plugin id must not be empty"));
        }
        if (method == null || method.isBlank()) {
            return CompletableFuture.failedFuture(new ValidationException("Method must not be empty"));
        }
        if (SandboxMessage.isReserved(method)) {
            return CompletableFuture.failedFuture(new ValidationException(
                    "Method " + method + " is a lifecycle hook and cannot be executed directly"));
        }
        ReentrantReadWriteLock.ReadLock lock = lockFor(pluginId).readLock();
        InstalledPlugin plugin;
        CompletableFuture<SandboxMessage.Response> call;
        long start;
        lock.lock();
        try {
            plugin = plugins.get(pluginId);
            if (plugin == null) {
                return CompletableFuture.failedFuture(new PluginNotFoundException("Plugin " + pluginId + " is not installed"));
            }
            PluginSandbox sandbox = plugin.getSandbox();
            if (plugin.status() != PluginStatus.ENABLED || sandbox == null) {
                return CompletableFuture.failedFuture(new PluginNotAvailableException(
                        "Plugin " + pluginId + " is not enabled (" + plugin.status().value() + ")"));
            }
            start = System.nanoTime();
            call = sandbox.call(method, args != null ? args : List.of(), config.getRpcTimeout());
        } finally {
            lock.unlock();
        }

        InstalledPlugin target = plugin;
        return call
                .whenCompleteAsync((response, error) ->
                        recordOutcome(target, response, error, (System.nanoTime() - start) / 1_000_000), completionExecutor)
                .thenApply(SandboxMessage.Response::result);
    }

    private void recordOutcome(InstalledPlugin plugin, SandboxMessage.Response response, Throwable error, long elapsedMs) {
        String pluginId = plugin.getId();
        ReentrantReadWriteLock.ReadLock lock = lockFor(pluginId).readLock();
        lock.lock();
        try {
            if (plugins.get(pluginId) != plugin) {
                log.debug("[{}] Plugin no longer installed, skipping metrics", pluginId);
                return;
            }
            synchronized (plugin) {
                if (error == null) {
                    plugin.getState().getMetrics().setExecutionCount(plugin.getState().getMetrics().getExecutionCount() + 1);
                    plugin.getState().getMetrics().setLoadTime(elapsedMs);
                    if (response.allocatedBytes() != null) {
                        plugin.getState().getMetrics().setMemoryUsage(response.allocatedBytes());
                    }
                } else {
                    plugin.getState().getMetrics().setErrorCount(plugin.getState().getMetrics().getErrorCount() + 1);
                    plugin.getState().setLastError(unwrap(error).getMessage());
                }
            }
            persistQuietly(plugin);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 配置 ====================

    /**
     * 当前生效配置：清单默认值合并覆盖项
     */
    public Map<String, Object> getPluginConfig(String pluginId) {
        return requirePlugin(pluginId).effectiveConfig();
    }

    /**
     * 浅合并配置补丁并持久化；插件启用时异步通知 configChanged（尽力而为）
     */
    public Map<String, Object> setPluginConfig(String pluginId, Map<String, Object> patch) {
        requireId(pluginId);
        if (patch == null) {
            throw new ValidationException("Config patch must not be null");
        }
        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            InstalledPlugin plugin = requirePlugin(pluginId);
            ConfigSchemaValidator.validate(plugin.getManifest(), patch);
            Map<String, Object> copy = new LinkedHashMap<>(patch);
            synchronized (plugin) {
                plugin.getState().getConfig().putAll(copy);
            }
            persist(plugin);
            eventBus.publishQuietly(new PluginConfigChangedEvent(pluginId, plugin.getManifest().getVersion(), copy));

            PluginSandbox sandbox = plugin.getSandbox();
            if (plugin.status() == PluginStatus.ENABLED && sandbox != null) {
                sandbox.call(SandboxMessage.METHOD_CONFIG_CHANGED, List.of(copy), config.getRpcTimeout())
                        .whenComplete((r, e) -> {
                            if (e != null) {
                                log.warn("[{}] configChanged notification failed: {}", pluginId, unwrap(e).getMessage());
                            }
                        });
            }
            return plugin.effectiveConfig();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 查询 ====================

    /**
     * 已安装插件状态（副本），按ID排序
     */
    public List<PluginState> getInstalledPlugins() {
        return plugins.values().stream()
                .map(InstalledPlugin::snapshot)
                .sorted(Comparator.comparing(PluginState::getId))
                .toList();
    }

    public Optional<PluginState> getPluginState(String pluginId) {
        return Optional.ofNullable(plugins.get(pluginId)).map(InstalledPlugin::snapshot);
    }

    public Optional<PluginManifest> getManifest(String pluginId) {
        return Optional.ofNullable(plugins.get(pluginId)).map(InstalledPlugin::getManifest);
    }

    public List<PluginSummary> searchRegistry(String query, SearchOptions options) {
        return registry.search(query, options);
    }

    // ==================== 启动恢复 ====================

    /**
     * 从已有目录恢复单个插件（启动时由 InstalledPluginLoader 调用）
     * 沙箱创建失败的插件仍会登记为 error 状态，以便宿主看到并处理。
     */
    public PluginState restore(Path pluginDir) {
        PluginManifest manifest = manifestLoader.load(pluginDir);
        String pluginId = manifest.getId();
        if (!pluginDir.getFileName().toString().equals(pluginId)) {
            throw new ValidationException("Directory " + pluginDir.getFileName() + " holds plugin " + pluginId);
        }

        ReentrantReadWriteLock.WriteLock lock = lockFor(pluginId).writeLock();
        lock.lock();
        try {
            if (plugins.containsKey(pluginId)) {
                throw new PluginAlreadyInstalledException("Plugin " + pluginId + " is already loaded");
            }
            PluginState state = stateStore.load(pluginId, manifest.getVersion());
            if (!manifest.getVersion().equals(state.getVersion())) {
                log.warn("[{}] State version {} differs from manifest {}, using manifest", pluginId,
                        state.getVersion(), manifest.getVersion());
                state.setVersion(manifest.getVersion());
            }
            boolean wasEnabled = state.getStatus() == PluginStatus.ENABLED;
            if (wasEnabled) {
                state.setStatus(PluginStatus.INSTALLED);
                state.setEnabledAt(null);
            }

            InstalledPlugin plugin = new InstalledPlugin(manifest, pluginDir, state);
            try {
                PluginSandbox sandbox = newSandbox(plugin);
                sandbox.initialize();
                plugin.setSandbox(sandbox);
            } catch (SandboxInitException e) {
                synchronized (plugin) {
                    state.setStatus(PluginStatus.ERROR);
                    state.setLastError(e.getMessage());
                }
                wasEnabled = false;
            }
            plugins.put(pluginId, plugin);
            persist(plugin);
            log.info("[{}] Restored version {} ({})", pluginId, manifest.getVersion(), plugin.status().value());

            if (wasEnabled) {
                try {
                    enable(pluginId);
                } catch (PlugBoxException e) {
                    log.error("[{}] Re-enable on startup failed: {}", pluginId, e.getMessage());
                }
            }
            return plugin.snapshot();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 内部方法 ====================

    private PluginSandbox newSandbox(InstalledPlugin plugin) {
        return new PluginSandbox(plugin.getManifest(), plugin.getDirectory(), config, hostServices, eventBus,
                plugin::effectiveConfig, timeoutScheduler, loaderFactory);
    }

    private void verify(String pluginId, String version, byte[] archive) {
        for (PluginPackageVerifier verifier : verifiers) {
            try {
                verifier.verify(pluginId, version, archive);
            } catch (PlugBoxException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ValidationException("Package verification failed for " + pluginId + ": " + e.getMessage(), e);
            }
        }
    }

    private InstalledPlugin requirePlugin(String pluginId) {
        InstalledPlugin plugin = plugins.get(pluginId);
        if (plugin == null) {
            throw new PluginNotFoundException("Plugin " + pluginId + " is not installed");
        }
        return plugin;
    }

    private static void requireId(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new ValidationException("Plugin id must not be empty");
        }
    }

    private ReentrantReadWriteLock lockFor(String pluginId) {
        return locks.computeIfAbsent(pluginId, k -> new ReentrantReadWriteLock());
    }

    private Path pluginDir(String pluginId) {
        Path root = config.getPluginsRoot().toAbsolutePath().normalize();
        Path dir = root.resolve(pluginId).normalize();
        if (!dir.getParent().equals(root)) {
            throw new ValidationException("Invalid plugin id: " + pluginId);
        }
        return dir;
    }

    private void persist(InstalledPlugin plugin) {
        stateStore.save(plugin.snapshot());
    }

    private void persistQuietly(InstalledPlugin plugin) {
        try {
            persist(plugin);
        } catch (PlugBoxException e) {
            log.warn("[{}] Failed to persist state: {}", plugin.getId(), e.getMessage());
        }
    }

    private void terminateQuietly(InstalledPlugin plugin) {
        PluginSandbox sandbox = plugin.getSandbox();
        if (sandbox == null) {
            return;
        }
        try {
            sandbox.terminate();
        } catch (RuntimeException e) {
            log.warn("[{}] Sandbox termination failed: {}", plugin.getId(), e.getMessage());
        }
    }

    private void deleteQuietly(Path dir) {
        try {
            deleteRecursively(dir);
        } catch (PlugBoxException e) {
            log.warn("Failed to delete {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to delete " + dir, e);
        }
    }

    /**
     * 阻塞等待 RPC 结果，异常解包为 PlugBoxException
     */
    private static void await(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException | CancellationException e) {
            throw unwrap(e);
        }
    }

    private static PlugBoxException unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return asPlugBoxException(cause);
    }

    private static PlugBoxException asPlugBoxException(Throwable e) {
        if (e instanceof PlugBoxException pbe) {
            return pbe;
        }
        return new PlugBoxException(ErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }
}
