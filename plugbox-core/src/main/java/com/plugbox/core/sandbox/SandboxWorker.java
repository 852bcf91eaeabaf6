package com.plugbox.core.sandbox;

import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.PluginExecutionException;
import com.plugbox.api.exception.SandboxInitException;
import com.plugbox.api.exception.SandboxTerminatedException;
import com.plugbox.api.plugin.PluginApi;
import com.plugbox.api.plugin.SandboxedPlugin;
import com.plugbox.core.config.PlugBoxConfig;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 插件侧执行循环
 * <p>
 * 一个分派线程从收件箱取请求，交给插件专属的有界线程池执行；结果以 Response 回投给宿主。
 * 所有线程都是以插件ID命名的守护线程，插件卡死只会占满自己的池。
 * </p>
 */
@Slf4j
class SandboxWorker {

    private final String pluginId;
    private final ClassLoader pluginClassLoader;
    private final Consumer<SandboxMessage.Response> outbox;
    private final BlockingQueue<SandboxMessage.Request> inbox = new LinkedBlockingQueue<>();
    private final ThreadPoolExecutor pool;
    private final Thread dispatcher;

    private volatile boolean running;
    private volatile SandboxedPlugin plugin;
    private volatile PluginApi api;

    SandboxWorker(String pluginId, ClassLoader pluginClassLoader, PlugBoxConfig config,
                  Consumer<SandboxMessage.Response> outbox) {
        this.pluginId = pluginId;
        this.pluginClassLoader = pluginClassLoader;
        this.outbox = outbox;

        AtomicInteger threadIndex = new AtomicInteger(1);
        this.pool = new ThreadPoolExecutor(
                config.getWorkerPoolSize(),
                config.getWorkerPoolSize(),
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.getWorkerQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "plugbox-" + pluginId + "-worker-" + threadIndex.getAndIncrement());
                    t.setDaemon(true);
                    t.setContextClassLoader(pluginClassLoader);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() // 满载快速失败
        );
        this.pool.allowCoreThreadTimeOut(true);

        this.dispatcher = new Thread(this::dispatchLoop, "plugbox-" + pluginId + "-dispatcher");
        this.dispatcher.setDaemon(true);
    }

    void start() {
        running = true;
        dispatcher.start();
    }

    /**
     * 在插件线程上加载并实例化入口类
     */
    SandboxedPlugin instantiate(String mainClass, long timeoutMs) {
        Future<SandboxedPlugin> future = pool.submit(() -> {
            Class<?> clazz = Class.forName(mainClass, true, pluginClassLoader);
            if (!SandboxedPlugin.class.isAssignableFrom(clazz)) {
                throw new SandboxInitException(mainClass + " does not implement " + SandboxedPlugin.class.getName());
            }
            return (SandboxedPlugin) clazz.getDeclaredConstructor().newInstance();
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SandboxInitException("Timed out loading entry class " + mainClass, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SandboxInitException sie) {
                throw sie;
            }
            throw new SandboxInitException("Failed to load entry class " + mainClass + ": " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxInitException("Interrupted while loading entry class " + mainClass, e);
        }
    }

    void bind(SandboxedPlugin plugin, PluginApi api) {
        this.plugin = plugin;
        this.api = api;
    }

    /**
     * 投递请求，停止后拒绝
     */
    void post(SandboxMessage.Request request) {
        if (!running) {
            throw new SandboxTerminatedException("Sandbox of plugin " + pluginId + " is terminated");
        }
        inbox.add(request);
    }

    void shutdown() {
        running = false;
        dispatcher.interrupt();
        pool.shutdownNow();
        inbox.clear();
    }

    // ==================== 内部方法 ====================

    private void dispatchLoop() {
        while (running) {
            SandboxMessage.Request request;
            try {
                request = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                pool.execute(() -> handle(request));
            } catch (RejectedExecutionException e) {
                if (!running) {
                    break;
                }
                log.warn("[{}] Worker pool saturated, rejecting {}", pluginId, request.method());
                outbox.accept(SandboxMessage.Response.failure(request.id(),
                        new PluginExecutionException("Plugin " + pluginId + " is busy")));
            }
        }
        log.debug("[{}] Dispatcher stopped", pluginId);
    }

    private void handle(SandboxMessage.Request request) {
        long allocatedBefore = allocatedBytes();
        SandboxMessage.Response response;
        try {
            Object result = dispatch(request);
            long allocatedAfter = allocatedBytes();
            Long allocated = allocatedBefore < 0 || allocatedAfter < 0 ? null : allocatedAfter - allocatedBefore;
            response = SandboxMessage.Response.success(request.id(), result, allocated);
        } catch (PlugBoxException e) {
            response = SandboxMessage.Response.failure(request.id(), e);
        } catch (Throwable t) {
            log.debug("[{}] {} failed", pluginId, request.method(), t);
            response = SandboxMessage.Response.failure(request.id(),
                    new PluginExecutionException("Plugin " + pluginId + " failed in " + request.method()
                            + ": " + t.getMessage(), t));
        }
        outbox.accept(response);
    }

    @SuppressWarnings("unchecked")
    private Object dispatch(SandboxMessage.Request request) throws Exception {
        SandboxedPlugin target = this.plugin;
        if (target == null) {
            throw new SandboxInitException("Plugin " + pluginId + " is not loaded");
        }
        List<Object> args = request.args();
        switch (request.method()) {
            case SandboxMessage.METHOD_INITIALIZE -> {
                target.initialize(api);
                return null;
            }
            case SandboxMessage.METHOD_CLEANUP -> {
                target.cleanup();
                return null;
            }
            case SandboxMessage.METHOD_CONFIG_CHANGED -> {
                Map<String, Object> patch = args.isEmpty() ? Map.of() : (Map<String, Object>) args.get(0);
                target.configChanged(patch);
                return null;
            }
            default -> {
                return target.invoke(request.method(), args);
            }
        }
    }

    private static long allocatedBytes() {
        ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        if (bean instanceof com.sun.management.ThreadMXBean sunBean && sunBean.isThreadAllocatedMemorySupported()) {
            return sunBean.getCurrentThreadAllocatedBytes();
        }
        return -1;
    }
}
