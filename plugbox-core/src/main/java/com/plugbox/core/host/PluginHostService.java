package com.plugbox.core.host;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.registry.PluginSummary;
import com.plugbox.api.registry.SearchOptions;
import com.plugbox.api.result.OperationResult;
import com.plugbox.api.state.PluginState;
import com.plugbox.core.plugin.PluginManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * 面向宿主的插件操作入口
 * 每个操作都返回 {@link OperationResult}，异常不会逃逸到宿主。
 */
@Slf4j
@RequiredArgsConstructor
public class PluginHostService {

    private final PluginManager pluginManager;

    public OperationResult<PluginState> install(String pluginId, String version) {
        return withId(pluginId, "install", () -> pluginManager.install(pluginId, version));
    }

    public OperationResult<Void> uninstall(String pluginId) {
        return withId(pluginId, "uninstall", () -> {
            pluginManager.uninstall(pluginId);
            return null;
        });
    }

    public OperationResult<PluginState> enable(String pluginId) {
        return withId(pluginId, "enable", () -> pluginManager.enable(pluginId));
    }

    public OperationResult<PluginState> disable(String pluginId) {
        return withId(pluginId, "disable", () -> pluginManager.disable(pluginId));
    }

    public OperationResult<PluginState> update(String pluginId, String version) {
        return withId(pluginId, "update", () -> pluginManager.updatePlugin(pluginId, version));
    }

    public OperationResult<List<PluginState>> listInstalled() {
        return run("listInstalled", pluginManager::getInstalledPlugins);
    }

    public OperationResult<PluginState> getState(String pluginId) {
        return withId(pluginId, "getState", () -> pluginManager.getPluginState(pluginId)
                .orElseThrow(() -> new PlugBoxException(ErrorKind.NOT_FOUND, "Plugin " + pluginId + " is not installed")));
    }

    public OperationResult<List<PluginSummary>> searchRegistry(String query, SearchOptions options) {
        return run("searchRegistry", () -> pluginManager.searchRegistry(query, options));
    }

    public OperationResult<Map<String, Object>> getConfig(String pluginId) {
        return withId(pluginId, "getConfig", () -> pluginManager.getPluginConfig(pluginId));
    }

    public OperationResult<Map<String, Object>> setConfig(String pluginId, Map<String, Object> patch) {
        return withId(pluginId, "setConfig", () -> pluginManager.setPluginConfig(pluginId, patch));
    }

    /**
     * 阻塞执行，等待时间由 RPC 超时约束
     */
    public OperationResult<Object> execute(String pluginId, String method, List<Object> args) {
        return executeAsync(pluginId, method, args).join();
    }

    public CompletableFuture<OperationResult<Object>> executeAsync(String pluginId, String method, List<Object> args) {
        if (pluginId == null || pluginId.isBlank()) {
            return CompletableFuture.completedFuture(
                    OperationResult.error(ErrorKind.VALIDATION, "Plugin id must not be empty"));
        }
        CompletableFuture<Object> future;
        try {
            future = pluginManager.executePlugin(pluginId, method, args);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(toError("execute", pluginId, e));
        }
        return future.handle((result, error) -> {
            if (error != null) {
                return PluginHostService.<Object>toError("execute", pluginId, error);
            }
            return OperationResult.ok(result);
        });
    }

    // ==================== 内部方法 ====================

    private <T> OperationResult<T> withId(String pluginId, String operation, Supplier<T> action) {
        if (pluginId == null || pluginId.isBlank()) {
            return OperationResult.error(ErrorKind.VALIDATION, "Plugin id must not be empty");
        }
        try {
            return OperationResult.ok(action.get());
        } catch (RuntimeException e) {
            return toError(operation, pluginId, e);
        }
    }

    private <T> OperationResult<T> run(String operation, Supplier<T> action) {
        try {
            return OperationResult.ok(action.get());
        } catch (RuntimeException e) {
            return toError(operation, null, e);
        }
    }

    private static <T> OperationResult<T> toError(String operation, String pluginId, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof PlugBoxException pbe) {
            log.debug("[{}] {} failed: {} {}", pluginId, operation, pbe.getKind(), pbe.getMessage());
            return OperationResult.error(pbe);
        }
        log.error("[{}] {} failed unexpectedly", pluginId, operation, cause);
        return OperationResult.error(ErrorKind.INTERNAL, String.valueOf(cause.getMessage()));
    }
}
