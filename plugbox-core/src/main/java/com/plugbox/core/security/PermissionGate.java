package com.plugbox.core.security;

import com.plugbox.api.exception.PermissionDeniedException;
import com.plugbox.api.plugin.PluginApi;
import com.plugbox.api.security.PermissionCategory;
import com.plugbox.api.security.RequiresPermission;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 权限闸门
 * <p>
 * 插件拿到的 {@link PluginApi} 是本类生成的 JDK 动态代理。每次调用先读取方法上的
 * {@link RequiresPermission}，对照冻结的 {@link PermissionSnapshot} 检查，通过后才委托给宿主实现。
 * 文件类调用先做路径规范化，越界直接 PathTraversal，与授权无关。
 * </p>
 */
@Slf4j
public class PermissionGate implements InvocationHandler {

    /**
     * 插件永远不能改写的描述文件
     */
    static final Set<String> RESERVED_FILES = Set.of("plugin.yml", "state.yml");

    private static final ConcurrentHashMap<Method, Optional<PermissionCategory>> CATEGORY_CACHE =
            new ConcurrentHashMap<>();

    private final String pluginId;
    private final PluginApi target;
    private final PermissionSnapshot snapshot;
    private final SandboxPathResolver pathResolver;

    private PermissionGate(String pluginId, PluginApi target, PermissionSnapshot snapshot,
                           SandboxPathResolver pathResolver) {
        this.pluginId = pluginId;
        this.target = target;
        this.snapshot = snapshot;
        this.pathResolver = pathResolver;
    }

    /**
     * 包装宿主实现
     */
    public static PluginApi protect(String pluginId, PluginApi target, PermissionSnapshot snapshot,
                                    SandboxPathResolver pathResolver) {
        return (PluginApi) Proxy.newProxyInstance(
                PluginApi.class.getClassLoader(),
                new Class<?>[]{PluginApi.class},
                new PermissionGate(pluginId, target, snapshot, pathResolver));
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return switch (method.getName()) {
                case "equals" -> proxy == args[0];
                case "hashCode" -> System.identityHashCode(proxy);
                default -> "PluginApi[" + pluginId + "]";
            };
        }

        Optional<PermissionCategory> required = CATEGORY_CACHE.computeIfAbsent(method,
                m -> Optional.ofNullable(m.getAnnotation(RequiresPermission.class)).map(RequiresPermission::value));
        if (required.isPresent()) {
            check(required.get(), method, args);
        }

        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private void check(PermissionCategory category, Method method, Object[] args) {
        Object resource = args != null && args.length > 0 ? args[0] : null;
        switch (category) {
            case FILESYSTEM_READ, FILESYSTEM_WRITE -> checkFile(category, String.valueOf(resource), args);
            case NETWORK -> {
                if (!snapshot.canFetch((String) resource)) {
                    deny(method, "network access to " + resource);
                }
            }
            case MODEL_EXECUTE -> {
                if (!snapshot.canUseModel((String) resource)) {
                    deny(method, "model " + resource);
                }
            }
            default -> {
                if (!snapshot.isGranted(category)) {
                    deny(method, category.capability());
                }
            }
        }
    }

    private void checkFile(PermissionCategory category, String path, Object[] args) {
        // 先规范化：越界与是否授权无关
        Path resolved = pathResolver.resolve(path);
        Path relative = pathResolver.relativize(resolved);

        boolean allowed;
        if (category == PermissionCategory.FILESYSTEM_WRITE) {
            allowed = !RESERVED_FILES.contains(relative.toString()) && snapshot.canWrite(relative);
        } else {
            allowed = snapshot.canRead(relative);
        }
        if (!allowed) {
            log.warn("[{}] Denied {} on {}", pluginId, category, relative);
            throw new PermissionDeniedException("Plugin " + pluginId + " may not "
                    + (category == PermissionCategory.FILESYSTEM_WRITE ? "write " : "read ") + relative);
        }
        args[0] = resolved.toString();
    }

    private void deny(Method method, String what) {
        log.warn("[{}] Denied {}: {}", pluginId, method.getName(), what);
        throw new PermissionDeniedException("Plugin " + pluginId + " is not permitted: " + what);
    }
}
