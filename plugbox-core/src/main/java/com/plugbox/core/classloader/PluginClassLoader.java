package com.plugbox.core.classloader;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件类加载器
 * 按包前缀决定类与资源的来源：
 * <ul>
 *     <li>宿主独占：JDK、PlugBox API 契约、宿主内部实现 (core / runtime) 与日志门面。
 *     只从父加载器取，插件包里的同名类会被忽略并记录告警。</li>
 *     <li>插件优先：其余类先在插件的 classes/、lib/ 中查找，没有再回退宿主。</li>
 * </ul>
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private static final List<String> HOST_ONLY_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.plugbox.api.",
            "com.plugbox.core.",
            "com.plugbox.runtime.",
            "org.slf4j."
    );

    private final String pluginId;
    private final AtomicInteger definedClasses = new AtomicInteger();

    public PluginClassLoader(String pluginId, URL[] urls, ClassLoader parent) {
        super("plugbox-" + pluginId, urls, parent);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }

    /**
     * 由插件自身定义的类数量
     */
    public int getDefinedClassCount() {
        return definedClasses.get();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                c = isHostOnly(name) ? loadFromHost(name) : loadPluginFirst(name);
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (isHostOnlyResource(name)) {
            return host().getResource(name);
        }
        URL own = findResource(name);
        return own != null ? own : host().getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (isHostOnlyResource(name)) {
            return host().getResources(name);
        }
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        urls.addAll(Collections.list(host().getResources(name)));
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        log.debug("[{}] Closing classloader ({} plugin class(es) defined)", pluginId, definedClasses.get());
        super.close();
    }

    // ==================== 内部方法 ====================

    private Class<?> loadFromHost(String name) throws ClassNotFoundException {
        if (findResource(classFile(name)) != null) {
            log.warn("[{}] Ignoring plugin copy of host class {}", pluginId, name);
        }
        return host().loadClass(name);
    }

    private Class<?> loadPluginFirst(String name) throws ClassNotFoundException {
        Class<?> own;
        try {
            own = findClass(name);
        } catch (ClassNotFoundException e) {
            return host().loadClass(name);
        }
        definedClasses.incrementAndGet();
        log.trace("[{}] Defined {}", pluginId, name);
        return own;
    }

    private ClassLoader host() {
        ClassLoader parent = getParent();
        return parent != null ? parent : ClassLoader.getPlatformClassLoader();
    }

    private static boolean isHostOnly(String className) {
        for (String pkg : HOST_ONLY_PACKAGES) {
            if (className.startsWith(pkg)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHostOnlyResource(String resourceName) {
        return resourceName.endsWith(".class") && isHostOnly(resourceName.replace('/', '.'));
    }

    private static String classFile(String className) {
        return className.replace('.', '/') + ".class";
    }
}
