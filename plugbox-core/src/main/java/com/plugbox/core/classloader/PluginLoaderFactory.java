package com.plugbox.core.classloader;

import java.nio.file.Path;

/**
 * 插件类加载器工厂
 */
public interface PluginLoaderFactory {

    PluginClassLoader create(String pluginId, Path pluginDir, ClassLoader parent);
}
