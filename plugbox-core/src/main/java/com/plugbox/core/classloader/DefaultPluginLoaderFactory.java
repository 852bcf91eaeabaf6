package com.plugbox.core.classloader;

import com.plugbox.api.exception.SandboxInitException;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 默认实现：classes/ 目录、lib/ 下的 jar（按文件名排序）、插件目录本身
 */
public class DefaultPluginLoaderFactory implements PluginLoaderFactory {

    @Override
    public PluginClassLoader create(String pluginId, Path pluginDir, ClassLoader parent) {
        try {
            List<URL> urls = new ArrayList<>();
            Path classes = pluginDir.resolve("classes");
            if (Files.isDirectory(classes)) {
                urls.add(classes.toUri().toURL());
            }
            Path lib = pluginDir.resolve("lib");
            if (Files.isDirectory(lib)) {
                try (Stream<Path> jars = Files.list(lib)) {
                    for (Path jar : jars.filter(p -> p.getFileName().toString().endsWith(".jar")).sorted().toList()) {
                        urls.add(jar.toUri().toURL());
                    }
                }
            }
            urls.add(pluginDir.toUri().toURL());
            return new PluginClassLoader(pluginId, urls.toArray(new URL[0]), parent);
        } catch (IOException e) {
            throw new SandboxInitException("Failed to create classloader for plugin " + pluginId, e);
        }
    }
}
