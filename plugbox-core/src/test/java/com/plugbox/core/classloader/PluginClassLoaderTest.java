package com.plugbox.core.classloader;

import com.example.widget.Widget;
import com.plugbox.api.plugin.SandboxedPlugin;
import com.plugbox.core.fixture.NotAPlugin;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginClassLoader 单元测试")
class PluginClassLoaderTest {

    @TempDir
    Path pluginDir;

    @Nested
    @DisplayName("类加载委派")
    class DelegationTests {

        @Test
        @DisplayName("API 契约类必须来自父加载器")
        void apiClassesShouldComeFromParent() throws Exception {
            try (PluginClassLoader loader = newLoader()) {
                assertSame(SandboxedPlugin.class, loader.loadClass(SandboxedPlugin.class.getName()));
                assertSame(String.class, loader.loadClass("java.lang.String"));
            }
        }

        @Test
        @DisplayName("插件包中的同名宿主类被忽略")
        void hostClassesShouldNotBeShadowed() throws Exception {
            copyClass(NotAPlugin.class);
            copyClass(SandboxedPlugin.class);

            try (PluginClassLoader loader = newLoader()) {
                assertSame(NotAPlugin.class, loader.loadClass(NotAPlugin.class.getName()));
                assertSame(SandboxedPlugin.class, loader.loadClass(SandboxedPlugin.class.getName()));
                assertEquals(0, loader.getDefinedClassCount());

                URL resource = loader.getResource(classFile(SandboxedPlugin.class));
                assertEquals(getClass().getClassLoader().getResource(classFile(SandboxedPlugin.class)), resource);
            }
        }

        @Test
        @DisplayName("非宿主包的类优先由插件自己定义")
        void pluginClassesShouldBeDefinedLocally() throws Exception {
            copyClass(Widget.class);

            try (PluginClassLoader loader = newLoader()) {
                Class<?> own = loader.loadClass(Widget.class.getName());

                assertNotSame(Widget.class, own);
                assertSame(loader, own.getClassLoader());
                assertEquals("plugbox-p1", own.getMethod("origin").invoke(own.getDeclaredConstructor().newInstance()));
                assertSame(own, loader.loadClass(Widget.class.getName()));
                assertEquals(1, loader.getDefinedClassCount());
            }
        }

        @Test
        @DisplayName("插件没有的类回退到宿主")
        void missingPluginClassShouldFallBackToHost() throws Exception {
            try (PluginClassLoader loader = newLoader()) {
                assertSame(Widget.class, loader.loadClass(Widget.class.getName()));
                assertEquals(0, loader.getDefinedClassCount());
            }
        }

        @Test
        @DisplayName("插件与宿主都没有的类抛出 ClassNotFoundException")
        void unknownClassShouldFail() throws Exception {
            try (PluginClassLoader loader = newLoader()) {
                assertThrows(ClassNotFoundException.class, () -> loader.loadClass("com.example.NonExistentClass"));
            }
        }
    }

    @Nested
    @DisplayName("资源加载")
    class ResourceTests {

        @Test
        @DisplayName("同名资源优先读取插件自己的")
        void pluginResourceShouldWin() throws Exception {
            Files.writeString(pluginDir.resolve("plugbox-probe.txt"), "plugin");

            try (PluginClassLoader loader = newLoader()) {
                assertEquals("plugin", read(loader.getResource("plugbox-probe.txt")));

                List<URL> all = Collections.list(loader.getResources("plugbox-probe.txt"));
                assertEquals(2, all.size());
                assertEquals("plugin", read(all.get(0)));
                assertEquals("host", read(all.get(1)));
            }
        }

        @Test
        @DisplayName("插件没有时回退到宿主资源")
        void hostResourceShouldBeFallback() throws Exception {
            try (PluginClassLoader loader = newLoader()) {
                assertEquals("host", read(loader.getResource("plugbox-probe.txt")));
            }
        }
    }

    @Nested
    @DisplayName("类路径组成")
    class FactoryTests {

        @Test
        @DisplayName("classes 目录优先，jar 按文件名排序，最后是插件目录")
        void urlsShouldBeOrdered() throws Exception {
            Files.createDirectories(pluginDir.resolve("classes"));
            Files.createDirectories(pluginDir.resolve("lib"));
            Files.write(pluginDir.resolve("lib/b.jar"), new byte[0]);
            Files.write(pluginDir.resolve("lib/a.jar"), new byte[0]);
            Files.writeString(pluginDir.resolve("lib/readme.txt"), "ignored");

            try (PluginClassLoader loader = new DefaultPluginLoaderFactory()
                    .create("p1", pluginDir, getClass().getClassLoader())) {
                List<String> urls = Arrays.stream(loader.getURLs()).map(URL::toString).toList();

                assertEquals(4, urls.size());
                assertTrue(urls.get(0).endsWith("/classes/"), urls.get(0));
                assertTrue(urls.get(1).endsWith("/lib/a.jar"), urls.get(1));
                assertTrue(urls.get(2).endsWith("/lib/b.jar"), urls.get(2));
                assertEquals("p1", loader.getPluginId());
            }
        }
    }

    // ==================== 辅助方法 ====================

    private PluginClassLoader newLoader() throws IOException {
        return new PluginClassLoader("p1", new URL[]{pluginDir.toUri().toURL()}, getClass().getClassLoader());
    }

    private void copyClass(Class<?> type) throws IOException {
        Path target = pluginDir.resolve(classFile(type));
        Files.createDirectories(target.getParent());
        try (InputStream in = type.getClassLoader().getResourceAsStream(classFile(type))) {
            assertNotNull(in, classFile(type));
            Files.write(target, in.readAllBytes());
        }
    }

    private static String classFile(Class<?> type) {
        return type.getName().replace('.', '/') + ".class";
    }

    private static String read(URL url) throws IOException {
        assertNotNull(url);
        try (InputStream in = url.openStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
    }
}
