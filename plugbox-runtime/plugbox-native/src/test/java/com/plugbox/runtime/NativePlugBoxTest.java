package com.plugbox.runtime;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.registry.PluginSummary;
import com.plugbox.api.result.OperationResult;
import com.plugbox.api.state.PluginState;
import com.plugbox.api.state.PluginStatus;
import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.spi.HostServices;
import com.plugbox.core.spi.RegistryTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("NativePlugBox 启动测试")
class NativePlugBoxTest {

    private static final String MANIFEST = String.join("\n",
            "id: greeter",
            "name: Greeter",
            "version: 1.0.0",
            "description: Greets people",
            "type: tool",
            "engine:",
            "  host: '>=1.0.0'",
            "capabilities: []",
            "main: " + GreeterPlugin.class.getName(),
            "configSchema:",
            "  greeting:",
            "    type: string",
            "defaultConfig:",
            "  greeting: Hello",
            "");

    @TempDir
    Path root;

    @Mock
    private RegistryTransport transport;

    private PlugBoxConfig config;
    private PlugBoxRuntime runtime;

    @BeforeEach
    void setUp() {
        config = PlugBoxConfig.builder()
                .pluginsRoot(root)
                .rpcTimeout(Duration.ofSeconds(5))
                .build();
        when(transport.search(anyString())).thenReturn(List.of());
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    @Test
    @DisplayName("空目录启动后可用，关闭幂等")
    void emptyStartAndClose() {
        runtime = start();

        OperationResult<List<PluginState>> installed = runtime.getHostService().listInstalled();
        assertTrue(installed.isSuccess());
        assertTrue(installed.getData().isEmpty());

        runtime.close();
        assertTrue(runtime.isClosed());
        assertDoesNotThrow(runtime::close);
    }

    @Test
    @DisplayName("启动时恢复并重新启用插件")
    void startShouldRestoreEnabledPlugins() throws IOException {
        Path dir = Files.createDirectories(root.resolve("greeter"));
        Files.writeString(dir.resolve("plugin.yml"), MANIFEST);
        Files.writeString(dir.resolve("state.yml"), String.join("\n",
                "id: greeter",
                "status: enabled",
                "version: 1.0.0",
                "installedAt: '2024-01-01T00:00:00Z'",
                "enabledAt: '2024-01-01T00:01:00Z'",
                "config:",
                "  greeting: Hi",
                ""));

        runtime = start();

        OperationResult<PluginState> state = runtime.getHostService().getState("greeter");
        assertTrue(state.isSuccess(), state.toString());
        assertEquals(PluginStatus.ENABLED, state.getData().getStatus());
        assertEquals("Hi, Ada", runtime.getHostService().execute("greeter", "greet", List.of("Ada")).getData());
    }

    @Test
    @DisplayName("通过宿主服务完成安装、启用、配置与调用")
    void hostServiceRoundTrip() throws IOException {
        when(transport.getPlugin("greeter")).thenReturn(Optional.of(PluginSummary.builder()
                .id("greeter").name("Greeter").description("Greets people").type("tool").version("1.0.0")
                .build()));
        when(transport.getVersions("greeter")).thenReturn(List.of("1.0.0"));
        when(transport.download("greeter", "1.0.0")).thenReturn(zip(Map.of("plugin.yml", MANIFEST)));
        runtime = start();

        assertTrue(runtime.getHostService().install("greeter", null).isSuccess());
        assertTrue(runtime.getHostService().enable("greeter").isSuccess());
        assertEquals("Hello, Bob", runtime.getHostService().execute("greeter", "greet", List.of("Bob")).getData());

        OperationResult<Map<String, Object>> invalid = runtime.getHostService().setConfig("greeter", Map.of("greeting", 1));
        assertEquals(ErrorKind.VALIDATION, invalid.getErrorKind());
        assertTrue(runtime.getHostService().setConfig("greeter", Map.of("greeting", "Howdy")).isSuccess());
        assertEquals("Howdy, Bob", runtime.getHostService().execute("greeter", "greet", List.of("Bob")).getData());

        OperationResult<Object> unknown = runtime.getHostService().execute("greeter", "wave", List.of());
        assertEquals(ErrorKind.PLUGIN_ERROR, unknown.getErrorKind());

        assertTrue(runtime.getHostService().uninstall("greeter").isSuccess());
        assertFalse(Files.exists(root.resolve("greeter")));
    }

    @Test
    @DisplayName("插件根目录不可用时启动失败")
    void unusableRootShouldFailStart() throws IOException {
        Path file = Files.writeString(root.resolve("not-a-dir"), "x");
        config = config.toBuilder().pluginsRoot(file).build();

        PlugBoxException e = assertThrows(PlugBoxException.class, this::start);
        assertEquals(ErrorKind.IO, e.getKind());
    }

    // ==================== 辅助方法 ====================

    private PlugBoxRuntime start() {
        return NativePlugBox.start(config, HostServices.none(), transport, List.of(), Clock.systemUTC(), false);
    }

    private static byte[] zip(Map<String, String> entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
