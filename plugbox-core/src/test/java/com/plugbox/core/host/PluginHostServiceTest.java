package com.plugbox.core.host;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PluginNotFoundException;
import com.plugbox.api.exception.SandboxTimeoutException;
import com.plugbox.api.result.OperationResult;
import com.plugbox.api.state.PluginState;
import com.plugbox.core.plugin.PluginManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PluginHostService 单元测试")
class PluginHostServiceTest {

    @Mock
    private PluginManager pluginManager;

    private PluginHostService hostService;

    @BeforeEach
    void setUp() {
        hostService = new PluginHostService(pluginManager);
    }

    @Nested
    @DisplayName("同步操作")
    class SyncOperationTests {

        @Test
        @DisplayName("成功时返回数据")
        void successShouldCarryData() {
            PluginState state = PluginState.installed("p1", "1.0.0", Instant.now());
            when(pluginManager.install("p1", null)).thenReturn(state);

            OperationResult<PluginState> result = hostService.install("p1", null);

            assertTrue(result.isSuccess());
            assertSame(state, result.getData());
            assertNull(result.getErrorKind());
        }

        @Test
        @DisplayName("空ID直接返回 VALIDATION，不触达管理器")
        void blankIdShouldBeValidation() {
            OperationResult<PluginState> result = hostService.enable("  ");

            assertFalse(result.isSuccess());
            assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
            verifyNoInteractions(pluginManager);
        }

        @Test
        @DisplayName("PlugBox 异常转换为对应错误类型")
        void plugBoxExceptionShouldKeepKind() {
            when(pluginManager.disable("ghost")).thenThrow(new PluginNotFoundException("Plugin ghost is not installed"));

            OperationResult<PluginState> result = hostService.disable("ghost");

            assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
            assertEquals("Plugin ghost is not installed", result.getMessage());
        }

        @Test
        @DisplayName("未预期异常归为 INTERNAL")
        void unexpectedExceptionShouldBeInternal() {
            when(pluginManager.getInstalledPlugins()).thenThrow(new IllegalStateException("corrupted"));

            OperationResult<List<PluginState>> result = hostService.listInstalled();

            assertEquals(ErrorKind.INTERNAL, result.getErrorKind());
            assertEquals("corrupted", result.getMessage());
        }

        @Test
        @DisplayName("查询不存在的状态返回 NOT_FOUND")
        void missingStateShouldBeNotFound() {
            when(pluginManager.getPluginState("ghost")).thenReturn(Optional.empty());

            assertEquals(ErrorKind.NOT_FOUND, hostService.getState("ghost").getErrorKind());
        }

        @Test
        @DisplayName("卸载成功返回空数据")
        void uninstallShouldSucceedWithoutData() {
            OperationResult<Void> result = hostService.uninstall("p1");

            assertTrue(result.isSuccess());
            verify(pluginManager).uninstall("p1");
        }

        @Test
        @DisplayName("配置写入转发补丁")
        void setConfigShouldForwardPatch() {
            when(pluginManager.setPluginConfig("p1", Map.of("depth", 3))).thenReturn(Map.of("depth", 3));

            OperationResult<Map<String, Object>> result = hostService.setConfig("p1", Map.of("depth", 3));

            assertEquals(Map.of("depth", 3), result.getData());
        }
    }

    @Nested
    @DisplayName("执行")
    class ExecuteTests {

        @Test
        @DisplayName("成功结果包装为 ok")
        void successShouldBeOk() {
            when(pluginManager.executePlugin(anyString(), anyString(), any()))
                    .thenReturn(CompletableFuture.completedFuture("done"));

            OperationResult<Object> result = hostService.execute("p1", "run", List.of());

            assertTrue(result.isSuccess());
            assertEquals("done", result.getData());
        }

        @Test
        @DisplayName("异步失败解包为原错误类型")
        void asyncFailureShouldUnwrap() {
            CompletableFuture<Object> failed = new CompletableFuture<>();
            failed.completeExceptionally(new SandboxTimeoutException("too slow"));
            when(pluginManager.executePlugin(anyString(), anyString(), any())).thenReturn(failed.thenApply(r -> r));

            OperationResult<Object> result = hostService.executeAsync("p1", "run", List.of()).join();

            assertEquals(ErrorKind.TIMEOUT, result.getErrorKind());
            assertEquals("too slow", result.getMessage());
        }

        @Test
        @DisplayName("空ID不触达管理器")
        void blankIdShouldNotReachManager() {
            OperationResult<Object> result = hostService.execute(null, "run", List.of());

            assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
            verify(pluginManager, never()).executePlugin(any(), any(), any());
        }
    }
}
