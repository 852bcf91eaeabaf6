package com.plugbox.core.registry;

import com.plugbox.api.event.RegistrySyncedEvent;
import com.plugbox.api.exception.RegistryException;
import com.plugbox.api.registry.PluginSummary;
import com.plugbox.api.registry.SearchOptions;
import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.event.EventBus;
import com.plugbox.core.fixture.MutableClock;
import com.plugbox.core.spi.RegistryTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RegistryClient 单元测试")
class RegistryClientTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private RegistryTransport transport;

    private MutableClock clock;
    private EventBus eventBus;
    private RegistryClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        eventBus = new EventBus();
        when(transport.search(anyString())).thenReturn(catalog());
        client = new RegistryClient(transport, PlugBoxConfig.defaults(), clock, eventBus);
    }

    @Nested
    @DisplayName("检索")
    class SearchTests {

        @Test
        @DisplayName("名称不区分大小写子串匹配")
        void nameShouldMatchCaseInsensitive() {
            List<PluginSummary> results = client.search("scraper", null);

            assertEquals(1, results.size());
            assertEquals("Web Scraper", results.get(0).getName());
        }

        @Test
        @DisplayName("描述与标签同样参与匹配")
        void descriptionAndTagsShouldMatch() {
            assertEquals(List.of("code-runner"), ids(client.search("SANDBOXED", null)));
            assertEquals(List.of("web-scraper"), ids(client.search("crawl", null)));
        }

        @Test
        @DisplayName("分类与类型过滤")
        void categoryAndTypeShouldFilter() {
            assertEquals(List.of("code-runner"),
                    ids(client.search("", SearchOptions.builder().category("development").build())));
            assertEquals(List.of("chat-panel"),
                    ids(client.search("", SearchOptions.builder().type("UI").build())));
        }

        @Test
        @DisplayName("limit 为 0 时返回空且不访问注册中心")
        void zeroLimitShouldShortCircuit() {
            assertTrue(client.search("scraper", SearchOptions.builder().limit(0).build()).isEmpty());
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("结果数不超过上限 50")
        void resultsShouldBeCapped() {
            List<PluginSummary> large = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                large.add(summary("bulk-" + i, "Bulk " + i, "bulk entry", "tool", "misc"));
            }
            when(transport.search(anyString())).thenReturn(large);

            assertEquals(50, client.search("bulk", SearchOptions.builder().limit(100).build()).size());
            assertEquals(50, client.search("bulk", null).size());
            assertEquals(2, client.search("bulk", SearchOptions.builder().limit(2).build()).size());
        }
    }

    @Nested
    @DisplayName("缓存新鲜度")
    class FreshnessTests {

        @Test
        @DisplayName("新鲜窗口内只同步一次")
        void freshCacheShouldNotResync() {
            client.search("", null);
            clock.advance(Duration.ofHours(23));
            client.search("", null);

            verify(transport, times(1)).search(anyString());
            assertEquals(Optional.of(START), client.getLastSync());
        }

        @Test
        @DisplayName("超过窗口后重新同步")
        void staleCacheShouldResync() {
            client.search("", null);
            clock.advance(Duration.ofHours(25));
            client.search("", null);

            verify(transport, times(2)).search(anyString());
            assertEquals(Optional.of(START.plus(Duration.ofHours(25))), client.getLastSync());
        }

        @Test
        @DisplayName("refresh 强制同步")
        void refreshShouldForceSync() {
            client.search("", null);
            client.refresh();

            verify(transport, times(2)).search(anyString());
        }

        @Test
        @DisplayName("同步成功发布事件")
        void syncShouldPublishEvent() {
            AtomicInteger count = new AtomicInteger();
            eventBus.subscribe(RegistrySyncedEvent.class, e -> count.set(e.getPluginCount()));

            client.refresh();

            assertEquals(3, count.get());
        }

        @Test
        @DisplayName("同步失败时继续使用旧缓存并在下次重试")
        void failedSyncShouldServeStaleCache() {
            client.search("", null);
            clock.advance(Duration.ofHours(25));
            when(transport.search(anyString())).thenThrow(new IllegalStateException("offline"));

            List<PluginSummary> results = client.search("scraper", null);

            assertEquals(List.of("web-scraper"), ids(results));
            assertEquals(Optional.of(START), client.getLastSync());

            client.search("scraper", null);
            verify(transport, times(3)).search(anyString());
        }

        @Test
        @DisplayName("版本查询与下载同样先检查新鲜度")
        void versionsAndDownloadShouldSyncFirst() {
            when(transport.getVersions("web-scraper")).thenReturn(List.of("1.0.0"));
            when(transport.download("web-scraper", "1.0.0")).thenReturn(new byte[]{1});

            client.getVersions("web-scraper");
            verify(transport, times(1)).search(anyString());

            clock.advance(Duration.ofHours(25));
            client.downloadPlugin("web-scraper", "1.0.0");
            verify(transport, times(2)).search(anyString());
            assertEquals(Optional.of(START.plus(Duration.ofHours(25))), client.getLastSync());
        }

        @Test
        @DisplayName("同步失败不影响下载")
        void failedSyncShouldNotBlockDownload() {
            when(transport.search(anyString())).thenThrow(new IllegalStateException("offline"));
            when(transport.download("web-scraper", "1.0.0")).thenReturn(new byte[]{1});

            assertArrayEquals(new byte[]{1}, client.downloadPlugin("web-scraper", "1.0.0"));
        }

        @Test
        @DisplayName("首次同步失败返回空结果而不是异常")
        void failedFirstSyncShouldReturnEmpty() {
            when(transport.search(anyString())).thenThrow(new IllegalStateException("offline"));

            assertTrue(client.search("scraper", null).isEmpty());
            assertTrue(client.getLastSync().isEmpty());
        }
    }

    @Nested
    @DisplayName("查询与下载")
    class LookupTests {

        @Test
        @DisplayName("缓存中没有时回退到传输层")
        void getPluginShouldFallBackToTransport() {
            PluginSummary hidden = summary("hidden", "Hidden", "not listed", "tool", "misc");
            when(transport.getPlugin("hidden")).thenReturn(Optional.of(hidden));

            assertEquals(Optional.of(hidden), client.getPlugin("hidden"));
            assertEquals("Web Scraper", client.getPlugin("web-scraper").orElseThrow().getName());
            verify(transport, never()).getPlugin("web-scraper");
        }

        @Test
        @DisplayName("空包与传输异常都是 RegistryException")
        void downloadFailuresShouldBeRegistryErrors() {
            when(transport.download("web-scraper", "1.0.0")).thenReturn(new byte[0]);
            when(transport.download("web-scraper", "2.0.0")).thenThrow(new IllegalStateException("502"));

            assertThrows(RegistryException.class, () -> client.downloadPlugin("web-scraper", "1.0.0"));
            RegistryException e = assertThrows(RegistryException.class,
                    () -> client.downloadPlugin("web-scraper", "2.0.0"));
            assertTrue(e.getMessage().contains("502"), e.getMessage());
        }

        @Test
        @DisplayName("版本列表为不可变副本")
        void versionsShouldBeCopied() {
            when(transport.getVersions("web-scraper")).thenReturn(new ArrayList<>(List.of("1.0.0", "1.1.0")));

            List<String> versions = client.getVersions("web-scraper");

            assertEquals(List.of("1.0.0", "1.1.0"), versions);
            assertThrows(UnsupportedOperationException.class, () -> versions.add("9.9.9"));
        }
    }

    // ==================== 辅助方法 ====================

    private static List<PluginSummary> catalog() {
        return List.of(
                PluginSummary.builder()
                        .id("web-scraper").name("Web Scraper").description("Extract data from websites")
                        .type("tool").category("data").tag("scraping").tag("crawl").version("1.0.0")
                        .build(),
                summary("code-runner", "Code Runner", "Sandboxed code execution", "tool", "development"),
                summary("chat-panel", "Chat Panel", "Conversation side panel", "ui", "interface"));
    }

    private static PluginSummary summary(String id, String name, String description, String type, String category) {
        return PluginSummary.builder()
                .id(id).name(name).description(description).type(type).category(category).version("1.0.0")
                .build();
    }

    private static List<String> ids(List<PluginSummary> summaries) {
        return summaries.stream().map(PluginSummary::getId).toList();
    }
}
