package com.plugbox.core.spi;

import com.plugbox.api.registry.PluginSummary;

import java.util.List;
import java.util.Optional;

/**
 * 注册中心传输 SPI
 * 线路协议 (REST/gRPC 等) 由宿主实现，Core 只依赖这四个操作。
 */
public interface RegistryTransport {

    /**
     * 检索目录，query 为空串时返回完整目录（按目录顺序）
     */
    List<PluginSummary> search(String query);

    Optional<PluginSummary> getPlugin(String pluginId);

    List<String> getVersions(String pluginId);

    /**
     * 下载插件包 (zip)
     */
    byte[] download(String pluginId, String version);
}
