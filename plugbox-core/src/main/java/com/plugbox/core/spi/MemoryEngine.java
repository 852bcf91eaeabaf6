package com.plugbox.core.spi;

import java.util.List;
import java.util.Map;

/**
 * 记忆存储 SPI（宿主提供）
 */
public interface MemoryEngine {

    String store(String ownerPluginId, String content, String type, Map<String, Object> metadata);

    List<Map<String, Object>> search(String ownerPluginId, String query, Map<String, Object> options);
}
