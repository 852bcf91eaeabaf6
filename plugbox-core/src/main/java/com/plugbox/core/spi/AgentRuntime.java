package com.plugbox.core.spi;

import java.util.Map;

/**
 * Agent 运行时 SPI（宿主提供）
 */
public interface AgentRuntime {

    String createAgent(String ownerPluginId, Map<String, Object> config);

    Object executeAgent(String agentId, Map<String, Object> task);

    void stopAgent(String agentId);
}
