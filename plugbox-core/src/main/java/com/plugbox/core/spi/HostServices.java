package com.plugbox.core.spi;

import lombok.Builder;
import lombok.Value;

/**
 * 宿主协作方集合
 * 未提供的协作方对应的插件调用以 UNSUPPORTED 失败。
 */
@Value
@Builder
public class HostServices {
    AgentRuntime agentRuntime;
    ModelManager modelManager;
    MemoryEngine memoryEngine;
    UiBridge uiBridge;
    NetworkGateway networkGateway;

    public static HostServices none() {
        return HostServices.builder().build();
    }
}
