package com.plugbox.api.manifest;

import java.util.Arrays;
import java.util.Optional;

/**
 * 插件类型
 */
public enum PluginType {
    TOOL("tool"),
    AGENT("agent"),
    UI("ui"),
    INTEGRATION("integration"),
    WORKFLOW("workflow");

    private final String value;

    PluginType(String value) {
        this.value = value;
    }

    /**
     * 清单中的取值（小写）
     */
    public String value() {
        return value;
    }

    public static Optional<PluginType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
