package com.plugbox.api.state;

import java.util.Arrays;
import java.util.Optional;

/**
 * 插件状态
 * <pre>
 * (none) --install--> INSTALLED --enable--> ENABLED --disable--> DISABLED --enable--> ENABLED
 * INSTALLED|ENABLED|DISABLED|ERROR --uninstall--> (none)
 * enable 失败 --> ERROR，ERROR 可重试 enable
 * </pre>
 */
public enum PluginStatus {
    INSTALLED("installed"),
    ENABLED("enabled"),
    DISABLED("disabled"),
    ERROR("error"),
    /** enable 进行中的瞬时状态 */
    LOADING("loading");

    private final String value;

    PluginStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PluginStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }
}
