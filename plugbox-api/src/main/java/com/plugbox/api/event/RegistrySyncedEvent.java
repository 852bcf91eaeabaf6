package com.plugbox.api.event;

import lombok.Getter;

/**
 * 注册中心缓存同步完成
 */
@Getter
public class RegistrySyncedEvent extends AbstractPlugBoxEvent {
    private final int pluginCount;

    public RegistrySyncedEvent(int pluginCount) {
        super();
        this.pluginCount = pluginCount;
    }
}
