package com.plugbox.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 框架事件基类
 */
@Getter
public abstract class AbstractPlugBoxEvent implements PlugBoxEvent, Serializable {
    private final long timestamp;

    public AbstractPlugBoxEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[timestamp=" + timestamp + "]";
    }
}
