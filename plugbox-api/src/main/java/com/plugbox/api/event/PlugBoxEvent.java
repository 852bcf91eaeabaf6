package com.plugbox.api.event;

/**
 * 框架事件标记接口
 */
public interface PlugBoxEvent {

    long getTimestamp();
}
