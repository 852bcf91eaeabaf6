package com.plugbox.api.event;

/**
 * 事件监听器接口
 *
 * @param <E> 监听的事件类型
 * @author PlugBox
 */
@FunctionalInterface
public interface PlugBoxEventListener<E extends PlugBoxEvent> {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(E event);
}
