package com.plugbox.core.event;

import com.plugbox.api.event.PlugBoxEvent;
import com.plugbox.api.event.PlugBoxEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 宿主事件总线
 * <p>
 * 监听器按事件类型订阅，订阅父类型可收到所有子类型事件。
 * {@link #publish} 会向上抛出监听器的运行时异常（用于前置钩子拦截）；
 * {@link #publishQuietly} 只记录日志，用于操作完成后的通知。
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends PlugBoxEvent>, List<PlugBoxEventListener<? extends PlugBoxEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends PlugBoxEvent> void subscribe(Class<E> eventType, PlugBoxEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(listener);
    }

    public <E extends PlugBoxEvent> void unsubscribe(Class<E> eventType, PlugBoxEventListener<E> listener) {
        List<PlugBoxEventListener<? extends PlugBoxEvent>> eventListeners = listeners.get(eventType);
        if (eventListeners != null) {
            eventListeners.remove(listener);
        }
    }

    public <E extends PlugBoxEvent> void publish(E event) {
        for (Map.Entry<Class<? extends PlugBoxEvent>, List<PlugBoxEventListener<? extends PlugBoxEvent>>> entry
                : listeners.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (PlugBoxEventListener<? extends PlugBoxEvent> listener : entry.getValue()) {
                @SuppressWarnings("unchecked")
                PlugBoxEventListener<E> castListener = (PlugBoxEventListener<E>) listener;
                try {
                    castListener.onEvent(event);
                } catch (RuntimeException e) {
                    // 业务拦截异常直接抛出
                    log.warn("Event listener threw exception, propagating: {}", e.getMessage());
                    throw e;
                }
            }
        }
    }

    public <E extends PlugBoxEvent> void publishQuietly(E event) {
        try {
            publish(event);
        } catch (RuntimeException e) {
            log.error("Error processing event {}", event, e);
        }
    }
}
