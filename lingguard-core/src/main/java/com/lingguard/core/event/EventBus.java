package com.lingguard.core.event;

import com.lingguard.api.event.SecurityEvent;
import com.lingguard.api.event.SecurityEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内安全事件总线
 * <p>
 * 监听器按订阅者 ID 登记，插件注销时可一次性移除。
 * 监听器异常只记录日志，不影响发布方。
 * </p>
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends SecurityEvent>, List<ListenerWrapper>> listeners =
            new ConcurrentHashMap<>();

    // 包装器，记录监听器归属的订阅者
    @Value
    private static class ListenerWrapper {
        String subscriberId;
        SecurityEventListener<? extends SecurityEvent> listener;
    }

    /**
     * 注册监听器
     */
    public <E extends SecurityEvent> void subscribe(String subscriberId, Class<E> eventType,
                                                    SecurityEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new ListenerWrapper(subscriberId, listener));
    }

    /**
     * 移除订阅者注册的所有监听器
     */
    public void unsubscribeAll(String subscriberId) {
        for (List<ListenerWrapper> list : listeners.values()) {
            list.removeIf(wrapper -> wrapper.getSubscriberId().equals(subscriberId));
        }
        log.debug("[EventBus] Removed listeners of subscriber: {}", subscriberId);
    }

    public <E extends SecurityEvent> void publish(E event) {
        List<ListenerWrapper> wrappers = listeners.get(event.getClass());
        if (wrappers == null) {
            return;
        }
        for (ListenerWrapper wrapper : wrappers) {
            try {
                @SuppressWarnings("unchecked")
                SecurityEventListener<E> castListener = (SecurityEventListener<E>) wrapper.getListener();
                castListener.onEvent(event);
            } catch (Exception e) {
                log.warn("[EventBus] Listener of {} failed on {}: {}",
                        wrapper.getSubscriberId(), event.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
