package com.lingguard.api.event;

/**
 * 安全事件监听器
 *
 * @param <E> 事件类型
 */
@FunctionalInterface
public interface SecurityEventListener<E extends SecurityEvent> {

    void onEvent(E event);
}
