package com.lingguard.api.event;

/**
 * 安全子系统事件标记接口
 */
public interface SecurityEvent {

    /**
     * 事件关联的插件 ID
     */
    String getPluginId();
}
