package com.lingguard.core.spi;

/**
 * 宿主通知展示
 */
public interface NotificationSink {

    void show(String title, String body);
}
