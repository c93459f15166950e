package com.lingguard.core.spi;

/**
 * 宿主剪贴板
 */
public interface ClipboardAccess {

    String read();

    void write(String text);
}
