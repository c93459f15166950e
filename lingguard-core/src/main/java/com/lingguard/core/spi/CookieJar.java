package com.lingguard.core.spi;

/**
 * 宿主 Cookie 读取
 */
public interface CookieJar {

    /**
     * 原始 Cookie 串，形如 {@code a=1; b=2}
     */
    String cookieHeader();
}
