package com.lingguard.core.resilience;

/**
 * 限流器接口
 */
public interface RateLimiter {

    /**
     * 尝试为指定键获取一次许可
     *
     * @param key 限流维度（插件 ID）
     * @return true if permitted, false otherwise
     */
    boolean tryAcquire(String key);

    /**
     * 清除指定键的计数状态
     */
    void reset(String key);

    /**
     * 获取名称
     */
    String getName();
}
