package com.lingguard.core.exception;

/**
 * 插件在当前窗口内的调用次数超过上限
 */
public class RateLimitExceededException extends CallNotPermittedException {

    private final int limit;
    private final long windowMs;

    public RateLimitExceededException(String pluginId, int limit, long windowMs) {
        super(pluginId, String.format("rate limit exceeded (%d requests per %ds)", limit, windowMs / 1000));
        this.limit = limit;
        this.windowMs = windowMs;
    }

    public int getLimit() {
        return limit;
    }

    public long getWindowMs() {
        return windowMs;
    }
}
