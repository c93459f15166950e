package com.lingguard.core.resilience;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 固定窗口限流器
 * <p>
 * 每个键独立计数。窗口不存在或已过期时，本次调用开启新窗口并计为 1；
 * 否则计数达到上限即拒绝。计数与窗口在 compute 中原子更新，并发调用不会超额放行。
 * </p>
 */
public class FixedWindowRateLimiter implements RateLimiter {

    private final String name;
    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;

    // 状态
    private final Map<String, State> states = new ConcurrentHashMap<>();

    private record State(int count, long windowResetAt, boolean admitted) {
    }

    public FixedWindowRateLimiter(String name, int maxRequests, long windowMs) {
        this(name, maxRequests, windowMs, Clock.systemUTC());
    }

    public FixedWindowRateLimiter(String name, int maxRequests, long windowMs, Clock clock) {
        if (maxRequests <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("maxRequests and windowMs must be positive");
        }
        this.name = name;
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key) {
        long now = clock.millis();
        State next = states.compute(key, (k, current) -> {
            if (current == null || now > current.windowResetAt) {
                return new State(1, now + windowMs, true);
            }
            if (current.count >= maxRequests) {
                return new State(current.count, current.windowResetAt, false);
            }
            return new State(current.count + 1, current.windowResetAt, true);
        });
        return next.admitted;
    }

    @Override
    public void reset(String key) {
        states.remove(key);
    }

    /**
     * 当前窗口内已放行的次数，无窗口时为 0
     */
    public int currentCount(String key) {
        State state = states.get(key);
        if (state == null || clock.millis() > state.windowResetAt) {
            return 0;
        }
        return state.count;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public long getWindowMs() {
        return windowMs;
    }

    @Override
    public String getName() {
        return name;
    }
}
