package com.lingguard.core.sandbox;

import com.lingguard.api.sandbox.CancellationSignal;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 超时驱动的取消信号，只能触发一次
 */
@Slf4j
class DefaultCancellationSignal implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Plugin operation aborted due to timeout");
        }
    }

    @Override
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        // 注册时已取消则立即执行；remove 成功保证只执行一次
        if (cancelled.get() && callbacks.remove(callback)) {
            runSafely(callback);
        }
    }

    void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runSafely(callback);
            }
        }
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("[Sandbox] Cancellation callback failed: {}", e.getMessage());
        }
    }
}
