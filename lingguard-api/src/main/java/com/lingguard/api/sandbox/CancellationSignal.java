package com.lingguard.api.sandbox;

/**
 * 协作式取消信号
 * <p>
 * 超时后信号被触发。操作应在挂起点（网络、定时等待）检查信号，
 * 并把取消视为终止且不可重试。
 * </p>
 */
public interface CancellationSignal {

    boolean isCancelled();

    /**
     * 已取消时抛出 {@link java.util.concurrent.CancellationException}
     */
    void throwIfCancelled();

    /**
     * 注册取消回调；若已取消则立即执行
     */
    void onCancel(Runnable callback);
}
