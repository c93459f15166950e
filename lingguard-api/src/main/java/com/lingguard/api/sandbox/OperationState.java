package com.lingguard.api.sandbox;

/**
 * 单次沙箱执行的状态
 * <p>
 * PENDING → RATE_LIMIT_CHECKED → RUNNING → {COMPLETED | FAILED | TIMED_OUT}。
 * 只有 RUNNING 状态下取消可被观察到。
 * </p>
 */
public enum OperationState {
    PENDING,
    RATE_LIMIT_CHECKED,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
