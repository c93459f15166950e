package com.lingguard.core.sandbox;

import com.lingguard.api.sandbox.OperationState;
import lombok.Getter;

import java.util.concurrent.Future;

/**
 * 执行中操作的登记项
 * 从登记到清理期间保存在执行器的活动操作表中。
 */
@Getter
class ActiveOperation {

    private final String operationId;
    private final String pluginId;
    private final long startTime;
    private final DefaultCancellationSignal signal = new DefaultCancellationSignal();

    private volatile OperationState state = OperationState.PENDING;
    private volatile Future<?> future;

    ActiveOperation(String operationId, String pluginId, long startTime) {
        this.operationId = operationId;
        this.pluginId = pluginId;
        this.startTime = startTime;
    }

    void transition(OperationState next) {
        // 终态不可再变
        if (!state.isTerminal()) {
            state = next;
        }
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    /**
     * 触发取消信号并中断工作线程
     */
    void abort() {
        signal.cancel();
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
    }
}
