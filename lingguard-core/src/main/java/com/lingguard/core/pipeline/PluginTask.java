package com.lingguard.core.pipeline;

import com.lingguard.api.permission.ConstrainedContext;
import com.lingguard.api.sandbox.CancellationSignal;

/**
 * 代表已注册插件执行的任务
 * 只能通过受限上下文访问宿主能力。
 *
 * @param <T> 结果类型
 */
@FunctionalInterface
public interface PluginTask<T> {

    T run(ConstrainedContext context, CancellationSignal signal) throws Exception;
}
