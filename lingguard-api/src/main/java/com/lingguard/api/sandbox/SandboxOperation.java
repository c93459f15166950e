package com.lingguard.api.sandbox;

/**
 * 在沙箱中执行的插件操作
 *
 * @param <T> 结果类型
 */
@FunctionalInterface
public interface SandboxOperation<T> {

    T run(CancellationSignal signal) throws Exception;
}
