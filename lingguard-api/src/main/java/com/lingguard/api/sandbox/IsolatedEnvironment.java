package com.lingguard.api.sandbox;

import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;

import java.util.concurrent.ScheduledFuture;

/**
 * 隔离执行环境
 * <p>
 * 与受限上下文互补：不做按能力的授权，只提供通用的安全外观，
 * 包括净化后的日志、仅限 HTTP/HTTPS 的请求、带大小上限的 JSON 读写。
 * </p>
 */
public interface IsolatedEnvironment {

    void log(String message);

    void info(String message);

    void warn(String message);

    void error(String message);

    /**
     * 仅允许 http/https，强制短超时
     */
    FetchResponse fetch(FetchRequest request);

    /**
     * 解析 JSON，结果为 Map / List / 标量
     */
    Object parseJson(String text);

    String stringifyJson(Object value);

    /**
     * 延迟执行任务，延迟上限 30 秒
     */
    ScheduledFuture<?> schedule(Runnable task, long delayMs);
}
