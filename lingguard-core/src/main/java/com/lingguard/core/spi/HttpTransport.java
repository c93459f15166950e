package com.lingguard.core.spi;

import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;

import java.io.IOException;
import java.time.Duration;

/**
 * 网络请求传输层
 * 受限上下文与隔离环境的 fetch 最终都经由此接口发出。
 */
public interface HttpTransport {

    FetchResponse send(FetchRequest request, Duration timeout) throws IOException, InterruptedException;
}
