package com.lingguard.core.host;

import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.core.spi.HttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 基于 JDK HttpClient 的默认传输实现
 */
@Slf4j
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient client;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(5))
                .build());
    }

    public JdkHttpTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public FetchResponse send(FetchRequest request, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher body = request.getBody() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.getBody());

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.getUrl()))
                .timeout(timeout)
                .method(request.getMethod(), body);
        request.getHeaders().forEach(builder::header);

        log.debug("[Http] {} {}", request.getMethod(), request.getUrl());
        HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new FetchResponse(response.statusCode(), response.body(), response.headers().map());
    }
}
