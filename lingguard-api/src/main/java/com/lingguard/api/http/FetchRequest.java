package com.lingguard.api.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 插件发起的 HTTP 请求
 */
@Value
@Builder
public class FetchRequest {

    String url;

    @Builder.Default
    String method = "GET";

    @Singular
    Map<String, String> headers;

    /**
     * 请求体，可为 null
     */
    String body;

    public static FetchRequest get(String url) {
        return FetchRequest.builder().url(url).build();
    }
}
