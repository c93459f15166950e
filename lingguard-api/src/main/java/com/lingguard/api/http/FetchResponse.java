package com.lingguard.api.http;

import java.util.List;
import java.util.Map;

/**
 * HTTP 响应
 */
public record FetchResponse(int status, String body, Map<String, List<String>> headers) {
}
