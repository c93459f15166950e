package com.lingguard.core.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lingguard.api.exception.InvalidArgumentException;
import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.api.sandbox.IsolatedEnvironment;
import com.lingguard.core.exception.InvocationException;
import com.lingguard.core.exception.SandboxViolationException;
import com.lingguard.core.spi.HttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 隔离执行环境的默认实现
 */
@Slf4j
class DefaultIsolatedEnvironment implements IsolatedEnvironment {

    static final int MAX_LOG_LENGTH = 1000;
    static final long MAX_SCHEDULE_DELAY_MS = 30_000;

    private static final Pattern SCRIPT_TAG = Pattern.compile("<script[^>]*>.*?</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern JS_PROTOCOL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);

    private final String pluginId;
    private final HttpTransport transport;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper mapper;
    private final Duration fetchTimeout;
    private final int maxJsonLength;

    DefaultIsolatedEnvironment(String pluginId, HttpTransport transport, ScheduledExecutorService scheduler,
                               ObjectMapper mapper, Duration fetchTimeout, int maxJsonLength) {
        this.pluginId = pluginId;
        this.transport = transport;
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.fetchTimeout = fetchTimeout;
        this.maxJsonLength = maxJsonLength;
    }

    @Override
    public void log(String message) {
        log.info("[PLUGIN] [{}] {}", pluginId, sanitize(message));
    }

    @Override
    public void info(String message) {
        log.info("[PLUGIN] [{}] {}", pluginId, sanitize(message));
    }

    @Override
    public void warn(String message) {
        log.warn("[PLUGIN] [{}] {}", pluginId, sanitize(message));
    }

    @Override
    public void error(String message) {
        log.error("[PLUGIN] [{}] {}", pluginId, sanitize(message));
    }

    static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        String sanitized = SCRIPT_TAG.matcher(message).replaceAll("[SCRIPT_REMOVED]");
        sanitized = JS_PROTOCOL.matcher(sanitized).replaceAll("[JS_PROTOCOL_REMOVED]");
        return sanitized.length() > MAX_LOG_LENGTH ? sanitized.substring(0, MAX_LOG_LENGTH) : sanitized;
    }

    @Override
    public FetchResponse fetch(FetchRequest request) {
        String scheme = schemeOf(request.getUrl());
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new SandboxViolationException(pluginId, "Only HTTP/HTTPS requests allowed in plugin context");
        }
        try {
            return transport.send(request, fetchTimeout);
        } catch (IOException e) {
            throw new InvocationException(pluginId, "Network request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationException(pluginId, "Network request interrupted", e);
        }
    }

    private static String schemeOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String scheme = new URI(url).getScheme();
            return scheme == null ? null : scheme.toLowerCase();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    @Override
    public Object parseJson(String text) {
        if (text == null) {
            throw new InvalidArgumentException("text", "Invalid JSON format");
        }
        if (text.length() > maxJsonLength) {
            throw new SandboxViolationException(pluginId, "JSON payload too large");
        }
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("text", "Invalid JSON format", e);
        }
    }

    @Override
    public String stringifyJson(Object value) {
        String result;
        try {
            result = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("value", "Failed to stringify JSON", e);
        }
        if (result.length() > maxJsonLength) {
            throw new SandboxViolationException(pluginId, "JSON output too large");
        }
        return result;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        if (delayMs > MAX_SCHEDULE_DELAY_MS) {
            throw new InvalidArgumentException("delayMs", delayMs, "Timeout delay too long (max 30s)");
        }
        if (delayMs < 0) {
            throw new InvalidArgumentException("delayMs", delayMs, "Timeout delay must not be negative");
        }
        return scheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.warn("[Sandbox] Scheduled task of plugin {} failed: {}", pluginId, e.getMessage());
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }
}
