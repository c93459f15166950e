package com.lingguard.core.event.monitor;

import com.lingguard.api.event.SecurityEvent;
import com.lingguard.api.security.RiskLevel;
import com.lingguard.api.security.SecurityLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 安全监控事件集合
 */
public class SecurityEvents {

    @Getter
    @RequiredArgsConstructor
    public static class IntegrityFailedEvent implements SecurityEvent {
        private final String pluginId;
        private final double trustScore;
        private final RiskLevel riskLevel;
        private final List<String> failedChecks;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class SandboxViolationEvent implements SecurityEvent {
        private final String pluginId;
        private final String operationId; // 请求检查时为 null
        private final String violation; // RATE_LIMIT, TIMEOUT, MEMORY, PAYLOAD
        private final String detail;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class ExecutionCompletedEvent implements SecurityEvent {
        private final String pluginId;
        private final String operationId;
        private final long durationMs;
        private final boolean success;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class SlowOperationEvent implements SecurityEvent {
        private final String pluginId;
        private final String operationId;
        private final long durationMs;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class PluginRegisteredEvent implements SecurityEvent {
        private final String pluginId;
        private final SecurityLevel securityLevel;
        private final double trustScore;
        private final RiskLevel riskLevel;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class PluginRejectedEvent implements SecurityEvent {
        private final String pluginId;
        private final String reason;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class PluginDetectedEvent implements SecurityEvent {
        private final String filename;
        private final String pluginId; // 无匹配插件时为 null
        private final int score;
        private final long timestamp = System.currentTimeMillis();
    }
}
