package com.lingguard.core.config;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Set;

/**
 * 安全子系统配置
 * <p>
 * 每个子系统实例持有一份，通过构造器注入各组件，不使用全局静态状态。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
public class SecurityConfig {

    public static final long MB = 1024L * 1024L;

    // ==================== 运行模式 ====================

    /**
     * 生产模式：拒绝回环/内网端点，HTTP 端点给出警告
     */
    @Builder.Default
    private boolean productionMode = false;

    // ==================== 静态校验 ====================

    /**
     * 清单允许声明的单文件大小上限
     */
    @Builder.Default
    private long maxFileSizeCeiling = 100 * MB;

    /**
     * 超过此值给出警告
     */
    @Builder.Default
    private long largeFileSizeThreshold = 50 * MB;

    // ==================== 完整性验证 ====================

    @Singular
    private Set<String> trustedSources;

    @Builder.Default
    private String signatureVersion = "v1";

    // ==================== 权限 ====================

    @Builder.Default
    private UnknownOperationPolicy unknownOperationPolicy = UnknownOperationPolicy.ALLOW;

    // ==================== 沙箱 ====================

    /**
     * 每个窗口内每个插件允许的请求数
     */
    @Builder.Default
    private int rateLimitRequests = 10;

    @Builder.Default
    private long rateLimitWindowMs = 60_000;

    @Builder.Default
    private long defaultTimeoutMs = 30_000;

    /**
     * 成功但耗时超过此值的操作记录为性能告警
     */
    @Builder.Default
    private long slowOperationThresholdMs = 10_000;

    /**
     * 内存增量告警阈值（仅告警，不中断）
     */
    @Builder.Default
    private long memoryLimitBytes = 100 * MB;

    /**
     * 请求体与 JSON 读写的大小上限
     */
    @Builder.Default
    private int maxPayloadBytes = 1024 * 1024;

    /**
     * 隔离环境中 fetch 的强制超时
     */
    @Builder.Default
    private long fetchTimeoutMs = 10_000;

    // ==================== 注册 ====================

    @Builder.Default
    private int maxPlugins = 50;

    /**
     * 清单签名工具写入的来源
     */
    @Builder.Default
    private String publisherSource = "lingguard.official";

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static SecurityConfig defaults() {
        return withDefaultTrustedSources().build();
    }

    /**
     * 生产配置：开启严格模式，未知操作默认拒绝
     */
    public static SecurityConfig production() {
        return withDefaultTrustedSources()
                .productionMode(true)
                .unknownOperationPolicy(UnknownOperationPolicy.DENY)
                .build();
    }

    /**
     * 开发模式配置（更宽松）
     */
    public static SecurityConfig development() {
        return withDefaultTrustedSources()
                .rateLimitRequests(1000)
                .defaultTimeoutMs(120_000) // 方便调试
                .slowOperationThresholdMs(60_000)
                .build();
    }

    private static SecurityConfigBuilder withDefaultTrustedSources() {
        return SecurityConfig.builder()
                .trustedSource("lingguard.official")
                .trustedSource("verified.plugins")
                .trustedSource("trusted.developers");
    }

    public boolean isTrustedSource(String source) {
        return source != null && trustedSources.contains(source);
    }

    @Override
    public String toString() {
        return String.format(
                "SecurityConfig{production=%s, rateLimit=%d/%dms, timeout=%dms, trustedSources=%s}",
                productionMode, rateLimitRequests, rateLimitWindowMs, defaultTimeoutMs, trustedSources);
    }
}
