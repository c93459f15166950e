package com.lingguard.core.integrity;

import com.lingguard.api.integrity.IntegrityCheck;
import com.lingguard.api.integrity.IntegrityCheckResult;
import com.lingguard.api.integrity.IntegrityReport;
import com.lingguard.api.manifest.ManifestCapability;
import com.lingguard.api.manifest.ManifestSignature;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.security.RiskLevel;
import com.lingguard.api.security.Severity;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.event.EventBus;
import com.lingguard.core.event.monitor.SecurityEvents;
import com.lingguard.core.spi.SecurityErrorReporter;
import com.lingguard.core.util.HostAddresses;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * 插件完整性与来源验证
 * <p>
 * 执行四项相互独立的检查：签名、内容哈希、来源、篡改迹象，
 * 由通过比例得出信任分与风险等级。预期内的缺陷以结果返回，
 * 内部异常会被转换为一条 critical 级检查，本方法从不向外抛出。
 * </p>
 */
@Slf4j
public class IntegrityVerifier {

    public static final String SIGNATURE_CHECK = "signature_verification";
    public static final String HASH_CHECK = "content_hash_verification";
    public static final String SOURCE_CHECK = "source_verification";
    public static final String TAMPERING_CHECK = "tampering_detection";
    public static final String SYSTEM_CHECK = "integrity_validation";

    private static final int MIN_SIGNATURE_LENGTH = 64;
    private static final Pattern SIGNATURE_SHAPE = Pattern.compile("^[A-Za-z0-9-]+:[0-9a-fA-F]+$");
    private static final Pattern VERSION_PREFIX = Pattern.compile("^v?\\d+\\.\\d+\\.\\d+");

    private final SecurityConfig config;
    private final ContentHasher hasher;
    private final SecurityErrorReporter errorReporter;
    private final EventBus eventBus;
    private final Clock clock;

    public IntegrityVerifier(SecurityConfig config, ContentHasher hasher,
                             SecurityErrorReporter errorReporter, EventBus eventBus) {
        this(config, hasher, errorReporter, eventBus, Clock.systemUTC());
    }

    public IntegrityVerifier(SecurityConfig config, ContentHasher hasher,
                             SecurityErrorReporter errorReporter, EventBus eventBus, Clock clock) {
        this.config = config;
        this.hasher = hasher;
        this.errorReporter = errorReporter;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public IntegrityCheckResult verify(PluginManifest manifest) {
        String pluginId = manifest == null ? null : manifest.getId();
        try {
            Objects.requireNonNull(manifest, "manifest");

            List<IntegrityCheck> checks = new ArrayList<>(4);
            checks.add(verifySignature(manifest));
            checks.add(verifyContentHash(manifest));
            checks.add(verifySource(manifest));
            checks.add(checkForTampering(manifest));

            IntegrityCheckResult result = IntegrityCheckResult.fromChecks(checks, recommendationsFor(checks));
            if (!result.isValid()) {
                onVerificationFailed(pluginId, result);
            }
            log.debug("[Integrity] {} -> trustScore={}, risk={}", pluginId,
                    String.format(Locale.ROOT, "%.1f", result.getTrustScore()), result.getRiskLevel());
            return result;
        } catch (Exception e) {
            log.error("[Integrity] Verification of {} failed with internal error", pluginId, e);
            Map<String, Object> context = new HashMap<>();
            context.put("pluginId", pluginId);
            errorReporter.report(e, "Plugin Integrity Validation Failed", context);
            return systemFailure();
        }
    }

    /**
     * 在指定执行器上异步验证
     */
    public CompletableFuture<IntegrityCheckResult> verifyAsync(PluginManifest manifest, Executor executor) {
        return CompletableFuture.supplyAsync(() -> verify(manifest), executor);
    }

    /**
     * 生成面向管理员的报告
     */
    public IntegrityReport report(IntegrityCheckResult result, String pluginId) {
        return IntegrityReport.from(result, pluginId, clock.instant());
    }

    // ==================== 四项检查 ====================

    private IntegrityCheck verifySignature(PluginManifest manifest) {
        ManifestSignature signature = manifest.getSignature();
        if (signature == null) {
            return IntegrityCheck.fail(SIGNATURE_CHECK, "Plugin lacks digital signature", Severity.HIGH);
        }
        if (!config.getSignatureVersion().equals(signature.getVersion())) {
            return IntegrityCheck.fail(SIGNATURE_CHECK, "Unsupported signature version", Severity.MEDIUM);
        }
        // 仅做结构校验，不做公钥验签
        if (!isValidSignatureFormat(signature)) {
            return IntegrityCheck.fail(SIGNATURE_CHECK, "Invalid signature format", Severity.HIGH);
        }
        return IntegrityCheck.pass(SIGNATURE_CHECK, "Signature format valid");
    }

    private IntegrityCheck verifyContentHash(PluginManifest manifest) {
        String actual = hasher.hash(manifest);
        String expected = manifest.getContentHash();
        if (expected == null || expected.isBlank()) {
            return IntegrityCheck.fail(HASH_CHECK, "No content hash provided", Severity.MEDIUM);
        }
        boolean matches = MessageDigest.isEqual(
                actual.getBytes(StandardCharsets.US_ASCII),
                expected.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            return IntegrityCheck.fail(HASH_CHECK, "Content hash mismatch - possible tampering", Severity.CRITICAL);
        }
        return IntegrityCheck.pass(HASH_CHECK, "Content hash verified");
    }

    private IntegrityCheck verifySource(PluginManifest manifest) {
        String source = manifest.getSource();
        if (source == null || source.isBlank()) {
            return IntegrityCheck.fail(SOURCE_CHECK, "Unknown plugin source", Severity.MEDIUM);
        }
        if (!config.isTrustedSource(source)) {
            return IntegrityCheck.fail(SOURCE_CHECK, "Untrusted source: " + source, Severity.LOW);
        }
        return IntegrityCheck.pass(SOURCE_CHECK, "Trusted source: " + source);
    }

    private IntegrityCheck checkForTampering(PluginManifest manifest) {
        List<String> issues = new ArrayList<>();

        if (manifest.isIdentityCoerced()) {
            issues.add("Plugin ID has been modified");
        }

        if (config.isProductionMode() && hasLocalEndpoint(manifest)) {
            issues.add("Suspicious local endpoints in production");
        }

        List<String> unknownCapabilities = manifest.getCapabilities().stream()
                .filter(name -> !ManifestCapability.isKnown(name))
                .sorted()
                .toList();
        if (!unknownCapabilities.isEmpty()) {
            issues.add("Plugin requests capabilities outside the known-safe set: "
                    + String.join(", ", unknownCapabilities));
        }

        String version = manifest.getVersion();
        if (version != null && !VERSION_PREFIX.matcher(version).find()) {
            issues.add("Invalid version format");
        }

        if (issues.isEmpty()) {
            return IntegrityCheck.pass(TAMPERING_CHECK, "No tampering detected");
        }
        return IntegrityCheck.fail(TAMPERING_CHECK, "Potential tampering: " + String.join(", ", issues), Severity.HIGH);
    }

    // ==================== 辅助方法 ====================

    private boolean isValidSignatureFormat(ManifestSignature signature) {
        String value = signature.getValue();
        String algorithm = signature.getAlgorithm();
        return value != null
                && algorithm != null && !algorithm.isBlank()
                && value.length() >= MIN_SIGNATURE_LENGTH
                && SIGNATURE_SHAPE.matcher(value).matches();
    }

    private boolean hasLocalEndpoint(PluginManifest manifest) {
        return manifest.getEndpoints().values().stream()
                .filter(Objects::nonNull)
                .anyMatch(url -> url.contains("localhost") || url.contains("127.0.0.1") || hostIsLoopback(url));
    }

    private boolean hostIsLoopback(String url) {
        try {
            return HostAddresses.isLoopback(URI.create(url).getHost());
        } catch (IllegalArgumentException e) {
            // 格式问题由 ConfigValidator 负责
            return false;
        }
    }

    private List<String> recommendationsFor(List<IntegrityCheck> checks) {
        List<String> failed = checks.stream().filter(c -> !c.passed()).map(IntegrityCheck::name).toList();
        List<String> recommendations = new ArrayList<>();

        if (failed.contains(SIGNATURE_CHECK)) {
            recommendations.add("Verify plugin comes from a trusted source");
        }
        if (failed.contains(HASH_CHECK)) {
            recommendations.add("Do not install - plugin may be corrupted or tampered with");
        }
        if (failed.contains(TAMPERING_CHECK)) {
            recommendations.add("Review plugin capabilities and endpoints before installation");
        }
        if (failed.contains(SOURCE_CHECK)) {
            recommendations.add("Exercise caution with plugins from unknown sources");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Plugin passed all integrity checks");
        }
        return recommendations;
    }

    private void onVerificationFailed(String pluginId, IntegrityCheckResult result) {
        List<String> failed = result.failedChecks().stream().map(IntegrityCheck::name).toList();
        log.warn("[Integrity] Plugin {} failed integrity verification: trustScore={}, risk={}, failed={}",
                pluginId, String.format(Locale.ROOT, "%.1f", result.getTrustScore()), result.getRiskLevel(), failed);
        if (eventBus != null) {
            eventBus.publish(new SecurityEvents.IntegrityFailedEvent(
                    pluginId, result.getTrustScore(), result.getRiskLevel(), failed));
        }
    }

    private static IntegrityCheckResult systemFailure() {
        return new IntegrityCheckResult(
                false,
                List.of(IntegrityCheck.fail(SYSTEM_CHECK,
                        "Integrity validation failed due to system error", Severity.CRITICAL)),
                0.0,
                RiskLevel.CRITICAL,
                List.of("Plugin verification failed - do not install"));
    }
}
