package com.lingguard.api.integrity;

import com.lingguard.api.security.RiskLevel;
import com.lingguard.api.security.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 面向管理员的完整性报告（扁平化、带时间戳）
 */
public record IntegrityReport(
        String pluginId,
        Instant timestamp,
        double trustScore,
        RiskLevel riskLevel,
        String overallStatus,
        List<CheckStatus> checks,
        List<String> recommendations,
        String summary) {

    public record CheckStatus(String name, String status, String message, Severity severity) {
    }

    public static IntegrityReport from(IntegrityCheckResult result, String pluginId, Instant timestamp) {
        List<CheckStatus> statuses = result.getChecks().stream()
                .map(check -> new CheckStatus(
                        check.name(),
                        check.passed() ? "PASS" : "FAIL",
                        check.message(),
                        check.severity()))
                .toList();
        String summary = String.format(Locale.ROOT,
                "Plugin %s scored %.1f%% trust score with %s risk level",
                pluginId, result.getTrustScore(), result.getRiskLevel().name().toLowerCase(Locale.ROOT));
        return new IntegrityReport(
                pluginId,
                timestamp,
                result.getTrustScore(),
                result.getRiskLevel(),
                result.isValid() ? "PASS" : "FAIL",
                statuses,
                result.getRecommendations(),
                summary);
    }
}
