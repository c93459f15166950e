package com.lingguard.api.integrity;

import com.lingguard.api.security.RiskLevel;
import lombok.Value;

import java.util.List;

/**
 * 完整性验证结果
 * <p>
 * 信任分总是由完整的检查列表重新计算，从不缓存。
 * </p>
 */
@Value
public class IntegrityCheckResult {

    /**
     * 通过验证所需的最低信任分
     */
    public static final double ACCEPTANCE_THRESHOLD = 75.0;

    boolean valid;
    List<IntegrityCheck> checks;
    double trustScore;
    RiskLevel riskLevel;
    List<String> recommendations;

    /**
     * 由检查列表计算信任分、风险等级与有效性
     */
    public static IntegrityCheckResult fromChecks(List<IntegrityCheck> checks, List<String> recommendations) {
        long passed = checks.stream().filter(IntegrityCheck::passed).count();
        double trustScore = checks.isEmpty() ? 0.0 : (passed * 100.0) / checks.size();
        return new IntegrityCheckResult(
                trustScore >= ACCEPTANCE_THRESHOLD,
                List.copyOf(checks),
                trustScore,
                RiskLevel.fromTrustScore(trustScore),
                List.copyOf(recommendations));
    }

    public List<IntegrityCheck> failedChecks() {
        return checks.stream().filter(check -> !check.passed()).toList();
    }
}
