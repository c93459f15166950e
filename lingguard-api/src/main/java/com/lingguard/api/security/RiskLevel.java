package com.lingguard.api.security;

/**
 * 风险等级
 * 用于完整性验证的信任分分段，以及请求内容检查的结论。
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * 信任分分段：>=90 LOW，>=75 MEDIUM，>=50 HIGH，其余 CRITICAL
     */
    public static RiskLevel fromTrustScore(double trustScore) {
        if (trustScore >= 90) {
            return LOW;
        }
        if (trustScore >= 75) {
            return MEDIUM;
        }
        if (trustScore >= 50) {
            return HIGH;
        }
        return CRITICAL;
    }
}
