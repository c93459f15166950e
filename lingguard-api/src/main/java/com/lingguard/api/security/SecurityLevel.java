package com.lingguard.api.security;

/**
 * 静态校验得出的安全等级
 */
public enum SecurityLevel {
    SECURE,
    LOW,
    MEDIUM,
    CRITICAL;

    /**
     * 由错误数与警告数推导：有错误即 CRITICAL；警告多于 3 条为 MEDIUM；有警告为 LOW
     */
    public static SecurityLevel derive(int errorCount, int warningCount) {
        if (errorCount > 0) {
            return CRITICAL;
        }
        if (warningCount > 3) {
            return MEDIUM;
        }
        if (warningCount > 0) {
            return LOW;
        }
        return SECURE;
    }
}
