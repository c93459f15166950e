package com.lingguard.api.security;

/**
 * 单项检查的严重程度
 */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
