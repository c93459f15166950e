package com.lingguard.api.integrity;

import com.lingguard.api.security.Severity;

/**
 * 单项完整性检查结果
 *
 * @param name     检查名称，如 signature_verification
 * @param passed   是否通过
 * @param message  说明
 * @param severity 严重程度（通过时为 INFO）
 */
public record IntegrityCheck(String name, boolean passed, String message, Severity severity) {

    public static IntegrityCheck pass(String name, String message) {
        return new IntegrityCheck(name, true, message, Severity.INFO);
    }

    public static IntegrityCheck fail(String name, String message, Severity severity) {
        return new IntegrityCheck(name, false, message, severity);
    }
}
