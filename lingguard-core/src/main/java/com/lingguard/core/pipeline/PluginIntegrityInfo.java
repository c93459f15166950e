package com.lingguard.core.pipeline;

import com.lingguard.api.integrity.IntegrityCheckResult;
import com.lingguard.api.integrity.IntegrityReport;
import com.lingguard.api.permission.PluginPermissions;
import com.lingguard.api.validation.ValidationResult;

/**
 * 已注册插件的安全总览，供管理端展示
 *
 * @param pluginId    插件 id
 * @param validation  当前清单的静态校验结果
 * @param integrity   当前清单的完整性验证结果
 * @param report      扁平化的完整性报告
 * @param permissions 当前授权
 * @param status      校验与完整性都通过为 SECURE，否则 RISKY
 */
public record PluginIntegrityInfo(String pluginId,
                                  ValidationResult validation,
                                  IntegrityCheckResult integrity,
                                  IntegrityReport report,
                                  PluginPermissions permissions,
                                  OverallStatus status) {

    public enum OverallStatus {
        SECURE,
        RISKY
    }
}
