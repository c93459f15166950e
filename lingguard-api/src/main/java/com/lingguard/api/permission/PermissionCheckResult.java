package com.lingguard.api.permission;

import java.util.List;

/**
 * 操作权限检查结果
 *
 * @param allowed             是否允许
 * @param missingCapabilities 缺失的能力名称
 * @param operation           操作名称
 * @param pluginId            插件 ID
 * @param knownOperation      操作类型是否可识别
 */
public record PermissionCheckResult(
        boolean allowed,
        List<String> missingCapabilities,
        String operation,
        String pluginId,
        boolean knownOperation) {
}
