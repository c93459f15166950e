package com.lingguard.core.permission;

import com.lingguard.api.manifest.ManifestCapability;
import com.lingguard.api.permission.ConstrainedContext;
import com.lingguard.api.permission.Permission;
import com.lingguard.api.permission.PermissionCheckResult;
import com.lingguard.api.permission.PluginOperation;
import com.lingguard.api.permission.PluginPermissions;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.config.UnknownOperationPolicy;
import com.lingguard.core.spi.HostBridge;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 插件权限管理
 * 职责：保存按插件授予的能力，执行操作级检查，构建受限上下文。
 * <p>
 * 默认拒绝（仅授予 fileUpload）。没有记录的插件按默认记录处理，不存在“缺失权限”状态。
 * </p>
 */
@Slf4j
public class PermissionManager {

    private final SecurityConfig config;
    private final HostBridge hostBridge;

    // Map<PluginId, PluginPermissions>
    private final Map<String, PluginPermissions> permissions = new ConcurrentHashMap<>();

    public PermissionManager(SecurityConfig config, HostBridge hostBridge) {
        this.config = config;
        this.hostBridge = hostBridge;
    }

    /**
     * 合并授予，未出现在 updates 中的能力保持原值
     */
    public void grant(String pluginId, Map<Permission, Boolean> updates) {
        PluginPermissions updated = permissions.compute(pluginId, (id, existing) ->
                (existing != null ? existing : PluginPermissions.defaults()).merge(updates));
        log.info("[Permission] Updated permissions for plugin {}: {}", pluginId, updated);
    }

    public void grant(String pluginId, Permission permission) {
        grant(pluginId, Map.of(permission, true));
    }

    public boolean has(String pluginId, Permission permission) {
        return getPermissions(pluginId).has(permission);
    }

    public PluginPermissions getPermissions(String pluginId) {
        return permissions.getOrDefault(pluginId, PluginPermissions.defaults());
    }

    /**
     * 移除记录，之后回落到默认记录
     */
    public void revokeAll(String pluginId) {
        if (permissions.remove(pluginId) != null) {
            log.info("[Permission] Revoked all permissions for plugin {}", pluginId);
        }
    }

    public PermissionCheckResult checkOperation(String pluginId, PluginOperation operation) {
        PluginPermissions current = getPermissions(pluginId);
        List<String> missing = operation.requiredPermissions().stream()
                .filter(permission -> !current.has(permission))
                .map(Permission::key)
                .toList();
        return new PermissionCheckResult(missing.isEmpty(), missing, operation.key(), pluginId, true);
    }

    /**
     * 按名称检查操作；无法识别的操作按 {@link UnknownOperationPolicy} 处理
     */
    public PermissionCheckResult checkOperation(String pluginId, String operationName) {
        Optional<PluginOperation> operation = PluginOperation.fromKey(operationName);
        if (operation.isPresent()) {
            return checkOperation(pluginId, operation.get());
        }

        boolean allowed = config.getUnknownOperationPolicy() == UnknownOperationPolicy.ALLOW;
        log.warn("[Permission] Unknown operation '{}' requested by plugin {} -> {}",
                operationName, pluginId, allowed ? "allowed" : "denied");
        return new PermissionCheckResult(allowed, List.of(), operationName, pluginId, false);
    }

    /**
     * 由清单声明的能力推导保守授权，只授予清单自身声明所需的能力
     */
    public void autoGrant(String pluginId, Set<String> declaredCapabilities) {
        boolean fileUpload = declaredCapabilities.contains(ManifestCapability.FILE_UPLOAD.key());
        boolean manualEntry = declaredCapabilities.contains(ManifestCapability.MANUAL_ENTRY.key());
        boolean batch = declaredCapabilities.contains(ManifestCapability.BATCH_PROCESSING.key());

        Map<Permission, Boolean> derived = new EnumMap<>(Permission.class);
        derived.put(Permission.FILE_UPLOAD, true);
        // 上传与手动录入都需要访问声明的端点
        if (fileUpload || manualEntry) {
            derived.put(Permission.NETWORK_ACCESS, true);
        }
        // 进度反馈
        if (fileUpload || batch) {
            derived.put(Permission.NOTIFICATIONS, true);
        }
        grant(pluginId, derived);
    }

    /**
     * 构建受限上下文
     * 权限在此刻一次性解析，之后对权限的修改不影响已构建的上下文。
     */
    public ConstrainedContext buildConstrainedContext(String pluginId) {
        return new CapabilityGatedContext(
                pluginId,
                getPermissions(pluginId),
                hostBridge,
                Duration.ofMillis(config.getFetchTimeoutMs()));
    }
}
