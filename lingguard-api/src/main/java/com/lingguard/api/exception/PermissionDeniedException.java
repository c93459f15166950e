package com.lingguard.api.exception;

import com.lingguard.api.permission.Permission;

/**
 * 权限拒绝异常
 * 当插件通过受限上下文调用未被授予的能力时抛出，消息中包含缺失的能力名称。
 *
 * @author LingGuard
 */
public class PermissionDeniedException extends LingGuardException {

    private final String pluginId;
    private final Permission permission;

    public PermissionDeniedException(String pluginId, Permission permission) {
        super("Plugin does not have permission: " + permission.key() + " (plugin=" + pluginId + ")");
        this.pluginId = pluginId;
        this.permission = permission;
    }

    public String getPluginId() {
        return pluginId;
    }

    public Permission getPermission() {
        return permission;
    }

    /**
     * 缺失的能力名称，如 networkAccess
     */
    public String getCapability() {
        return permission.key();
    }
}
