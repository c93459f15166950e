package com.lingguard.api.permission;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 需要权限检查的操作类型及其所需能力
 */
public enum PluginOperation {

    FILE_UPLOAD("fileUpload", Permission.FILE_UPLOAD),

    NETWORK_REQUEST("networkRequest", Permission.NETWORK_ACCESS),

    LOCAL_STORAGE("localStorage", Permission.LOCAL_STORAGE),

    SHOW_NOTIFICATION("showNotification", Permission.NOTIFICATIONS),

    CLIPBOARD_ACCESS("clipboardAccess", Permission.CLIPBOARD),

    DEVICE_INFO("deviceInfo", Permission.DEVICE_INFO);

    private final String key;
    private final Set<Permission> required;

    PluginOperation(String key, Permission first, Permission... rest) {
        this.key = key;
        this.required = EnumSet.of(first, rest);
    }

    public String key() {
        return key;
    }

    public Set<Permission> requiredPermissions() {
        return EnumSet.copyOf(required);
    }

    public static Optional<PluginOperation> fromKey(String key) {
        return Arrays.stream(values())
                .filter(operation -> operation.key.equals(key))
                .findFirst();
    }
}
