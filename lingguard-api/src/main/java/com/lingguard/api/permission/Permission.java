package com.lingguard.api.permission;

import java.util.Arrays;
import java.util.Optional;

/**
 * 宿主敏感能力
 * 每个能力控制一类敏感操作，默认只授予 FILE_UPLOAD。
 */
public enum Permission {

    FILE_UPLOAD("fileUpload", true),

    NETWORK_ACCESS("networkAccess", false),

    LOCAL_STORAGE("localStorage", false),

    COOKIES("cookies", false),

    NOTIFICATIONS("notifications", false),

    CLIPBOARD("clipboard", false),

    CAMERA("camera", false),

    MICROPHONE("microphone", false),

    LOCATION("location", false),

    DEVICE_INFO("deviceInfo", false);

    private final String key;
    private final boolean grantedByDefault;

    Permission(String key, boolean grantedByDefault) {
        this.key = key;
        this.grantedByDefault = grantedByDefault;
    }

    public String key() {
        return key;
    }

    public boolean isGrantedByDefault() {
        return grantedByDefault;
    }

    public static Optional<Permission> fromKey(String key) {
        return Arrays.stream(values())
                .filter(permission -> permission.key.equals(key))
                .findFirst();
    }
}
