package com.lingguard.api.permission;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 插件权限记录（不可变）
 * <p>
 * 固定包含全部 {@link Permission} 键。默认记录仅 fileUpload 为 true。
 * </p>
 */
@EqualsAndHashCode
public final class PluginPermissions {

    private static final PluginPermissions DEFAULTS = new PluginPermissions(defaultFlags());

    private final Map<Permission, Boolean> flags;

    private PluginPermissions(EnumMap<Permission, Boolean> flags) {
        this.flags = Collections.unmodifiableMap(flags);
    }

    public static PluginPermissions defaults() {
        return DEFAULTS;
    }

    /**
     * 合并部分更新，未出现在 updates 中的能力保持原值
     */
    public PluginPermissions merge(Map<Permission, Boolean> updates) {
        EnumMap<Permission, Boolean> merged = new EnumMap<>(flags);
        updates.forEach((permission, granted) -> {
            if (permission != null && granted != null) {
                merged.put(permission, granted);
            }
        });
        return new PluginPermissions(merged);
    }

    public boolean has(Permission permission) {
        return flags.getOrDefault(permission, false);
    }

    public Map<Permission, Boolean> asMap() {
        return flags;
    }

    @Override
    public String toString() {
        return flags.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(entry -> entry.getKey().key())
                .collect(Collectors.joining(", ", "PluginPermissions{", "}"));
    }

    private static EnumMap<Permission, Boolean> defaultFlags() {
        EnumMap<Permission, Boolean> map = new EnumMap<>(Permission.class);
        for (Permission permission : Permission.values()) {
            map.put(permission, permission.isGrantedByDefault());
        }
        return map;
    }
}
