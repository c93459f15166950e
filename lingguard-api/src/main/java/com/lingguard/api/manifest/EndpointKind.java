package com.lingguard.api.manifest;

import java.util.Arrays;
import java.util.Optional;

/**
 * 插件清单中可声明的端点类型
 */
public enum EndpointKind {

    /**
     * 文件上传端点（必填）
     */
    UPLOAD("upload"),

    DETECT("detect"),

    /**
     * 手动录入端点
     */
    MANUAL("manual"),

    VALIDATE("validate"),

    STATUS("status");

    private final String key;

    EndpointKind(String key) {
        this.key = key;
    }

    /**
     * 清单中使用的键名
     */
    public String key() {
        return key;
    }

    public static Optional<EndpointKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
