package com.lingguard.api.manifest;

import java.util.Arrays;
import java.util.Optional;

/**
 * 清单可声明的业务能力（已知安全集合）
 * <p>
 * 清单中的 capabilities 以名称形式声明，超出此集合的名称被视为越权请求。
 * </p>
 */
public enum ManifestCapability {

    FILE_UPLOAD("fileUpload"),

    MANUAL_ENTRY("manualEntry"),

    BATCH_PROCESSING("batchProcessing"),

    IMAGE_PROCESSING("imageProcessing"),

    DATA_VALIDATION("dataValidation"),

    ENCRYPTION_SUPPORT("encryptionSupport");

    private final String key;

    ManifestCapability(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ManifestCapability> fromKey(String key) {
        return Arrays.stream(values())
                .filter(capability -> capability.key.equals(key))
                .findFirst();
    }

    public static boolean isKnown(String key) {
        return fromKey(key).isPresent();
    }
}
