package com.lingguard.api.manifest;

import lombok.Builder;
import lombok.Value;

/**
 * 清单附带的签名信息
 * <p>
 * value 形如 {@code sha256:<hex>}，version 为签名方案版本。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ManifestSignature {

    String value;

    String algorithm;

    String version;

    /**
     * ISO-8601 格式的签名时间
     */
    String timestamp;
}
