package com.lingguard.api.manifest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 插件清单
 * <p>
 * 描述插件身份、上传端点、文件类型处理与能力声明，以及可选的来源信息（签名、内容哈希、来源域）。
 * 注册时创建，之后不可变；任何修改都必须重新校验和验签，而不是原地修改。
 * </p>
 *
 * @author LingGuard
 */
@Value
@Builder(toBuilder = true)
public class PluginManifest {

    // === 身份 ===
    String id;
    String name;
    String version;
    String description;

    // === 文件处理 ===
    @Singular
    Set<String> fileTypes;

    /**
     * 单个文件大小上限（字节）
     */
    long maxFileSize;

    @Singular
    Map<EndpointKind, String> endpoints;

    /**
     * 声明的能力名称，正常情况下应属于 {@link ManifestCapability}
     */
    @Singular
    Set<String> capabilities;

    @Singular
    List<String> features;

    // === 来源信息 ===
    ManifestSignature signature;
    String contentHash;
    String source;

    /**
     * 加载时 id 不是字符串而被强制转换（类型混淆迹象）
     */
    boolean identityCoerced;

    public String getEndpoint(EndpointKind kind) {
        return endpoints.get(kind);
    }

    public boolean declares(ManifestCapability capability) {
        return capabilities.contains(capability.key());
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{id='%s', version='%s'}", id, version);
    }
}
