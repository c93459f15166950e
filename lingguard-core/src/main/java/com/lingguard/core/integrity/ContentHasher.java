package com.lingguard.core.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.core.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 清单内容哈希
 * <p>
 * 对身份、端点、能力做稳定的 JSON 序列化（键排序），再计算 SHA-256 十六进制摘要。
 * 同一清单多次计算结果一致。
 * </p>
 */
public class ContentHasher {

    public static final String HASH_ALGORITHM = "SHA-256";

    public String hash(PluginManifest manifest) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] bytes = digest.digest(canonicalForm(manifest).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm unavailable: " + HASH_ALGORITHM, e);
        }
    }

    /**
     * 参与哈希的规范化 JSON
     */
    public String canonicalForm(PluginManifest manifest) {
        Map<String, String> endpoints = new TreeMap<>();
        manifest.getEndpoints().forEach((kind, url) -> endpoints.put(kind.key(), url));

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("id", manifest.getId());
        content.put("name", manifest.getName());
        content.put("version", manifest.getVersion());
        content.put("endpoints", endpoints);
        content.put("capabilities", manifest.getCapabilities().stream().sorted().toList());

        try {
            return JsonSupport.mapper().writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manifest content", e);
        }
    }
}
