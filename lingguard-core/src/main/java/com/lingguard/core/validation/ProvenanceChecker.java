package com.lingguard.core.validation;

import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.validation.ValidationResult;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.util.HostAddresses;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 注册前的来源元数据检查
 * <p>
 * 要求清单带有签名与内容哈希，端点使用 HTTPS（回环地址除外）。
 * 注册流水线在完整性验证之后调用它，结果只记录到日志和注册结论中，不阻断注册。
 * </p>
 */
public class ProvenanceChecker {

    private static final Pattern VERSION_PREFIX = Pattern.compile("^v?\\d+\\.\\d+\\.\\d+");

    private final SecurityConfig config;

    public ProvenanceChecker(SecurityConfig config) {
        this.config = config;
    }

    public ValidationResult check(PluginManifest manifest) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        boolean insecureEndpoints = manifest.getEndpoints().values().stream()
                .filter(Objects::nonNull)
                .anyMatch(ProvenanceChecker::isPlainHttpToRemoteHost);
        if (insecureEndpoints) {
            if (config.isProductionMode()) {
                errors.add("Plugin endpoints must use HTTPS in production");
            } else {
                warnings.add("Plugin uses HTTP endpoints - ensure HTTPS in production");
            }
        }

        if (manifest.getSignature() == null) {
            errors.add("Plugin missing digital signature");
        }
        if (manifest.getContentHash() == null) {
            errors.add("Plugin missing content hash");
        }
        if (manifest.getSource() == null) {
            warnings.add("Plugin source not specified");
        }

        String version = manifest.getVersion();
        if (version == null || !VERSION_PREFIX.matcher(version).find()) {
            errors.add("Invalid version format - use semantic versioning (e.g., v1.0.0)");
        }

        return ValidationResult.of(errors, warnings);
    }

    private static boolean isPlainHttpToRemoteHost(String url) {
        if (!url.startsWith("http://")) {
            return false;
        }
        try {
            return !HostAddresses.isLoopback(URI.create(url).getHost());
        } catch (IllegalArgumentException e) {
            // 无法解析的地址由 ConfigValidator 报告，这里按不安全处理
            return true;
        }
    }
}
