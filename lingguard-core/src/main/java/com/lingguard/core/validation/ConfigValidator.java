package com.lingguard.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lingguard.api.manifest.EndpointKind;
import com.lingguard.api.manifest.ManifestCapability;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.validation.ValidationResult;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.util.FileTypes;
import com.lingguard.core.util.HostAddresses;
import com.lingguard.core.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 插件清单静态校验器
 * <p>
 * 各项检查相互独立、全部执行，调用方一次即可拿到完整的缺陷列表。
 * 除生产模式开关外不依赖任何外部状态。
 * </p>
 */
@Slf4j
public class ConfigValidator {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final Set<String> RESTRICTED_ID_PATTERNS = Set.of("admin", "system", "root", "config", "__");
    private static final Pattern PLUGIN_ID_PATTERN = Pattern.compile("^[a-z0-9-]+$");
    private static final Pattern VERSION_PATTERN = Pattern.compile("^v?\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9-]+)?$");
    private static final int MAX_ENDPOINT_LENGTH = 200;

    private static final List<Pattern> SUSPICIOUS_CONTENT = List.of(
            Pattern.compile("eval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("function\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("data:.*script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("onclick|onload|onerror", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("document\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("window\\.", Pattern.CASE_INSENSITIVE));

    private final SecurityConfig config;

    public ConfigValidator(SecurityConfig config) {
        this.config = config;
    }

    public ValidationResult validate(PluginManifest manifest) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (manifest == null) {
            errors.add("Plugin configuration missing");
            return ValidationResult.of(errors, warnings);
        }

        try {
            validateStructure(manifest, errors);
            validatePluginId(manifest.getId(), errors);
            validateVersion(manifest.getVersion(), warnings);
            validateEndpoints(manifest.getEndpoints(), errors, warnings);
            validateFileTypes(manifest.getFileTypes(), errors, warnings);
            validateFileSize(manifest.getMaxFileSize(), errors, warnings);
            validateCapabilities(manifest, warnings);
            validateContent(manifest, warnings);
        } catch (RuntimeException e) {
            log.error("[Validator] Unexpected failure while validating {}", manifest.getId(), e);
            errors.add("Validation error: " + e.getMessage());
        }

        ValidationResult result = ValidationResult.of(errors, warnings);
        log.debug("[Validator] {} -> valid={}, level={}, errors={}, warnings={}",
                manifest.getId(), result.isValid(), result.getSecurityLevel(), errors.size(), warnings.size());
        return result;
    }

    private void validateStructure(PluginManifest manifest, List<String> errors) {
        requireField(manifest.getId(), "id", errors);
        requireField(manifest.getName(), "name", errors);
        requireField(manifest.getVersion(), "version", errors);
        requireField(manifest.getEndpoint(EndpointKind.UPLOAD), "endpoints.upload", errors);
        if (manifest.getFileTypes().isEmpty()) {
            errors.add("Required field missing: fileTypes");
        }
    }

    private void requireField(String value, String field, List<String> errors) {
        if (isBlank(value)) {
            errors.add("Required field missing: " + field);
        }
    }

    private void validatePluginId(String id, List<String> errors) {
        // 缺失已由结构检查报告
        if (isBlank(id)) {
            return;
        }
        if (id.length() < 3 || id.length() > 50) {
            errors.add("Plugin ID must be between 3 and 50 characters");
        }
        if (!PLUGIN_ID_PATTERN.matcher(id).matches()) {
            errors.add("Plugin ID can only contain lowercase letters, numbers, and hyphens");
        }
        if (RESTRICTED_ID_PATTERNS.stream().anyMatch(id::contains)) {
            errors.add("Plugin ID contains restricted patterns");
        }
    }

    private void validateVersion(String version, List<String> warnings) {
        if (isBlank(version)) {
            return;
        }
        if (!VERSION_PATTERN.matcher(version).matches()) {
            warnings.add("Version format should follow semantic versioning (e.g., v1.0.0)");
        }
    }

    private void validateEndpoints(Map<EndpointKind, String> endpoints, List<String> errors, List<String> warnings) {
        endpoints.forEach((kind, url) -> {
            if (!isBlank(url)) {
                validateEndpointUrl(kind.key(), url, errors, warnings);
            }
        });
    }

    private void validateEndpointUrl(String type, String url, List<String> errors, List<String> warnings) {
        if (url.length() > MAX_ENDPOINT_LENGTH) {
            errors.add(type + " endpoint URL too long (max " + MAX_ENDPOINT_LENGTH + " chars)");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            errors.add(type + " endpoint URL is malformed: " + url);
            return;
        }
        if (!uri.isAbsolute()) {
            errors.add(type + " endpoint URL is malformed: " + url);
            return;
        }

        // 先判协议：javascript:、data: 这类不透明 URI 没有 host
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        boolean allowedScheme = ALLOWED_SCHEMES.contains(scheme);
        if (!allowedScheme) {
            errors.add(type + " endpoint uses disallowed protocol: " + scheme + ":");
        }
        if (uri.getHost() == null) {
            if (allowedScheme) {
                errors.add(type + " endpoint URL is malformed: " + url);
            }
            return;
        }

        String host = HostAddresses.normalize(uri.getHost());
        if (config.isProductionMode()) {
            if (HostAddresses.isLoopback(host)) {
                errors.add(type + " endpoint uses blocked domain: " + host);
            } else if (HostAddresses.isPrivate(host)) {
                errors.add(type + " endpoint uses private IP address: " + host);
            }
            if ("http".equals(scheme)) {
                warnings.add(type + " endpoint should use HTTPS in production");
            }
        }

        // 路径穿越
        String path = uri.getRawPath();
        if (path != null && (path.contains("..") || path.contains("//"))) {
            errors.add(type + " endpoint contains potentially dangerous path patterns");
        }
    }

    private void validateFileTypes(Set<String> fileTypes, List<String> errors, List<String> warnings) {
        if (fileTypes.isEmpty()) {
            return;
        }
        List<String> normalized = fileTypes.stream().map(FileTypes::normalize).toList();

        List<String> dangerous = normalized.stream().filter(FileTypes.DANGEROUS::contains).toList();
        if (!dangerous.isEmpty()) {
            errors.add("Plugin supports dangerous file types: " + String.join(", ", dangerous));
        }

        List<String> unusual = normalized.stream().filter(t -> !FileTypes.COMMONLY_SAFE.contains(t)).toList();
        if (!unusual.isEmpty()) {
            warnings.add("Plugin supports unusual file types: " + String.join(", ", unusual));
        }
    }

    private void validateFileSize(long maxFileSize, List<String> errors, List<String> warnings) {
        if (maxFileSize <= 0) {
            errors.add("Plugin maxFileSize must be a positive number");
            return;
        }
        if (maxFileSize > config.getMaxFileSizeCeiling()) {
            errors.add("Plugin file size limit too large (max "
                    + Math.round((double) config.getMaxFileSizeCeiling() / SecurityConfig.MB) + "MB)");
        }
        if (maxFileSize > config.getLargeFileSizeThreshold()) {
            warnings.add("Plugin allows very large file uploads - consider security implications");
        }
    }

    private void validateCapabilities(PluginManifest manifest, List<String> warnings) {
        if (config.isTrustedSource(manifest.getSource())) {
            return;
        }
        if (manifest.declares(ManifestCapability.BATCH_PROCESSING) && manifest.declares(ManifestCapability.FILE_UPLOAD)) {
            warnings.add("Plugin supports both batch processing and file upload - monitor for abuse");
        }
        if (manifest.declares(ManifestCapability.IMAGE_PROCESSING) && manifest.declares(ManifestCapability.BATCH_PROCESSING)) {
            warnings.add("Image processing + batch processing could consume significant resources");
        }
    }

    private void validateContent(PluginManifest manifest, List<String> warnings) {
        String content = String.join(" ",
                nullToEmpty(manifest.getName()),
                nullToEmpty(manifest.getDescription()),
                serializeEndpoints(manifest.getEndpoints()));

        if (SUSPICIOUS_CONTENT.stream().anyMatch(p -> p.matcher(content).find())) {
            warnings.add("Plugin content contains potentially suspicious patterns");
        }
    }

    private String serializeEndpoints(Map<EndpointKind, String> endpoints) {
        Map<String, String> byKey = endpoints.entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().key(), e -> nullToEmpty(e.getValue())));
        try {
            return JsonSupport.mapper().writeValueAsString(byKey);
        } catch (JsonProcessingException e) {
            return byKey.toString();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
