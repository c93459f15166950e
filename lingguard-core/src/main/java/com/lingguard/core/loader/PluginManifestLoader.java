package com.lingguard.core.loader;

import com.lingguard.api.config.PluginDefinition;
import com.lingguard.api.exception.InvalidArgumentException;
import com.lingguard.api.manifest.EndpointKind;
import com.lingguard.api.manifest.ManifestSignature;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Map;
import java.util.Objects;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 插件清单加载器
 * <p>
 * 从目录或插件 Jar 中读取 plugin.yml，解析为 {@link PluginDefinition} 后冻结为 {@link PluginManifest}。
 * 加载只做结构转换，不做安全判断；非字符串 id 会被转换并打上标记，由完整性验证判定为篡改迹象。
 * </p>
 */
@Slf4j
public class PluginManifestLoader {

    public static final String PLUGIN_MANIFEST_NAME = "plugin.yml";

    /**
     * 解析插件清单 (支持 Jar 和 目录)
     *
     * @param file 插件文件（jar）或目录
     * @return 插件清单，如果不是合法插件则返回 null
     */
    public static PluginManifest parseManifest(File file) {
        if (file.isDirectory()) {
            return parseFromDirectory(file);
        } else if (file.getName().endsWith(".jar")) {
            return parseFromJar(file);
        }
        return null; // 忽略非 Jar 和非目录的文件
    }

    private static PluginManifest parseFromDirectory(File dir) {
        File ymlFile = new File(dir, PLUGIN_MANIFEST_NAME);
        if (!ymlFile.exists()) {
            return null;
        }

        try (InputStream is = Files.newInputStream(ymlFile.toPath())) {
            return load(is);
        } catch (IOException | UncheckedIOException | InvalidArgumentException e) {
            log.warn("[Loader] Found directory {} but failed to parse {}: {}",
                    dir.getName(), PLUGIN_MANIFEST_NAME, e.getMessage());
            return null;
        }
    }

    private static PluginManifest parseFromJar(File jarFile) {
        try (JarFile jar = new JarFile(jarFile)) {
            JarEntry entry = jar.getJarEntry(PLUGIN_MANIFEST_NAME);
            if (entry == null) {
                log.debug("[Loader] Skipping jar {}: No {} found inside.", jarFile.getName(), PLUGIN_MANIFEST_NAME);
                return null;
            }

            try (InputStream is = jar.getInputStream(entry)) {
                return load(is);
            }
        } catch (IOException | UncheckedIOException | InvalidArgumentException e) {
            log.warn("[Loader] Error reading jar file: {}", jarFile.getName(), e);
            return null;
        }
    }

    /**
     * 从流中加载清单，流由本方法关闭
     *
     * @throws InvalidArgumentException YAML 无法解析或含未知端点
     */
    public static PluginManifest load(InputStream inputStream) {
        Yaml yaml = YamlCompatUtils.createLoaderYaml(PluginDefinition.class);

        try (InputStream is = inputStream) {
            PluginDefinition definition = yaml.load(is);
            if (definition == null) {
                throw new InvalidArgumentException(PLUGIN_MANIFEST_NAME, "Plugin manifest is empty");
            }
            return toManifest(definition);
        } catch (YAMLException e) {
            throw new InvalidArgumentException(PLUGIN_MANIFEST_NAME, "Failed to load plugin manifest: "
                    + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read plugin manifest", e);
        }
    }

    /**
     * 冻结为不可变清单
     */
    public static PluginManifest toManifest(PluginDefinition definition) {
        Object rawId = definition.getId();
        boolean coerced = rawId != null && !(rawId instanceof String);
        if (coerced) {
            log.warn("[Loader] Plugin id {} is a {}, coerced to string",
                    rawId, rawId.getClass().getSimpleName());
        }

        PluginManifest.PluginManifestBuilder builder = PluginManifest.builder()
                .id(rawId == null ? null : String.valueOf(rawId))
                .identityCoerced(coerced)
                .name(definition.getName())
                .version(definition.getVersion())
                .description(definition.getDescription())
                .maxFileSize(definition.getMaxFileSize() == null ? 0L : definition.getMaxFileSize())
                .contentHash(definition.getContentHash())
                .source(definition.getSource());

        if (definition.getFileTypes() != null) {
            definition.getFileTypes().stream().filter(Objects::nonNull).forEach(builder::fileType);
        }
        if (definition.getFeatures() != null) {
            definition.getFeatures().stream().filter(Objects::nonNull).forEach(builder::feature);
        }
        if (definition.getEndpoints() != null) {
            for (Map.Entry<String, String> entry : definition.getEndpoints().entrySet()) {
                EndpointKind kind = EndpointKind.fromKey(entry.getKey())
                        .orElseThrow(() -> new InvalidArgumentException("endpoints", entry.getKey(),
                                "Unknown endpoint: " + entry.getKey()));
                if (entry.getValue() != null) {
                    builder.endpoint(kind, entry.getValue());
                }
            }
        }
        if (definition.getCapabilities() != null) {
            definition.getCapabilities().forEach((name, enabled) -> {
                if (Boolean.TRUE.equals(enabled)) {
                    builder.capability(name);
                }
            });
        }

        PluginDefinition.Signature signature = definition.getSignature();
        if (signature != null) {
            builder.signature(ManifestSignature.builder()
                    .value(signature.getValue())
                    .algorithm(signature.getAlgorithm())
                    .version(signature.getVersion())
                    .timestamp(signature.getTimestamp())
                    .build());
        }
        return builder.build();
    }
}
