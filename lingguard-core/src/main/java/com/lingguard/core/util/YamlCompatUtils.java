package com.lingguard.core.util;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.inspector.TagInspector;

/**
 * YAML 工具类
 * <p>
 * SnakeYAML 2.x 默认禁止 !! 全局标签，清单只放行 com.lingguard.* 下的类型，
 * 其余标签（如 !!javax.script.ScriptEngineManager）在解析时直接被拒绝。
 * 同时限制文档体积与别名数量，防止清单借 YAML 特性耗尽内存。
 * </p>
 */
@Slf4j
public final class YamlCompatUtils {

    private static final int MAX_ALIASES = 20;
    private static final int MAX_CODE_POINTS = 1024 * 1024;

    private YamlCompatUtils() {
    }

    /**
     * 创建仅用于加载清单的 Yaml 实例，目标类型为 rootType
     */
    public static Yaml createLoaderYaml(Class<?> rootType) {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setTagInspector(lingguardTagsOnly());
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        loaderOptions.setCodePointLimit(MAX_CODE_POINTS);
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(rootType, loaderOptions));
    }

    private static TagInspector lingguardTagsOnly() {
        return tag -> {
            String className = tag.getClassName();
            boolean allowed = className != null && className.startsWith("com.lingguard.");
            if (!allowed) {
                log.warn("[Loader] Rejected global YAML tag: {}", tag);
            }
            return allowed;
        };
    }
}
