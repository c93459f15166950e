package com.lingguard.api.config;

import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应 plugin.yml 的根节点
 * <p>
 * 可变的加载模型，加载后冻结为不可变的 {@code PluginManifest}。
 * id 声明为 Object，以便识别被写成非字符串的身份字段。
 * </p>
 */
@Getter
@Setter
public class PluginDefinition implements Serializable {

    // === 基础元数据 ===
    private Object id;
    private String name;
    private String version;
    private String description;

    // === 文件处理 ===
    private List<String> fileTypes = new ArrayList<>();
    private Long maxFileSize;
    private List<String> features = new ArrayList<>();

    // === 端点与能力 ===
    private Map<String, String> endpoints = new LinkedHashMap<>();
    private Map<String, Boolean> capabilities = new LinkedHashMap<>();

    // === 来源信息 ===
    private Signature signature;
    private String contentHash;
    private String source;

    @Getter
    @Setter
    public static class Signature implements Serializable {
        private String value;
        private String algorithm;
        private String version;
        private String timestamp;
    }

    @Override
    public String toString() {
        return String.format("PluginDefinition{id='%s', version='%s'}", id, version);
    }
}
