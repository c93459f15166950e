package com.lingguard.core.spi;

import java.util.Optional;

/**
 * 宿主键值存储
 * 键由受限上下文加上插件命名空间前缀后传入。
 */
public interface PluginStorage {

    Optional<String> get(String key);

    void put(String key, String value);
}
