package com.lingguard.core.spi;

import java.util.Map;

/**
 * 错误上报 SPI
 * <p>
 * 完整性失败、沙箱违规、慢操作等均通过此接口交给宿主的错误日志服务。
 * 实现不应抛出异常。
 * </p>
 */
public interface SecurityErrorReporter {

    /**
     * @param error    错误对象
     * @param category 分类，如 "Plugin Memory Violation"
     * @param context  上下文（插件 ID、操作 ID、耗时等）
     */
    void report(Throwable error, String category, Map<String, Object> context);
}
