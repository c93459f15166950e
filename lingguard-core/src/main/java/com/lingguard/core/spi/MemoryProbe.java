package com.lingguard.core.spi;

/**
 * 内存用量探针
 * 宿主无法提供时返回 0，此时不做内存观测。
 */
@FunctionalInterface
public interface MemoryProbe {

    long usedBytes();

    static MemoryProbe runtime() {
        return () -> {
            Runtime runtime = Runtime.getRuntime();
            return runtime.totalMemory() - runtime.freeMemory();
        };
    }
}
