package com.lingguard.api.sandbox;

import lombok.Builder;
import lombok.Value;

/**
 * 单次沙箱执行的可选参数
 * 未设置的项使用执行器的全局配置。
 */
@Value
@Builder
public class SandboxOptions {

    /**
     * 超时（毫秒），null 或非正数表示使用默认值
     */
    Long timeoutMs;

    /**
     * 内存增量告警阈值（字节），null 表示使用默认值
     */
    Long memoryLimitBytes;

    public static SandboxOptions defaults() {
        return SandboxOptions.builder().build();
    }

    public static SandboxOptions withTimeout(long timeoutMs) {
        return SandboxOptions.builder().timeoutMs(timeoutMs).build();
    }
}
