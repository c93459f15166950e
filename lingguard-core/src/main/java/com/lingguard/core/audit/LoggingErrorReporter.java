package com.lingguard.core.audit;

import com.lingguard.core.spi.SecurityErrorReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 默认错误上报：写入日志
 * 生产环境可替换为写入 ES/DB 的实现。
 */
@Slf4j
public class LoggingErrorReporter implements SecurityErrorReporter {

    @Override
    public void report(Throwable error, String category, Map<String, Object> context) {
        try {
            log.warn("[AUDIT] Category={}, Error={}, Context={}", category, error.getMessage(), context);
            if (log.isDebugEnabled()) {
                log.debug("[AUDIT] Stack trace for {}", category, error);
            }
        } catch (Exception e) {
            log.warn("Audit log failed", e);
        }
    }
}
