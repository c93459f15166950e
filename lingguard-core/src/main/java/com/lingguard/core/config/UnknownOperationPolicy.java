package com.lingguard.core.config;

/**
 * 对无法识别的操作类型的处理策略
 */
public enum UnknownOperationPolicy {

    /**
     * 视为不需要任何能力，直接放行
     */
    ALLOW,

    /**
     * 直接拒绝
     */
    DENY
}
