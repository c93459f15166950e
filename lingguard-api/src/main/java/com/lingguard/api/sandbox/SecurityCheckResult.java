package com.lingguard.api.sandbox;

import com.lingguard.api.security.RiskLevel;

import java.util.List;

/**
 * 请求内容检查结果
 *
 * @param secure    是否未发现问题
 * @param issues    逐条问题描述
 * @param riskLevel 风险等级
 */
public record SecurityCheckResult(boolean secure, List<String> issues, RiskLevel riskLevel) {
}
