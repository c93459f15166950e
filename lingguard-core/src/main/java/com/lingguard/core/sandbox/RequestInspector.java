package com.lingguard.core.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lingguard.api.sandbox.SecurityCheckResult;
import com.lingguard.api.security.RiskLevel;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 请求内容检查
 * <p>
 * 将请求序列化为 JSON 后检查体积、代码注入特征与 SQL 注入特征。
 * 只做子串匹配，不解析语义。
 * </p>
 */
class RequestInspector {

    static final String PAYLOAD_TOO_LARGE = "Request payload too large";
    static final String MALICIOUS_CONTENT = "Request contains potentially malicious content";
    static final String SQL_INJECTION = "Request contains SQL injection patterns";
    static final String STRUCTURE_INVALID = "Failed to validate request structure";

    private static final List<String> INJECTION_PATTERNS = List.of(
            "eval(", "function(", "javascript:", "<script", "document.",
            "window.", "process.", "__proto__", "constructor", "prototype");

    private static final List<String> SQL_PATTERNS = List.of(
            "union select", "drop table", "insert into", "delete from",
            "update set", "--", "/*", "*/");

    private static final List<String> CRITICAL_KEYWORDS = List.of("malicious", "injection", "script");

    private final ObjectMapper mapper;
    private final int maxPayloadBytes;

    RequestInspector(ObjectMapper mapper, int maxPayloadBytes) {
        this.mapper = mapper;
        this.maxPayloadBytes = maxPayloadBytes;
    }

    SecurityCheckResult inspect(Object payload) {
        List<String> issues = new ArrayList<>();
        try {
            String serialized = mapper.writeValueAsString(payload);
            if (serialized.getBytes(StandardCharsets.UTF_8).length > maxPayloadBytes) {
                issues.add(PAYLOAD_TOO_LARGE);
            }

            String lower = serialized.toLowerCase(Locale.ROOT);
            if (INJECTION_PATTERNS.stream().anyMatch(lower::contains)) {
                issues.add(MALICIOUS_CONTENT);
            }
            if (SQL_PATTERNS.stream().anyMatch(lower::contains)) {
                issues.add(SQL_INJECTION);
            }
        } catch (JsonProcessingException e) {
            issues.add(STRUCTURE_INVALID);
        }
        return new SecurityCheckResult(issues.isEmpty(), List.copyOf(issues), riskLevel(issues));
    }

    static RiskLevel riskLevel(List<String> issues) {
        boolean critical = issues.stream()
                .map(issue -> issue.toLowerCase(Locale.ROOT))
                .anyMatch(issue -> CRITICAL_KEYWORDS.stream().anyMatch(issue::contains));
        if (critical) {
            return RiskLevel.CRITICAL;
        }
        if (issues.size() > 2) {
            return RiskLevel.HIGH;
        }
        if (!issues.isEmpty()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
