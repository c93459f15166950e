package com.lingguard.core.exception;

import com.lingguard.api.exception.LingGuardException;

import java.util.List;

/**
 * 沙箱策略违规：请求体过大或含恶意内容、不允许的协议、超出上限的 JSON 等
 */
public class SandboxViolationException extends LingGuardException {

    private final String pluginId;
    private final List<String> issues;

    public SandboxViolationException(String pluginId, String message) {
        this(pluginId, message, List.of(message));
    }

    public SandboxViolationException(String pluginId, String message, List<String> issues) {
        super(message);
        this.pluginId = pluginId;
        this.issues = List.copyOf(issues);
    }

    public String getPluginId() {
        return pluginId;
    }

    public List<String> getIssues() {
        return issues;
    }
}
