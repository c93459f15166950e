package com.lingguard.core.exception;

import com.lingguard.api.exception.LingGuardException;

/**
 * 沙箱执行超时
 */
public class SandboxTimeoutException extends LingGuardException {

    private final String pluginId;
    private final long timeoutMs;

    public SandboxTimeoutException(String pluginId, long timeoutMs) {
        super("Plugin " + pluginId + " operation timed out after " + timeoutMs + "ms");
        this.pluginId = pluginId;
        this.timeoutMs = timeoutMs;
    }

    public String getPluginId() {
        return pluginId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
