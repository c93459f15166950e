package com.lingguard.core.exception;

import com.lingguard.api.exception.LingGuardException;

/**
 * 沙箱在执行前拒绝调用时抛出
 */
public class CallNotPermittedException extends LingGuardException {

    private final String pluginId;
    private final String reason;

    public CallNotPermittedException(String pluginId, String reason) {
        super("Call not permitted for plugin " + pluginId + ": " + reason);
        this.pluginId = pluginId;
        this.reason = reason;
    }

    public String getPluginId() {
        return pluginId;
    }

    public String getReason() {
        return reason;
    }
}
