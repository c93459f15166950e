package com.lingguard.core.exception;

import com.lingguard.api.exception.LingGuardException;

/**
 * 插件操作执行异常
 * 包装操作抛出的受检异常。
 */
public class InvocationException extends LingGuardException {

    private final String pluginId;

    public InvocationException(String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
