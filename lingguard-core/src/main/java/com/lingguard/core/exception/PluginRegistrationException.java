package com.lingguard.core.exception;

import com.lingguard.api.exception.LingGuardException;
import com.lingguard.api.integrity.IntegrityCheckResult;
import com.lingguard.api.validation.ValidationResult;

/**
 * 插件注册被安全流水线拒绝
 * <p>
 * 携带已得出的校验结论，便于宿主逐条展示。
 * </p>
 */
public class PluginRegistrationException extends LingGuardException {

    private final String pluginId;
    private final ValidationResult validation;
    private final IntegrityCheckResult integrity;

    public PluginRegistrationException(String pluginId, String message,
                                       ValidationResult validation, IntegrityCheckResult integrity) {
        super(message);
        this.pluginId = pluginId;
        this.validation = validation;
        this.integrity = integrity;
    }

    public String getPluginId() {
        return pluginId;
    }

    /**
     * 静态校验结果，可能为 null（注册在校验前被拒绝）
     */
    public ValidationResult getValidation() {
        return validation;
    }

    /**
     * 完整性验证结果，可能为 null（在验证前被拒绝）
     */
    public IntegrityCheckResult getIntegrity() {
        return integrity;
    }
}
