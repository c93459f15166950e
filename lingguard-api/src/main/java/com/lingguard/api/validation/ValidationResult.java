package com.lingguard.api.validation;

import com.lingguard.api.security.SecurityLevel;
import lombok.Value;

import java.util.List;

/**
 * 清单静态校验结果
 * <p>
 * errors 阻断注册，warnings 仅作提示。每次校验调用产生一个新实例。
 * </p>
 */
@Value
public class ValidationResult {

    boolean valid;
    List<String> errors;
    List<String> warnings;
    SecurityLevel securityLevel;

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(
                errors.isEmpty(),
                List.copyOf(errors),
                List.copyOf(warnings),
                SecurityLevel.derive(errors.size(), warnings.size()));
    }
}
