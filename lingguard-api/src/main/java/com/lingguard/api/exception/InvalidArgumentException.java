package com.lingguard.api.exception;

/**
 * 无效参数异常
 * 当传入的清单、配置或调用参数不满足要求时抛出。
 */
public class InvalidArgumentException extends LingGuardException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        super(message, cause);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }
}
