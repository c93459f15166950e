package com.lingguard.api.exception;

/**
 * LingGuard 基础异常
 *
 * @author LingGuard
 */
public class LingGuardException extends RuntimeException {

    public LingGuardException(String message) {
        super(message);
    }

    public LingGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
