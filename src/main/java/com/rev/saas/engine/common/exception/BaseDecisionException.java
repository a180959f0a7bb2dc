package com.rev.saas.engine.common.exception;

import lombok.Getter;

/**
 * Base exception for every failure the decision engine reports to its callers.
 * Carries a stable error code next to the message.
 */
@Getter
public abstract class BaseDecisionException extends RuntimeException {

    private final String errorCode;

    protected BaseDecisionException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseDecisionException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseDecisionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
