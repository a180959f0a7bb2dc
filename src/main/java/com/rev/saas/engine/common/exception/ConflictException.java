package com.rev.saas.engine.common.exception;

/**
 * A write collided with a concurrent write or a uniqueness constraint and could not be resolved by retrying.
 */
public class ConflictException extends BaseDecisionException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CONFLICT";

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
