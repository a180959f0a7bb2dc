package com.rev.saas.engine.common.exception;

/**
 * The decision store, or an external collaborator such as the scenario generator, cannot be reached.
 */
public class DependencyUnavailableException extends BaseDecisionException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-003";

    public DependencyUnavailableException(String message) {
        super(message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public DependencyUnavailableException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
