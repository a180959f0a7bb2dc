package com.rev.saas.engine.common.exception;

/**
 * Thrown when a decision, outcome or scenario set is absent, soft-deleted or owned by another user.
 * The three causes are reported identically.
 */
public class EntityNotFoundException extends BaseDecisionException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, String identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
