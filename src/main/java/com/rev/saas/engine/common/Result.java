package com.rev.saas.engine.common;

import com.rev.saas.engine.common.exception.BaseDecisionException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode, Instant timestamp) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = (timestamp == null ? Instant.now() : timestamp);
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null, Instant.now());
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null, Instant.now());
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code, Instant.now());
    }

    public static <T> Result<T> fail(BaseDecisionException ex) {
        return new Result<>(false, null, ex.getMessage(), ex.getErrorCode(), Instant.now());
    }

    // ---------- convenience helpers ----------

    /**
     * Convenience alias: true when successful.
     */
    public boolean isOk() {
        return success;
    }

    /**
     * Convenience alias for the payload (same as getData()).
     */
    public T get() {
        return data;
    }

    /**
     * True when failed.
     */
    public boolean isFailure() {
        return !success;
    }
}
