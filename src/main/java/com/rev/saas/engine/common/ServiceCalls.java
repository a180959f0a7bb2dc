package com.rev.saas.engine.common;

import com.rev.saas.engine.common.exception.BaseDecisionException;
import com.rev.saas.engine.common.exception.DependencyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.function.Supplier;

/**
 * Boundary helper for public service operations: runs the body and turns engine exceptions into a failed
 * {@link Result}. An unreachable store is reported as {@code ERR-DB-003}; every other data access error
 * propagates unchanged.
 */
@Slf4j
public final class ServiceCalls {

    private ServiceCalls() {
    }

    public static <T> Result<T> capture(String op, Supplier<T> body) {
        try {
            return Result.ok(body.get());
        } catch (BaseDecisionException ex) {
            log.warn("{} failed: [{}] {}", op, ex.getErrorCode(), ex.getMessage());
            return Result.fail(ex);
        } catch (DataAccessResourceFailureException ex) {
            log.error("{} failed: decision store unavailable", op, ex);
            return Result.fail(new DependencyUnavailableException("Decision store unavailable", ex));
        }
    }

    public static Result<Void> run(String op, Runnable body) {
        return capture(op, () -> {
            body.run();
            return null;
        });
    }
}
