package com.openforge.meetingmemory.config;

import com.openforge.meetingmemory.CollaboratorException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;

import java.util.function.Supplier;

/**
 * Circuit breaker + retry around one collaborator call. Decorated
 * programmatically, no AOP proxies.
 *
 * Whatever is left after the decorators give up is rethrown as a
 * {@link CollaboratorException} tagged with the collaborator.
 */
public final class ResilientCall {

    private ResilientCall() {
    }

    public static <T> T execute(CircuitBreaker circuitBreaker,
                                Retry retry,
                                CollaboratorException.Collaborator collaborator,
                                Supplier<T> call) {
        Supplier<T> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException(collaborator,
                    "%s call ultimately failed: %s".formatted(collaborator, e.getMessage()), e);
        }
    }
}
