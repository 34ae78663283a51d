package com.openforge.meetingmemory.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring, one named instance per collaborator:
 *   • "retrieval"        circuit breaker + retry
 *   • "answerGeneration" circuit breaker + retry
 *   • "storage"          circuit breaker only; writes are never retried
 */
@Configuration
public class Resilience4jConfig {

    static final String RETRIEVAL         = "retrieval";
    static final String ANSWER_GENERATION = "answerGeneration";
    static final String STORAGE           = "storage";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // answer generation may be an LLM; anything over 30 s is a failure
                .slowCallDurationThreshold(Duration.ofSeconds(30))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(RETRIEVAL);
        registry.circuitBreaker(ANSWER_GENERATION);
        registry.circuitBreaker(STORAGE);
        return registry;
    }

    @Bean
    public CircuitBreaker retrievalCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(RETRIEVAL);
    }

    @Bean
    public CircuitBreaker answerGenerationCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(ANSWER_GENERATION);
    }

    @Bean
    public CircuitBreaker storageCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(STORAGE);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                // only transport failures are worth another attempt
                .retryExceptions(IOException.class, UncheckedIOException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(RETRIEVAL);
        registry.retry(ANSWER_GENERATION);
        return registry;
    }

    @Bean
    public Retry retrievalRetry(RetryRegistry registry) {
        return registry.retry(RETRIEVAL);
    }

    @Bean
    public Retry answerGenerationRetry(RetryRegistry registry) {
        return registry.retry(ANSWER_GENERATION);
    }
}
