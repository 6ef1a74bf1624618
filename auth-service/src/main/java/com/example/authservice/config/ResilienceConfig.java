package com.example.authservice.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

import java.time.Duration;

/**
 * Resilience4j configuration for the Redis-backed revocation store.
 *
 * Circuit Breaker Strategy:
 * - Failure rate threshold: 50% over a 20-call window
 * - Wait duration in open state: 5s
 * - Permitted calls in half-open state: 3
 *
 * While the circuit is open every blacklist check fails fast with 503.
 * No retry: a revocation check is on the request path and must stay bounded.
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String REVOCATION_STORE = "revocationStore";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(5))
                .permittedNumberOfCallsInHalfOpenState(3)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .slowCallDurationThreshold(Duration.ofMillis(500))
                .slowCallRateThreshold(100)
                .recordExceptions(DataAccessException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);

        registry.circuitBreaker(REVOCATION_STORE).getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Revocation store circuit breaker state changed: FROM {} TO {}",
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()))
                .onCallNotPermitted(event ->
                        log.error("Revocation store circuit breaker call not permitted (circuit is OPEN)"));

        return registry;
    }

    @Bean
    public CircuitBreaker revocationStoreCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(REVOCATION_STORE);
    }
}
