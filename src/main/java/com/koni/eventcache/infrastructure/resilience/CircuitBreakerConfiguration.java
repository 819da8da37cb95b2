package com.koni.eventcache.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the circuit breaker protecting calls to the device registry.
 * 
 * Circuit Breaker States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failure threshold exceeded, requests fail fast
 * - HALF_OPEN: Testing if the registry recovered, limited requests allowed
 */
@Slf4j
@Configuration
public class CircuitBreakerConfiguration {
    
    /**
     * Creates CircuitBreakerConfig for device registry calls.
     * 
     * Configuration:
     * - Sliding window: 10 requests (COUNT_BASED)
     * - Failure threshold: 50% (circuit opens if 5 out of 10 requests fail)
     * - Wait duration in OPEN state: 10 seconds
     * - Permitted calls in HALF_OPEN: 3 (to test recovery)
     * - Automatic transition: OPEN -> HALF_OPEN after wait duration
     * 
     * @return CircuitBreakerConfig with custom settings
     */
    @Bean
    public CircuitBreakerConfig deviceRegistryCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(10))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }
    
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }
    
    /**
     * Creates the CircuitBreaker named "deviceRegistry" used by the registry client.
     * State transitions are logged for observability.
     * 
     * @param registry the circuit breaker registry
     * @return CircuitBreaker instance for device registry calls
     */
    @Bean
    public CircuitBreaker deviceRegistryCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("deviceRegistry");
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Device registry circuit breaker state transition: {} -> {}",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onCallNotPermitted(event -> log.warn("Device registry call not permitted (circuit is OPEN)"));
        return circuitBreaker;
    }
}
