package com.example.commerce.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs what the payment gateway guards do. Instances are created lazily on the first
 * gateway call, so listeners are also attached as registry entries appear.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    static final String PAYMENT_CIRCUIT_BREAKER = "paymentCB";
    static final String PAYMENT_TIME_LIMITER = "paymentTL";

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;

    public Resilience4jEventConfig(CircuitBreakerRegistry circuitBreakerRegistry,
                                   TimeLimiterRegistry timeLimiterRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void watchPaymentGuards() {
        circuitBreakerRegistry.find(PAYMENT_CIRCUIT_BREAKER).ifPresent(this::watch);
        circuitBreakerRegistry.getEventPublisher().onEntryAdded(added -> {
            if (PAYMENT_CIRCUIT_BREAKER.equals(added.getAddedEntry().getName())) {
                watch(added.getAddedEntry());
            }
        });

        timeLimiterRegistry.find(PAYMENT_TIME_LIMITER).ifPresent(this::watch);
        timeLimiterRegistry.getEventPublisher().onEntryAdded(added -> {
            if (PAYMENT_TIME_LIMITER.equals(added.getAddedEntry().getName())) {
                watch(added.getAddedEntry());
            }
        });
    }

    private void watch(CircuitBreaker breaker) {
        log.debug("Watching circuit breaker {}", breaker.getName());
        breaker.getEventPublisher().onStateTransition(transition -> {
            CircuitBreaker.State to = transition.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                log.warn("Payment gateways unavailable: {} opened after failure rate {}%",
                        breaker.getName(), breaker.getMetrics().getFailureRate());
            } else {
                log.info("Payment circuit {} moved {} -> {}", breaker.getName(),
                        transition.getStateTransition().getFromState(), to);
            }
        });
        breaker.getEventPublisher().onError(failed -> log.debug(
                "Gateway call failed after {}ms: {}",
                failed.getElapsedDuration().toMillis(), failed.getThrowable().toString()));
        breaker.getEventPublisher().onSlowCallRateExceeded(slow -> log.warn(
                "Gateway calls slow on {}: {}% above threshold",
                slow.getCircuitBreakerName(), slow.getSlowCallRate()));
        breaker.getEventPublisher().onCallNotPermitted(rejected -> log.warn(
                "Gateway call rejected while {} is open; payment recorded as failed",
                rejected.getCircuitBreakerName()));
    }

    private void watch(TimeLimiter limiter) {
        log.debug("Watching time limiter {} ({})", limiter.getName(),
                limiter.getTimeLimiterConfig().getTimeoutDuration());
        limiter.getEventPublisher().onTimeout(timeout -> log.warn(
                "Gateway call timed out after {}", limiter.getTimeLimiterConfig().getTimeoutDuration()));
    }
}
