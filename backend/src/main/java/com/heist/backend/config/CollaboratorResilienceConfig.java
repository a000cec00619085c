package com.heist.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class CollaboratorResilienceConfig {

    @Bean
    public CircuitBreaker auditCircuitBreaker(
            @Value("${collaborator.audit.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${collaborator.audit.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${collaborator.audit.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        return CircuitBreaker.of("audit", circuitConfig(failureRateThreshold, waitOpenSeconds, slidingWindowSize));
    }

    @Bean
    public CircuitBreaker walletCircuitBreaker(
            @Value("${collaborator.wallet.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${collaborator.wallet.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${collaborator.wallet.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        return CircuitBreaker.of("wallet", circuitConfig(failureRateThreshold, waitOpenSeconds, slidingWindowSize));
    }

    @Bean
    public TimeLimiter collaboratorTimeLimiter(
            @Value("${collaborator.timeout-ms:10000}") long timeoutMs
    ) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("collaborator", config);
    }

    @Bean
    public Retry auditRetry(
            @Value("${collaborator.audit.retry.max-attempts:2}") int maxAttempts,
            @Value("${collaborator.audit.retry.base-delay-ms:250}") long baseDelayMs,
            @Value("${collaborator.audit.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("audit", config);
    }

    private CircuitBreakerConfig circuitConfig(float failureRateThreshold, long waitOpenSeconds, int slidingWindowSize) {
        return CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
    }
}
