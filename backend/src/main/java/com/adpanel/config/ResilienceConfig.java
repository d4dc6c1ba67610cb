package com.adpanel.config;

import com.adpanel.exception.PlatformApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

@Slf4j
@Configuration
public class ResilienceConfig {

    static final String PLATFORM = "platform";
    static final String PLATFORM_READ = "platformRead";
    static final String PLATFORM_WRITE = "platformWrite";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        // Rejected requests say nothing about platform health
        CircuitBreakerConfig platformConfig =
                CircuitBreakerConfig.custom()
                        .failureRateThreshold(60)
                        .waitDurationInOpenState(Duration.ofMinutes(1))
                        .slidingWindowSize(20)
                        .minimumNumberOfCalls(10)
                        .permittedNumberOfCallsInHalfOpenState(5)
                        .recordException(ResilienceConfig::isTransient)
                        .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.circuitBreaker(PLATFORM, platformConfig);
        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig readConfig =
                RetryConfig.custom()
                        .maxAttempts(3)
                        .waitDuration(Duration.ofMillis(1000))
                        .retryOnException(ResilienceConfig::isTransient)
                        .build();

        RetryConfig writeConfig =
                RetryConfig.custom()
                        .maxAttempts(2)
                        .waitDuration(Duration.ofMillis(1000))
                        .retryOnException(ResilienceConfig::isTransportFailure)
                        .build();

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(PLATFORM_READ, readConfig);
        registry.retry(PLATFORM_WRITE, writeConfig);
        return registry;
    }

    @Bean
    public CircuitBreaker platformCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(PLATFORM);
        circuitBreaker
                .getEventPublisher()
                .onStateTransition(
                        event -> log.info("Platform Circuit Breaker state transition: {}", event));
        return circuitBreaker;
    }

    @Bean
    public Retry platformReadRetry(RetryRegistry registry) {
        Retry retry = registry.retry(PLATFORM_READ);
        retry.getEventPublisher()
                .onRetry(
                        event ->
                                log.warn(
                                        "Platform Read API retry attempt {}: {}",
                                        event.getNumberOfRetryAttempts(),
                                        event.getLastThrowable().getMessage()));
        return retry;
    }

    @Bean
    public Retry platformWriteRetry(RetryRegistry registry) {
        Retry retry = registry.retry(PLATFORM_WRITE);
        retry.getEventPublisher()
                .onRetry(
                        event ->
                                log.warn(
                                        "Platform Write API retry attempt {}: {}",
                                        event.getNumberOfRetryAttempts(),
                                        event.getLastThrowable().getMessage()));
        return retry;
    }

    /** Writes are only repeated when the request may never have reached the platform. */
    static boolean isTransportFailure(Throwable throwable) {
        if (throwable instanceof PlatformApiException) {
            return ((PlatformApiException) throwable).isTransportFailure();
        }
        return throwable instanceof ResourceAccessException;
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof PlatformApiException) {
            return ((PlatformApiException) throwable).isRetryable();
        }
        return throwable instanceof ResourceAccessException;
    }
}
