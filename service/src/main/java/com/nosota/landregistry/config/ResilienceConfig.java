package com.nosota.landregistry.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class ResilienceConfig {

    /**
     * Bounded local retry for handing transition events to the notification sink.
     * Exponential backoff starting at {@code initial-interval-ms}.
     */
    @Bean
    public Retry notificationRetry(RegistryProperties properties) {
        RegistryProperties.Notification notification = properties.notification();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(notification.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        notification.initialIntervalMs(), notification.multiplier()))
                .build();

        Retry retry = RetryRegistry.of(config).retry("notificationRetry");
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying notification delivery (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }
}
