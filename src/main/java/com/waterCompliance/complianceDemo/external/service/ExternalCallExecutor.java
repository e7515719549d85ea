package com.waterCompliance.complianceDemo.external.service;

import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Single boundary for outbound calls. Retries with exponential backoff and turns every
 * failure into an {@link ExternalCallException} once attempts are exhausted.
 */
@Slf4j
@Component
public class ExternalCallExecutor {

    private final RetryRegistry retryRegistry;

    public ExternalCallExecutor(@Value("${external.retry.max-attempts:2}") int maxAttempts,
                                @Value("${external.retry.initial-backoff:PT0.2S}") Duration initialBackoff,
                                @Value("${external.retry.multiplier:2.0}") double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(ExternalCallException.class)
                .build();
        this.retryRegistry = RetryRegistry.of(config);
    }

    public <T> T execute(String callName, Supplier<T> call) {
        Retry retry = retryRegistry.retry(callName);
        Supplier<T> guarded = () -> {
            try {
                return call.get();
            } catch (ExternalCallException e) {
                log.warn("External call attempt failed - call: {}, error: {}", callName, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.warn("External call attempt failed - call: {}, error: {}", callName, e.getMessage());
                throw new ExternalCallException(callName + " call failed: " + e.getMessage(), e);
            }
        };
        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (ExternalCallException e) {
            log.error("External call failed after retries - call: {}, attempts: {}, error: {}",
                    callName, retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw e;
        }
    }
}
