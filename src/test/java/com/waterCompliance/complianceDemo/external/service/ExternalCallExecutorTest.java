package com.waterCompliance.complianceDemo.external.service;

import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallExecutorTest {

    private final ExternalCallExecutor executor = new ExternalCallExecutor(3, Duration.ofMillis(1), 2.0);

    @Test
    void shouldReturnResultOfSuccessfulCall() {
        assertThat(executor.execute("lookup", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void shouldRetryUntilCallSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute("reasoning", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ExternalCallTimeoutException("read timed out", null);
            }
            return "answer";
        });

        assertThat(result).isEqualTo("answer");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void shouldWrapUnexpectedFailuresAndStopAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("guidance-search", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bad payload");
        }))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("guidance-search")
                .hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(3);
    }
}
