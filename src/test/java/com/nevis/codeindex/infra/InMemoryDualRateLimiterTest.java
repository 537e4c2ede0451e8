package com.nevis.codeindex.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InMemoryDualRateLimiterTest {

    private InMemoryDualRateLimiter limiter;
    private static final int RPM_LIMIT = 3;
    private static final int TPM_LIMIT = 100;

    @BeforeEach
    void setUp() {
        limiter = new InMemoryDualRateLimiter(RPM_LIMIT, TPM_LIMIT);
    }

    @Test
    void shouldEnforceRpmLimit() {
        String provider = "gemini";
        AtomicInteger calls = new AtomicInteger(0);

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.execute(provider, 1, calls::incrementAndGet);
        }
        assertThat(calls.get()).isEqualTo(RPM_LIMIT);

        CompletableFuture<Void> blocked = CompletableFuture.runAsync(() ->
            limiter.execute(provider, 1, calls::incrementAndGet)
        );

        assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
        assertThat(calls.get()).isEqualTo(RPM_LIMIT);
        blocked.cancel(true);
    }

    @Test
    void shouldEnforceTpmLimit() {
        String provider = "gemini-tpm";

        limiter.execute(provider, TPM_LIMIT, () -> "full");

        CompletableFuture<String> blocked = CompletableFuture.supplyAsync(() ->
            limiter.execute(provider, 1, () -> "denied")
        );

        assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
        blocked.cancel(true);
    }

    @Test
    void shouldCapOversizedRequestAtTheWholeBudget() {
        String provider = "oversized";

        assertThat(limiter.execute(provider, TPM_LIMIT * 5, () -> "passed")).isEqualTo("passed");
        assertThat(limiter.availableTokens(provider)).isZero();
        assertThat(limiter.availableRequests(provider)).isEqualTo(RPM_LIMIT - 1);
    }

    @Test
    void shouldIsolateLimitsByKey() {
        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.acquire("provider-a", 1);
        }

        CompletableFuture<String> independent = CompletableFuture.supplyAsync(() ->
            limiter.execute("provider-b", 1, () -> "success")
        );

        assertThat(independent.join()).isEqualTo("success");
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
