package com.urlsentry.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultRetryPolicyTest {

    private final DefaultRetryPolicy policy =
            new DefaultRetryPolicy(2, Duration.ofMillis(100), 0.0, Set.of(503));

    @Test
    void transient_failures_are_retried_until_attempts_run_out() {
        ProbeResult timeout = ProbeResult.timeout(10);
        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.shouldRetry(timeout, 1)).isTrue();
        assertThat(policy.shouldRetry(timeout, 2)).isTrue();
        assertThat(policy.shouldRetry(timeout, 3)).isFalse();

        assertThat(policy.shouldRetry(ProbeResult.connection("refused", 1), 1)).isTrue();
        assertThat(policy.shouldRetry(ProbeResult.status(500, 1), 1)).isTrue();
    }

    @Test
    void permanent_results_are_not_retried() {
        assertThat(policy.shouldRetry(ProbeResult.status(200, 1), 1)).isFalse();
        assertThat(policy.shouldRetry(ProbeResult.status(404, 1), 1)).isFalse();
        assertThat(policy.shouldRetry(ProbeResult.status(301, 1), 1)).isFalse();
        assertThat(policy.shouldRetry(ProbeResult.invalidUrl("bad"), 1)).isFalse();
    }

    @Test
    void client_errors_including_too_many_requests_are_final() {
        assertThat(policy.shouldRetry(ProbeResult.status(429, 1), 1)).isFalse();
        assertThat(policy.shouldRetry(ProbeResult.status(408, 1), 1)).isFalse();
    }

    @Test
    void only_5xx_range_counts_as_server_error() {
        assertThat(policy.shouldRetry(ProbeResult.status(599, 1), 1)).isTrue();
        assertThat(policy.shouldRetry(ProbeResult.status(600, 1), 1)).isFalse();
        assertThat(policy.shouldRetry(ProbeResult.status(999, 1), 1)).isFalse();
    }

    @Test
    void allowed_status_is_never_retried() {
        assertThat(policy.shouldRetry(ProbeResult.status(503, 1), 1)).isFalse();
    }

    @Test
    void delay_doubles_per_attempt() {
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void delay_is_capped_and_zero_base_means_no_wait() {
        assertThat(new DefaultRetryPolicy(20, Duration.ofSeconds(1)).nextDelay(40))
                .isEqualTo(Duration.ofMinutes(10));
        assertThat(new DefaultRetryPolicy(3, Duration.ZERO).nextDelay(2)).isEqualTo(Duration.ZERO);
    }

    @Test
    void jitter_stays_within_ratio() {
        DefaultRetryPolicy jittered = new DefaultRetryPolicy(3, Duration.ofMillis(1000), 0.2, Set.of());
        for (int i = 0; i < 50; i++) {
            assertThat(jittered.nextDelay(1).toMillis()).isBetween(800L, 1200L);
        }
    }

    @Test
    void zero_retries_means_single_attempt() {
        DefaultRetryPolicy none = new DefaultRetryPolicy(0, Duration.ofMillis(100));
        assertThat(none.maxAttempts()).isEqualTo(1);
        assertThat(none.shouldRetry(ProbeResult.status(503, 1), 1)).isFalse();
    }

    @Test
    void rejects_bad_arguments() {
        assertThatThrownBy(() -> new DefaultRetryPolicy(-1, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultRetryPolicy(1, Duration.ofMillis(-5))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultRetryPolicy(1, Duration.ZERO, 1.0, Set.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
