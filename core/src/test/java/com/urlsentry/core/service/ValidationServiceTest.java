package com.urlsentry.core.service;

import com.urlsentry.core.http.ProbeResult;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.Classification.Kind;
import com.urlsentry.core.model.DistinctUrl;
import com.urlsentry.core.model.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static com.urlsentry.core.service.TestUrls.distinctAll;
import static com.urlsentry.core.service.TestUrls.numbered;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationServiceTest {

    private static CheckConfig cfg() {
        return new CheckConfig().setConcurrency(4).setRetryDelay(Duration.ofMillis(100));
    }

    @Test
    void transient_failures_retry_then_succeed() {
        // 1) 설정: 503, 503, 200
        ScriptedProbe probe = new ScriptedProbe().respond("https://flaky.test", 503, 503, 200);
        RecordingSleeper sleeper = new RecordingSleeper();
        ValidationService svc = new ValidationService(cfg().setRetryAttempts(2), probe, sleeper);

        // 2) 실행
        ValidationRun run = svc.run(distinctAll("https://flaky.test"));

        // 3) 검증
        ValidationOutcome o = run.outcomes().get(0);
        assertThat(o.classification().kind()).isEqualTo(Kind.SUCCESS);
        assertThat(o.classification().statusCode()).isEqualTo(200);
        assertThat(o.attemptsMade()).isEqualTo(3);
        assertThat(probe.calls("https://flaky.test")).isEqualTo(3);
        assertThat(sleeper.slept()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(run.stats().retriesTotal()).isEqualTo(2);
        assertThat(run.stats().requestsTotal()).isEqualTo(3);
    }

    @Test
    void exhausted_retries_report_last_status() {
        ScriptedProbe probe = new ScriptedProbe().respond("https://down.test", 503);
        ValidationService svc = new ValidationService(cfg().setRetryAttempts(2), probe, new RecordingSleeper());

        ValidationOutcome o = svc.run(distinctAll("https://down.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.HTTP_ERROR);
        assertThat(o.classification().statusCode()).isEqualTo(503);
        assertThat(o.attemptsMade()).isEqualTo(3);
    }

    @Test
    void not_found_is_not_retried() {
        ScriptedProbe probe = new ScriptedProbe().respond("https://gone.test", 404);
        RecordingSleeper sleeper = new RecordingSleeper();
        ValidationService svc = new ValidationService(cfg().setRetryAttempts(3), probe, sleeper);

        ValidationOutcome o = svc.run(distinctAll("https://gone.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.HTTP_ERROR);
        assertThat(o.attemptsMade()).isEqualTo(1);
        assertThat(sleeper.slept()).isEmpty();
    }

    @Test
    void too_many_requests_is_final_without_backoff() {
        ScriptedProbe probe = new ScriptedProbe().respond("https://busy.test", 429, 200);
        RecordingSleeper sleeper = new RecordingSleeper();
        ValidationService svc = new ValidationService(cfg().setRetryAttempts(2), probe, sleeper);

        ValidationOutcome o = svc.run(distinctAll("https://busy.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.HTTP_ERROR);
        assertThat(o.classification().statusCode()).isEqualTo(429);
        assertThat(o.attemptsMade()).isEqualTo(1);
        assertThat(probe.calls("https://busy.test")).isEqualTo(1);
        assertThat(sleeper.slept()).isEmpty();
    }

    @Test
    void timeouts_are_retried_then_allowed() {
        ScriptedProbe probe = new ScriptedProbe().respond("https://slow.test", ProbeResult.timeout(30));
        ValidationService svc = new ValidationService(
                cfg().setRetryAttempts(1).setAllowTimeout(true), probe, new RecordingSleeper());

        ValidationOutcome o = svc.run(distinctAll("https://slow.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.TIMEOUT_ALLOWED);
        assertThat(o.attemptsMade()).isEqualTo(2);
        assertThat(o.isIssue()).isFalse();
    }

    @Test
    void excluded_and_allowlisted_urls_make_no_calls() {
        ScriptedProbe probe = new ScriptedProbe();
        CheckConfig c = cfg()
                .setExcludeRegexes(List.of("localhost"))
                .setAllowlist(List.of("internal.corp"));
        ValidationService svc = new ValidationService(c, probe, new RecordingSleeper());

        ValidationRun run = svc.run(distinctAll(
                "http://localhost:8080/x", "https://internal.corp/wiki", "https://public.test"));

        assertThat(run.outcomes()).extracting(o -> o.classification().kind())
                .containsExactly(Kind.EXCLUDED_BY_PATTERN, Kind.ALLOWED, Kind.SUCCESS);
        assertThat(run.outcomes().get(0).attemptsMade()).isZero();
        assertThat(run.outcomes().get(1).attemptsMade()).isZero();
        assertThat(probe.calls("http://localhost:8080/x")).isZero();
        assertThat(probe.calls("https://internal.corp/wiki")).isZero();
        assertThat(probe.totalCalls()).isEqualTo(1);
    }

    @Test
    void exclusion_wins_over_allowlist() {
        CheckConfig c = cfg().setExcludeRegexes(List.of("corp")).setAllowlist(List.of("internal"));
        ValidationService svc = new ValidationService(c, new ScriptedProbe(), new RecordingSleeper());

        ValidationOutcome o = svc.run(distinctAll("https://internal.corp")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.EXCLUDED_BY_PATTERN);
    }

    @Test
    void allowed_status_code_is_success_and_not_retried() {
        ScriptedProbe probe = new ScriptedProbe().respond("https://busy.test", 429);
        ValidationService svc = new ValidationService(
                cfg().setRetryAttempts(3).setAllowedStatusCodes(Set.of(429)), probe, new RecordingSleeper());

        ValidationOutcome o = svc.run(distinctAll("https://busy.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.SUCCESS);
        assertThat(o.attemptsMade()).isEqualTo(1);
    }

    @Test
    void exactly_one_outcome_per_url_in_input_order() {
        ScriptedProbe probe = new ScriptedProbe();
        List<DistinctUrl> urls = numbered(60);
        for (int i = 0; i < 60; i += 3) probe.respond(urls.get(i).url(), 503, 200);
        for (int i = 1; i < 60; i += 7) probe.respond(urls.get(i).url(), 404);

        ValidationService svc = new ValidationService(
                cfg().setConcurrency(8).setRetryAttempts(2), probe, new RecordingSleeper());
        ValidationRun run = svc.run(urls);

        assertThat(run.notCompleted()).isZero();
        assertThat(run.interrupted()).isFalse();
        assertThat(run.outcomes()).extracting(ValidationOutcome::url)
                .containsExactlyElementsOf(urls.stream().map(DistinctUrl::url).collect(Collectors.toList()));
    }

    @Test
    void probe_runtime_exception_becomes_connection_error() {
        ValidationService svc = new ValidationService(cfg(), url -> {
            throw new IllegalStateException("boom");
        }, new RecordingSleeper());

        ValidationOutcome o = svc.run(distinctAll("https://x.test")).outcomes().get(0);

        assertThat(o.classification().kind()).isEqualTo(Kind.CONNECTION_ERROR);
        assertThat(o.classification().description()).contains("boom");
    }

    @Test
    void rate_limit_spaces_all_requests() {
        CheckConfig c = cfg().setRateLimitDelay(Duration.ofMillis(50));
        ValidationService svc = new ValidationService(c, new ScriptedProbe(), new RecordingSleeper());

        long t0 = System.nanoTime();
        svc.run(numbered(6));
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(elapsedMs).isGreaterThanOrEqualTo(5 * 50 - 15);
        assertThat(svc.getRateLimiter().grantedCount()).isEqualTo(6);
    }

    @Test
    void progress_is_reported_up_to_completion() {
        List<Long> done = new CopyOnWriteArrayList<>();
        ValidationService svc = new ValidationService(cfg().setProgressEvery(5), new ScriptedProbe(), new RecordingSleeper());

        svc.run(numbered(12), (p, phase, d, total) -> done.add(d), null, null);

        assertThat(done).contains(0L, 5L, 10L, 12L).allMatch(d -> d <= 12L);
    }

    @Test
    void duplicate_input_url_is_rejected() {
        ValidationService svc = new ValidationService(cfg(), new ScriptedProbe(), new RecordingSleeper());
        assertThatThrownBy(() -> svc.run(distinctAll("https://a.test", "https://a.test")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void bad_config_fails_at_construction() {
        assertThatThrownBy(() -> new ValidationService(new CheckConfig().setConcurrency(0),
                new ScriptedProbe(), new RecordingSleeper()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new ValidationService(new CheckConfig().setTimeout(Duration.ZERO),
                new ScriptedProbe(), new RecordingSleeper()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void empty_input_gives_empty_run() {
        ValidationService svc = new ValidationService(cfg(), new ScriptedProbe(), new RecordingSleeper());
        ValidationRun run = svc.run(List.of());
        assertThat(run.outcomes()).isEmpty();
        assertThat(run.interrupted()).isFalse();
        assertThat(run.stats().requestsTotal()).isZero();
    }
}
