package com.urlsentry.core.service;

import com.urlsentry.core.api.IUrlProbe;
import com.urlsentry.core.http.CountingRetryPolicy;
import com.urlsentry.core.http.DefaultRetryPolicy;
import com.urlsentry.core.http.HttpProber;
import com.urlsentry.core.http.OutcomeClassifier;
import com.urlsentry.core.http.ProbeResult;
import com.urlsentry.core.http.RetryPolicy;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.CheckStats;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.DistinctUrl;
import com.urlsentry.core.model.ValidationOutcome;
import com.urlsentry.core.util.DefaultSleeper;
import com.urlsentry.core.util.ProgressListener;
import com.urlsentry.core.util.RateLimiter;
import com.urlsentry.core.util.Sleeper;
import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 검증 오케스트레이터:
 *  - 제외/허용 목록 선처리(네트워크 호출 없음)
 *  - 남은 URL을 배치로 묶어 고정 스레드풀(동시성=concurrency)에 제출
 *  - 모든 시도 전에 전역 RateLimiter 토큰 획득, 일시적 실패는 지수 백오프로 재시도
 *  - URL마다 최종 결과 정확히 1건
 *
 * 중단(취소 플래그, 마감, 인터럽트) 시 새 배치 디스패치를 멈추고,
 * 진행 중 요청은 다음 시도 경계에서 정리한 뒤 완료된 URL만으로 결과를 돌려준다.
 */
public final class ValidationService {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ValidationService.class);

    /** 마감 후 진행 중 요청을 기다리는 여유 시간(요청 타임아웃에 더함) */
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final CheckConfig config;
    private final IUrlProbe probe;
    private final Supplier<RetryPolicy> retryPolicies;
    private final Sleeper sleeper;
    private final RateLimiter rateLimiter;
    private final OutcomeClassifier classifier;
    private final UrlFilter filter;

    /** 기본 구현 */
    public ValidationService(CheckConfig config) {
        this(validated(config), new HttpProber(config), DefaultSleeper.INSTANCE);
    }

    /** DI/테스트용 */
    public ValidationService(CheckConfig config, IUrlProbe probe, Sleeper sleeper) {
        this(config, probe, defaultRetryPolicies(config), sleeper, limiterFor(config));
    }

    public ValidationService(CheckConfig config, IUrlProbe probe, Supplier<RetryPolicy> retryPolicies,
                             Sleeper sleeper, RateLimiter rateLimiter) {
        this.config = validated(config);
        this.probe = Objects.requireNonNull(probe, "probe");
        this.retryPolicies = Objects.requireNonNull(retryPolicies, "retryPolicies");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.classifier = new OutcomeClassifier(config.isAllowTimeout(), config.getAllowedStatusCodes());
        this.filter = UrlFilter.from(config);
    }

    private static CheckConfig validated(CheckConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    private static Supplier<RetryPolicy> defaultRetryPolicies(CheckConfig config) {
        Objects.requireNonNull(config, "config");
        return () -> new DefaultRetryPolicy(config.getRetryAttempts(), config.getRetryDelay(),
                0.0, config.getAllowedStatusCodes());
    }

    private static RateLimiter limiterFor(CheckConfig config) {
        Duration d = Objects.requireNonNull(config, "config").getRateLimitDelay();
        return (d == null || d.isZero() || d.isNegative()) ? RateLimiter.unlimited() : RateLimiter.spacing(d);
    }

    public RateLimiter getRateLimiter() { return rateLimiter; }

    /* =========================
       실행 API
       ========================= */

    public ValidationRun run(List<DistinctUrl> urls) {
        return run(urls, ProgressListener.NONE, null, null);
    }

    /**
     * @param cancelFlag 외부 취소 플래그(옵션)
     * @param deadline   전체 실행 마감(옵션). 지나면 부분 결과 반환
     */
    public ValidationRun run(List<DistinctUrl> urls, ProgressListener listener,
                             AtomicBoolean cancelFlag, Instant deadline) {
        Objects.requireNonNull(urls, "urls");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final RunContext ctx = new RunContext(cancelFlag, deadline);
        final int cc = config.getConcurrency();

        // ---- 0) 입력 계약 + 선처리 ----
        Set<String> seen = new HashSet<>();
        List<DistinctUrl> toCheck = new ArrayList<>(urls.size());
        for (DistinctUrl d : urls) {
            Objects.requireNonNull(d, "url element");
            if (!seen.add(d.url())) throw new IllegalArgumentException("duplicate distinct url: " + d.url());
            ctx.states.put(d.url(), UrlState.PENDING);

            Optional<Classification> skip = filter.skipReason(d.url());
            if (skip.isPresent()) {
                Classification c = skip.get();
                ctx.transition(d.url(), c.kind() == Classification.Kind.ALLOWED ? UrlState.ALLOWED : UrlState.EXCLUDED);
                ctx.record(ValidationOutcome.skipped(d.url(), c));
                LOG.debug("Skipped {}: {}", d.url(), c.label());
            } else {
                toCheck.add(d);
            }
        }

        final int total = toCheck.size();
        final int batchSize = BatchSizer.size(total, cc, config.getBatchMin(), config.getBatchMax());
        LOG.info("Validation start: unique={}, toCheck={}, skipped={}, cc={}, batchSize={}, retry={}, rateLimitMs={}",
                urls.size(), total, urls.size() - total, cc, batchSize,
                config.getRetryAttempts(), config.getRateLimitDelay().toMillis());
        SLOG.info("run-start",
                "unique", urls.size(),
                "toCheck", total,
                "cc", cc,
                "batchSize", batchSize,
                "retryAttempts", config.getRetryAttempts(),
                "rateLimitMs", config.getRateLimitDelay().toMillis());

        if (total > 0) {
            safeProgress(pl, 0.0, 0, total);
            dispatch(toCheck, batchSize, cc, ctx, pl, total);
        }

        // ---- 3) 입력 순서로 결과 정리 ----
        List<ValidationOutcome> outcomes = new ArrayList<>(urls.size());
        int notCompleted = 0;
        for (DistinctUrl d : urls) {
            ValidationOutcome o = ctx.sink.get(d.url());
            if (o != null) outcomes.add(o);
            else notCompleted++;
        }
        boolean interrupted = notCompleted > 0;
        if (interrupted) {
            LOG.warn("Validation interrupted: completed={}, notCompleted={}", outcomes.size(), notCompleted);
            SLOG.warn("run-interrupted", "completed", outcomes.size(), "notCompleted", notCompleted,
                    "reason", ctx.stopReason());
        }

        CheckStats.Snapshot snap = ctx.stats.snapshot();
        LOG.info("Validation done. checked={}, requests={}, retries={}, maxObservedCC={}",
                ctx.completed.get(), snap.requestsTotal(), snap.retriesTotal(), snap.maxObservedInFlight());
        SLOG.info("run-done",
                "checked", ctx.completed.get(),
                "requests", snap.requestsTotal(),
                "retries", snap.retriesTotal(),
                "maxObservedCC", snap.maxObservedInFlight(),
                "avgLatencyMs", snap.avgLatencyMs());

        if (ctx.callerInterrupted) Thread.currentThread().interrupt();
        return new ValidationRun(outcomes, notCompleted, interrupted, snap);
    }

    /* =========================
       디스패치
       ========================= */

    private void dispatch(List<DistinctUrl> toCheck, int batchSize, int cc,
                          RunContext ctx, ProgressListener pl, int total) {
        // 고정 스레드풀(+역압): 큐가 차면 제출 스레드가 기다린다
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("check-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        List<Future<?>> futures = new ArrayList<>();
        try {
            // ---- 1) 배치 제출 ----
            int batchNo = 0;
            for (List<DistinctUrl> batch : BatchSizer.partition(toCheck, batchSize)) {
                if (ctx.shouldStop()) break;
                final int no = ++batchNo;
                try {
                    futures.add(exec.submit(() -> checkBatch(batch, ctx, pl, total)));
                } catch (RejectedExecutionException rex) {
                    ctx.callerInterrupted |= Thread.interrupted();
                    ctx.requestStop("interrupted");
                    break;
                }
                SLOG.debug("batch-dispatched", "batch", no, "size", batch.size());
            }

            // ---- 2) 완료 대기 ----
            for (Future<?> f : futures) {
                if (!await(f, ctx)) break;
            }
        } finally {
            // ---- 종료: 새 작업 없음 → 진행 중 요청은 타임아웃 안에 끝나길 기다린 뒤 강제 종료 ----
            exec.shutdown();
            if (ctx.stop.get() && !ctx.callerInterrupted) {
                try {
                    long waitMs = config.getTimeoutMs() + SHUTDOWN_GRACE.toMillis();
                    if (!exec.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                        LOG.warn("Workers still busy after {} ms, aborting", waitMs);
                    }
                } catch (InterruptedException ie) {
                    ctx.callerInterrupted = true;
                }
            }
            exec.shutdownNow();
            try {
                exec.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                ctx.callerInterrupted = true;
            }
        }
    }

    /** false면 더 기다리지 않는다(중단됨). */
    private boolean await(Future<?> f, RunContext ctx) {
        try {
            if (ctx.deadline == null) {
                f.get();
            } else {
                long leftMs = Duration.between(Instant.now(), ctx.deadline).toMillis();
                if (leftMs <= 0) throw new TimeoutException();
                f.get(leftMs, TimeUnit.MILLISECONDS);
            }
            return true;
        } catch (TimeoutException te) {
            ctx.requestStop("deadline");
            return false;
        } catch (InterruptedException ie) {
            ctx.callerInterrupted = true;
            ctx.requestStop("interrupted");
            return false;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.warn("Check batch failed: {}", cause.toString());
            SLOG.error("batch-failed", cause, "cause", cause.toString());
            return true;
        }
    }

    /** 워커: 배치 하나를 순서대로 처리 */
    private void checkBatch(List<DistinctUrl> batch, RunContext ctx, ProgressListener pl, int total) {
        for (DistinctUrl d : batch) {
            if (ctx.shouldStop()) return;
            try {
                ValidationOutcome o = checkOne(d.url(), ctx);
                if (o == null) return; // 시도 경계에서 중단
                ctx.record(o);
                int done = ctx.completed.incrementAndGet();
                LOG.debug("Checked {} -> {} (attempts={})", o.url(), o.classification().label(), o.attemptsMade());
                SLOG.debug("url-checked",
                        "url", o.url(),
                        "kind", o.classification().kind().name(),
                        "attempts", o.attemptsMade(),
                        "ms", o.duration().toMillis());
                if (done % config.getProgressEvery() == 0 || done == total) {
                    safeProgress(pl, (double) done / (double) total, done, total);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                ctx.requestStop("interrupted");
                return;
            }
        }
    }

    /** URL 한 건: 시도 → 분류 → (일시적 실패면) 백오프 후 재시도. 중단되면 null. */
    ValidationOutcome checkOne(String url, RunContext ctx) throws InterruptedException {
        CountingRetryPolicy policy = new CountingRetryPolicy(retryPolicies.get());
        long t0 = System.nanoTime();
        ctx.transition(url, UrlState.DISPATCHED);

        int attempt = 0;
        while (true) {
            rateLimiter.acquire();
            if (ctx.shouldStop()) return null;
            attempt++;

            ProbeResult r = attemptOnce(url, ctx.stats);
            if (!policy.shouldRetry(r, attempt)) {
                ctx.transition(url, UrlState.COMPLETED);
                Duration took = Duration.ofNanos(System.nanoTime() - t0);
                return new ValidationOutcome(url, classifier.classify(r), attempt, took);
            }

            ctx.transition(url, UrlState.RETRY_SCHEDULED);
            ctx.stats.addRetry();
            Duration delay = policy.nextDelay(attempt);
            LOG.debug("Retry {} for {} in {} ms ({})", attempt, url, delay.toMillis(),
                    r.isResponse() ? r.statusCode() : r.failure());
            SLOG.debug("retry-scheduled",
                    "url", url,
                    "attempt", attempt,
                    "delayMs", delay.toMillis(),
                    "status", r.statusCode(),
                    "failure", r.failure().name());
            sleeper.sleep(delay);
            if (ctx.shouldStop()) return null;
            ctx.transition(url, UrlState.DISPATCHED);
        }
    }

    private ProbeResult attemptOnce(String url, CheckStats stats) throws InterruptedException {
        stats.requestStarted();
        long a0 = System.nanoTime();
        try {
            return probe.probe(url);
        } catch (RuntimeException e) {
            // 프로브 구현 버그도 URL 단위 결과로 남긴다
            LOG.warn("Probe failed unexpectedly for {}: {}", url, e.toString());
            SLOG.error("probe-failed", e, "url", url);
            return ProbeResult.connection("probe failed: " + e, 0);
        } finally {
            stats.requestFinished(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - a0));
        }
    }

    private static void safeProgress(ProgressListener pl, double p, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), "validate", done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    /* =========================
       실행 1회 상태
       ========================= */

    static final class RunContext {
        final ConcurrentHashMap<String, ValidationOutcome> sink = new ConcurrentHashMap<>();
        final ConcurrentHashMap<String, UrlState> states = new ConcurrentHashMap<>();
        final CheckStats stats = new CheckStats();
        final AtomicInteger completed = new AtomicInteger(0);
        final AtomicBoolean stop = new AtomicBoolean(false);
        final AtomicBoolean cancel;
        final Instant deadline;
        volatile String stopReason;
        volatile boolean callerInterrupted;

        RunContext(AtomicBoolean cancel, Instant deadline) {
            this.cancel = cancel;
            this.deadline = deadline;
        }

        boolean shouldStop() {
            if (stop.get()) return true;
            if (Thread.currentThread().isInterrupted()) return requestStop("interrupted");
            if (cancel != null && cancel.get()) return requestStop("cancelled");
            if (deadline != null && !Instant.now().isBefore(deadline)) return requestStop("deadline");
            return false;
        }

        boolean requestStop(String reason) {
            if (stop.compareAndSet(false, true)) stopReason = reason;
            return true;
        }

        String stopReason() { return stopReason == null ? "unknown" : stopReason; }

        void transition(String url, UrlState next) {
            states.compute(url, (k, cur) -> {
                UrlState from = (cur == null) ? UrlState.PENDING : cur;
                if (!from.canMoveTo(next))
                    throw new IllegalStateException("illegal state change " + from + " -> " + next + " for " + url);
                return next;
            });
        }

        /** 결과 싱크: URL당 한 번만 기록 */
        void record(ValidationOutcome o) {
            if (sink.putIfAbsent(o.url(), o) != null)
                throw new IllegalStateException("outcome already recorded for " + o.url());
        }
    }
}
