package com.urlsentry.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CheckStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);       // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);       // 재시도 횟수 총합
    private final AtomicLong sumAttemptMs  = new AtomicLong(0);       // 시도별 응답 대기 합
    private final AtomicInteger inFlight   = new AtomicInteger(0);
    private final AtomicInteger maxObservedInFlight = new AtomicInteger(0);

    /** 요청 직전 호출. 현재 동시 요청 수 반환 */
    public int requestStarted() {
        requestsTotal.incrementAndGet();
        int cur = inFlight.incrementAndGet();
        maxObservedInFlight.accumulateAndGet(cur, Math::max);
        return cur;
    }

    /** 요청 직후 호출(예외 포함, finally에서) */
    public void requestFinished(long elapsedMs) {
        inFlight.decrementAndGet();
        sumAttemptMs.addAndGet(Math.max(0, elapsedMs));
    }

    public void addRetry() { retriesTotal.incrementAndGet(); }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long avg = (req == 0) ? 0 : sumAttemptMs.get() / req;
        return new Snapshot(req, retriesTotal.get(), maxObservedInFlight.get(), avg);
    }

    /** 불변 스냅샷 */
    public record Snapshot(long requestsTotal, long retriesTotal, int maxObservedInFlight, long avgLatencyMs) {
        public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0);
    }
}
