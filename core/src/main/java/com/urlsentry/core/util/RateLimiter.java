package com.urlsentry.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 전역 토큰 버킷. 모든 워커가 하나의 인스턴스를 공유한다.
 * 토큰은 interval마다 1개씩 채워지고 capacity를 넘지 않는다.
 * 버킷이 비면 다음 토큰이 찰 때까지 모니터에서 대기한다(바쁜 대기 없음).
 */
public final class RateLimiter {
    private final long capacity;
    private final long intervalNs;   // 0이면 제한 없음
    private double tokens;
    private long lastNs;
    private long granted;

    public RateLimiter(long capacity, Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
        this.capacity = capacity;
        this.intervalNs = interval.toNanos();
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** 요청 간 최소 간격만 강제하는 리미터(capacity=1). */
    public static RateLimiter spacing(Duration minInterval) {
        return new RateLimiter(1, minInterval);
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(1, Duration.ZERO);
    }

    public boolean isUnlimited() { return intervalNs == 0L; }

    /** 토큰 1개 획득. 인터럽트되면 토큰 없이 InterruptedException. */
    public synchronized void acquire() throws InterruptedException {
        if (intervalNs == 0L) {
            if (Thread.interrupted()) throw new InterruptedException();
            granted++;
            return;
        }
        for (;;) {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                granted++;
                return;
            }
            long waitNs = (long) Math.ceil((1.0 - tokens) * intervalNs);
            long ms = TimeUnit.NANOSECONDS.toMillis(waitNs);
            int ns = (int) (waitNs - TimeUnit.MILLISECONDS.toNanos(ms));
            this.wait(ms, Math.max(ns, ms == 0 ? 1 : 0));
        }
    }

    /** 지금까지 발급한 토큰 수 */
    public synchronized long grantedCount() { return granted; }

    private void refill() {
        long now = System.nanoTime();
        double add = (double) (now - lastNs) / (double) intervalNs;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
