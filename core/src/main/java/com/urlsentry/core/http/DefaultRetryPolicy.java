package com.urlsentry.core.http;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 일시적 실패(타임아웃, 연결 오류, 5xx)에서만 재시도. 4xx는 한 번에 확정.
 * 지연은 base → 2·base → 4·base … (jitterRatio가 0보다 크면 ±ratio 흔들기).
 * 허용 상태코드로 지정된 코드는 성공으로 보므로 재시도하지 않는다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    /** 지연 상한: 2^k 곱이 넘치지 않게 */
    private static final long MAX_DELAY_MS = Duration.ofMinutes(10).toMillis();

    private final int maxAttempts;
    private final long baseMillis;
    private final double jitterRatio;
    private final Set<Integer> allowedStatusCodes;

    public DefaultRetryPolicy(int retryAttempts, Duration baseDelay) {
        this(retryAttempts, baseDelay, 0.0, Set.of());
    }

    /**
     * @param retryAttempts 첫 시도 이후 추가 시도 수(0이면 재시도 없음)
     */
    public DefaultRetryPolicy(int retryAttempts, Duration baseDelay, double jitterRatio, Set<Integer> allowedStatusCodes) {
        if (retryAttempts < 0) throw new IllegalArgumentException("retryAttempts must be >= 0");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) throw new IllegalArgumentException("jitterRatio must be within [0,1)");
        this.maxAttempts = retryAttempts + 1;
        this.baseMillis = baseDelay.toMillis();
        this.jitterRatio = jitterRatio;
        this.allowedStatusCodes = (allowedStatusCodes == null) ? Set.of() : Set.copyOf(allowedStatusCodes);
    }

    @Override public boolean shouldRetry(ProbeResult r, int attempt) {
        if (attempt >= maxAttempts) return false;
        return switch (r.failure()) {
            case TIMEOUT, CONNECTION -> true;
            case INVALID_URL -> false;
            case NONE -> isTransientStatus(r.statusCode());
        };
    }

    private boolean isTransientStatus(int code) {
        return !allowedStatusCodes.contains(code) && code >= 500 && code <= 599;
    }

    @Override public Duration nextDelay(int attempt) {
        if (baseMillis == 0) return Duration.ZERO;
        int shift = Math.min(Math.max(0, attempt - 1), 30);
        long raw = Math.min(MAX_DELAY_MS, baseMillis * (1L << shift));
        if (jitterRatio == 0.0) return Duration.ofMillis(raw);
        double jitter = 1.0 - jitterRatio + ThreadLocalRandom.current().nextDouble(2 * jitterRatio);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
