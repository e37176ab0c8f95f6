package com.urlsentry.core.http;

import java.time.Duration;
import java.util.Objects;

/** RetryPolicy를 감싸 URL 한 건의 재시도 횟수를 센다. URL마다 새로 만들어 쓴다. */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries = 0;

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(ProbeResult result, int attempt) {
        boolean again = delegate.shouldRetry(result, attempt);
        if (again) retries++;
        return again;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return retries;
    }
}
