package com.urlsentry.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * URL 하나의 최종 검증 결과. 재시도 중간 상태는 외부로 나오지 않는다.
 * attemptsMade: 실제 네트워크 시도 수(건너뛴 항목은 0).
 */
public record ValidationOutcome(String url, Classification classification, int attemptsMade, Duration duration) {
    public ValidationOutcome {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(duration, "duration");
        if (attemptsMade < 0) throw new IllegalArgumentException("attemptsMade must be >= 0");
        if (classification.isSkipped() && attemptsMade != 0)
            throw new IllegalArgumentException("skipped outcome must have 0 attempts");
    }

    public static ValidationOutcome skipped(String url, Classification c) {
        return new ValidationOutcome(url, c, 0, Duration.ZERO);
    }

    public boolean isIssue() { return classification.isIssue(); }
}
