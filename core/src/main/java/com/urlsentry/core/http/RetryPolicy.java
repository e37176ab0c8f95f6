package com.urlsentry.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 끝난 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(ProbeResult result, int attempt);
    /** attempt번째 시도가 실패한 뒤 기다릴 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). */
    int maxAttempts();
}
