package com.urlsentry.core.http;

import java.util.Objects;

/**
 * 네트워크 시도 1회의 원시 결과(분류 전).
 * failure == NONE이면 statusCode가 실제 응답 코드, 아니면 -1.
 */
public record ProbeResult(int statusCode, Failure failure, String description, long elapsedMs) {

    public enum Failure {
        NONE,
        TIMEOUT,
        CONNECTION,
        /** URL 자체가 잘못됨. 재시도해도 바뀌지 않는다. */
        INVALID_URL
    }

    public ProbeResult {
        Objects.requireNonNull(failure, "failure");
        if (failure == Failure.NONE && (statusCode < 100 || statusCode > 999))
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        if (failure != Failure.NONE) statusCode = -1;
    }

    public static ProbeResult status(int code, long elapsedMs) {
        return new ProbeResult(code, Failure.NONE, null, elapsedMs);
    }

    public static ProbeResult timeout(long elapsedMs) {
        return new ProbeResult(-1, Failure.TIMEOUT, "operation timed out", elapsedMs);
    }

    public static ProbeResult connection(String description, long elapsedMs) {
        return new ProbeResult(-1, Failure.CONNECTION, description, elapsedMs);
    }

    public static ProbeResult invalidUrl(String description) {
        return new ProbeResult(-1, Failure.INVALID_URL, description, 0);
    }

    public boolean isResponse() { return failure == Failure.NONE; }
}
