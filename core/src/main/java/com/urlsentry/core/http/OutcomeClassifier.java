package com.urlsentry.core.http;

import com.urlsentry.core.model.Classification;

import java.util.Set;

/**
 * ProbeResult → Classification. 순수 함수.
 * 순서: 타임아웃 → 연결/URL 오류 → 2xx → 허용 코드 → 그 외 HTTP 오류.
 */
public final class OutcomeClassifier {

    private final boolean allowTimeout;
    private final Set<Integer> allowedStatusCodes;

    public OutcomeClassifier(boolean allowTimeout, Set<Integer> allowedStatusCodes) {
        this.allowTimeout = allowTimeout;
        this.allowedStatusCodes = (allowedStatusCodes == null) ? Set.of() : Set.copyOf(allowedStatusCodes);
    }

    public Classification classify(ProbeResult r) {
        return switch (r.failure()) {
            case TIMEOUT -> allowTimeout ? Classification.timeoutAllowed() : Classification.timeout();
            case CONNECTION, INVALID_URL -> Classification.connectionError(describe(r));
            case NONE -> classifyStatus(r.statusCode());
        };
    }

    Classification classifyStatus(int code) {
        if (code >= 200 && code < 300) return Classification.success(code);
        if (allowedStatusCodes.contains(code)) return Classification.success(code);
        return Classification.httpError(code);
    }

    private static String describe(ProbeResult r) {
        String d = r.description();
        return (d == null || d.isBlank()) ? "connection failed" : d;
    }
}
