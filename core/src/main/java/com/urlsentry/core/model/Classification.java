package com.urlsentry.core.model;

import java.util.Objects;

/**
 * URL 검증 결과 분류. 닫힌 태그 타입: Kind 값마다 필요한 필드가 정해져 있다.
 * <ul>
 *   <li>SUCCESS: 2xx 또는 허용 상태코드 (statusCode 있음)</li>
 *   <li>TIMEOUT_ALLOWED: 타임아웃이지만 allowTimeout=true (이슈 아님)</li>
 *   <li>HTTP_ERROR: 그 외 응답 코드 (statusCode 있음)</li>
 *   <li>TIMEOUT: 타임아웃 (allowTimeout=false)</li>
 *   <li>CONNECTION_ERROR: DNS/연결 거부/TLS/잘못된 URL (description 있음)</li>
 *   <li>EXCLUDED_BY_PATTERN, ALLOWED: 네트워크 호출 없이 건너뜀</li>
 * </ul>
 */
public record Classification(Kind kind, Integer statusCode, String description) {

    public enum Kind {
        SUCCESS,
        TIMEOUT_ALLOWED,
        HTTP_ERROR,
        TIMEOUT,
        CONNECTION_ERROR,
        EXCLUDED_BY_PATTERN,
        ALLOWED
    }

    public static final String TIMED_OUT = "operation timed out";

    public Classification {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case SUCCESS, HTTP_ERROR -> {
                if (statusCode == null) throw new IllegalArgumentException(kind + " requires statusCode");
            }
            case CONNECTION_ERROR -> {
                if (description == null || description.isBlank())
                    throw new IllegalArgumentException("CONNECTION_ERROR requires description");
            }
            case TIMEOUT_ALLOWED, TIMEOUT, EXCLUDED_BY_PATTERN, ALLOWED -> { }
        }
    }

    public static Classification success(int statusCode) {
        return new Classification(Kind.SUCCESS, statusCode, null);
    }
    public static Classification timeoutAllowed() {
        return new Classification(Kind.TIMEOUT_ALLOWED, null, TIMED_OUT);
    }
    public static Classification httpError(int statusCode) {
        return new Classification(Kind.HTTP_ERROR, statusCode, null);
    }
    public static Classification timeout() {
        return new Classification(Kind.TIMEOUT, null, TIMED_OUT);
    }
    public static Classification connectionError(String description) {
        return new Classification(Kind.CONNECTION_ERROR, null, description);
    }
    public static Classification excluded(String pattern) {
        return new Classification(Kind.EXCLUDED_BY_PATTERN, null, "excluded by " + pattern);
    }
    public static Classification allowed(String entry) {
        return new Classification(Kind.ALLOWED, null, "allowlisted by " + entry);
    }

    /** 리포트 이슈 여부 */
    public boolean isIssue() {
        return switch (kind) {
            case SUCCESS, TIMEOUT_ALLOWED, EXCLUDED_BY_PATTERN, ALLOWED -> false;
            case HTTP_ERROR, TIMEOUT, CONNECTION_ERROR -> true;
        };
    }

    /** 네트워크 호출 없이 건너뛴 항목(실패율 분모에서 제외) */
    public boolean isSkipped() {
        return switch (kind) {
            case EXCLUDED_BY_PATTERN, ALLOWED -> true;
            case SUCCESS, TIMEOUT_ALLOWED, HTTP_ERROR, TIMEOUT, CONNECTION_ERROR -> false;
        };
    }

    /** 사람이 읽는 한 줄 설명: "404", "operation timed out" 등 */
    public String label() {
        return switch (kind) {
            case SUCCESS, HTTP_ERROR -> String.valueOf(statusCode);
            case TIMEOUT_ALLOWED -> TIMED_OUT + " (allowed)";
            case TIMEOUT -> TIMED_OUT;
            case CONNECTION_ERROR, EXCLUDED_BY_PATTERN, ALLOWED -> description;
        };
    }
}
