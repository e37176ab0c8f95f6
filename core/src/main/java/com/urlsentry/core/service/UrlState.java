package com.urlsentry.core.service;

/**
 * URL 하나의 검증 단계.
 * PENDING → EXCLUDED | ALLOWED | DISPATCHED,
 * DISPATCHED ⇄ RETRY_SCHEDULED, DISPATCHED → COMPLETED.
 */
enum UrlState {
    PENDING,
    EXCLUDED,
    ALLOWED,
    DISPATCHED,
    RETRY_SCHEDULED,
    COMPLETED;

    boolean isTerminal() {
        return switch (this) {
            case EXCLUDED, ALLOWED, COMPLETED -> true;
            case PENDING, DISPATCHED, RETRY_SCHEDULED -> false;
        };
    }

    boolean canMoveTo(UrlState next) {
        return switch (this) {
            case PENDING -> next == EXCLUDED || next == ALLOWED || next == DISPATCHED;
            case DISPATCHED -> next == RETRY_SCHEDULED || next == COMPLETED;
            case RETRY_SCHEDULED -> next == DISPATCHED;
            case EXCLUDED, ALLOWED, COMPLETED -> false;
        };
    }
}
