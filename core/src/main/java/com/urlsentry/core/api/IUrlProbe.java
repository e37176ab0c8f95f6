package com.urlsentry.core.api;

import com.urlsentry.core.http.ProbeResult;

/** URL 검증 최소 계약: URL 하나에 대해 네트워크 시도 1회를 수행한다. */
public interface IUrlProbe extends AutoCloseable {
    /**
     * 예외로 새지 않고 결과 값으로 돌려준다(타임아웃/연결 실패 포함).
     * 인터럽트만 그대로 전파한다.
     */
    ProbeResult probe(String url) throws InterruptedException;

    @Override default void close() {}
}
