package com.urlsentry.core.model;

public enum Verdict {
    PASS(0),
    FAIL(1);

    private final int exitCode;

    Verdict(int exitCode) { this.exitCode = exitCode; }

    /** 프로세스 종료 코드(0 = 통과) */
    public int exitCode() { return exitCode; }
}
