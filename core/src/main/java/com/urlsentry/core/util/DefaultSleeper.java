package com.urlsentry.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** 실제 스레드 대기. 음수/0은 즉시 반환하되 인터럽트 상태는 확인한다. */
public final class DefaultSleeper implements Sleeper {
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override public void sleep(Duration d) throws InterruptedException {
        long ns = (d == null) ? 0L : d.toNanos();
        if (ns > 0) {
            TimeUnit.NANOSECONDS.sleep(ns);
        } else if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }
}
