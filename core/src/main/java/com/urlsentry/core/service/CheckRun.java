package com.urlsentry.core.service;

import com.urlsentry.core.model.CheckStats;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.ValidationReport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 파이프라인 1회 실행 결과: 리포트 + 읽기 실패 파일 + 텔레메트리 + 시간 정보 */
public record CheckRun(ValidationReport report,
                       List<FileReadFailure> fileFailures,
                       int filesScanned,
                       CheckStats.Snapshot stats,
                       Instant startedAt,
                       Duration elapsed) {
    public CheckRun {
        Objects.requireNonNull(report, "report");
        fileFailures = List.copyOf(fileFailures);
        Objects.requireNonNull(stats, "stats");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(elapsed, "elapsed");
    }
}
