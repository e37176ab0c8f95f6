package com.urlsentry.core.discovery;

import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.UrlOccurrence;

import java.util.List;

/**
 * 발견 단계 산출물. occurrences는 입력 파일 순서 → 줄 순서.
 * 읽지 못한 파일은 failures에만 남고 occurrences에는 0건.
 */
public record DiscoveryResult(List<UrlOccurrence> occurrences, List<FileReadFailure> failures, int filesScanned) {
    public DiscoveryResult {
        occurrences = List.copyOf(occurrences);
        failures = List.copyOf(failures);
    }

    public static DiscoveryResult of(List<UrlOccurrence> occurrences) {
        return new DiscoveryResult(occurrences, List.of(), 1);
    }
}
