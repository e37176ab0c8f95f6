package com.urlsentry.core.model;

import java.util.Objects;

/**
 * 중복 제거된 URL 하나. 키는 원문 문자열 그대로(정규화 없음).
 * firstLocation = 처음 본 위치, occurrenceCount = 전체 등장 횟수.
 */
public record DistinctUrl(String url, UrlOccurrence firstLocation, int occurrenceCount) {
    public DistinctUrl {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(firstLocation, "firstLocation");
        if (!url.equals(firstLocation.url()))
            throw new IllegalArgumentException("firstLocation.url must equal url");
        if (occurrenceCount < 1) throw new IllegalArgumentException("occurrenceCount must be >= 1");
    }
}
