package com.urlsentry.core.model;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * 파일 안에서 URL이 한 번 등장한 위치. line은 1부터.
 */
public record UrlOccurrence(String url, Path file, int line) {

    /** 파일 경로 → 줄 번호 순. 리포트 이슈 정렬 기준. */
    public static final Comparator<UrlOccurrence> BY_LOCATION =
            Comparator.comparing((UrlOccurrence o) -> o.file().toString())
                      .thenComparingInt(UrlOccurrence::line);

    public UrlOccurrence {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(file, "file");
        if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        if (line < 1) throw new IllegalArgumentException("line must be >= 1");
    }

    @Override public String toString() {
        return url + " - " + file + " - L" + line;
    }
}
