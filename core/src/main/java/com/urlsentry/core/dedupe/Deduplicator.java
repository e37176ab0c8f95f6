package com.urlsentry.core.dedupe;

import com.urlsentry.core.model.DistinctUrl;
import com.urlsentry.core.model.UrlOccurrence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * URL 등장 스트림 → 고유 URL 집합. 해시 조회라 O(n).
 * 키는 원문 문자열 그대로: 끝 슬래시, 대소문자, 쿼리 순서가 다르면 다른 URL이다.
 * 처음 본 위치가 firstLocation, 모든 등장이 occurrenceCount를 1씩 올린다.
 *
 * <p>스레드 세이프하지 않음. 한 실행에서 한 스레드가 accept → result 순으로 쓴다.
 */
public final class Deduplicator {

    private static final class Entry {
        final UrlOccurrence first;
        int count;
        Entry(UrlOccurrence first) { this.first = first; }
    }

    private final Map<String, Entry> byUrl;
    private long total;

    public Deduplicator() { this(16); }

    public Deduplicator(int expectedOccurrences) {
        this.byUrl = new LinkedHashMap<>(Math.max(16, (int) (expectedOccurrences / 0.75f) + 1));
    }

    public static DedupResult dedupe(List<UrlOccurrence> occurrences) {
        Deduplicator d = new Deduplicator(occurrences.size());
        d.acceptAll(occurrences);
        return d.result();
    }

    public Deduplicator accept(UrlOccurrence o) {
        Objects.requireNonNull(o, "occurrence");
        byUrl.computeIfAbsent(o.url(), k -> new Entry(o)).count++;
        total++;
        return this;
    }

    public Deduplicator acceptAll(Iterable<UrlOccurrence> occurrences) {
        for (UrlOccurrence o : occurrences) accept(o);
        return this;
    }

    /** 지금까지 받은 등장으로 고유 URL 목록을 만든다(처음 본 순서). */
    public DedupResult result() {
        List<DistinctUrl> out = new ArrayList<>(byUrl.size());
        for (var e : byUrl.entrySet()) {
            out.add(new DistinctUrl(e.getKey(), e.getValue().first, e.getValue().count));
        }
        return new DedupResult(out, total);
    }
}
