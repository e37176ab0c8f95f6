package com.urlsentry.core.dedupe;

import com.urlsentry.core.model.DistinctUrl;

import java.util.List;

/**
 * 고유 URL 목록 + 원래 등장 총수.
 * 불변식: distinct의 url은 모두 다르고, occurrenceCount 합 == totalOccurrences.
 */
public record DedupResult(List<DistinctUrl> distinct, long totalOccurrences) {
    public DedupResult {
        distinct = List.copyOf(distinct);
        long sum = 0;
        for (DistinctUrl d : distinct) sum += d.occurrenceCount();
        if (sum != totalOccurrences)
            throw new IllegalStateException("occurrence counts (" + sum + ") != total (" + totalOccurrences + ")");
    }

    public int uniqueCount() { return distinct.size(); }
}
