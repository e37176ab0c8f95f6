package com.urlsentry.core.service;

import java.util.ArrayList;
import java.util.List;

/** 배치 크기 = clamp(고유 URL 수 / 동시성, min, max). */
final class BatchSizer {
    private BatchSizer() {}

    static int size(int uniqueCount, int concurrency, int min, int max) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (min < 1 || max < min) throw new IllegalArgumentException("invalid batch bounds " + min + ".." + max);
        int raw = uniqueCount / concurrency;
        return Math.max(min, Math.min(max, raw));
    }

    static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        List<List<T>> out = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int i = 0; i < items.size(); i += batchSize) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + batchSize))));
        }
        return out;
    }
}
