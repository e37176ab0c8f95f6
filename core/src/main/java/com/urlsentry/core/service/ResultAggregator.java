package com.urlsentry.core.service;

import com.urlsentry.core.dedupe.DedupResult;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.DistinctUrl;
import com.urlsentry.core.model.ReportIssue;
import com.urlsentry.core.model.ValidationOutcome;
import com.urlsentry.core.model.ValidationReport;
import com.urlsentry.core.model.Verdict;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 결과 집계:
 *  - 분류별 개수
 *  - 실패율 = 이슈 / 실제 검증 수(제외·허용 목록 제외) × 100
 *  - 실패율 > 임계치면 FAIL (임계치 0이면 이슈 1건으로 실패)
 *  - 이슈는 첫 위치(파일, 줄) 순
 */
public final class ResultAggregator {

    private final double failureThreshold;

    public ResultAggregator(double failureThreshold) {
        if (Double.isNaN(failureThreshold) || failureThreshold < 0.0 || failureThreshold > 100.0)
            throw new IllegalArgumentException("failureThreshold must be within 0..100");
        this.failureThreshold = failureThreshold;
    }

    public ValidationReport aggregate(DedupResult dedup, ValidationRun run) {
        Objects.requireNonNull(dedup, "dedup");
        Objects.requireNonNull(run, "run");

        Map<String, DistinctUrl> byUrl = new HashMap<>(dedup.distinct().size() * 2);
        for (DistinctUrl d : dedup.distinct()) byUrl.put(d.url(), d);

        Map<Classification.Kind, Integer> counts = new EnumMap<>(Classification.Kind.class);
        List<ReportIssue> issues = new ArrayList<>();
        int validated = 0;

        for (ValidationOutcome o : run.outcomes()) {
            DistinctUrl target = byUrl.get(o.url());
            if (target == null) throw new IllegalArgumentException("outcome for unknown url: " + o.url());
            counts.merge(o.classification().kind(), 1, Integer::sum);
            if (!o.classification().isSkipped()) validated++;
            if (o.isIssue()) issues.add(new ReportIssue(target, o));
        }
        issues.sort(ReportIssue.STABLE_ORDER);

        double rate = failureRate(issues.size(), validated);
        return ValidationReport.builder()
                .totalOccurrences(dedup.totalOccurrences())
                .uniqueChecked(dedup.uniqueCount())
                .validatedCount(validated)
                .notCompleted(run.notCompleted())
                .countsByKind(counts)
                .issues(issues)
                .failureRate(rate)
                .failureThreshold(failureThreshold)
                .verdict(verdictFor(rate, failureThreshold))
                .interrupted(run.interrupted())
                .build();
    }

    static double failureRate(int issues, int validated) {
        return (validated == 0) ? 0.0 : (issues * 100.0) / validated;
    }

    static Verdict verdictFor(double rate, double threshold) {
        return (rate > threshold) ? Verdict.FAIL : Verdict.PASS;
    }
}
