package com.urlsentry.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 1회의 최종 리포트(불변).
 * <ul>
 *   <li>totalOccurrences: 발견된 URL 등장 총수</li>
 *   <li>uniqueChecked: 중복 제거 후 URL 수(건너뛴 것 포함)</li>
 *   <li>validatedCount: 실제 검증된 URL 수(제외/허용 목록 제외) = 실패율 분모</li>
 *   <li>issues: 첫 위치(파일, 줄) 순으로 정렬된 이슈 목록</li>
 *   <li>interrupted: 중단/마감으로 일부 URL이 미완료</li>
 * </ul>
 */
public final class ValidationReport {
    private final long totalOccurrences;
    private final int uniqueChecked;
    private final int validatedCount;
    private final int notCompleted;
    private final Map<Classification.Kind, Integer> countsByKind;
    private final List<ReportIssue> issues;
    private final Verdict verdict;
    private final double failureRate;
    private final double failureThreshold;
    private final boolean interrupted;

    private ValidationReport(Builder b) {
        this.totalOccurrences = b.totalOccurrences;
        this.uniqueChecked = b.uniqueChecked;
        this.validatedCount = b.validatedCount;
        this.notCompleted = b.notCompleted;
        EnumMap<Classification.Kind, Integer> counts = new EnumMap<>(Classification.Kind.class);
        for (Classification.Kind k : Classification.Kind.values()) {
            counts.put(k, b.countsByKind.getOrDefault(k, 0));
        }
        this.countsByKind = Collections.unmodifiableMap(counts);
        this.issues = List.copyOf(b.issues);
        this.verdict = b.verdict;
        this.failureRate = b.failureRate;
        this.failureThreshold = b.failureThreshold;
        this.interrupted = b.interrupted;
    }

    public long getTotalOccurrences() { return totalOccurrences; }
    public int getUniqueChecked() { return uniqueChecked; }
    public int getValidatedCount() { return validatedCount; }
    public int getNotCompleted() { return notCompleted; }
    public Map<Classification.Kind, Integer> getCountsByKind() { return countsByKind; }
    public int count(Classification.Kind kind) { return countsByKind.get(kind); }
    public List<ReportIssue> getIssues() { return issues; }
    public int getIssueCount() { return issues.size(); }
    public Verdict getVerdict() { return verdict; }
    /** 0~100 (%) */
    public double getFailureRate() { return failureRate; }
    public double getFailureThreshold() { return failureThreshold; }
    public boolean isInterrupted() { return interrupted; }
    public boolean isPassed() { return verdict == Verdict.PASS; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private long totalOccurrences;
        private int uniqueChecked;
        private int validatedCount;
        private int notCompleted;
        private final Map<Classification.Kind, Integer> countsByKind = new EnumMap<>(Classification.Kind.class);
        private final List<ReportIssue> issues = new ArrayList<>();
        private Verdict verdict;
        private double failureRate;
        private double failureThreshold;
        private boolean interrupted;

        public Builder totalOccurrences(long v) { this.totalOccurrences = v; return this; }
        public Builder uniqueChecked(int v) { this.uniqueChecked = v; return this; }
        public Builder validatedCount(int v) { this.validatedCount = v; return this; }
        public Builder notCompleted(int v) { this.notCompleted = v; return this; }
        public Builder countsByKind(Map<Classification.Kind, Integer> m) {
            this.countsByKind.clear();
            if (m != null) this.countsByKind.putAll(m);
            return this;
        }
        public Builder issues(List<ReportIssue> list) {
            this.issues.clear();
            if (list != null) this.issues.addAll(list);
            return this;
        }
        public Builder verdict(Verdict v) { this.verdict = v; return this; }
        public Builder failureRate(double v) { this.failureRate = v; return this; }
        public Builder failureThreshold(double v) { this.failureThreshold = v; return this; }
        public Builder interrupted(boolean v) { this.interrupted = v; return this; }

        public ValidationReport build() {
            Objects.requireNonNull(verdict, "verdict");
            if (totalOccurrences < 0) throw new IllegalArgumentException("totalOccurrences must be >= 0");
            if (validatedCount > uniqueChecked)
                throw new IllegalArgumentException("validatedCount must be <= uniqueChecked");
            return new ValidationReport(this);
        }
    }
}
