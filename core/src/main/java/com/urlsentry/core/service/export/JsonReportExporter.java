package com.urlsentry.core.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.CheckStats;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.ReportIssue;
import com.urlsentry.core.model.ValidationReport;
import com.urlsentry.core.service.CheckRun;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기계 판독용 JSON 보고서(Jackson).
 * 필드 순서 고정, 시간은 ISO-8601. 같은 입력이면 meta의 시간 필드를 빼고 같은 출력.
 */
public class JsonReportExporter implements ReportExporter {

    public static final String REPORT_VERSION = "1.0";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override public String extension() { return "json"; }

    @Override
    public String render(CheckConfig cfg, CheckRun run) {
        try {
            return MAPPER.writeValueAsString(toDocument(cfg, run)) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Document toDocument(CheckConfig cfg, CheckRun run) {
        ValidationReport r = run.report();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Classification.Kind k : Classification.Kind.values()) counts.put(k.name(), r.count(k));

        Summary summary = new Summary(
                r.getTotalOccurrences(), r.getUniqueChecked(), r.getValidatedCount(), r.getNotCompleted(),
                r.getIssueCount(), round1(r.getFailureRate()), r.getFailureThreshold(),
                r.getVerdict().name(), r.isInterrupted(), counts);

        CheckStats.Snapshot s = run.stats();
        Runtime runtime = new Runtime(cfg.getConcurrency(), cfg.getTimeoutMs(), cfg.getRetryAttempts(),
                cfg.getRateLimitDelay().toMillis(), s.requestsTotal(), s.retriesTotal(),
                s.maxObservedInFlight(), s.avgLatencyMs());

        List<Issue> issues = r.getIssues().stream().map(JsonReportExporter::toIssue).toList();
        List<Unreadable> unreadable = run.fileFailures().stream()
                .map(f -> new Unreadable(f.file().toString(), f.reason())).toList();

        Meta meta = new Meta(REPORT_VERSION, run.startedAt(), run.elapsed().toMillis(), run.filesScanned());
        return new Document(meta, summary, runtime, issues, unreadable);
    }

    private static Issue toIssue(ReportIssue i) {
        Classification c = i.classification();
        return new Issue(i.url(), i.file(), i.line(), c.kind().name(), c.statusCode(), i.description(),
                i.outcome().attemptsMade(), i.target().occurrenceCount());
    }

    private static double round1(double v) { return Math.round(v * 10.0) / 10.0; }

    // ---------- 문서 구조 ----------
    record Document(Meta meta, Summary summary, Runtime runtime, List<Issue> issues, List<Unreadable> unreadableFiles) {}

    record Meta(String reportVersion, Instant startedAt, long elapsedMs, int filesScanned) {}

    record Summary(long totalOccurrences, int uniqueChecked, int validated, int notCompleted, int issues,
                   double failureRate, double failureThreshold, String verdict, boolean interrupted,
                   Map<String, Integer> counts) {}

    record Runtime(int concurrency, long timeoutMs, int retryAttempts, long rateLimitDelayMs,
                   long requestsTotal, long retriesTotal, int maxObservedConcurrency, long avgLatencyMs) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Issue(String url, String file, int line, String kind, Integer statusCode, String description,
                 int attempts, int occurrences) {}

    record Unreadable(String file, String reason) {}
}
