package com.urlsentry.core.service.export;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.ReportIssue;
import com.urlsentry.core.model.ValidationReport;
import com.urlsentry.core.service.CheckRun;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 터미널용 텍스트 보고서.
 * 이슈는 네트워크 오류 → 4xx → 5xx → 3xx → 기타 순으로 묶는다.
 */
public class TextReportExporter implements ReportExporter {

    private final boolean quiet;

    public TextReportExporter() { this(false); }

    /** quiet면 요약 줄과 임계치 줄만 */
    public TextReportExporter(boolean quiet) { this.quiet = quiet; }

    @Override public String extension() { return "txt"; }

    @Override
    public String render(CheckConfig cfg, CheckRun run) {
        ValidationReport r = run.report();
        StringBuilder sb = new StringBuilder(1024);

        if (!quiet) {
            for (FileReadFailure f : run.fileFailures()) {
                sb.append("! Could not read ").append(f.file()).append(": ").append(f.reason()).append('\n');
            }
            sb.append(String.format(Locale.ROOT, "> Found %d URLs (%d unique) in %d files%n",
                    r.getTotalOccurrences(), r.getUniqueChecked(), run.filesScanned()));
            int skipped = r.count(Classification.Kind.EXCLUDED_BY_PATTERN) + r.count(Classification.Kind.ALLOWED);
            if (skipped > 0) sb.append("> Skipped ").append(skipped).append(" URLs (excluded or allowlisted)\n");
            sb.append('\n');

            if (r.getIssues().isEmpty()) {
                sb.append("No issues found!\n");
            } else {
                sb.append("Issues\n");
                appendGroups(sb, r.getIssues());
            }
        }

        if (r.isInterrupted()) {
            sb.append(String.format(Locale.ROOT, "%nRun interrupted: %d URLs were not checked%n", r.getNotCompleted()));
        }
        appendThreshold(sb, r);
        return sb.toString();
    }

    static Map<String, List<ReportIssue>> group(List<ReportIssue> issues) {
        Map<String, List<ReportIssue>> groups = new LinkedHashMap<>();
        groups.put("Network/Connection Errors", new ArrayList<>());
        groups.put("Client Errors (4xx)", new ArrayList<>());
        groups.put("Server Errors (5xx)", new ArrayList<>());
        groups.put("Redirect Issues (3xx)", new ArrayList<>());
        groups.put("Other HTTP Issues", new ArrayList<>());
        for (ReportIssue i : issues) groups.get(groupOf(i.classification())).add(i);
        groups.values().removeIf(List::isEmpty);
        return groups;
    }

    private static String groupOf(Classification c) {
        return switch (c.kind()) {
            case TIMEOUT, CONNECTION_ERROR -> "Network/Connection Errors";
            case HTTP_ERROR -> {
                int code = c.statusCode();
                if (code >= 400 && code < 500) yield "Client Errors (4xx)";
                if (code >= 500 && code < 600) yield "Server Errors (5xx)";
                if (code >= 300 && code < 400) yield "Redirect Issues (3xx)";
                yield "Other HTTP Issues";
            }
            case SUCCESS, TIMEOUT_ALLOWED, EXCLUDED_BY_PATTERN, ALLOWED ->
                    throw new IllegalArgumentException("not an issue: " + c.kind());
        };
    }

    private static void appendGroups(StringBuilder sb, List<ReportIssue> issues) {
        for (var e : group(issues).entrySet()) {
            sb.append('\n').append("   ").append(e.getKey()).append(":\n");
            int n = 1;
            for (ReportIssue i : e.getValue()) {
                sb.append("      ").append(n++).append(". ")
                  .append(i.description()).append(' ')
                  .append(i.url())
                  .append(" (").append(i.file()).append(':').append(i.line()).append(")\n");
            }
        }
    }

    private static void appendThreshold(StringBuilder sb, ValidationReport r) {
        int failed = r.getIssueCount();
        int checked = r.getValidatedCount();
        if (r.isPassed() && failed == 0) return;
        String verb = r.isPassed() ? "is within" : "exceeds";
        sb.append(String.format(Locale.ROOT, "%nFailure rate %.1f%% %s threshold %.1f%% (%d/%d URLs failed)%n",
                r.getFailureRate(), verb, r.getFailureThreshold(), failed, checked));
    }
}
