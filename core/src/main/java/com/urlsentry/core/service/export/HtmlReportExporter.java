package com.urlsentry.core.service.export;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.CheckStats;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.ReportIssue;
import com.urlsentry.core.model.ValidationReport;
import com.urlsentry.core.service.CheckRun;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;

/**
 * 단일 파일 HTML 대시보드. jsoup DOM으로 조립하므로 URL/설명은 자동 이스케이프된다.
 * 구성: 요약 카드 → 분류별 개수 → 이슈 표 → 읽기 실패 파일.
 */
public class HtmlReportExporter implements ReportExporter {

    @Override public String extension() { return "html"; }

    @Override
    public String render(CheckConfig cfg, CheckRun run) {
        ValidationReport r = run.report();
        Document doc = Document.createShell("");
        doc.title("urlsentry report");
        doc.head().appendElement("meta").attr("charset", "utf-8");
        doc.head().appendElement("meta").attr("name", "viewport").attr("content", "width=device-width,initial-scale=1");
        doc.head().appendElement("style").appendChild(new DataNode(HtmlReportTemplates.css()));

        Element header = doc.body().appendElement("header");
        header.appendElement("h1").text("urlsentry: Link Check Report");
        header.appendElement("div").addClass("muted")
              .text("Started: " + run.startedAt() + " · Elapsed: " + run.elapsed().toMillis() + " ms");

        Element wrap = doc.body().appendElement("div").addClass("wrap");
        summaryCard(wrap, cfg, run);
        countsCard(wrap, r);
        issuesCard(wrap, r);
        if (!run.fileFailures().isEmpty()) failuresCard(wrap, run);

        return doc.outerHtml();
    }

    private static void summaryCard(Element parent, CheckConfig cfg, CheckRun run) {
        ValidationReport r = run.report();
        Element card = parent.appendElement("section").addClass("card").attr("id", "summary");
        card.appendElement("h2").text("Summary");

        Element verdict = card.appendElement("div").addClass("verdict")
                .addClass(r.isPassed() ? "verdict-pass" : "verdict-fail")
                .text(r.getVerdict().name());
        verdict.attr("data-verdict", r.getVerdict().name());

        Element grid = card.appendElement("div").addClass("grid");
        kv(grid, "Files scanned", String.valueOf(run.filesScanned()));
        kv(grid, "URLs found", String.valueOf(r.getTotalOccurrences()));
        kv(grid, "Unique URLs", String.valueOf(r.getUniqueChecked()));
        kv(grid, "Checked", String.valueOf(r.getValidatedCount()));
        kv(grid, "Issues", String.valueOf(r.getIssueCount()));
        kv(grid, "Failure rate", String.format(Locale.ROOT, "%.1f%% (threshold %.1f%%)",
                r.getFailureRate(), r.getFailureThreshold()));
        if (r.isInterrupted()) kv(grid, "Not checked (interrupted)", String.valueOf(r.getNotCompleted()));

        CheckStats.Snapshot s = run.stats();
        kv(grid, "Requests (total)", String.valueOf(s.requestsTotal()));
        kv(grid, "Retries", String.valueOf(s.retriesTotal()));
        kv(grid, "Concurrency (max / limit)", s.maxObservedInFlight() + " / " + cfg.getConcurrency());
        kv(grid, "Avg Latency (ms)", String.valueOf(s.avgLatencyMs()));
    }

    private static void countsCard(Element parent, ValidationReport r) {
        Element card = parent.appendElement("section").addClass("card").attr("id", "counts");
        card.appendElement("h2").text("Outcomes");
        Element tbody = table(card, "Outcome", "Count");
        for (Classification.Kind k : Classification.Kind.values()) {
            Element tr = tbody.appendElement("tr");
            tr.appendElement("td").addClass("kind-" + k.name()).text(k.name());
            tr.appendElement("td").text(String.valueOf(r.count(k)));
        }
    }

    private static void issuesCard(Element parent, ValidationReport r) {
        Element card = parent.appendElement("section").addClass("card").attr("id", "issues");
        card.appendElement("h2").text("Issues (" + r.getIssueCount() + ")");
        if (r.getIssues().isEmpty()) {
            card.appendElement("div").addClass("muted").text("No issues found.");
            return;
        }
        Element tbody = table(card, "#", "URL", "Result", "Location", "Attempts");
        int n = 1;
        for (ReportIssue i : r.getIssues()) {
            Element tr = tbody.appendElement("tr").addClass("issue");
            tr.appendElement("td").text(String.valueOf(n++));
            tr.appendElement("td").addClass("url")
              .appendElement("a").attr("href", i.url()).attr("rel", "noopener noreferrer").text(i.url());
            tr.appendElement("td").addClass("kind-" + i.classification().kind().name()).text(i.description());
            tr.appendElement("td").text(i.file() + ":" + i.line());
            tr.appendElement("td").text(String.valueOf(i.outcome().attemptsMade()));
        }
    }

    private static void failuresCard(Element parent, CheckRun run) {
        Element card = parent.appendElement("section").addClass("card").attr("id", "unreadable");
        card.appendElement("h2").text("Unreadable files");
        Element tbody = table(card, "File", "Reason");
        for (FileReadFailure f : run.fileFailures()) {
            Element tr = tbody.appendElement("tr");
            tr.appendElement("td").text(f.file().toString());
            tr.appendElement("td").text(f.reason());
        }
    }

    private static Element table(Element parent, String... headings) {
        Element table = parent.appendElement("table");
        Element tr = table.appendElement("thead").appendElement("tr");
        for (String h : headings) tr.appendElement("th").text(h);
        return table.appendElement("tbody");
    }

    private static void kv(Element grid, String k, String v) {
        Element row = grid.appendElement("div").addClass("kv");
        row.appendElement("span").addClass("k").text(k);
        row.appendElement("span").addClass("v").text(v);
    }
}
