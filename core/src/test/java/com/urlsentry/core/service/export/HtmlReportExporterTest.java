package com.urlsentry.core.service.export;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.service.CheckRun;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlReportExporterTest {

    @TempDir
    Path tmp;

    @Test
    void renders_dashboard_sections() throws Exception {
        // 1) 이슈 1건 + 읽기 실패 1건
        CheckRun run = SampleRuns.run(0.0, List.of(new FileReadFailure(Path.of("gone.md"), "NoSuchFileException")),
                "https://a.test/404?q=<script>", Classification.httpError(404),
                "https://a.test/ok", Classification.success(200));

        // 2) 파일로 내보내기
        Path out = new HtmlReportExporter().export(tmp, new CheckConfig(), run);
        assertTrue(Files.exists(out));
        assertTrue(out.getFileName().toString().endsWith(".html"));

        // 3) DOM 검증
        Document doc = Jsoup.parse(Files.readString(out));
        assertEquals("urlsentry report", doc.title());

        Element verdict = doc.selectFirst("#summary .verdict");
        assertNotNull(verdict);
        assertEquals("FAIL", verdict.attr("data-verdict"));
        assertTrue(verdict.hasClass("verdict-fail"));

        assertEquals(Classification.Kind.values().length, doc.select("#counts tbody tr").size());
        assertEquals("1", doc.selectFirst("#counts td.kind-HTTP_ERROR").nextElementSibling().text());

        assertEquals(1, doc.select("#issues tr.issue").size());
        Element link = doc.selectFirst("#issues tr.issue a[href]");
        assertNotNull(link);
        assertEquals("https://a.test/404?q=<script>", link.attr("href"));
        assertTrue(doc.select("script").isEmpty());

        assertNotNull(doc.selectFirst("#unreadable"));
        assertFalse(doc.select("style").first().data().isBlank());
    }

    @Test
    void clean_run_shows_pass_and_no_issue_rows() {
        CheckRun run = SampleRuns.run(0.0, List.of(), "https://a.test/ok", Classification.success(200));

        Document doc = Jsoup.parse(new HtmlReportExporter().render(new CheckConfig(), run));

        assertEquals("PASS", doc.selectFirst(".verdict").attr("data-verdict"));
        assertTrue(doc.select("#issues tr.issue").isEmpty());
        assertTrue(doc.selectFirst("#issues").text().contains("No issues found."));
        assertTrue(doc.select("#unreadable").isEmpty());
    }
}
