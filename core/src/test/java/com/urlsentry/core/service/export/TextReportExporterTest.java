package com.urlsentry.core.service.export;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.service.CheckRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextReportExporterTest {

    private final CheckConfig cfg = new CheckConfig();

    @Test
    void clean_run_says_no_issues_and_omits_threshold_line() {
        CheckRun run = SampleRuns.run(0.0, List.of(),
                "https://a.test", Classification.success(200));

        String out = new TextReportExporter().render(cfg, run);

        assertThat(out).contains("> Found 1 URLs (1 unique) in 2 files");
        assertThat(out).contains("No issues found!");
        assertThat(out).doesNotContain("Failure rate");
    }

    @Test
    void issues_are_grouped_in_fixed_order() {
        CheckRun run = SampleRuns.run(0.0, List.of(),
                "https://a.test/500", Classification.httpError(500),
                "https://a.test/404", Classification.httpError(404),
                "https://a.test/down", Classification.connectionError("Connection refused"),
                "https://a.test/moved", Classification.httpError(301),
                "https://a.test/ok", Classification.success(200));

        String out = new TextReportExporter().render(cfg, run);

        int net = out.indexOf("Network/Connection Errors:");
        int client = out.indexOf("Client Errors (4xx):");
        int server = out.indexOf("Server Errors (5xx):");
        int redirect = out.indexOf("Redirect Issues (3xx):");
        assertThat(net).isPositive();
        assertThat(client).isGreaterThan(net);
        assertThat(server).isGreaterThan(client);
        assertThat(redirect).isGreaterThan(server);
        assertThat(out).doesNotContain("Other HTTP Issues");
        assertThat(out).contains("1. 404 https://a.test/404 (" + Path.of("docs", "a.md") + ":2)");
        assertThat(out).contains("1. Connection refused https://a.test/down");
        assertThat(out).contains("Failure rate 80.0% exceeds threshold 0.0% (4/5 URLs failed)");
    }

    @Test
    void within_threshold_line_and_skips() {
        CheckRun run = SampleRuns.run(60.0, List.of(),
                "https://a.test/404", Classification.httpError(404),
                "https://a.test/ok", Classification.success(200),
                "https://skip.test", Classification.excluded("skip"));

        String out = new TextReportExporter().render(cfg, run);

        assertThat(out).contains("> Skipped 1 URLs (excluded or allowlisted)");
        assertThat(out).contains("Failure rate 50.0% is within threshold 60.0% (1/2 URLs failed)");
    }

    @Test
    void quiet_mode_prints_only_threshold() {
        CheckRun run = SampleRuns.run(0.0, List.of(new FileReadFailure(Path.of("x.md"), "NoSuchFileException: x.md")),
                "https://a.test/404", Classification.httpError(404));

        String out = new TextReportExporter(true).render(cfg, run);

        assertThat(out).doesNotContain("Found").doesNotContain("Could not read").doesNotContain("Issues");
        assertThat(out).contains("Failure rate 100.0% exceeds threshold 0.0% (1/1 URLs failed)");
    }

    @Test
    void unreadable_files_and_interruption_are_shown() {
        CheckRun run = SampleRuns.withPending(0.0, List.of(new FileReadFailure(Path.of("x.md"), "AccessDeniedException: x.md")),
                1, "https://a.test", Classification.success(200));

        String out = new TextReportExporter().render(cfg, run);

        assertThat(out).startsWith("! Could not read x.md: AccessDeniedException: x.md");
        assertThat(out).contains("Run interrupted: 1 URLs were not checked");
    }

    @Test
    void export_writes_timestamped_file(@TempDir Path tmp) throws Exception {
        CheckRun run = SampleRuns.run(0.0, List.of(), "https://a.test", Classification.success(200));

        Path out = new TextReportExporter().export(tmp, cfg, run);

        assertThat(out.getParent()).isEqualTo(tmp.resolve("reports"));
        assertThat(out.getFileName().toString()).startsWith("urlcheck-").endsWith(".txt");
        assertThat(Files.readString(out)).contains("No issues found!");
    }
}
