package com.urlsentry.app.cli;

import com.urlsentry.app.files.FileExpander;
import com.urlsentry.app.logging.LogSetup;
import com.urlsentry.core.api.IUrlProbe;
import com.urlsentry.core.config.ConfigException;
import com.urlsentry.core.discovery.TextUrlFinder;
import com.urlsentry.core.http.HttpProber;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.service.CheckRun;
import com.urlsentry.core.service.LinkCheckPipeline;
import com.urlsentry.core.service.ValidationService;
import com.urlsentry.core.service.export.HtmlReportExporter;
import com.urlsentry.core.service.export.JsonReportExporter;
import com.urlsentry.core.service.export.ReportExporter;
import com.urlsentry.core.service.export.TextReportExporter;
import com.urlsentry.core.util.DefaultSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * 명령행 진입점: 인자 → 설정 → 파일 목록 → 검사 → 보고서 → 종료 코드.
 * 종료 코드 0 = 통과, 1 = 실패(또는 중단), 2 = 사용법/설정 오류.
 */
public final class CheckCommand {

    private static final Logger LOG = LoggerFactory.getLogger(CheckCommand.class);

    public static final int EXIT_PASS = 0;
    public static final int EXIT_FAIL = 1;
    public static final int EXIT_USAGE = 2;

    private static final long REPORT_GRACE_MS = 5_000;

    private final Function<CheckConfig, IUrlProbe> probes;
    private final Path workDir;
    private final boolean installShutdownHook;

    public CheckCommand() {
        this(CheckCommand::processProbe, Path.of(""), true);
    }

    /** 실제 실행: 이 프로세스의 JDK HTTP 전역 설정까지 건다 */
    private static IUrlProbe processProbe(CheckConfig cfg) {
        HttpProber.applyProcessWideSettings(cfg);
        return new HttpProber(cfg);
    }

    /** 테스트용: 프로브/작업 디렉터리 주입 */
    CheckCommand(Function<CheckConfig, IUrlProbe> probes, Path workDir, boolean installShutdownHook) {
        this.probes = Objects.requireNonNull(probes, "probes");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.installShutdownHook = installShutdownHook;
    }

    public static void main(String[] args) {
        int code = new CheckCommand().run(args, System.out, System.err);
        System.exit(code);
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, new AtomicBoolean(false));
    }

    /** 테스트용: 종료 훅이 세우는 중단 플래그를 직접 주입 */
    int run(String[] args, PrintStream out, PrintStream err, AtomicBoolean cancel) {
        final CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println("Try --help for usage.");
            return EXIT_USAGE;
        }
        if (opts.help) {
            out.print(CliOptions.USAGE);
            return EXIT_PASS;
        }
        if (opts.version) {
            out.println(HttpProber.DEFAULT_USER_AGENT);
            return EXIT_PASS;
        }

        LogSetup.init(opts.verbose ? Level.FINE : opts.quiet ? Level.WARNING : Level.INFO);

        final CheckConfig cfg;
        final List<Path> files;
        try {
            cfg = new ConfigResolver(workDir).resolve(opts);
            files = new FileExpander(opts.recursive, cfg.getFileTypes()).expand(resolveAll(opts.paths));
        } catch (ConfigException e) {
            err.println("config error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (NoSuchFileException e) {
            err.println("error: " + e.getFile() + ": no such file or directory");
            return EXIT_USAGE;
        } catch (IllegalArgumentException | IOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (files.isEmpty()) {
            err.println("error: no files to check");
            return EXIT_USAGE;
        }

        // Ctrl-C: 디스패치를 멈추고, 부분 보고서가 출력/저장될 때까지 JVM 종료를 미룬다
        CountDownLatch reported = new CountDownLatch(1);
        Thread hook = installShutdownHook ? registerHook(cancel, reported, cfg) : null;
        try {
            return checkAndReport(cfg, files, opts, cancel, out, err);
        } finally {
            out.flush();
            err.flush();
            reported.countDown();
            unregisterHook(hook);
        }
    }

    private int checkAndReport(CheckConfig cfg, List<Path> files, CliOptions opts,
                               AtomicBoolean cancel, PrintStream out, PrintStream err) {
        CheckRun run;
        try (IUrlProbe probe = probes.apply(cfg)) {
            Instant deadline = (opts.deadlineSeconds == null) ? null : Instant.now().plusSeconds(opts.deadlineSeconds);
            ValidationService validator = new ValidationService(cfg, probe, DefaultSleeper.INSTANCE);
            LinkCheckPipeline pipeline = new LinkCheckPipeline(cfg, new TextUrlFinder(), validator, Clock.systemUTC());
            run = pipeline.run(files, null, cancel, deadline);
        }

        ReportExporter stdoutExporter = (cfg.getOutputFormat() == CheckConfig.OutputFormat.JSON)
                ? new JsonReportExporter()
                : new TextReportExporter(opts.quiet);
        out.print(stdoutExporter.render(cfg, run));
        out.flush();

        if (opts.reportDir != null) {
            PrintStream notes = (cfg.getOutputFormat() == CheckConfig.OutputFormat.JSON) ? err : out;
            try {
                Path base = workDir.resolve(opts.reportDir);
                for (ReportExporter x : List.of(new JsonReportExporter(), new HtmlReportExporter())) {
                    notes.println("> Report written: " + x.export(base, cfg, run));
                }
            } catch (IOException e) {
                LOG.error("Report export failed", e);
                err.println("error: cannot write reports: " + e.getMessage());
                return EXIT_FAIL;
            }
        }

        if (run.report().isInterrupted()) return EXIT_FAIL;
        return run.report().getVerdict().exitCode();
    }

    private static Thread registerHook(AtomicBoolean cancel, CountDownLatch reported, CheckConfig cfg) {
        // 진행 중 요청(타임아웃) + 보고서 작성 여유
        long waitMs = cfg.getTimeoutMs() + REPORT_GRACE_MS;
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                if (!reported.await(waitMs, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Report not finished after {} ms, exiting anyway", waitMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "urlsentry-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void unregisterHook(Thread hook) {
        if (hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException alreadyShuttingDown) {
            LOG.debug("JVM is shutting down, hook stays registered");
        }
    }

    private List<Path> resolveAll(List<Path> paths) {
        List<Path> out = new ArrayList<>(paths.size());
        for (Path p : paths) out.add(workDir.resolve(p));
        return out;
    }
}
