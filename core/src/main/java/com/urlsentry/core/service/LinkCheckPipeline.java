package com.urlsentry.core.service;

import com.urlsentry.core.dedupe.DedupResult;
import com.urlsentry.core.dedupe.Deduplicator;
import com.urlsentry.core.discovery.DiscoveryResult;
import com.urlsentry.core.discovery.TextUrlFinder;
import com.urlsentry.core.discovery.UrlFinder;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.ValidationReport;
import com.urlsentry.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 파일 → 발견 → 중복 제거 → 검증 → 집계.
 * 중복 제거는 검증 전에 전부 끝난다(URL당 검사 1회).
 */
public final class LinkCheckPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(LinkCheckPipeline.class);

    private final CheckConfig config;
    private final UrlFinder finder;
    private final ValidationService validator;
    private final Clock clock;

    public LinkCheckPipeline(CheckConfig config) {
        this(config, new TextUrlFinder(), new ValidationService(config), Clock.systemUTC());
    }

    public LinkCheckPipeline(CheckConfig config, UrlFinder finder, ValidationService validator, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.finder = Objects.requireNonNull(finder, "finder");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CheckRun run(List<Path> files) {
        return run(files, ProgressListener.NONE, null, null);
    }

    public CheckRun run(List<Path> files, ProgressListener listener, AtomicBoolean cancel, Instant deadline) {
        Objects.requireNonNull(files, "files");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant started = clock.instant();
        final long t0 = System.nanoTime();

        notify(pl, 0.0, "discover", 0, files.size());
        DiscoveryResult found = finder.find(files);
        notify(pl, 1.0, "discover", files.size(), files.size());

        DedupResult dedup = Deduplicator.dedupe(found.occurrences());
        LOG.info("Found {} URLs ({} unique) in {} files", dedup.totalOccurrences(), dedup.uniqueCount(), files.size());

        ValidationRun run = validator.run(dedup.distinct(), pl, cancel, deadline);

        notify(pl, 0.0, "report", 0, 1);
        ValidationReport report = new ResultAggregator(config.effectiveFailureThreshold()).aggregate(dedup, run);
        notify(pl, 1.0, "report", 1, 1);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        LOG.info("Check finished in {} ms: verdict={}, issues={}, failureRate={}%",
                elapsed.toMillis(), report.getVerdict(), report.getIssueCount(),
                String.format(java.util.Locale.ROOT, "%.1f", report.getFailureRate()));
        return new CheckRun(report, found.failures(), found.filesScanned(), run.stats(), started, elapsed);
    }

    private static void notify(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(p, phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }
}
