package com.urlsentry.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public static ReportContext context(Path baseDir, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports"); }
    public static String filePrefix(ReportContext ctx) { return "urlcheck-" + timestamp(ctx); }

    public static Path path(ReportContext ctx, String extension) {
        return reportsDir(ctx).resolve(filePrefix(ctx) + "." + extension);
    }

    public record ReportContext(Path baseDir, Instant startedAt) {}
}
