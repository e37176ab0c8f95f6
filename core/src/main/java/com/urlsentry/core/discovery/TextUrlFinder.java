package com.urlsentry.core.discovery;

import com.urlsentry.core.model.FileReadFailure;
import com.urlsentry.core.model.UrlOccurrence;
import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 텍스트 파일 기반 URL 탐색기.
 * 파일은 병렬로 읽되 결과는 입력 순서대로 모은다.
 * UTF-8로 읽고 깨진 바이트는 대체 문자로 바꾼다(파일 하나 때문에 실패하지 않도록).
 */
public class TextUrlFinder implements UrlFinder {

    private static final Logger LOG = LoggerFactory.getLogger(TextUrlFinder.class);
    private static final StructuredLog SLOG = StructuredLog.get(TextUrlFinder.class);

    private final UrlExtractor extractor;
    private final boolean parallel;

    public TextUrlFinder() {
        this(new UrlExtractor(), true);
    }

    public TextUrlFinder(UrlExtractor extractor, boolean parallel) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.parallel = parallel;
    }

    @Override
    public DiscoveryResult find(List<Path> files) {
        Objects.requireNonNull(files, "files");
        var stream = parallel ? files.parallelStream() : files.stream();
        List<FileScan> scans = stream.map(this::scanFile).toList(); // 순서 유지

        int total = 0;
        for (FileScan s : scans) total += s.occurrences().size();

        List<UrlOccurrence> all = new ArrayList<>(total);
        List<FileReadFailure> failures = new ArrayList<>();
        for (FileScan s : scans) {
            all.addAll(s.occurrences());
            if (s.failure() != null) failures.add(s.failure());
        }
        LOG.info("Discovery done: files={}, occurrences={}, unreadable={}", files.size(), all.size(), failures.size());
        return new DiscoveryResult(all, failures, files.size());
    }

    /** 파일 하나 스캔. 읽기 실패는 failure로 돌려준다. */
    FileScan scanFile(Path file) {
        final String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException | SecurityException e) {
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            LOG.warn("Could not read {}: {}", file, reason);
            SLOG.warn("file-unreadable", "file", String.valueOf(file), "reason", reason);
            return new FileScan(List.of(), new FileReadFailure(file, reason));
        }
        return new FileScan(scanContent(file, content), null);
    }

    /** 이미 읽은 내용 스캔(입력이 파일이 아닌 경우에도 사용). */
    public List<UrlOccurrence> scanContent(Path file, String content) {
        ContentUrls urls = new ContentUrls(extractor, file, content);
        int capacity = CapacityHint.estimate(file, urls.candidateLineCount());
        if (capacity == 0) return List.of();
        List<UrlOccurrence> out = new ArrayList<>(capacity);
        for (UrlOccurrence o : urls) out.add(o);
        LOG.debug("Scanned {}: {} urls (capacity hint {})", file, out.size(), capacity);
        return out;
    }

    record FileScan(List<UrlOccurrence> occurrences, FileReadFailure failure) {}
}
