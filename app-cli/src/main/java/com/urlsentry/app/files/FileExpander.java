package com.urlsentry.app.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 명령행 경로 → 검사할 파일 목록.
 * 디렉터리는 recursive일 때만 내려가며, 확장자 필터는 디렉터리에서 찾은 파일에만 적용한다.
 * 빈 문자열 확장자("")는 확장자 없는 파일을 뜻한다. 결과는 중복 없이 입력 순서 → 경로 순.
 */
public final class FileExpander {

    private static final Logger LOG = LoggerFactory.getLogger(FileExpander.class);

    private final boolean recursive;
    private final Set<String> extensions; // null이면 전부

    public FileExpander(boolean recursive, Set<String> extensions) {
        this.recursive = recursive;
        this.extensions = (extensions == null) ? null : normalize(extensions);
    }

    public List<Path> expand(List<Path> inputs) throws IOException {
        Objects.requireNonNull(inputs, "inputs");
        Set<Path> out = new LinkedHashSet<>();
        for (Path p : inputs) {
            if (Files.isDirectory(p)) {
                if (!recursive) {
                    throw new IllegalArgumentException(p + " is a directory (use --recursive)");
                }
                out.addAll(walk(p));
            } else if (Files.exists(p)) {
                out.add(p);
            } else {
                throw new NoSuchFileException(p.toString(), null, "no such file or directory");
            }
        }
        LOG.debug("Expanded {} inputs to {} files", inputs.size(), out.size());
        return new ArrayList<>(out);
    }

    private List<Path> walk(Path dir) throws IOException {
        try (Stream<Path> s = Files.walk(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(this::accepts)
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    boolean accepts(Path file) {
        if (extensions == null) return true;
        return extensions.contains(extensionOf(file));
    }

    /** "a/b.MD" → "md", "Makefile" → "", ".env" → "" */
    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) return "";
        String s = name.toString();
        int i = s.lastIndexOf('.');
        return (i <= 0) ? "" : s.substring(i + 1).toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalize(Set<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String e : raw) {
            if (e == null) continue;
            String s = e.trim().toLowerCase(Locale.ROOT);
            if (s.startsWith(".")) s = s.substring(1);
            out.add(s);
        }
        return Set.copyOf(out);
    }
}
