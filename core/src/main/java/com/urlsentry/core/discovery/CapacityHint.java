package com.urlsentry.core.discovery;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 파일 확장자로 "URL이 있는 줄당 평균 URL 수"를 어림해 결과 리스트 초기 용량을 정한다.
 * 성능용 어림값일 뿐 정확성과는 무관하다.
 */
public final class CapacityHint {
    private CapacityHint() {}

    static final int DEFAULT_MULTIPLIER = 2;
    static final int MIN_CAPACITY = 4;

    private static final Map<String, Integer> MULTIPLIERS = Map.of(
            "md", 2, "markdown", 2,
            "html", 3, "htm", 3,
            "txt", 1, "rst", 1,
            "json", 2, "xml", 2
    );

    /** matchedLines=0이면 0, 아니면 max(matchedLines * 배수, 4) */
    public static int estimate(Path file, int matchedLines) {
        if (matchedLines <= 0) return 0;
        int mul = multiplierFor(file);
        long cap = (long) matchedLines * mul;
        return (int) Math.min(Integer.MAX_VALUE - 8, Math.max(cap, MIN_CAPACITY));
    }

    static int multiplierFor(Path file) {
        if (file == null || file.getFileName() == null) return DEFAULT_MULTIPLIER;
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return DEFAULT_MULTIPLIER;
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return MULTIPLIERS.getOrDefault(ext, DEFAULT_MULTIPLIER);
    }
}
