package com.urlsentry.core.service;

import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.CheckConfig;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 네트워크 호출 전 걸러내기.
 * 제외 패턴(정규식 find)을 먼저 보고, 다음에 허용 목록(부분 문자열)을 본다.
 */
public final class UrlFilter {

    private final List<Pattern> excludes;
    private final List<String> allowlist;

    public UrlFilter(List<Pattern> excludes, List<String> allowlist) {
        this.excludes = List.copyOf(Objects.requireNonNull(excludes, "excludes"));
        this.allowlist = List.copyOf(Objects.requireNonNull(allowlist, "allowlist"));
    }

    public static UrlFilter from(CheckConfig cfg) {
        return new UrlFilter(cfg.getExcludePatterns(), cfg.getAllowlist());
    }

    /** 건너뛸 URL이면 그 분류, 검사 대상이면 empty. */
    public Optional<Classification> skipReason(String url) {
        for (Pattern p : excludes) {
            if (p.matcher(url).find()) return Optional.of(Classification.excluded(p.pattern()));
        }
        for (String entry : allowlist) {
            if (url.contains(entry)) return Optional.of(Classification.allowed(entry));
        }
        return Optional.empty();
    }

    public boolean isEmpty() { return excludes.isEmpty() && allowlist.isEmpty(); }
}
