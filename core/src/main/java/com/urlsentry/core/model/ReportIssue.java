package com.urlsentry.core.model;

import java.util.Comparator;
import java.util.Objects;

/** 리포트에 올라가는 이슈 한 건: 대상 URL(+첫 위치) + 최종 결과 */
public record ReportIssue(DistinctUrl target, ValidationOutcome outcome) {

    /** 첫 위치(파일 → 줄) 순, 같은 위치면 URL 문자열 순 */
    public static final Comparator<ReportIssue> STABLE_ORDER =
            Comparator.comparing((ReportIssue i) -> i.target().firstLocation(), UrlOccurrence.BY_LOCATION)
                      .thenComparing(i -> i.target().url());

    public ReportIssue {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(outcome, "outcome");
        if (!target.url().equals(outcome.url()))
            throw new IllegalArgumentException("outcome.url must equal target.url");
    }

    public String url() { return target.url(); }
    public String file() { return target.firstLocation().file().toString(); }
    public int line() { return target.firstLocation().line(); }
    public Classification classification() { return outcome.classification(); }
    public String description() { return outcome.classification().label(); }
}
