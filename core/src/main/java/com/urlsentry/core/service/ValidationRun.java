package com.urlsentry.core.service;

import com.urlsentry.core.model.CheckStats;
import com.urlsentry.core.model.ValidationOutcome;

import java.util.List;

/**
 * 검증 단계 산출물.
 * outcomes는 입력 순서이며 완료된 URL만 담는다(건너뛴 URL 포함).
 * notCompleted는 중단/마감으로 결과가 없는 URL 수.
 */
public record ValidationRun(List<ValidationOutcome> outcomes, int notCompleted, boolean interrupted,
                            CheckStats.Snapshot stats) {
    public ValidationRun {
        outcomes = List.copyOf(outcomes);
        if (notCompleted < 0) throw new IllegalArgumentException("notCompleted must be >= 0");
    }
}
