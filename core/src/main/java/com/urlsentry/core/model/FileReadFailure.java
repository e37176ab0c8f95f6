package com.urlsentry.core.model;

import java.nio.file.Path;
import java.util.Objects;

/** 읽지 못한 파일. 이 파일의 URL은 0건으로 처리되고 실행은 계속된다. */
public record FileReadFailure(Path file, String reason) {
    public FileReadFailure {
        Objects.requireNonNull(file, "file");
        reason = (reason == null || reason.isBlank()) ? "unreadable" : reason;
    }
}
