package com.urlsentry.core.config;

import java.nio.file.Path;

/** 설정 파일을 읽거나 해석할 수 없음(I/O, YAML 문법, 잘못된 값) */
public class ConfigException extends Exception {
    private final Path source;

    public ConfigException(Path source, String message) {
        super(prefix(source) + message);
        this.source = source;
    }

    public ConfigException(Path source, String message, Throwable cause) {
        super(prefix(source) + message, cause);
        this.source = source;
    }

    /** 문제가 된 파일(CLI 값이면 null) */
    public Path getSource() { return source; }

    private static String prefix(Path source) {
        return (source == null) ? "" : source + ": ";
    }
}
