package com.urlsentry.core.discovery;

import java.nio.file.Path;
import java.util.List;

/** 파일 목록에서 URL 등장 위치를 찾는 전략 인터페이스. */
public interface UrlFinder {
    /**
     * 파일 하나를 못 읽어도 예외를 던지지 않고 결과의 failures에 남긴다.
     */
    DiscoveryResult find(List<Path> files);
}
