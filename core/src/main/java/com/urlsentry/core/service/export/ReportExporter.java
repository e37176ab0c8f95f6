package com.urlsentry.core.service.export;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.service.CheckRun;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** 검사 결과를 보고서 형태로 내보내는 책임 (텍스트/JSON/HTML) */
public interface ReportExporter {

    /** 보고서 본문 생성(부수효과 없음) */
    String render(CheckConfig cfg, CheckRun run);

    /** 파일 확장자(점 제외) */
    String extension();

    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @return 생성된 파일의 경로
     */
    default Path export(Path baseDir, CheckConfig cfg, CheckRun run) throws IOException {
        var ctx = ReportNaming.context(baseDir, run.startedAt());
        Files.createDirectories(ReportNaming.reportsDir(ctx));
        Path out = ReportNaming.path(ctx, extension());
        Files.writeString(out, render(cfg, run), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }
}
