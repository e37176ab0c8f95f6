package com.urlsentry.app.cli;

import com.urlsentry.core.config.ConfigException;
import com.urlsentry.core.config.YamlConfigLoader;
import com.urlsentry.core.model.CheckConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 설정 우선순위: 기본값 → 설정 파일 → 명령행.
 * 설정 파일은 --config, 없으면 작업 디렉터리(+부모 3단계)의 .urlsentry.yml.
 */
final class ConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigResolver.class);

    private final Path workDir;

    ConfigResolver(Path workDir) {
        this.workDir = Objects.requireNonNull(workDir, "workDir");
    }

    CheckConfig resolve(CliOptions opts) throws ConfigException {
        CheckConfig cfg = CheckConfig.defaults();

        Path file = configFile(opts);
        if (file != null) {
            LOG.info("Using config {}", file);
            YamlConfigLoader.applyTo(file, cfg);
        }

        try {
            opts.applyTo(cfg);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException(null, e.getMessage(), e);
        }
        try {
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException(blame(file, opts), e.getMessage(), e);
        }
        return cfg;
    }

    /** 명령행 값만으로도 깨지면 명령행 탓(null), 아니면 설정 파일 탓 */
    private static Path blame(Path file, CliOptions opts) {
        if (file == null) return null;
        CheckConfig cliOnly = CheckConfig.defaults();
        try {
            opts.applyTo(cliOnly);
            cliOnly.validate();
            return file;
        } catch (IllegalArgumentException | NullPointerException e) {
            return null;
        }
    }

    Path configFile(CliOptions opts) {
        if (opts.noConfig) return null;
        if (opts.config != null) return workDir.resolve(opts.config);
        return YamlConfigLoader.find(workDir);
    }
}
