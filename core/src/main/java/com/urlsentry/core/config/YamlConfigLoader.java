package com.urlsentry.core.config;

import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.CheckConfig.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.PatternSyntaxException;

/**
 * .urlsentry.yml을 읽어 CheckConfig에 반영.
 *
 * 예상 YAML 키:
 * timeoutSeconds: 30
 * concurrency: 8
 * retryAttempts: 2
 * retryDelayMs: 1000
 * rateLimitDelayMs: 100
 * allowTimeout: false
 * allowedStatusCodes: [403, 429]
 * allowlist: ["localhost", "example.com"]
 * excludePatterns: ["^https://internal\\."]
 * useHeadRequests: false
 * userAgent: "my-bot/1.0"
 * proxy: "http://proxy:8080"
 * insecure: false
 * failureThreshold: 5.0
 * fileTypes: [md, html]
 * outputFormat: text | json
 * batch:
 *   min: 2
 *   max: 100
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    public static final String FILE_NAME = ".urlsentry.yml";
    /** 작업 디렉터리 위로 몇 단계까지 찾을지 */
    public static final int MAX_PARENT_LEVELS = 3;

    private static final Set<String> KNOWN_KEYS = Set.of(
            "timeoutSeconds", "concurrency", "retryAttempts", "retryDelayMs", "rateLimitDelayMs",
            "allowTimeout", "allowedStatusCodes", "allowlist", "excludePatterns", "useHeadRequests",
            "userAgent", "proxy", "insecure", "failureThreshold", "fileTypes", "outputFormat", "batch");

    private YamlConfigLoader() {}

    /** 작업 디렉터리부터 부모 3단계까지 .urlsentry.yml 찾기. 없으면 null */
    public static Path find(Path startDir) {
        Path dir = Objects.requireNonNull(startDir, "startDir").toAbsolutePath().normalize();
        for (int level = 0; level <= MAX_PARENT_LEVELS && dir != null; level++) {
            Path candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) return candidate;
            dir = dir.getParent();
        }
        return null;
    }

    /** 기본값 위에 파일 값을 얹고 검증까지 */
    public static CheckConfig load(Path yamlPath) throws ConfigException {
        CheckConfig cfg = applyTo(yamlPath, CheckConfig.defaults());
        try {
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException(yamlPath, e.getMessage(), e);
        }
        return cfg;
    }

    /** 파일 값을 cfg에 덮어쓴다(검증은 호출자 몫: CLI 값을 더 얹은 뒤 한 번에) */
    public static CheckConfig applyTo(Path yamlPath, CheckConfig cfg) throws ConfigException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(cfg, "cfg");
        if (!Files.exists(yamlPath)) {
            throw new ConfigException(yamlPath, "config file not found");
        }

        final Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (IOException e) {
            throw new ConfigException(yamlPath, "cannot read: " + e.getMessage(), e);
        } catch (YAMLException e) {
            throw new ConfigException(yamlPath, "invalid YAML: " + e.getMessage(), e);
        }

        if (root == null) return cfg; // 빈 파일
        if (!(root instanceof Map<?, ?> map)) {
            throw new ConfigException(yamlPath, "top level must be a mapping");
        }

        try {
            apply(map, cfg);
        } catch (PatternSyntaxException e) {
            throw new ConfigException(yamlPath, "invalid exclude pattern: " + e.getDescription() + " in " + e.getPattern(), e);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new ConfigException(yamlPath, e.getMessage(), e);
        }
        LOG.debug("Loaded config from {}", yamlPath);
        return cfg;
    }

    private static void apply(Map<?, ?> map, CheckConfig cfg) {
        for (Object k : map.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(k))) LOG.warn("Unknown config key ignored: {}", k);
        }

        setLong(map, "timeoutSeconds", s -> cfg.setTimeout(Duration.ofSeconds(s)));
        setLong(map, "concurrency", v -> cfg.setConcurrency(toInt("concurrency", v)));
        setLong(map, "retryAttempts", v -> cfg.setRetryAttempts(toInt("retryAttempts", v)));
        setLong(map, "retryDelayMs", ms -> cfg.setRetryDelay(Duration.ofMillis(ms)));
        setLong(map, "rateLimitDelayMs", ms -> cfg.setRateLimitDelay(Duration.ofMillis(ms)));
        setBoolean(map, "allowTimeout", cfg::setAllowTimeout);
        setBoolean(map, "useHeadRequests", cfg::setUseHeadRequests);
        setBoolean(map, "insecure", cfg::setInsecure);
        setString(map, "userAgent", cfg::setUserAgent);
        setString(map, "proxy", p -> cfg.setProxy(parseProxy(p)));

        List<String> codes = stringList(map, "allowedStatusCodes");
        if (codes != null) cfg.setAllowedStatusCodes(parseStatusCodes(codes));
        List<String> allow = stringList(map, "allowlist");
        if (allow != null) cfg.setAllowlist(allow);
        List<String> excludes = stringList(map, "excludePatterns");
        if (excludes != null) cfg.setExcludeRegexes(excludes);
        List<String> types = stringList(map, "fileTypes");
        if (types != null) cfg.setFileTypes(new LinkedHashSet<>(types));

        Object threshold = map.get("failureThreshold");
        if (threshold instanceof Number n) cfg.setFailureThreshold(n.doubleValue());
        else if (threshold != null) cfg.setFailureThreshold(parseDouble("failureThreshold", String.valueOf(threshold)));

        Object fmt = map.get("outputFormat");
        if (fmt != null) cfg.setOutputFormat(parseFormat(String.valueOf(fmt)));

        Object batch = map.get("batch");
        if (batch instanceof Map<?, ?> b) {
            setLong(b, "min", v -> cfg.setBatchMin(toInt("batch.min", v)));
            setLong(b, "max", v -> cfg.setBatchMax(toInt("batch.max", v)));
        } else if (batch != null) {
            throw new IllegalArgumentException("batch must be a mapping with min/max");
        }
    }

    // ------------ 값 해석(CLI에서도 사용) ------------
    public static URI parseProxy(String s) {
        String v = s.trim();
        if (!v.contains("://")) v = "http://" + v;
        URI u;
        try {
            u = URI.create(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid proxy: " + s, e);
        }
        if (u.getHost() == null || u.getPort() < 0) throw new IllegalArgumentException("proxy must be host:port, got " + s);
        return u;
    }

    public static Set<Integer> parseStatusCodes(List<String> raw) {
        Set<Integer> out = new LinkedHashSet<>();
        for (String s : raw) {
            int code;
            try {
                code = Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid status code: " + s);
            }
            if (code < 100 || code > 599) throw new IllegalArgumentException("status code out of range 100..599: " + code);
            out.add(code);
        }
        return out;
    }

    public static OutputFormat parseFormat(String s) {
        String v = s.trim().toUpperCase(Locale.ROOT);
        for (OutputFormat f : OutputFormat.values()) if (f.name().equals(v)) return f;
        throw new IllegalArgumentException("unknown output format: " + s + " (expected text or json)");
    }

    public static List<String> splitCsv(String s) {
        List<String> out = new ArrayList<>();
        for (String p : s.split(",", -1)) out.add(p.trim());
        return out;
    }

    // ------------ helpers ------------
    private static List<String> stringList(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v == null) return null;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : splitCsv(String.valueOf(v))) if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) {
            String s = String.valueOf(v).trim();
            if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false"))
                throw new IllegalArgumentException(key + " must be true or false, got " + s);
            setter.accept(Boolean.parseBoolean(s));
        }
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) {
            setter.accept(n.longValue());
            return;
        }
        try {
            setter.accept(Long.parseLong(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got " + v);
        }
    }

    private static int toInt(String key, long v) {
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) throw new IllegalArgumentException(key + " out of range: " + v);
        return (int) v;
    }

    private static double parseDouble(String key, String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got " + s);
        }
    }
}
