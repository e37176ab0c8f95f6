package com.urlsentry.app.cli;

import com.urlsentry.core.config.YamlConfigLoader;
import com.urlsentry.core.model.CheckConfig;
import com.urlsentry.core.model.CheckConfig.OutputFormat;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 명령행 파싱 결과. "--opt value"와 "--opt=value" 둘 다 받는다.
 * 값이 있는 필드만 설정 파일 값을 덮어쓴다(null = 지정 안 함).
 */
final class CliOptions {

    static final String USAGE = """
            Usage: urlsentry [options] <file|dir>...

            Input:
              -r, --recursive              descend into directories
                  --include <ext,...>      only files with these extensions ("" = no extension)
                  --config <file>          config file (default: .urlsentry.yml in . or up to 3 parents)
                  --no-config              ignore config files

            Network:
              -t, --timeout <seconds>      per-request timeout (default 30)
              -c, --concurrency <n>        max in-flight requests (default: CPU count)
                  --retry <n>              retries for transient failures (default 0)
                  --retry-delay <ms>       base backoff delay (default 1000)
                  --rate-limit <ms>        minimum spacing between requests (default 0)
                  --head                   use HEAD instead of GET
                  --user-agent <ua>        custom User-Agent
                  --proxy <host:port>      HTTP proxy
                  --insecure               skip TLS certificate verification

            Verdict:
                  --allow-timeout          timeouts are not issues
                  --allow-status <c,...>   status codes treated as success
                  --allowlist <s,...>      skip URLs containing these substrings
                  --exclude-pattern <re>   skip URLs matching regex (repeatable)
                  --failure-threshold <%>  fail only above this failure rate (default 0)
                  --deadline <seconds>     stop the run after this long and report partial results

            Output:
                  --format <text|json>     report format on stdout (default text)
                  --report-dir <dir>       also write JSON and HTML reports under <dir>/reports
              -q, --quiet                  summary only, warnings-only logging
              -v, --verbose                debug logging
              -h, --help                   show this help
                  --version                print version

            Exit codes: 0 = pass, 1 = fail or interrupted, 2 = usage or config error
            """;

    final List<Path> paths = new ArrayList<>();
    boolean help;
    boolean version;
    boolean recursive;
    Set<String> include;
    Path config;
    boolean noConfig;

    Long timeoutSeconds;
    Integer concurrency;
    Integer retry;
    Long retryDelayMs;
    Long rateLimitMs;
    Boolean head;
    String userAgent;
    URI proxy;
    Boolean insecure;

    Boolean allowTimeout;
    Set<Integer> allowStatus;
    List<String> allowlist;
    final List<String> excludePatterns = new ArrayList<>();
    Double failureThreshold;
    Long deadlineSeconds;

    OutputFormat format;
    Path reportDir;
    boolean quiet;
    boolean verbose;

    static CliOptions parse(String[] args) throws UsageException {
        CliOptions o = new CliOptions();
        boolean positionalOnly = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (positionalOnly || !a.startsWith("-") || a.equals("-")) {
                o.paths.add(Path.of(a));
                continue;
            }
            if (a.equals("--")) { positionalOnly = true; continue; }

            String key = a;
            String inline = null;
            int eq = a.indexOf('=');
            if (a.startsWith("--") && eq > 0) {
                key = a.substring(0, eq);
                inline = a.substring(eq + 1);
            }

            switch (key) {
                case "-h", "--help" -> o.help = true;
                case "--version" -> o.version = true;
                case "-r", "--recursive" -> o.recursive = true;
                case "--include" -> o.include = new LinkedHashSet<>(YamlConfigLoader.splitCsv(value(args, ++i, key, inline)));
                case "--config" -> o.config = Path.of(value(args, ++i, key, inline));
                case "--no-config" -> o.noConfig = true;
                case "-t", "--timeout" -> o.timeoutSeconds = parseLong(key, value(args, ++i, key, inline));
                case "-c", "--concurrency" -> o.concurrency = parseInt(key, value(args, ++i, key, inline));
                case "--retry" -> o.retry = parseInt(key, value(args, ++i, key, inline));
                case "--retry-delay" -> o.retryDelayMs = parseLong(key, value(args, ++i, key, inline));
                case "--rate-limit" -> o.rateLimitMs = parseLong(key, value(args, ++i, key, inline));
                case "--head" -> o.head = true;
                case "--user-agent" -> o.userAgent = value(args, ++i, key, inline);
                case "--proxy" -> o.proxy = parseProxy(value(args, ++i, key, inline));
                case "--insecure" -> o.insecure = true;
                case "--allow-timeout" -> o.allowTimeout = true;
                case "--allow-status" -> o.allowStatus = parseCodes(value(args, ++i, key, inline));
                case "--allowlist" -> o.allowlist = YamlConfigLoader.splitCsv(value(args, ++i, key, inline));
                case "--exclude-pattern" -> o.excludePatterns.add(checkRegex(value(args, ++i, key, inline)));
                case "--failure-threshold" -> o.failureThreshold = parseDouble(key, value(args, ++i, key, inline));
                case "--deadline" -> o.deadlineSeconds = parseLong(key, value(args, ++i, key, inline));
                case "--format" -> o.format = parseFormat(value(args, ++i, key, inline));
                case "--report-dir" -> o.reportDir = Path.of(value(args, ++i, key, inline));
                case "-q", "--quiet" -> o.quiet = true;
                case "-v", "--verbose" -> o.verbose = true;
                default -> throw new UsageException("unknown option: " + a);
            }
            // 값 없는 플래그에 "=값"이 붙은 경우
            if (inline != null && !takesValue(key)) throw new UsageException(key + " does not take a value");
            // inline 값을 썼으면 다음 인자를 소비하지 않는다
            if (inline != null) i--;
        }

        if (o.quiet && o.verbose) throw new UsageException("--quiet and --verbose are mutually exclusive");
        if (o.deadlineSeconds != null && o.deadlineSeconds < 1) throw new UsageException("--deadline must be >= 1");
        if (!o.help && !o.version && o.paths.isEmpty()) throw new UsageException("no input files given");
        return o;
    }

    /** 지정된 값만 cfg에 덮어쓴다 */
    void applyTo(CheckConfig cfg) {
        if (timeoutSeconds != null) cfg.setTimeout(Duration.ofSeconds(timeoutSeconds));
        if (concurrency != null) cfg.setConcurrency(concurrency);
        if (retry != null) cfg.setRetryAttempts(retry);
        if (retryDelayMs != null) cfg.setRetryDelay(Duration.ofMillis(retryDelayMs));
        if (rateLimitMs != null) cfg.setRateLimitDelay(Duration.ofMillis(rateLimitMs));
        if (head != null) cfg.setUseHeadRequests(head);
        if (userAgent != null) cfg.setUserAgent(userAgent);
        if (proxy != null) cfg.setProxy(proxy);
        if (insecure != null) cfg.setInsecure(insecure);
        if (allowTimeout != null) cfg.setAllowTimeout(allowTimeout);
        if (allowStatus != null) cfg.setAllowedStatusCodes(allowStatus);
        if (allowlist != null) cfg.setAllowlist(allowlist);
        if (!excludePatterns.isEmpty()) cfg.setExcludeRegexes(excludePatterns);
        if (failureThreshold != null) cfg.setFailureThreshold(failureThreshold);
        if (include != null) cfg.setFileTypes(include);
        if (format != null) cfg.setOutputFormat(format);
    }

    private static boolean takesValue(String key) {
        return switch (key) {
            case "--include", "--config", "-t", "--timeout", "-c", "--concurrency", "--retry", "--retry-delay",
                 "--rate-limit", "--user-agent", "--proxy", "--allow-status", "--allowlist", "--exclude-pattern",
                 "--failure-threshold", "--deadline", "--format", "--report-dir" -> true;
            default -> false;
        };
    }

    private static String value(String[] args, int i, String key, String inline) throws UsageException {
        if (inline != null) return inline;
        if (i >= args.length) throw new UsageException(key + " requires a value");
        return args[i];
    }

    private static long parseLong(String key, String v) throws UsageException {
        try { return Long.parseLong(v.trim()); }
        catch (NumberFormatException e) { throw new UsageException(key + " expects a whole number, got '" + v + "'"); }
    }

    private static int parseInt(String key, String v) throws UsageException {
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) { throw new UsageException(key + " expects a whole number, got '" + v + "'"); }
    }

    private static double parseDouble(String key, String v) throws UsageException {
        try { return Double.parseDouble(v.trim()); }
        catch (NumberFormatException e) { throw new UsageException(key + " expects a number, got '" + v + "'"); }
    }

    private static URI parseProxy(String v) throws UsageException {
        try { return YamlConfigLoader.parseProxy(v); }
        catch (IllegalArgumentException e) { throw new UsageException(e.getMessage()); }
    }

    private static Set<Integer> parseCodes(String v) throws UsageException {
        try { return YamlConfigLoader.parseStatusCodes(YamlConfigLoader.splitCsv(v)); }
        catch (IllegalArgumentException e) { throw new UsageException(e.getMessage()); }
    }

    private static OutputFormat parseFormat(String v) throws UsageException {
        try { return YamlConfigLoader.parseFormat(v); }
        catch (IllegalArgumentException e) { throw new UsageException(e.getMessage()); }
    }

    private static String checkRegex(String v) throws UsageException {
        try {
            Pattern.compile(v);
            return v;
        } catch (PatternSyntaxException e) {
            throw new UsageException("invalid --exclude-pattern: " + e.getDescription() + " in " + v);
        }
    }
}
