package com.urlsentry.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 검증 설정 (.urlsentry.yml / CLI 매핑 대상). 순수 설정 보관용.
 * 세터는 값을 그대로 보관하고, 범위 검사는 validate()에서 한 번에 한다.
 * 엔진은 생성 시 validate()를 호출하므로 잘못된 값은 조용히 보정되지 않고 즉시 실패한다.
 */
public final class CheckConfig {

    public enum OutputFormat { TEXT, JSON }

    public static final int MAX_CONCURRENCY = 1000;
    public static final int MAX_RETRY_ATTEMPTS = 20;
    public static final long MAX_TIMEOUT_SECONDS = 86_400;

    // ---------- 네트워크 ----------
    private Duration timeout = Duration.ofSeconds(30);     // 시도 1회당 타임아웃
    private int concurrency = Runtime.getRuntime().availableProcessors();
    private boolean useHeadRequests = false;
    private String userAgent;                               // null이면 기본 UA
    private URI proxy;                                      // null이면 시스템 기본
    private boolean insecure = false;                       // TLS 인증서 검증 생략
    private int keepAliveSeconds = 30;                      // 유휴 커넥션 유지 시간
    private int maxPooledConnections = 0;                   // 0 = JDK 기본(무제한)

    // ---------- 재시도/속도 ----------
    private int retryAttempts = 0;
    private Duration retryDelay = Duration.ofMillis(1000);
    private Duration rateLimitDelay = Duration.ZERO;        // 전역 최소 요청 간격(0이면 제한 없음)

    // ---------- 판정 ----------
    private boolean allowTimeout = false;
    private Set<Integer> allowedStatusCodes = Set.of();
    private List<String> allowlist = List.of();
    private List<Pattern> excludePatterns = List.of();
    private Double failureThreshold;                        // null = 0% (이슈 1건이라도 실패)

    // ---------- 배치/진행률 ----------
    private int batchMin = 2;
    private int batchMax = 100;
    private int progressEvery = 10;

    // ---------- 발견/출력(앱 레이어에서 사용) ----------
    private Set<String> fileTypes;                          // null이면 모든 파일
    private OutputFormat outputFormat = OutputFormat.TEXT;

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isUseHeadRequests() { return useHeadRequests; }
    public String getUserAgent() { return userAgent; }
    public URI getProxy() { return proxy; }
    public boolean isInsecure() { return insecure; }
    public int getKeepAliveSeconds() { return keepAliveSeconds; }
    public int getMaxPooledConnections() { return maxPooledConnections; }
    public int getRetryAttempts() { return retryAttempts; }
    public Duration getRetryDelay() { return retryDelay; }
    public Duration getRateLimitDelay() { return rateLimitDelay; }
    public boolean isAllowTimeout() { return allowTimeout; }
    public Set<Integer> getAllowedStatusCodes() { return allowedStatusCodes; }
    public List<String> getAllowlist() { return allowlist; }
    public List<Pattern> getExcludePatterns() { return excludePatterns; }
    public Double getFailureThreshold() { return failureThreshold; }
    public int getBatchMin() { return batchMin; }
    public int getBatchMax() { return batchMax; }
    public int getProgressEvery() { return progressEvery; }
    public Set<String> getFileTypes() { return fileTypes; }
    public OutputFormat getOutputFormat() { return outputFormat; }

    /** 임계치 미설정이면 0% */
    public double effectiveFailureThreshold() {
        return failureThreshold == null ? 0.0 : failureThreshold;
    }

    // ---------- fluent setters ----------
    public CheckConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CheckConfig setTimeoutSeconds(long seconds) { this.timeout = Duration.ofSeconds(seconds); return this; }
    public CheckConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public CheckConfig setUseHeadRequests(boolean v) { this.useHeadRequests = v; return this; }
    public CheckConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CheckConfig setProxy(URI proxy) { this.proxy = proxy; return this; }
    public CheckConfig setInsecure(boolean v) { this.insecure = v; return this; }
    public CheckConfig setKeepAliveSeconds(int v) { this.keepAliveSeconds = v; return this; }
    public CheckConfig setMaxPooledConnections(int v) { this.maxPooledConnections = v; return this; }
    public CheckConfig setRetryAttempts(int v) { this.retryAttempts = v; return this; }
    public CheckConfig setRetryDelay(Duration d) { this.retryDelay = d; return this; }
    public CheckConfig setRateLimitDelay(Duration d) { this.rateLimitDelay = d; return this; }
    public CheckConfig setAllowTimeout(boolean v) { this.allowTimeout = v; return this; }

    public CheckConfig setAllowedStatusCodes(Set<Integer> codes) {
        this.allowedStatusCodes = (codes == null) ? Set.of() : Set.copyOf(codes);
        return this;
    }

    public CheckConfig setAllowlist(List<String> entries) {
        List<String> out = new ArrayList<>();
        if (entries != null) {
            for (String e : entries) if (e != null && !e.isBlank()) out.add(e.trim());
        }
        this.allowlist = List.copyOf(out);
        return this;
    }

    public CheckConfig setExcludePatterns(List<Pattern> patterns) {
        this.excludePatterns = (patterns == null) ? List.of() : List.copyOf(patterns);
        return this;
    }

    /** 정규식 문자열을 컴파일해서 보관. 문법 오류면 PatternSyntaxException(IAE). */
    public CheckConfig setExcludeRegexes(List<String> regexes) {
        List<Pattern> out = new ArrayList<>();
        if (regexes != null) {
            for (String r : regexes) if (r != null && !r.isEmpty()) out.add(Pattern.compile(r));
        }
        this.excludePatterns = List.copyOf(out);
        return this;
    }

    public CheckConfig setFailureThreshold(Double percent) { this.failureThreshold = percent; return this; }
    public CheckConfig setBatchMin(int v) { this.batchMin = v; return this; }
    public CheckConfig setBatchMax(int v) { this.batchMax = v; return this; }
    public CheckConfig setProgressEvery(int v) { this.progressEvery = v; return this; }

    public CheckConfig setFileTypes(Set<String> types) {
        if (types == null) { this.fileTypes = null; return this; }
        Set<String> out = new LinkedHashSet<>();
        for (String t : types) {
            if (t == null) continue;
            String s = t.trim();
            if (s.startsWith(".")) s = s.substring(1);
            out.add(s);
        }
        this.fileTypes = Set.copyOf(out);
        return this;
    }

    public CheckConfig setOutputFormat(OutputFormat f) { this.outputFormat = f; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (timeout.getSeconds() > MAX_TIMEOUT_SECONDS)
            throw new IllegalArgumentException("timeout must be <= " + MAX_TIMEOUT_SECONDS + "s");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (concurrency > MAX_CONCURRENCY)
            throw new IllegalArgumentException("concurrency must be <= " + MAX_CONCURRENCY);
        if (retryAttempts < 0) throw new IllegalArgumentException("retryAttempts must be >= 0");
        if (retryAttempts > MAX_RETRY_ATTEMPTS)
            throw new IllegalArgumentException("retryAttempts must be <= " + MAX_RETRY_ATTEMPTS);
        Objects.requireNonNull(retryDelay, "retryDelay");
        if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must be >= 0");
        Objects.requireNonNull(rateLimitDelay, "rateLimitDelay");
        if (rateLimitDelay.isNegative()) throw new IllegalArgumentException("rateLimitDelay must be >= 0");
        for (Integer code : allowedStatusCodes) {
            if (code == null || code < 100 || code > 599)
                throw new IllegalArgumentException("allowedStatusCodes must be within 100..599: " + code);
        }
        for (Pattern p : excludePatterns) Objects.requireNonNull(p, "excludePatterns element");
        if (failureThreshold != null && (failureThreshold.isNaN() || failureThreshold < 0.0 || failureThreshold > 100.0))
            throw new IllegalArgumentException("failureThreshold must be within 0..100");
        if (batchMin < 1) throw new IllegalArgumentException("batchMin must be >= 1");
        if (batchMax < batchMin) throw new IllegalArgumentException("batchMax must be >= batchMin");
        if (progressEvery < 1) throw new IllegalArgumentException("progressEvery must be >= 1");
        if (keepAliveSeconds < 1) throw new IllegalArgumentException("keepAliveSeconds must be >= 1");
        if (maxPooledConnections < 0) throw new IllegalArgumentException("maxPooledConnections must be >= 0");
        if (proxy != null && (proxy.getHost() == null || proxy.getPort() < 0))
            throw new IllegalArgumentException("proxy must be host:port, got " + proxy);
        Objects.requireNonNull(outputFormat, "outputFormat");
    }

    // ---------- helpers ----------
    public static CheckConfig defaults() { return new CheckConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
