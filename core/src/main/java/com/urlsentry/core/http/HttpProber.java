package com.urlsentry.core.http;

import com.urlsentry.core.api.IUrlProbe;
import com.urlsentry.core.model.CheckConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * java.net.http 기반 URL 프로브.
 * 클라이언트 하나를 모든 워커가 공유한다(커넥션 풀 재사용).
 * 본문은 읽지 않고 버린다. 리다이렉트는 따라간 뒤 최종 코드로 판정.
 */
public class HttpProber implements IUrlProbe {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProber.class);

    public static final String DEFAULT_USER_AGENT = "urlsentry/" + loadVersion();

    /** 테스트/모킹용 송신 훅: 요청을 보내고 최종 상태코드를 돌려준다. */
    @FunctionalInterface
    public interface HttpSender {
        int send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration timeout;
    private final boolean head;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpProber(CheckConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.head = config.isUseHeadRequests();
        this.userAgent = resolveUserAgent(config);
        this.client = buildClient(config);
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpProber(CheckConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.head = config.isUseHeadRequests();
        this.userAgent = resolveUserAgent(config);
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public ProbeResult probe(String url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        final HttpRequest req;
        try {
            req = buildRequest(url);
        } catch (IllegalArgumentException e) {
            return ProbeResult.invalidUrl("invalid URL: " + e.getMessage());
        }

        long start = System.nanoTime();
        try {
            int status = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
            return ProbeResult.status(status, elapsedMs(start));
        } catch (HttpTimeoutException e) {
            return ProbeResult.timeout(elapsedMs(start));
        } catch (IOException e) {
            return ProbeResult.connection(describe(e), elapsedMs(start));
        } catch (IllegalArgumentException e) {
            return ProbeResult.invalidUrl("invalid URL: " + e.getMessage());
        }
    }

    HttpRequest buildRequest(String url) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", userAgent);
        if (head) b.method("HEAD", HttpRequest.BodyPublishers.noBody());
        else b.GET();
        return b.build();
    }

    String userAgent() { return userAgent; }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }

    /** 원인 체인에서 처음 나오는 메시지. 없으면 예외 클래스명. */
    static String describe(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String m = t.getMessage();
            if (m != null && !m.isBlank()) return m;
            if (t.getCause() == t) break;
        }
        return e.getClass().getSimpleName();
    }

    private static String resolveUserAgent(CheckConfig config) {
        String ua = config.getUserAgent();
        return (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua;
    }

    /**
     * JDK HttpClient가 시스템 속성으로만 받는 설정(연결 풀, 호스트 이름 검증)을 프로세스 전체에 건다.
     * 이미 지정된 속성은 건드리지 않는다. 속성은 JDK가 처음 읽을 때 고정되므로
     * 첫 HttpClient 생성 전에, 프로세스를 소유한 진입점에서만 호출한다.
     *
     * <p>insecure면 호스트 이름 검증이 이 JVM의 모든 HttpClient에서 꺼진다.
     */
    public static void applyProcessWideSettings(CheckConfig config) {
        setIfAbsent("jdk.httpclient.keepalive.timeout", String.valueOf(config.getKeepAliveSeconds()));
        if (config.getMaxPooledConnections() > 0) {
            setIfAbsent("jdk.httpclient.connectionPoolSize", String.valueOf(config.getMaxPooledConnections()));
        }
        if (config.isInsecure()) {
            setIfAbsent("jdk.internal.httpclient.disableHostnameVerification", "true");
        }
    }

    private static HttpClient buildClient(CheckConfig config) {
        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout());

        URI proxy = config.getProxy();
        if (proxy != null) {
            b.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), proxy.getPort())));
            LOG.info("Using proxy {}:{}", proxy.getHost(), proxy.getPort());
        }
        if (config.isInsecure()) {
            // 인증서 검증만 이 클라이언트에 한정. 호스트 이름 검증은 applyProcessWideSettings 몫
            b.sslContext(trustAllContext());
            LOG.warn("TLS certificate verification is disabled (--insecure)");
        }
        return b.build();
    }

    private static void setIfAbsent(String key, String value) {
        if (System.getProperty(key) == null) System.setProperty(key, value);
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = { new X509TrustManager() {
            @Override public void checkClientTrusted(X509Certificate[] chain, String authType) { }
            @Override public void checkServerTrusted(X509Certificate[] chain, String authType) { }
            @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
        } };
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, trustAll, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create insecure TLS context", e);
        }
    }

    private static String loadVersion() {
        try (InputStream in = HttpProber.class.getResourceAsStream("/urlsentry-version.properties")) {
            if (in == null) return "dev";
            Properties p = new Properties();
            p.load(in);
            String v = p.getProperty("version");
            return (v == null || v.isBlank() || v.startsWith("${")) ? "dev" : v.trim();
        } catch (IOException e) {
            LOG.debug("Version resource unreadable: {}", e.toString());
            return "dev";
        }
    }
}
