package com.urlsentry.core.http;

import com.sun.net.httpserver.HttpServer;
import com.urlsentry.core.model.CheckConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpProberTest {

    private HttpServer server;
    private ExecutorService serverPool;

    @AfterEach
    void stopServer() {
        if (server != null) server.stop(0);
        if (serverPool != null) serverPool.shutdownNow();
    }

    @Test
    void get_with_default_user_agent() throws Exception {
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        HttpProber prober = new HttpProber(new CheckConfig(), req -> { seen.set(req); return 200; });

        ProbeResult r = prober.probe("https://a.test/ok");

        assertThat(r.isResponse()).isTrue();
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(seen.get().method()).isEqualTo("GET");
        assertThat(seen.get().headers().firstValue("User-Agent")).hasValue(HttpProber.DEFAULT_USER_AGENT);
        assertThat(seen.get().timeout()).hasValue(Duration.ofSeconds(30));
    }

    @Test
    void head_mode_and_custom_user_agent() throws Exception {
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        CheckConfig cfg = new CheckConfig().setUseHeadRequests(true).setUserAgent("my-bot/1.0");
        HttpProber prober = new HttpProber(cfg, req -> { seen.set(req); return 204; });

        prober.probe("https://a.test/");

        assertThat(seen.get().method()).isEqualTo("HEAD");
        assertThat(seen.get().headers().firstValue("User-Agent")).hasValue("my-bot/1.0");
    }

    @Test
    void timeout_exception_maps_to_timeout() throws Exception {
        HttpProber prober = new HttpProber(new CheckConfig(), req -> {
            throw new HttpTimeoutException("request timed out");
        });
        ProbeResult r = prober.probe("https://slow.test/");
        assertThat(r.failure()).isEqualTo(ProbeResult.Failure.TIMEOUT);
        assertThat(r.statusCode()).isEqualTo(-1);
    }

    @Test
    void io_exception_maps_to_connection_with_message() throws Exception {
        HttpProber prober = new HttpProber(new CheckConfig(), req -> {
            throw new ConnectException("Connection refused");
        });
        ProbeResult r = prober.probe("https://down.test/");
        assertThat(r.failure()).isEqualTo(ProbeResult.Failure.CONNECTION);
        assertThat(r.description()).isEqualTo("Connection refused");
    }

    @Test
    void malformed_url_is_invalid_without_sending() throws Exception {
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        HttpProber prober = new HttpProber(new CheckConfig(), req -> { seen.set(req); return 200; });

        ProbeResult r = prober.probe("http://bad host/x");

        assertThat(r.failure()).isEqualTo(ProbeResult.Failure.INVALID_URL);
        assertThat(r.description()).startsWith("invalid URL");
        assertThat(seen.get()).isNull();
    }

    private static final String HOSTNAME_CHECK_OFF = "jdk.internal.httpclient.disableHostnameVerification";

    @Test
    void insecure_client_leaves_jvm_properties_alone() {
        String before = System.clearProperty(HOSTNAME_CHECK_OFF);
        try {
            new HttpProber(new CheckConfig().setInsecure(true)).close();

            assertThat(System.getProperty(HOSTNAME_CHECK_OFF)).isNull();
        } finally {
            if (before != null) System.setProperty(HOSTNAME_CHECK_OFF, before);
        }
    }

    @Test
    void process_wide_settings_keep_values_already_set() {
        String before = System.setProperty(HOSTNAME_CHECK_OFF, "false");
        try {
            HttpProber.applyProcessWideSettings(new CheckConfig().setInsecure(true));

            assertThat(System.getProperty(HOSTNAME_CHECK_OFF)).isEqualTo("false");
        } finally {
            if (before == null) System.clearProperty(HOSTNAME_CHECK_OFF);
            else System.setProperty(HOSTNAME_CHECK_OFF, before);
        }
    }

    @Test
    void describe_walks_cause_chain() {
        Exception e = new RuntimeException(null, new java.io.IOException("no route"));
        assertThat(HttpProber.describe(e)).isEqualTo("no route");
        assertThat(HttpProber.describe(new java.io.IOException())).isEqualTo("IOException");
    }

    @Test
    void real_client_against_local_server() throws Exception {
        // 1) 로컬 서버
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverPool = Executors.newCachedThreadPool();
        server.setExecutor(serverPool);
        server.createContext("/ok", ex -> { ex.sendResponseHeaders(200, -1); ex.close(); });
        server.createContext("/missing", ex -> { ex.sendResponseHeaders(404, -1); ex.close(); });
        server.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/ok");
            ex.sendResponseHeaders(301, -1);
            ex.close();
        });
        server.createContext("/slow", ex -> {
            try { Thread.sleep(2000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
            ex.sendResponseHeaders(200, -1);
            ex.close();
        });
        server.start();
        String base = "http://127.0.0.1:" + server.getAddress().getPort();

        // 2) 실제 HttpClient
        HttpProber prober = new HttpProber(new CheckConfig().setTimeout(Duration.ofMillis(500)));

        // 3) 검증
        assertThat(prober.probe(base + "/ok").statusCode()).isEqualTo(200);
        assertThat(prober.probe(base + "/missing").statusCode()).isEqualTo(404);
        assertThat(prober.probe(base + "/moved").statusCode()).isEqualTo(200);
        assertThat(prober.probe(base + "/slow").failure()).isEqualTo(ProbeResult.Failure.TIMEOUT);
    }

    @Test
    void refused_port_is_connection_error() throws Exception {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        HttpProber prober = new HttpProber(new CheckConfig().setTimeout(Duration.ofSeconds(2)));
        ProbeResult r = prober.probe("http://127.0.0.1:" + port + "/");
        assertThat(r.failure()).isEqualTo(ProbeResult.Failure.CONNECTION);
        assertThat(r.description()).isNotBlank();
    }
}
