package io.fullerstack.uptime.core.probe;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for HttpProber against a local JDK HttpServer.
 */
class HttpProberTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/ok", exchange -> respond(exchange, 200));
        server.createContext("/no-content", exchange -> respond(exchange, 204));
        server.createContext("/broken", exchange -> respond(exchange, 500));
        server.createContext("/missing", exchange -> respond(exchange, 404));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", baseUrl + "/ok");
            respond(exchange, 301);
        });
        server.createContext("/not-modified", exchange -> {
            exchange.sendResponseHeaders(304, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200);
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
    }

    private void respond(HttpExchange exchange, int status) throws IOException {
        lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
        if (status == 204) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] body = "ok".getBytes();
        exchange.sendResponseHeaders(status, body.length);
        exchange.getResponseBody().write(body);
        exchange.close();
    }

    private ProbeResult probe(String path) {
        return new HttpProber(ProbeSettings.defaults()).probe(MonitoredTarget.of(baseUrl + path));
    }

    @Test
    void shouldReportReachableFor2xx() {
        ProbeResult result = probe("/ok");

        assertThat(result.reachable()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.error()).isNull();

        assertThat(probe("/no-content").reachable()).isTrue();
    }

    @Test
    void shouldSendIdentifyingUserAgent() {
        new HttpProber(new ProbeSettings(Duration.ofSeconds(5), "uptime-test-agent"))
            .probe(MonitoredTarget.of(baseUrl + "/ok"));

        assertThat(lastUserAgent.get()).isEqualTo("uptime-test-agent");
    }

    @Test
    void shouldReportHttpErrorWithStatusCode() {
        ProbeResult result = probe("/broken");

        assertThat(result.reachable()).isFalse();
        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.error()).isEqualTo("HTTP Error 500");

        assertThat(probe("/missing").statusCode()).isEqualTo(404);
    }

    @Test
    void shouldFollowRedirects() {
        ProbeResult result = probe("/moved");

        assertThat(result.reachable()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
    }

    @Test
    void shouldTreatFinal3xxAsDown() {
        ProbeResult result = probe("/not-modified");

        assertThat(result.reachable()).isFalse();
        assertThat(result.statusCode()).isEqualTo(304);
    }

    @Test
    void shouldReportTimeoutWithoutStatusCode() {
        ProbeResult result = new HttpProber(ProbeSettings.withTimeout(Duration.ofMillis(200)))
            .probe(MonitoredTarget.of(baseUrl + "/slow"));

        assertThat(result.reachable()).isFalse();
        assertThat(result.statusCode()).isNull();
        assertThat(result.error()).contains("Timed out");
    }

    @Test
    void shouldReportConnectionRefused() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getLoopbackAddress())) {
            freePort = socket.getLocalPort();
        }

        ProbeResult result = new HttpProber(ProbeSettings.withTimeout(Duration.ofSeconds(2)))
            .probe(MonitoredTarget.of("http://127.0.0.1:" + freePort + "/"));

        assertThat(result.reachable()).isFalse();
        assertThat(result.statusCode()).isNull();
        assertThat(result.error()).isNotBlank();
    }

    @Test
    void shouldNeverThrowForMalformedUrl() {
        ProbeResult result = new HttpProber(ProbeSettings.defaults())
            .probe(MonitoredTarget.of("exa mple.com/with spaces"));

        assertThat(result.reachable()).isFalse();
        assertThat(result.statusCode()).isNull();
        assertThat(result.error()).startsWith("Invalid URL");
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> ProbeSettings.withTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
