package io.fullerstack.uptime.core.local;

import com.sun.net.httpserver.HttpServer;
import io.fullerstack.uptime.core.config.BackendType;
import io.fullerstack.uptime.core.config.UptimeConfig;
import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.TargetKey;
import io.fullerstack.uptime.core.probe.HttpProber;
import io.fullerstack.uptime.core.reconcile.ReconcileAction;
import io.fullerstack.uptime.core.run.EvaluationRecord;
import io.fullerstack.uptime.core.run.RunCoordinator;
import io.fullerstack.uptime.core.run.RunReport;
import io.fullerstack.uptime.core.store.FlagBodyCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end runs of the local backend against a loopback HTTP server.
 */
class LocalMonitorBackendTest {

    private static final Instant NOW = Instant.parse("2024-06-10T08:15:30Z");

    @TempDir
    Path root;

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private String target;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/health", exchange -> {
            byte[] body = "ok".getBytes();
            exchange.sendResponseHeaders(status.get(), body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.start();
        target = "http://127.0.0.1:" + server.getAddress().getPort() + "/health";

        Files.createDirectories(root.resolve("ping-config"));
        Files.writeString(root.resolve("ping-config/urls.json"), "{\"urls\": [\"" + target + "\"]}");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private UptimeConfig config() {
        return UptimeConfig.builder()
            .notificationDestination("local-alerts")
            .probeTimeout(Duration.ofSeconds(5))
            .backend(BackendType.LOCAL)
            .localRoot(root)
            .build();
    }

    @Test
    void shouldRaiseSuppressAndClearAcrossRuns() {
        // Given
        LocalMonitorBackend backend = new LocalMonitorBackend(root);
        RunCoordinator coordinator = new RunCoordinator(backend,
            new HttpProber(config().probeSettings()), Clock.fixed(NOW, ZoneOffset.UTC));
        TargetKey key = new TargetKey("127.0.0.1_" + server.getAddress().getPort());
        FileFlagStore flags = new FileFlagStore(root.resolve("ping-flags"), new FlagBodyCodec());

        // When: target fails twice, then recovers
        status.set(500);
        RunReport first = coordinator.run(config());
        RunReport second = coordinator.run(config());
        boolean flaggedWhileDown = flags.lookup(key).exists();
        status.set(200);
        RunReport third = coordinator.run(config());

        // Then
        EvaluationRecord raised = first.records().get(0);
        assertThat(raised.action()).isEqualTo(ReconcileAction.RAISE_ALERT);
        assertThat(raised.probeResult().statusCode()).isEqualTo(500);
        assertThat(second.records().get(0).action()).isEqualTo(ReconcileAction.NONE);
        assertThat(second.records().get(0).flagExistedBefore()).isTrue();
        assertThat(flaggedWhileDown).isTrue();

        EvaluationRecord cleared = third.records().get(0);
        assertThat(cleared.action()).isEqualTo(ReconcileAction.CLEAR_ALERT);
        assertThat(cleared.error()).isNull();
        assertThat(flags.lookup(key).exists()).isFalse();
    }

    @Test
    void shouldStampFlagWithRunClock() {
        status.set(503);
        LocalMonitorBackend backend = new LocalMonitorBackend(root);

        new RunCoordinator(backend, new HttpProber(config().probeSettings()), Clock.fixed(NOW, ZoneOffset.UTC))
            .run(config());

        FileFlagStore flags = new FileFlagStore(root.resolve("ping-flags"), new FlagBodyCodec());
        TargetKey key = new TargetKey("127.0.0.1_" + server.getAddress().getPort());
        assertThat(flags.read(key)).contains(new DownFlag(key, NOW.getEpochSecond(), DownFlag.DOWN));
    }

    @Test
    void shouldFailRunWhenListIsMissing() throws IOException {
        Files.delete(root.resolve("ping-config/urls.json"));

        RunReport report = new RunCoordinator(new LocalMonitorBackend(root),
            new HttpProber(config().probeSettings()), Clock.systemUTC()).run(config());

        assertThat(report.success()).isFalse();
        assertThat(report.message()).startsWith("Error: URL list not found");
    }

    @Test
    void shouldFailRunWhenListHasEntryWithoutHost() throws IOException {
        // Given
        Files.writeString(root.resolve("ping-config/urls.json"), "{\"urls\": [\"https://\", \"http:///path\"]}");

        // When
        RunReport report = new RunCoordinator(new LocalMonitorBackend(root),
            new HttpProber(config().probeSettings()), Clock.systemUTC()).run(config());

        // Then: rejected as configuration, never reported as a flag store problem
        assertThat(report.success()).isFalse();
        assertThat(report.message()).contains("entry 0").contains("urls.json");
        assertThat(report.records()).isEmpty();
        assertThat(root.resolve("ping-flags")).doesNotExist();
    }
}
