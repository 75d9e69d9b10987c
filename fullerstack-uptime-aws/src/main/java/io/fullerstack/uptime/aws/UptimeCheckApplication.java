package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.config.BackendType;
import io.fullerstack.uptime.core.config.ConfigurationException;
import io.fullerstack.uptime.core.config.UptimeConfig;
import io.fullerstack.uptime.core.local.LocalMonitorBackend;
import io.fullerstack.uptime.core.probe.HttpProber;
import io.fullerstack.uptime.core.run.RunCoordinator;
import io.fullerstack.uptime.core.run.RunReport;
import io.fullerstack.uptime.core.run.RunReportJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;

import java.time.Clock;
import java.util.Map;

/**
 * Uptime Check - one evaluation pass over the configured URLs.
 * <p>
 * Meant to be triggered by an external scheduler (cron, EventBridge, Kubernetes CronJob).
 * Reads its configuration from the environment (see {@link UptimeConfig}), prints the
 * run report as JSON on stdout and exits 0 when the run completed, 1 when it could not start.
 * {@code AWS_REGION} selects the region for the AWS clients; without it the SDK default
 * region chain applies.
 * <p>
 * <b>Flow:</b>
 * <pre>
 * environment → UptimeConfig
 *     ↓
 * backend (AWS: S3 + SNS, local: files + log)
 *     ↓
 * RunCoordinator.run()  →  probe → flag lookup → reconcile → record
 *     ↓
 * report JSON on stdout
 * </pre>
 */
public class UptimeCheckApplication {

    private static final Logger logger = LoggerFactory.getLogger(UptimeCheckApplication.class);

    public static void main(String[] args) {
        RunReport report = run(System.getenv());
        System.out.println(new RunReportJson().toJson(report));
        System.exit(report.success() ? 0 : 1);
    }

    /**
     * Runs one pass using the given environment.
     */
    public static RunReport run(Map<String, String> env) {
        UptimeConfig config;
        try {
            config = UptimeConfig.fromEnvironment(env);
            config.requireRunnable();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return RunReport.failed(e.getMessage());
        }

        logger.info("Uptime check starting: backend={}, targets={}, flags={}, destination={}",
            config.backend(), config.targetList(), config.flagNamespace(), config.notificationDestination());

        HttpProber prober = new HttpProber(config.probeSettings());
        Clock clock = Clock.systemUTC();

        if (config.backend() == BackendType.LOCAL) {
            return new RunCoordinator(new LocalMonitorBackend(config.localRoot()), prober, clock).run(config);
        }

        try (AwsMonitorBackend backend = AwsMonitorBackend.create(regionFrom(env))) {
            return new RunCoordinator(backend, prober, clock).run(config);
        } catch (SdkException e) {
            logger.error("Failed to initialize AWS clients", e);
            return RunReport.failed("Failed to initialize AWS clients: " + e.getMessage());
        }
    }

    /**
     * Region named by {@code AWS_REGION}, or null to fall back to the SDK's default region chain.
     */
    static Region regionFrom(Map<String, String> env) {
        String region = env.get("AWS_REGION");
        if (region == null || region.isBlank()) {
            return null;
        }
        return Region.of(region.trim());
    }
}
