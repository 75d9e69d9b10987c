package io.fullerstack.uptime.core.config;

import io.fullerstack.uptime.core.probe.ProbeSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration bundle for one run.
 * <p>
 * Identifies where the target list lives, the namespace holding the flags and the
 * destination for notifications. The destination may be absent here; the run
 * refuses to start without it (see {@link #requireRunnable()}), so a misconfigured
 * deployment still produces a report explaining why nothing was checked.
 *
 * <h3>Environment variables ({@link #fromEnvironment(Map)}):</h3>
 * <pre>
 * CONFIG_BUCKET          container of the URL list       (default: ping-config)
 * CONFIG_KEY             name of the URL list            (default: urls.json)
 * FLAGS_BUCKET           flag namespace                  (default: ping-flags)
 * SNS_TOPIC_ARN          notification destination        (required)
 * PROBE_TIMEOUT_SECONDS  probe timeout                   (default: 10)
 * PROBE_USER_AGENT       probe User-Agent header         (default: Fullerstack Uptime Monitor)
 * UPTIME_BACKEND         aws | local                     (default: aws)
 * UPTIME_LOCAL_ROOT      root directory for local        (default: .uptime)
 * </pre>
 *
 * @param targetList              location of the URL list document
 * @param flagNamespace           bucket or directory holding flags
 * @param notificationDestination topic ARN (or local channel name); null when not configured
 * @param probeSettings           probe timeout and User-Agent
 * @param backend                 which collaborators to wire
 * @param localRoot               root directory for the local backend
 */
public record UptimeConfig(
    ObjectLocation targetList,
    String flagNamespace,
    String notificationDestination,
    ProbeSettings probeSettings,
    BackendType backend,
    Path localRoot
) {
    public static final String DEFAULT_CONFIG_BUCKET = "ping-config";
    public static final String DEFAULT_CONFIG_KEY = "urls.json";
    public static final String DEFAULT_FLAGS_BUCKET = "ping-flags";
    public static final String DEFAULT_LOCAL_ROOT = ".uptime";

    public UptimeConfig {
        Objects.requireNonNull(probeSettings, "probeSettings cannot be null");
        Objects.requireNonNull(backend, "backend cannot be null");
        Objects.requireNonNull(localRoot, "localRoot cannot be null");
    }

    /**
     * Reads the configuration from environment variables.
     *
     * @throws ConfigurationException if a value is present but malformed
     */
    public static UptimeConfig fromEnvironment(Map<String, String> env) {
        String configBucket = env.getOrDefault("CONFIG_BUCKET", DEFAULT_CONFIG_BUCKET);
        String configKey = env.getOrDefault("CONFIG_KEY", DEFAULT_CONFIG_KEY);
        String timeoutValue = env.getOrDefault("PROBE_TIMEOUT_SECONDS",
            String.valueOf(ProbeSettings.DEFAULT_TIMEOUT.toSeconds()));

        long timeoutSeconds;
        try {
            timeoutSeconds = Long.parseLong(timeoutValue.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("PROBE_TIMEOUT_SECONDS must be a whole number, got '" + timeoutValue + "'", e);
        }
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException("PROBE_TIMEOUT_SECONDS must be positive, got " + timeoutSeconds);
        }

        return builder()
            .targetList(location(configBucket, configKey))
            .flagNamespace(env.getOrDefault("FLAGS_BUCKET", DEFAULT_FLAGS_BUCKET))
            .notificationDestination(env.get("SNS_TOPIC_ARN"))
            .probeTimeout(Duration.ofSeconds(timeoutSeconds))
            .userAgent(env.getOrDefault("PROBE_USER_AGENT", ProbeSettings.DEFAULT_USER_AGENT))
            .backend(BackendType.parse(env.getOrDefault("UPTIME_BACKEND", "aws")))
            .localRoot(Path.of(env.getOrDefault("UPTIME_LOCAL_ROOT", DEFAULT_LOCAL_ROOT)))
            .build();
    }

    private static ObjectLocation location(String container, String name) {
        if (container == null || container.isBlank() || name == null || name.isBlank()) {
            return null;
        }
        return new ObjectLocation(container, name);
    }

    /**
     * Checks the run preconditions.
     *
     * @throws ConfigurationException naming the first missing setting
     */
    public void requireRunnable() {
        if (notificationDestination == null || notificationDestination.isBlank()) {
            throw new ConfigurationException("SNS_TOPIC_ARN environment variable is not set");
        }
        if (targetList == null) {
            throw new ConfigurationException("CONFIG_BUCKET and CONFIG_KEY must both be set");
        }
        if (flagNamespace == null || flagNamespace.isBlank()) {
            throw new ConfigurationException("FLAGS_BUCKET must be set");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ObjectLocation targetList = new ObjectLocation(DEFAULT_CONFIG_BUCKET, DEFAULT_CONFIG_KEY);
        private String flagNamespace = DEFAULT_FLAGS_BUCKET;
        private String notificationDestination;
        private Duration probeTimeout = ProbeSettings.DEFAULT_TIMEOUT;
        private String userAgent = ProbeSettings.DEFAULT_USER_AGENT;
        private BackendType backend = BackendType.AWS;
        private Path localRoot = Path.of(DEFAULT_LOCAL_ROOT);

        public Builder targetList(ObjectLocation targetList) {
            this.targetList = targetList;
            return this;
        }

        public Builder targetList(String container, String name) {
            return targetList(new ObjectLocation(container, name));
        }

        public Builder flagNamespace(String flagNamespace) {
            this.flagNamespace = flagNamespace;
            return this;
        }

        public Builder notificationDestination(String notificationDestination) {
            this.notificationDestination = notificationDestination;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder backend(BackendType backend) {
            this.backend = backend;
            return this;
        }

        public Builder localRoot(Path localRoot) {
            this.localRoot = localRoot;
            return this;
        }

        public UptimeConfig build() {
            ProbeSettings probeSettings;
            try {
                probeSettings = new ProbeSettings(probeTimeout, userAgent);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException("Invalid probe settings: " + e.getMessage(), e);
            }
            return new UptimeConfig(
                targetList,
                flagNamespace,
                notificationDestination,
                probeSettings,
                backend,
                localRoot
            );
        }
    }
}
