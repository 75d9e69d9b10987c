package io.fullerstack.uptime.core.probe;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for HTTP probing.
 *
 * @param timeout   connect and response timeout for one probe (default: 10 seconds)
 * @param userAgent value of the User-Agent header identifying the monitor
 */
public record ProbeSettings(
    Duration timeout,
    String userAgent
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_USER_AGENT = "Fullerstack Uptime Monitor";

    public ProbeSettings {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(userAgent, "userAgent cannot be null");

        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be blank");
        }
    }

    public static ProbeSettings defaults() {
        return new ProbeSettings(DEFAULT_TIMEOUT, DEFAULT_USER_AGENT);
    }

    public static ProbeSettings withTimeout(Duration timeout) {
        return new ProbeSettings(timeout, DEFAULT_USER_AGENT);
    }
}
