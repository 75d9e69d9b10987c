package io.fullerstack.uptime.core.model;

import java.util.Objects;

/**
 * Identity of a monitored target for flag naming.
 * <p>
 * Derived from the host part of the URL: scheme removed, path dropped,
 * {@code :} replaced by {@code _} so host:port pairs are safe object names.
 * <pre>
 * https://example.com/health  →  example.com
 * localhost:8080/status       →  localhost_8080
 * </pre>
 * Two URLs on the same host share a key.
 *
 * @param value the key (never blank)
 */
public record TargetKey(String value) {

    public TargetKey {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value cannot be blank");
        }
    }

    /**
     * @throws IllegalArgumentException if the URL has no host part
     */
    public static TargetKey fromUrl(String url) {
        Objects.requireNonNull(url, "url cannot be null");
        String host = MonitoredTarget.stripScheme(url.trim());
        int slash = host.indexOf('/');
        if (slash >= 0) {
            host = host.substring(0, slash);
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("URL has no host: '" + url + "'");
        }
        return new TargetKey(host.replace(':', '_'));
    }

    @Override
    public String toString() {
        return value;
    }
}
