package io.fullerstack.uptime.core.model;

import java.util.Objects;

/**
 * A URL under monitoring, exactly as it appears in the target list.
 * <p>
 * The configured form is kept verbatim because it is what operators see in
 * notification subjects and in the run report. Probing uses {@link #normalizedUrl()},
 * flag naming uses {@link #key()}.
 *
 * @param url configured URL, with or without scheme (e.g. "example.com", "https://example.com/health");
 *            must name a host
 */
public record MonitoredTarget(String url) {

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    public MonitoredTarget {
        Objects.requireNonNull(url, "url cannot be null");
        url = url.trim();
        if (url.isEmpty()) {
            throw new IllegalArgumentException("url cannot be blank");
        }
        TargetKey.fromUrl(url);
    }

    public static MonitoredTarget of(String url) {
        return new MonitoredTarget(url);
    }

    /**
     * URL to probe: the configured URL, prefixed with {@code https://} when it carries no http(s) scheme.
     */
    public String normalizedUrl() {
        if (hasScheme(url)) {
            return url;
        }
        return HTTPS + url;
    }

    /**
     * Flag key derived from the host part of the URL.
     */
    public TargetKey key() {
        return TargetKey.fromUrl(url);
    }

    static boolean hasScheme(String url) {
        String lower = url.toLowerCase();
        return lower.startsWith(HTTP) || lower.startsWith(HTTPS);
    }

    static String stripScheme(String url) {
        String lower = url.toLowerCase();
        if (lower.startsWith(HTTPS)) {
            return url.substring(HTTPS.length());
        }
        if (lower.startsWith(HTTP)) {
            return url.substring(HTTP.length());
        }
        return url;
    }

    @Override
    public String toString() {
        return url;
    }
}
