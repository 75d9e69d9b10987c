package io.fullerstack.uptime.core.model;

/**
 * Outcome of a single reachability probe.
 * <p>
 * Produced fresh on every run and never persisted.
 *
 * @param reachable  true only for a final 2xx response
 * @param statusCode HTTP status of the final response, null when no response was received
 * @param error      failure description, null when reachable
 */
public record ProbeResult(
    boolean reachable,
    Integer statusCode,
    String error
) {

    public static ProbeResult up(int statusCode) {
        return new ProbeResult(true, statusCode, null);
    }

    /**
     * Server answered, but not with a 2xx.
     */
    public static ProbeResult httpError(int statusCode, String error) {
        return new ProbeResult(false, statusCode, error);
    }

    /**
     * No response at all (timeout, DNS, refused connection, malformed URL).
     */
    public static ProbeResult unreachable(String error) {
        return new ProbeResult(false, null, error);
    }

    public boolean hasStatusCode() {
        return statusCode != null;
    }
}
