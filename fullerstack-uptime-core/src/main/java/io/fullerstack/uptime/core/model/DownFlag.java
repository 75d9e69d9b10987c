package io.fullerstack.uptime.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted marker meaning "this target was last observed down".
 * <p>
 * Existence is the only thing that matters between runs; the timestamp and
 * status travel with the flag for operators inspecting the store.
 *
 * @param key       target the flag belongs to
 * @param timestamp epoch seconds at which the outage was first seen
 * @param status    always {@value #DOWN}
 */
public record DownFlag(TargetKey key, long timestamp, String status) {

    public static final String DOWN = "down";

    public DownFlag {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp cannot be negative");
        }
    }

    public static DownFlag raisedAt(TargetKey key, Instant now) {
        return new DownFlag(key, now.getEpochSecond(), DOWN);
    }
}
