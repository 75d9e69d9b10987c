package io.fullerstack.uptime.core.model;

import java.util.Objects;

/**
 * Three-way result of asking a flag store whether a target is flagged down.
 * <p>
 * A storage outage is reported as {@link FlagPresence#FAILED}, never as
 * {@link FlagPresence#ABSENT}: an unreadable flag says nothing about the target.
 *
 * @param presence PRESENT, ABSENT or FAILED
 * @param error    failure description, only set for FAILED
 */
public record FlagLookup(FlagPresence presence, String error) {

    private static final FlagLookup PRESENT = new FlagLookup(FlagPresence.PRESENT, null);
    private static final FlagLookup ABSENT = new FlagLookup(FlagPresence.ABSENT, null);

    public FlagLookup {
        Objects.requireNonNull(presence, "presence cannot be null");
        if (presence == FlagPresence.FAILED && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("FAILED lookup requires an error description");
        }
        if (presence != FlagPresence.FAILED && error != null) {
            throw new IllegalArgumentException("only FAILED lookups carry an error");
        }
    }

    public static FlagLookup present() {
        return PRESENT;
    }

    public static FlagLookup absent() {
        return ABSENT;
    }

    public static FlagLookup of(boolean exists) {
        return exists ? PRESENT : ABSENT;
    }

    public static FlagLookup failed(String error) {
        return new FlagLookup(FlagPresence.FAILED, error);
    }

    public boolean isFailed() {
        return presence == FlagPresence.FAILED;
    }

    /**
     * @throws IllegalStateException if the lookup failed
     */
    public boolean exists() {
        if (isFailed()) {
            throw new IllegalStateException("flag presence unknown: " + error);
        }
        return presence == FlagPresence.PRESENT;
    }
}
