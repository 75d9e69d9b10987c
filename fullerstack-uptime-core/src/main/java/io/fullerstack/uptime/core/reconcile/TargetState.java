package io.fullerstack.uptime.core.reconcile;

/**
 * Resting states of a monitored target, as seen through its flag.
 * <p>
 * "Up but previously down" is not a state; it is the
 * {@code DOWN_FLAGGED → UP_CLEAN} transition.
 */
public enum TargetState {
    /** No flag: last observed up (or never observed). */
    UP_CLEAN,
    /** Flag exists: last observed down and already alerted. */
    DOWN_FLAGGED;

    public static TargetState fromFlag(boolean flagExists) {
        return flagExists ? DOWN_FLAGGED : UP_CLEAN;
    }

    public static TargetState fromProbe(boolean reachable) {
        return reachable ? UP_CLEAN : DOWN_FLAGGED;
    }
}
