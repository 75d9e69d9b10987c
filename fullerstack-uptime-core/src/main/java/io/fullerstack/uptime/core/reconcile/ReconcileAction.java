package io.fullerstack.uptime.core.reconcile;

/**
 * What the reconciler does about one target in one run.
 */
public enum ReconcileAction {
    /** Nothing changed, or nothing to clear. */
    NONE,
    /** Create the flag, then send the down notification. */
    RAISE_ALERT,
    /** Delete the flag, then send the recovery notification. */
    CLEAR_ALERT
}
