package io.fullerstack.uptime.core.reconcile;

import java.util.Objects;

/**
 * A state transition and the action it requires.
 *
 * @param before state implied by the flag snapshot
 * @param after  state implied by the probe
 * @param action action for the transition
 */
public record Decision(TargetState before, TargetState after, ReconcileAction action) {

    public Decision {
        Objects.requireNonNull(before, "before cannot be null");
        Objects.requireNonNull(after, "after cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }

    public boolean isTransition() {
        return before != after;
    }
}
