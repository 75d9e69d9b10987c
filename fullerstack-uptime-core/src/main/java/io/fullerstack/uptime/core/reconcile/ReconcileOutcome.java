package io.fullerstack.uptime.core.reconcile;

import java.util.Objects;

/**
 * Result of applying a {@link Decision}.
 * <p>
 * When {@code notificationError} is set the flag mutation went through but the
 * notification did not: a partial failure the caller must report.
 *
 * @param decision          decision that was applied
 * @param notificationError description of the failed notification, or null
 */
public record ReconcileOutcome(Decision decision, String notificationError) {

    public ReconcileOutcome {
        Objects.requireNonNull(decision, "decision cannot be null");
    }

    public static ReconcileOutcome completed(Decision decision) {
        return new ReconcileOutcome(decision, null);
    }

    public static ReconcileOutcome notificationFailed(Decision decision, String error) {
        return new ReconcileOutcome(decision, error);
    }

    public ReconcileAction action() {
        return decision.action();
    }

    public boolean isPartialFailure() {
        return notificationError != null;
    }
}
