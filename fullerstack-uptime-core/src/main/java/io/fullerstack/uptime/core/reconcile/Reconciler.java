package io.fullerstack.uptime.core.reconcile;

import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;
import io.fullerstack.uptime.core.notify.AlertMessage;
import io.fullerstack.uptime.core.notify.Notifier;
import io.fullerstack.uptime.core.store.FlagStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Decides and applies the alerting action for one target.
 *
 * <h3>Transition table:</h3>
 * <pre>
 * reachable  flag    action        side effects
 * ---------  ------  ------------  ---------------------------------
 * false      absent  RAISE_ALERT   create flag, send DOWN message
 * false      exists  NONE          (already alerted, still down)
 * true       exists  CLEAR_ALERT   delete flag, send RESOLVED message
 * true       absent  NONE          (healthy)
 * </pre>
 *
 * <h3>Error Handling:</h3>
 * <ul>
 *   <li>The flag store is mutated first; a failure there propagates and no message is sent</li>
 *   <li>A notifier failure after a successful mutation is returned as a partial failure
 *       on the {@link ReconcileOutcome}; the flag stays as written</li>
 * </ul>
 *
 * <p>The flag snapshot passed in is trusted: existence is not re-checked between the
 * decision and its side effects.
 *
 * @see FlagStore
 * @see Notifier
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final FlagStore flagStore;
    private final Notifier notifier;
    private final Clock clock;

    public Reconciler(FlagStore flagStore, Notifier notifier, Clock clock) {
        this.flagStore = Objects.requireNonNull(flagStore, "flagStore cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Pure transition function; depends only on its two arguments.
     */
    public static Decision decide(boolean reachable, boolean flagExists) {
        TargetState before = TargetState.fromFlag(flagExists);
        TargetState after = TargetState.fromProbe(reachable);

        ReconcileAction action;
        if (before == TargetState.UP_CLEAN && after == TargetState.DOWN_FLAGGED) {
            action = ReconcileAction.RAISE_ALERT;
        } else if (before == TargetState.DOWN_FLAGGED && after == TargetState.UP_CLEAN) {
            action = ReconcileAction.CLEAR_ALERT;
        } else {
            action = ReconcileAction.NONE;
        }
        return new Decision(before, after, action);
    }

    /**
     * Decides the action for a target and carries it out.
     *
     * @param target      target being evaluated
     * @param probeResult fresh probe outcome
     * @param flagExists  flag snapshot taken before this call
     * @return applied decision, possibly with a notification failure
     * @throws io.fullerstack.uptime.core.store.FlagStoreException if the flag mutation fails
     */
    public ReconcileOutcome reconcile(MonitoredTarget target, ProbeResult probeResult, boolean flagExists) {
        Decision decision = decide(probeResult.reachable(), flagExists);

        switch (decision.action()) {
            case RAISE_ALERT:
                flagStore.create(DownFlag.raisedAt(target.key(), clock.instant()));
                logger.info("URL {} is down (status={}, error={}). Flag created.",
                    target, probeResult.statusCode(), probeResult.error());
                return notify(decision, target, AlertMessage.down(target, probeResult));

            case CLEAR_ALERT:
                flagStore.delete(target.key());
                logger.info("URL {} is back up. Flag removed.", target);
                return notify(decision, target, AlertMessage.recovered(target));

            case NONE:
            default:
                if (decision.after() == TargetState.DOWN_FLAGGED) {
                    logger.info("URL {} is still down. Flag exists, no notification sent.", target);
                } else {
                    logger.debug("URL {} is up.", target);
                }
                return ReconcileOutcome.completed(decision);
        }
    }

    private ReconcileOutcome notify(Decision decision, MonitoredTarget target, AlertMessage message) {
        try {
            message.publishTo(notifier);
            logger.info("Notification sent for {}: {}", target, message.subject());
            return ReconcileOutcome.completed(decision);
        } catch (RuntimeException e) {
            logger.warn("Failed to send notification for {} after {}: {}",
                target, decision.action(), e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ReconcileOutcome.notificationFailed(decision, error);
        }
    }
}
