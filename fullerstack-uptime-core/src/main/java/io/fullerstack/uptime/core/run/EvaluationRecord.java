package io.fullerstack.uptime.core.run;

import io.fullerstack.uptime.core.model.ProbeResult;
import io.fullerstack.uptime.core.model.TargetError;
import io.fullerstack.uptime.core.reconcile.ReconcileAction;

import java.util.Objects;

/**
 * What happened to one target during a run.
 *
 * @param url                 target URL as configured
 * @param probeResult         probe outcome
 * @param flagExistedBefore   flag snapshot taken before acting; null when the lookup failed
 * @param action              action carried out (NONE when the target errored before acting)
 * @param error               per-target failure, or null
 */
public record EvaluationRecord(
    String url,
    ProbeResult probeResult,
    Boolean flagExistedBefore,
    ReconcileAction action,
    TargetError error
) {

    public EvaluationRecord {
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(probeResult, "probeResult cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }

    public boolean hasError() {
        return error != null;
    }
}
