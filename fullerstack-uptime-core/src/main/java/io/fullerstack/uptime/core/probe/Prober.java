package io.fullerstack.uptime.core.probe;

import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;

/**
 * Executes one reachability check against a target.
 * <p>
 * Implementations never throw: every failure is folded into {@link ProbeResult#error()}.
 */
public interface Prober {

    ProbeResult probe(MonitoredTarget target);
}
