package io.fullerstack.uptime.core.run;

import io.fullerstack.uptime.core.config.ConfigurationException;
import io.fullerstack.uptime.core.config.UptimeConfig;
import io.fullerstack.uptime.core.model.FlagLookup;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;
import io.fullerstack.uptime.core.model.TargetError;
import io.fullerstack.uptime.core.model.TargetKey;
import io.fullerstack.uptime.core.probe.Prober;
import io.fullerstack.uptime.core.reconcile.ReconcileAction;
import io.fullerstack.uptime.core.reconcile.ReconcileOutcome;
import io.fullerstack.uptime.core.reconcile.Reconciler;
import io.fullerstack.uptime.core.store.FlagStore;
import io.fullerstack.uptime.core.store.FlagStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one evaluation pass over the configured targets.
 *
 * <h3>Run sequence:</h3>
 * <pre>
 * requireRunnable()          ── missing destination/location → failed report, nothing touched
 *        ↓
 * load target list           ── missing or malformed → failed report
 *                               (as is any other backend failure before the first target)
 *        ↓
 * for each target, in order:
 *     probe → flag lookup → reconcile → record
 * </pre>
 *
 * <p>A failure on one target (flag store unavailable, notification rejected) is recorded
 * on that target's {@link EvaluationRecord}; the remaining targets are still evaluated.
 * Targets are evaluated sequentially on the calling thread.
 */
public class RunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RunCoordinator.class);

    private final MonitorBackend backend;
    private final Prober prober;
    private final Clock clock;

    public RunCoordinator(MonitorBackend backend, Prober prober, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.prober = Objects.requireNonNull(prober, "prober cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public RunReport run(UptimeConfig config) {
        List<MonitoredTarget> targets;
        FlagStore flagStore;
        Reconciler reconciler;
        try {
            config.requireRunnable();
            flagStore = backend.flagStore(config.flagNamespace());
            reconciler = new Reconciler(flagStore, backend.notifier(config.notificationDestination()), clock);
            targets = backend.targetListSource().load(config.targetList());
        } catch (ConfigurationException e) {
            logger.error("Run not started: {}", e.getMessage());
            return RunReport.failed(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Run not started: backend failed during start-up", e);
            return RunReport.failed(describe(e));
        }

        logger.info("Checking {} target(s) from {}", targets.size(), config.targetList());

        List<EvaluationRecord> records = new ArrayList<>(targets.size());
        for (MonitoredTarget target : targets) {
            records.add(evaluate(target, flagStore, reconciler));
        }

        RunReport report = RunReport.completed(records);
        logger.info("Run completed: {} target(s), {} with errors", records.size(), report.errorCount());
        return report;
    }

    private EvaluationRecord evaluate(MonitoredTarget target, FlagStore flagStore, Reconciler reconciler) {
        ProbeResult probe = prober.probe(target);
        TargetKey key = target.key();

        FlagLookup lookup;
        try {
            lookup = flagStore.lookup(key);
        } catch (RuntimeException e) {
            lookup = FlagLookup.failed(describe(e));
        }

        if (lookup.isFailed()) {
            logger.warn("Flag lookup failed for {}, skipping reconcile: {}", target, lookup.error());
            return new EvaluationRecord(target.url(), probe, null, ReconcileAction.NONE,
                TargetError.flagStore(lookup.error()));
        }

        boolean flagExists = lookup.exists();
        try {
            ReconcileOutcome outcome = reconciler.reconcile(target, probe, flagExists);
            TargetError error = outcome.isPartialFailure()
                ? TargetError.notifier(outcome.notificationError())
                : null;
            return new EvaluationRecord(target.url(), probe, flagExists, outcome.action(), error);

        } catch (FlagStoreException e) {
            logger.warn("Flag store failed for {}: {}", target, e.getMessage(), e);
            return new EvaluationRecord(target.url(), probe, flagExists, ReconcileAction.NONE,
                TargetError.flagStore(describe(e)));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure evaluating {}", target, e);
            return new EvaluationRecord(target.url(), probe, flagExists, ReconcileAction.NONE,
                TargetError.internal(describe(e)));
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
