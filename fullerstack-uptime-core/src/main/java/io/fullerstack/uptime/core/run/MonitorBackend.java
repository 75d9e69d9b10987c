package io.fullerstack.uptime.core.run;

import io.fullerstack.uptime.core.config.TargetListSource;
import io.fullerstack.uptime.core.notify.Notifier;
import io.fullerstack.uptime.core.store.FlagStore;

/**
 * Supplies the collaborators a run needs, bound to the locations named in its configuration.
 * <p>
 * Clients behind the collaborators are created once by the backend and shared;
 * the factory methods only bind a namespace or destination.
 */
public interface MonitorBackend {

    TargetListSource targetListSource();

    /**
     * @param namespace bucket or directory holding the flags
     */
    FlagStore flagStore(String namespace);

    /**
     * @param destination topic ARN or channel name
     */
    Notifier notifier(String destination);
}
