package io.fullerstack.uptime.core.config;

import io.fullerstack.uptime.core.model.MonitoredTarget;

import java.util.List;

/**
 * Loads the ordered list of targets for a run.
 */
public interface TargetListSource {

    /**
     * @param location where the URL list document lives
     * @return targets in document order
     * @throws ConfigurationException if the document is missing, unreadable or malformed
     */
    List<MonitoredTarget> load(ObjectLocation location);
}
