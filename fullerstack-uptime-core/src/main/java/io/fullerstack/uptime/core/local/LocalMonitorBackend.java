package io.fullerstack.uptime.core.local;

import io.fullerstack.uptime.core.config.TargetListParser;
import io.fullerstack.uptime.core.config.TargetListSource;
import io.fullerstack.uptime.core.notify.LoggingNotifier;
import io.fullerstack.uptime.core.notify.Notifier;
import io.fullerstack.uptime.core.run.MonitorBackend;
import io.fullerstack.uptime.core.store.FlagBodyCodec;
import io.fullerstack.uptime.core.store.FlagStore;

import java.nio.file.Path;

/**
 * Backend for running without AWS: containers and namespaces are directories under a
 * root, notifications go to the log.
 * <pre>
 * &lt;root&gt;/ping-config/urls.json
 * &lt;root&gt;/ping-flags/flags/example.com.flag
 * </pre>
 */
public class LocalMonitorBackend implements MonitorBackend {

    private final Path root;
    private final TargetListParser parser = new TargetListParser();
    private final FlagBodyCodec codec = new FlagBodyCodec();

    public LocalMonitorBackend(Path root) {
        this.root = root;
    }

    @Override
    public TargetListSource targetListSource() {
        return new FileTargetListSource(root, parser);
    }

    @Override
    public FlagStore flagStore(String namespace) {
        return new FileFlagStore(root.resolve(namespace), codec);
    }

    @Override
    public Notifier notifier(String destination) {
        return new LoggingNotifier(destination);
    }
}
