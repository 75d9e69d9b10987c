package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.config.TargetListParser;
import io.fullerstack.uptime.core.config.TargetListSource;
import io.fullerstack.uptime.core.notify.Notifier;
import io.fullerstack.uptime.core.run.MonitorBackend;
import io.fullerstack.uptime.core.store.FlagBodyCodec;
import io.fullerstack.uptime.core.store.FlagStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * S3 and SNS collaborators for a run.
 * <p>
 * Each AWS client is built once and shared by every store and notifier handed out.
 *
 * <pre>{@code
 * try (AwsMonitorBackend backend = AwsMonitorBackend.create(null)) {
 *     RunReport report = new RunCoordinator(backend, prober, Clock.systemUTC()).run(config);
 * }
 * }</pre>
 *
 * @author Fullerstack
 */
public class AwsMonitorBackend implements MonitorBackend, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AwsMonitorBackend.class);

    private final S3Client s3Client;
    private final SnsClient snsClient;
    private final TargetListParser parser = new TargetListParser();
    private final FlagBodyCodec codec = new FlagBodyCodec();

    public AwsMonitorBackend(S3Client s3Client, SnsClient snsClient) {
        this.s3Client = s3Client;
        this.snsClient = snsClient;
    }

    /**
     * Builds clients from the default credential and region chains.
     *
     * @param region explicit region, or null to use the default region chain
     */
    public static AwsMonitorBackend create(Region region) {
        if (region == null) {
            return new AwsMonitorBackend(S3Client.create(), SnsClient.create());
        }
        return new AwsMonitorBackend(
            S3Client.builder().region(region).build(),
            SnsClient.builder().region(region).build());
    }

    @Override
    public TargetListSource targetListSource() {
        return new S3TargetListSource(s3Client, parser);
    }

    @Override
    public FlagStore flagStore(String namespace) {
        return new S3FlagStore(s3Client, namespace, codec);
    }

    @Override
    public Notifier notifier(String destination) {
        return new SnsNotifier(snsClient, destination);
    }

    @Override
    public void close() {
        try {
            s3Client.close();
        } finally {
            snsClient.close();
            logger.debug("AwsMonitorBackend closed");
        }
    }
}
