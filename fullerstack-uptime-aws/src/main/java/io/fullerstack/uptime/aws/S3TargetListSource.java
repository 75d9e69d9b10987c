package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.config.ConfigurationException;
import io.fullerstack.uptime.core.config.ObjectLocation;
import io.fullerstack.uptime.core.config.TargetListParser;
import io.fullerstack.uptime.core.config.TargetListSource;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the URL list document from S3.
 *
 * @author Fullerstack
 */
public class S3TargetListSource implements TargetListSource {

    private static final Logger logger = LoggerFactory.getLogger(S3TargetListSource.class);

    private final S3Client s3Client;
    private final TargetListParser parser;

    public S3TargetListSource(S3Client s3Client, TargetListParser parser) {
        this.s3Client = s3Client;
        this.parser = parser;
    }

    /**
     * @throws ConfigurationException if the object is missing, unreadable or malformed
     */
    @Override
    public List<MonitoredTarget> load(ObjectLocation location) {
        String uri = "s3://" + location.container() + "/" + location.name();
        try {
            logger.debug("Loading URL list from {}", uri);

            ResponseBytes<GetObjectResponse> object = s3Client.getObjectAsBytes(
                GetObjectRequest.builder()
                    .bucket(location.container())
                    .key(location.name())
                    .build());

            return parser.parse(object.asString(StandardCharsets.UTF_8), uri);

        } catch (NoSuchKeyException e) {
            throw new ConfigurationException("URL list not found: " + uri, e);
        } catch (NoSuchBucketException e) {
            throw new ConfigurationException("Bucket not found for URL list: " + uri, e);
        } catch (SdkException e) {
            throw new ConfigurationException("Failed to read URL list " + uri + ": " + e.getMessage(), e);
        }
    }
}
