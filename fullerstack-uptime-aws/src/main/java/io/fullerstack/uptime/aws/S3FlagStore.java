package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.FlagLookup;
import io.fullerstack.uptime.core.model.TargetKey;
import io.fullerstack.uptime.core.store.FlagBodyCodec;
import io.fullerstack.uptime.core.store.FlagNames;
import io.fullerstack.uptime.core.store.FlagStore;
import io.fullerstack.uptime.core.store.FlagStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Flag store backed by S3 objects: {@code s3://<bucket>/flags/<key>.flag}.
 * <p>
 * Presence is checked with HeadObject. A 404 means absent; any other failure
 * (403, throttling, network) is reported as a failed lookup rather than absent.
 * Note that S3 answers 403 for a missing key when the caller lacks s3:ListBucket.
 *
 * @author Fullerstack
 */
public class S3FlagStore implements FlagStore {

    private static final Logger logger = LoggerFactory.getLogger(S3FlagStore.class);
    private static final String CONTENT_TYPE = "application/json";

    private final S3Client s3Client;
    private final String bucket;
    private final FlagBodyCodec codec;

    public S3FlagStore(S3Client s3Client, String bucket, FlagBodyCodec codec) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.codec = codec;
    }

    @Override
    public FlagLookup lookup(TargetKey key) {
        String objectKey = FlagNames.objectName(key);
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .build());
            return FlagLookup.present();

        } catch (NoSuchKeyException e) {
            return FlagLookup.absent();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return FlagLookup.absent();
            }
            logger.warn("HeadObject s3://{}/{} failed with status {}", bucket, objectKey, e.statusCode(), e);
            return FlagLookup.failed("S3 HeadObject s3://" + bucket + "/" + objectKey
                + " failed with status " + e.statusCode() + ": " + errorCode(e));
        } catch (SdkException e) {
            logger.warn("HeadObject s3://{}/{} failed", bucket, objectKey, e);
            return FlagLookup.failed("S3 HeadObject s3://" + bucket + "/" + objectKey + " failed: " + e.getMessage());
        }
    }

    @Override
    public void create(DownFlag flag) {
        String objectKey = FlagNames.objectName(flag.key());
        try {
            s3Client.putObject(
                PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .contentType(CONTENT_TYPE)
                    .build(),
                RequestBody.fromString(codec.encode(flag)));
            logger.debug("Created flag s3://{}/{}", bucket, objectKey);

        } catch (SdkException e) {
            throw new FlagStoreException("Failed to create flag s3://" + bucket + "/" + objectKey, e);
        }
    }

    @Override
    public void delete(TargetKey key) {
        String objectKey = FlagNames.objectName(key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .build());
            logger.debug("Deleted flag s3://{}/{}", bucket, objectKey);

        } catch (NoSuchKeyException e) {
            logger.debug("Flag s3://{}/{} already absent", bucket, objectKey);
        } catch (SdkException e) {
            throw new FlagStoreException("Failed to delete flag s3://" + bucket + "/" + objectKey, e);
        }
    }

    private static String errorCode(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null) {
            return e.awsErrorDetails().errorCode();
        }
        return e.getMessage();
    }
}
