package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.notify.Notifier;
import io.fullerstack.uptime.core.notify.NotifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * Publishes notifications to an SNS topic.
 * <p>
 * SNS rejects subjects longer than 100 characters or containing line breaks, so the
 * subject is flattened and truncated before publishing. The body is sent unchanged.
 *
 * @author Fullerstack
 */
public class SnsNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(SnsNotifier.class);
    static final int MAX_SUBJECT_LENGTH = 100;

    private final SnsClient snsClient;
    private final String topicArn;

    public SnsNotifier(SnsClient snsClient, String topicArn) {
        this.snsClient = snsClient;
        this.topicArn = topicArn;
    }

    @Override
    public void publish(String subject, String body) {
        try {
            PublishResponse response = snsClient.publish(PublishRequest.builder()
                .topicArn(topicArn)
                .subject(subjectFor(subject))
                .message(body)
                .build());
            logger.debug("Published '{}' to {} (messageId={})", subject, topicArn, response.messageId());

        } catch (SdkException e) {
            throw new NotifierException("Failed to publish to " + topicArn + ": " + e.getMessage(), e);
        }
    }

    static String subjectFor(String subject) {
        String flat = subject.replaceAll("[\\r\\n]+", " ").trim();
        if (flat.length() <= MAX_SUBJECT_LENGTH) {
            return flat;
        }
        return flat.substring(0, MAX_SUBJECT_LENGTH - 3) + "...";
    }
}
