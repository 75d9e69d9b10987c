package io.fullerstack.uptime.core.notify;

import io.fullerstack.uptime.core.model.MonitoredTarget;
import io.fullerstack.uptime.core.model.ProbeResult;

import java.util.Objects;

/**
 * Subject and body of an outage or recovery notification.
 *
 * @param subject one-line subject
 * @param body    plain-text body
 */
public record AlertMessage(String subject, String body) {

    static final String FOOTER = "This is an automated message from the Fullerstack Uptime Monitor.";

    public AlertMessage {
        Objects.requireNonNull(subject, "subject cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
    }

    /**
     * Message sent when a target goes down.
     */
    public static AlertMessage down(MonitoredTarget target, ProbeResult result) {
        String statusCode = result.hasStatusCode() ? String.valueOf(result.statusCode()) : "N/A";
        String body = "The URL " + target.url() + " is currently DOWN.\n"
            + "\n"
            + "Status Code: " + statusCode + "\n"
            + "Error: " + result.error() + "\n"
            + "\n"
            + FOOTER + "\n";
        return new AlertMessage("ALERT: " + target.url() + " is DOWN", body);
    }

    /**
     * Message sent when a flagged target answers again.
     */
    public static AlertMessage recovered(MonitoredTarget target) {
        String body = "The URL " + target.url() + " is now back UP.\n"
            + "\n"
            + FOOTER + "\n";
        return new AlertMessage("RESOLVED: " + target.url() + " is back UP", body);
    }

    public void publishTo(Notifier notifier) {
        notifier.publish(subject, body);
    }
}
