package io.fullerstack.uptime.core.notify;

/**
 * Fire-and-forget publisher for outage and recovery messages.
 *
 * <p>This interface abstracts the notification transport (SNS topic, log,
 * chat webhook) so the reconciler sends messages without transport coupling.
 *
 * <h3>Implementation Notes:</h3>
 * <ul>
 *   <li>One call publishes one message; no retries are expected</li>
 *   <li>Transport-specific limits (subject length, encoding) are the implementation's concern</li>
 *   <li>Failures are thrown as {@link NotifierException}; the caller reports them, it never aborts the run</li>
 * </ul>
 *
 * @see io.fullerstack.uptime.core.reconcile.Reconciler
 */
public interface Notifier {

    /**
     * Publishes a message.
     *
     * @param subject one-line subject (e.g. "ALERT: example.com is DOWN")
     * @param body    plain-text body
     * @throws NotifierException if the message could not be handed to the transport
     */
    void publish(String subject, String body);
}
