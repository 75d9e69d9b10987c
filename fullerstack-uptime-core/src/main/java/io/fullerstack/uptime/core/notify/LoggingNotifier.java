package io.fullerstack.uptime.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Notifier that writes messages to the log and keeps them for inspection.
 * <p>
 * Used by the local backend where no messaging service is available.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotifier.class);

    private final String destination;
    private final List<AlertMessage> published = Collections.synchronizedList(new ArrayList<>());

    public LoggingNotifier(String destination) {
        this.destination = destination;
    }

    @Override
    public void publish(String subject, String body) {
        published.add(new AlertMessage(subject, body));
        logger.warn("[{}] {}\n{}", destination, subject, body);
    }

    public List<AlertMessage> published() {
        synchronized (published) {
            return List.copyOf(published);
        }
    }
}
