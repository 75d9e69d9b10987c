package io.fullerstack.uptime.core.notify;

/**
 * Exception thrown when a notification cannot be published.
 */
public class NotifierException extends RuntimeException {

    public NotifierException(String message) {
        super(message);
    }

    public NotifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
