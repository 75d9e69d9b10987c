package io.fullerstack.uptime.core.store;

/**
 * Exception thrown when a flag store write or delete fails.
 */
public class FlagStoreException extends RuntimeException {

    public FlagStoreException(String message) {
        super(message);
    }

    public FlagStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
