package io.fullerstack.uptime.core.model;

import java.util.Objects;

/**
 * Failure recorded against a single target; never aborts the run.
 *
 * @param kind    which collaborator failed
 * @param message description
 */
public record TargetError(Kind kind, String message) {

    public enum Kind {
        FLAG_STORE,
        NOTIFIER,
        INTERNAL
    }

    public TargetError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static TargetError flagStore(String message) {
        return new TargetError(Kind.FLAG_STORE, message);
    }

    public static TargetError notifier(String message) {
        return new TargetError(Kind.NOTIFIER, message);
    }

    public static TargetError internal(String message) {
        return new TargetError(Kind.INTERNAL, message);
    }
}
