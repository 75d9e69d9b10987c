package io.fullerstack.uptime.core.model;

/**
 * Result kinds of a flag existence check.
 */
public enum FlagPresence {
    PRESENT,
    ABSENT,
    FAILED
}
