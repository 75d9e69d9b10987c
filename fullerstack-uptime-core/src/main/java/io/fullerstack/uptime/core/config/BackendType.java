package io.fullerstack.uptime.core.config;

/**
 * Where the target list, flags and notifications live.
 */
public enum BackendType {
    /** S3 for the target list and flags, SNS for notifications. */
    AWS,
    /** Local files for the target list and flags, the log for notifications. */
    LOCAL;

    public static BackendType parse(String value) {
        for (BackendType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown backend '" + value + "', expected one of: aws, local");
    }
}
