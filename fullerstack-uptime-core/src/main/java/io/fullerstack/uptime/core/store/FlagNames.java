package io.fullerstack.uptime.core.store;

import io.fullerstack.uptime.core.model.TargetKey;

/**
 * Object naming for flags inside a namespace: {@code flags/<key>.flag}.
 */
public final class FlagNames {

    public static final String PREFIX = "flags/";
    public static final String SUFFIX = ".flag";

    private FlagNames() {
    }

    public static String objectName(TargetKey key) {
        return PREFIX + key.value() + SUFFIX;
    }
}
