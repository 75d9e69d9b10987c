package io.fullerstack.uptime.core.config;

import java.util.Objects;

/**
 * A named object inside a container (S3 bucket and key, or directory and file name).
 *
 * @param container bucket or directory name
 * @param name      key or file name within the container
 */
public record ObjectLocation(String container, String name) {

    public ObjectLocation {
        Objects.requireNonNull(container, "container cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (container.isBlank()) {
            throw new IllegalArgumentException("container cannot be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return container + "/" + name;
    }
}
