package io.fullerstack.uptime.core.local;

import io.fullerstack.uptime.core.config.ConfigurationException;
import io.fullerstack.uptime.core.config.ObjectLocation;
import io.fullerstack.uptime.core.config.TargetListParser;
import io.fullerstack.uptime.core.config.TargetListSource;
import io.fullerstack.uptime.core.model.MonitoredTarget;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the URL list from {@code <root>/<container>/<name>}.
 */
public class FileTargetListSource implements TargetListSource {

    private final Path root;
    private final TargetListParser parser;

    public FileTargetListSource(Path root, TargetListParser parser) {
        this.root = root;
        this.parser = parser;
    }

    @Override
    public List<MonitoredTarget> load(ObjectLocation location) {
        Path file = root.resolve(location.container()).resolve(location.name());
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return parser.parse(json, file.toString());
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("URL list not found: " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read URL list " + file + ": " + e.getMessage(), e);
        }
    }
}
