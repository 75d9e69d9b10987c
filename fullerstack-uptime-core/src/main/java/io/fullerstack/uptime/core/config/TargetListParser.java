package io.fullerstack.uptime.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the URL list document.
 * <p>
 * Format:
 * <pre>{@code
 * {
 *   "urls": [
 *     "example.com",
 *     "https://api.example.com/health"
 *   ]
 * }
 * }</pre>
 * Anything else (non-object root, missing or non-array {@code urls}, non-string or
 * blank entries, entries without a host) is rejected with {@link ConfigurationException}. Unknown sibling
 * fields are ignored.
 */
public class TargetListParser {

    private static final Logger logger = LoggerFactory.getLogger(TargetListParser.class);
    private static final String URLS = "urls";

    private final ObjectMapper objectMapper;

    public TargetListParser() {
        this(new ObjectMapper());
    }

    public TargetListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param json   document content
     * @param source description of where it came from, used in error messages
     */
    public List<MonitoredTarget> parse(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("URL list " + source + " is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ConfigurationException("URL list " + source + " must be a JSON object with a 'urls' array");
        }

        JsonNode urls = root.get(URLS);
        if (urls == null || !urls.isArray()) {
            throw new ConfigurationException("URL list " + source + " must contain a 'urls' array");
        }

        List<MonitoredTarget> targets = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            JsonNode entry = urls.get(i);
            if (!entry.isTextual() || entry.asText().isBlank()) {
                throw new ConfigurationException(
                    "URL list " + source + ": entry " + i + " must be a non-blank string, got " + entry);
            }
            try {
                targets.add(MonitoredTarget.of(entry.asText()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(
                    "URL list " + source + ": entry " + i + " is not a usable URL: " + e.getMessage(), e);
            }
        }

        logger.debug("Parsed {} target(s) from {}", targets.size(), source);
        return List.copyOf(targets);
    }
}
