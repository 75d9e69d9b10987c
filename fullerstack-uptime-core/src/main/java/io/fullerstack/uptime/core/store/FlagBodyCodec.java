package io.fullerstack.uptime.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.TargetKey;

/**
 * JSON body of a stored flag: {@code {"timestamp": 1718000000, "status": "down"}}.
 * <p>
 * The key is not part of the body; it is the object name.
 */
public final class FlagBodyCodec {

    private final ObjectMapper objectMapper;

    public FlagBodyCodec() {
        this(new ObjectMapper());
    }

    public FlagBodyCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(DownFlag flag) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("timestamp", flag.timestamp());
        body.put("status", flag.status());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new FlagStoreException("Failed to encode flag for " + flag.key(), e);
        }
    }

    public DownFlag decode(TargetKey key, String json) {
        try {
            JsonNode body = objectMapper.readTree(json);
            if (body == null || !body.isObject()) {
                throw new FlagStoreException("Flag body for " + key + " is not a JSON object");
            }
            return new DownFlag(
                key,
                body.path("timestamp").asLong(0),
                body.path("status").asText(DownFlag.DOWN));
        } catch (JsonProcessingException e) {
            throw new FlagStoreException("Failed to decode flag for " + key, e);
        }
    }
}
