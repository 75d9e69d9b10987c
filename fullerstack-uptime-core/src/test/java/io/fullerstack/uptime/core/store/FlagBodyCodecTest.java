package io.fullerstack.uptime.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.TargetKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class FlagBodyCodecTest {

    private final FlagBodyCodec codec = new FlagBodyCodec();
    private final TargetKey key = new TargetKey("bad.example.com");

    @Test
    void shouldEncodeTimestampAndStatus() throws Exception {
        DownFlag flag = DownFlag.raisedAt(key, Instant.parse("2024-06-10T08:15:30Z"));

        JsonNode body = new ObjectMapper().readTree(codec.encode(flag));

        assertThat(body.get("timestamp").asLong()).isEqualTo(1718007330L);
        assertThat(body.get("status").asText()).isEqualTo("down");
        assertThat(body.has("key")).isFalse();
    }

    @Test
    void shouldDecodeStoredBody() {
        DownFlag flag = codec.decode(key, "{\"timestamp\": 1718007330, \"status\": \"down\"}");

        assertThat(flag).isEqualTo(new DownFlag(key, 1718007330L, "down"));
    }

    @Test
    void shouldRejectNonJsonBody() {
        assertThatThrownBy(() -> codec.decode(key, "down since tuesday"))
            .isInstanceOf(FlagStoreException.class)
            .hasMessageContaining("bad.example.com");

        assertThatThrownBy(() -> codec.decode(key, "[1, 2]"))
            .isInstanceOf(FlagStoreException.class)
            .hasMessageContaining("not a JSON object");
    }

    @Test
    void shouldNameFlagObjectsUnderFlagsPrefix() {
        assertThat(FlagNames.objectName(new TargetKey("localhost_8080"))).isEqualTo("flags/localhost_8080.flag");
    }
}
