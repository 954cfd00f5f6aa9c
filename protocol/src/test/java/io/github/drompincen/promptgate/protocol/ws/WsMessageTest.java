package io.github.drompincen.promptgate.protocol.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.promptgate.protocol.json.ProtocolJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    private final ObjectMapper mapper = ProtocolJson.newObjectMapper();

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.PROMPT_REQUEST, "sess-1", new TextNode("payload"));

        assertThat(msg.type()).isEqualTo(WsMessageType.PROMPT_REQUEST);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
        assertThat(msg.payload().asText()).isEqualTo("payload");
        assertThat(msg.ts()).isNotNull();
    }

    @Test
    void errorFactoryCreatesErrorMessage() {
        WsMessage msg = WsMessage.error("sess-1", new TextNode("something went wrong"));

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.sessionId()).isEqualTo("sess-1");
    }

    @Test
    void timestampSerializesAsIsoString() throws Exception {
        String json = mapper.writeValueAsString(WsMessage.of(WsMessageType.SUBSCRIBED, "s1", null));

        assertThat(json).contains("\"type\":\"SUBSCRIBED\"").containsPattern("\"ts\":\"\\d{4}-");
    }

    @Test
    void wsMessageTypesIncludeClientAndServerTypes() {
        assertThat(WsMessageType.valueOf("SUBSCRIBE_SESSION")).isNotNull();
        assertThat(WsMessageType.valueOf("RESPOND_PROMPT")).isNotNull();
        assertThat(WsMessageType.valueOf("PROMPT_RESOLVED")).isNotNull();
        assertThat(WsMessageType.valueOf("SESSION_STATE")).isNotNull();
        assertThat(WsMessageType.valueOf("ERROR")).isNotNull();
    }
}
