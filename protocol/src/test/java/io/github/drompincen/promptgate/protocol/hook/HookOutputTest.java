package io.github.drompincen.promptgate.protocol.hook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.json.ProtocolJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HookOutputTest {

    private final ObjectMapper mapper = ProtocolJson.newObjectMapper();

    @Test
    void allowSerializesToEmptyObject() throws Exception {
        assertThat(mapper.writeValueAsString(HookOutput.allow())).isEqualTo("{}");
        assertThat(HookOutput.allow().allowed()).isTrue();
    }

    @Test
    void denyCarriesReason() throws Exception {
        HookOutput out = HookOutput.deny("nope");

        String json = mapper.writeValueAsString(out);

        assertThat(out.allowed()).isFalse();
        assertThat(out.reason()).isEqualTo("nope");
        assertThat(json).isEqualTo("{\"hookSpecificOutput\":{\"hookEventName\":\"PreToolUse\","
                + "\"permissionDecision\":\"deny\",\"permissionDecisionReason\":\"nope\"}}");
    }

    @Test
    void inputReadsSnakeCaseAndIgnoresExtras() throws Exception {
        String json = "{\"hook_event_name\":\"PreToolUse\",\"tool_name\":\"Bash\","
                + "\"tool_input\":{\"command\":\"ls\"},\"cwd\":\"/tmp\",\"session_id\":\"abc\"}";

        HookInput input = mapper.readValue(json, HookInput.class);

        assertThat(input.toolName()).isEqualTo("Bash");
        assertThat(input.toolInput().path("command").asText()).isEqualTo("ls");
        assertThat(input.sessionId()).isEqualTo("abc");
        assertThat(input.toolUseId()).isNull();
    }
}
