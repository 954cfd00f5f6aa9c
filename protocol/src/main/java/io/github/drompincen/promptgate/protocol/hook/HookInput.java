package io.github.drompincen.promptgate.protocol.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tool-call descriptor the agent writes to the hook's stdin.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookInput(
        @JsonProperty("hook_event_name") String hookEventName,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("tool_input") JsonNode toolInput,
        @JsonProperty("tool_use_id") String toolUseId,
        @JsonProperty("session_id") String sessionId
) {}
