package io.github.drompincen.promptgate.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.hook.policy.GatePolicy;
import io.github.drompincen.promptgate.hook.strategy.InterceptionStrategy;
import io.github.drompincen.promptgate.protocol.hook.HookInput;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * One pre-tool-use invocation: stdin JSON in, decision JSON out. Never throws; a failure inside a
 * gated call denies, a failure before the call is classified allows.
 */
public class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    public static final String NO_SESSION_REASON = "No WebUI session ID found. Cannot request approval.";
    public static final String INTERNAL_ERROR_REASON = "Approval hook failed; refusing to run the tool unreviewed.";

    private final ObjectMapper objectMapper;
    private final GatePolicy policy;
    private final InterceptionStrategy strategy;
    private final String sessionId;

    public HookRunner(ObjectMapper objectMapper, GatePolicy policy, InterceptionStrategy strategy, String sessionId) {
        this.objectMapper = objectMapper;
        this.policy = policy;
        this.strategy = strategy;
        this.sessionId = sessionId;
    }

    public String run(String stdin) {
        return write(decide(stdin));
    }

    HookOutput decide(String stdin) {
        if (stdin == null || stdin.isBlank()) {
            log.debug("Empty hook input, allowing");
            return HookOutput.allow();
        }
        HookInput input;
        try {
            input = objectMapper.readValue(stdin, HookInput.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed hook input, allowing: {}", e.getOriginalMessage());
            return HookOutput.allow();
        }

        Optional<PromptType> gate;
        try {
            gate = policy.gateFor(input.toolName(), input.toolInput());
        } catch (RuntimeException e) {
            log.error("Cannot classify {}, allowing", input.toolName(), e);
            return HookOutput.allow();
        }
        if (gate.isEmpty()) {
            log.debug("{} is not gated", input.toolName());
            return HookOutput.allow();
        }
        if (sessionId == null) {
            log.warn("Denying {}: no session id in environment", input.toolName());
            return HookOutput.deny(NO_SESSION_REASON);
        }

        log.info("Intercepting {} as {} for session {}", input.toolName(), gate.get().wireName(), sessionId);
        HookOutput output;
        try {
            output = strategy.intercept(sessionId, input, gate.get());
        } catch (RuntimeException e) {
            log.error("Interception of {} failed", input.toolName(), e);
            output = HookOutput.deny(INTERNAL_ERROR_REASON);
        }
        if (output.allowed()) {
            log.info("Allowing {}", input.toolName());
        } else {
            log.info("Denying {}: {}", input.toolName(), output.reason());
        }
        return output;
    }

    private String write(HookOutput output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            log.error("Cannot encode hook output", e);
            return output.allowed() ? "{}" : fallbackDeny();
        }
    }

    private static String fallbackDeny() {
        return "{\"hookSpecificOutput\":{\"hookEventName\":\"PreToolUse\",\"permissionDecision\":\"deny\","
                + "\"permissionDecisionReason\":\"" + INTERNAL_ERROR_REASON + "\"}}";
    }
}
