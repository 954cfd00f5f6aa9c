package io.github.drompincen.promptgate.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.hook.strategy.LongPollInterceptionStrategy;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests plan approval outside of a tool-call hook. Used with the redirect strategy: on approval
 * the gateway marks the session's sentinel and the agent's next ExitPlanMode passes.
 */
public class ConfirmPlanCommand {

    private static final Logger log = LoggerFactory.getLogger(ConfirmPlanCommand.class);

    public static final String APPROVED_MESSAGE = "Plan approved. You can now call ExitPlanMode.";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Input(String planContent, String planPath) {}

    public record Result(boolean approved, String message) {}

    private final ObjectMapper objectMapper;
    private final LongPollInterceptionStrategy longPoll;
    private final String sessionId;

    public ConfirmPlanCommand(ObjectMapper objectMapper, LongPollInterceptionStrategy longPoll, String sessionId) {
        this.objectMapper = objectMapper;
        this.longPoll = longPoll;
        this.sessionId = sessionId;
    }

    public String run(String stdin) {
        return write(confirm(stdin));
    }

    Result confirm(String stdin) {
        if (sessionId == null) {
            return new Result(false, HookRunner.NO_SESSION_REASON);
        }
        Input input = new Input(null, null);
        if (stdin != null && !stdin.isBlank()) {
            try {
                input = objectMapper.readValue(stdin, Input.class);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed confirm-plan input: {}", e.getOriginalMessage());
            }
        }
        HookOutput decision = longPoll.await(sessionId, PlanApprovalPrompt.draft(input.planContent(), input.planPath()));
        if (decision.allowed()) {
            log.info("Plan approved for session {}", sessionId);
            return new Result(true, APPROVED_MESSAGE);
        }
        return new Result(false, decision.reason());
    }

    private String write(Result result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode confirm-plan result", e);
        }
    }
}
