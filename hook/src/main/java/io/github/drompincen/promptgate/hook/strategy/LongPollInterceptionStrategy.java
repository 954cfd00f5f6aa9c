package io.github.drompincen.promptgate.hook.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.hook.client.GatewayClient;
import io.github.drompincen.promptgate.hook.client.GatewayException;
import io.github.drompincen.promptgate.hook.policy.ClaudeSettingsWriter;
import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.hook.HookInput;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.prompt.PermissionPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PermissionResponse;
import io.github.drompincen.promptgate.protocol.prompt.PermissionScope;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import io.github.drompincen.promptgate.protocol.prompt.UserQuestionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Submits the prompt and blocks on the gateway's long-poll. The gateway owns the deadline, so the
 * poll carries no client-side timeout.
 */
public class LongPollInterceptionStrategy implements InterceptionStrategy {

    private static final Logger log = LoggerFactory.getLogger(LongPollInterceptionStrategy.class);

    public static final String PLAN_DENIED = "User denied the plan. Please revise based on their feedback.";

    private final GatewayClient gateway;
    private final ObjectMapper objectMapper;
    private final ClaudeSettingsWriter settingsWriter;

    public LongPollInterceptionStrategy(GatewayClient gateway, ObjectMapper objectMapper,
                                        ClaudeSettingsWriter settingsWriter) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.settingsWriter = settingsWriter;
    }

    @Override
    public HookOutput intercept(String sessionId, HookInput input, PromptType gate) {
        Prompt draft = PromptDrafts.from(gate, input.toolName(), input.toolInput(), objectMapper);
        return await(sessionId, draft);
    }

    /** Submits an already-built draft and waits for its decision. */
    public HookOutput await(String sessionId, Prompt draft) {
        PromptType type = draft.type();
        String requestId;
        try {
            requestId = gateway.submit(sessionId, UUID.randomUUID().toString(), draft);
        } catch (GatewayException e) {
            log.warn("Submit failed: {}", e.getMessage());
            return HookOutput.deny(e.getStatus() < 0 ? ioFailure(type) : submitFailure(type));
        }
        log.info("Request {} submitted, waiting for user response", requestId);

        PollResponse result;
        try {
            result = gateway.poll(requestId);
        } catch (GatewayException e) {
            log.warn("Poll failed: {}", e.getMessage());
            return HookOutput.deny(e.getStatus() < 0 ? ioFailure(type) : pollFailure(type));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", requestId);
            return HookOutput.deny(ioFailure(type));
        }
        HookOutput output = translate(type, result);
        if (output.allowed() && draft instanceof PermissionPrompt permission) {
            remember(permission, result);
        }
        return output;
    }

    // saving the rule is best effort; the call is already approved
    private void remember(PermissionPrompt draft, PollResponse result) {
        if (!(result.response() instanceof PermissionResponse response)) {
            return;
        }
        PermissionScope scope = response.effectiveScope();
        if (!scope.persistent()) {
            return;
        }
        String pattern = response.pattern() != null && !response.pattern().isBlank()
                ? response.pattern() : draft.suggestedPattern();
        settingsWriter.remember(pattern, scope);
    }

    HookOutput translate(PromptType type, PollResponse result) {
        if (result.state() == ResolutionState.TIMED_OUT) {
            String reason = result.error() != null ? result.error() : PollResponse.TIMEOUT_ERROR;
            log.info("{} timed out", type.wireName());
            return HookOutput.deny(reason);
        }
        if (result.state() == null && result.error() != null) {
            log.warn("Gateway reported: {}", result.error());
            return HookOutput.deny(pollFailure(type));
        }
        if (type == PromptType.USER_QUESTION) {
            return answered(result);
        }
        if (result.approved()) {
            log.info("{} approved by user", type.wireName());
            return HookOutput.allow();
        }
        String reason = result.reason() != null && !result.reason().isBlank() ? result.reason() : deniedReason(type);
        log.info("{} denied: {}", type.wireName(), reason);
        return HookOutput.deny(reason);
    }

    // a pre-tool hook cannot return a value, so the answers ride back on the denial
    private HookOutput answered(PollResponse result) {
        if (!(result.response() instanceof UserQuestionResponse answers) || answers.answers().isEmpty()) {
            String reason = result.reason() != null && !result.reason().isBlank()
                    ? result.reason() : deniedReason(PromptType.USER_QUESTION);
            log.info("Question dismissed without an answer: {}", reason);
            return HookOutput.deny(reason);
        }
        try {
            String json = objectMapper.writeValueAsString(answers.answers());
            log.info("Question answered");
            return HookOutput.deny("The user answered through the WebUI: " + json);
        } catch (JsonProcessingException e) {
            log.warn("Cannot encode answers: {}", e.getMessage());
            return HookOutput.deny(pollFailure(PromptType.USER_QUESTION));
        }
    }

    static String deniedReason(PromptType type) {
        return switch (type) {
            case PLAN_APPROVAL -> PLAN_DENIED;
            case PERMISSION -> "User denied permission for this tool call.";
            case COMMIT_APPROVAL -> "User rejected the commit.";
            case USER_QUESTION -> "User declined to answer the question.";
        };
    }

    static String submitFailure(PromptType type) {
        return "Failed to request " + noun(type) + " from WebUI.";
    }

    static String pollFailure(PromptType type) {
        return "Failed to get " + noun(type) + " response.";
    }

    static String ioFailure(PromptType type) {
        return "Error communicating with WebUI for " + noun(type) + ".";
    }

    private static String noun(PromptType type) {
        return switch (type) {
            case PLAN_APPROVAL -> "plan approval";
            case PERMISSION -> "permission approval";
            case COMMIT_APPROVAL -> "commit approval";
            case USER_QUESTION -> "user answer";
        };
    }
}
