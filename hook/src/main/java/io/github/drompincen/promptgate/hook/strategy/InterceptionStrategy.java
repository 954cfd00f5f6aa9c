package io.github.drompincen.promptgate.hook.strategy;

import io.github.drompincen.promptgate.protocol.hook.HookInput;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;

/**
 * Turns one gated tool call into an allow or deny decision.
 */
public interface InterceptionStrategy {

    HookOutput intercept(String sessionId, HookInput input, PromptType gate);
}
