package io.github.drompincen.promptgate.hook.strategy;

import io.github.drompincen.promptgate.protocol.hook.HookInput;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plan approval without a blocking hook: the first attempt is denied with an instruction to run
 * {@code confirm-plan}; once the gateway marks the session's sentinel, the retry is allowed.
 * Every other gate falls through to the long-poll strategy.
 */
public class RedirectInterceptionStrategy implements InterceptionStrategy {

    private static final Logger log = LoggerFactory.getLogger(RedirectInterceptionStrategy.class);

    public static final String REDIRECT_REASON = "Plan approval required before exiting plan mode. "
            + "Please run the promptgate confirm-plan command to request user approval for your plan. "
            + "Once approved, you can call ExitPlanMode again.";

    private final SignalChannel signals;
    private final InterceptionStrategy fallback;

    public RedirectInterceptionStrategy(SignalChannel signals, InterceptionStrategy fallback) {
        this.signals = signals;
        this.fallback = fallback;
    }

    @Override
    public HookOutput intercept(String sessionId, HookInput input, PromptType gate) {
        if (gate != PromptType.PLAN_APPROVAL) {
            return fallback.intercept(sessionId, input, gate);
        }
        if (signals.consume(sessionId)) {
            log.info("Plan already approved for session {}, allowing exit", sessionId);
            return HookOutput.allow();
        }
        log.info("No approval sentinel for session {}, redirecting to confirm-plan", sessionId);
        return HookOutput.deny(REDIRECT_REASON);
    }
}
