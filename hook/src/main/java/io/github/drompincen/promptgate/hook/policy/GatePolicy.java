package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which tool calls need a human. {@code allowPatterns} auto-approve permission-gated calls;
 * they never bypass plan, question or commit gates.
 */
public record GatePolicy(
        Set<String> permissionTools,
        Set<String> commitTools,
        List<String> allowPatterns
) {
    public static final String EXIT_PLAN_MODE = "ExitPlanMode";
    public static final String ASK_USER_QUESTION = "AskUserQuestion";

    public static final Set<String> DEFAULT_PERMISSION_TOOLS =
            Set.of("Bash", "Write", "Edit", "WebFetch", "NotebookEdit");
    public static final Set<String> DEFAULT_COMMIT_TOOLS = Set.of("GitCommit");

    public GatePolicy {
        permissionTools = Set.copyOf(permissionTools);
        commitTools = Set.copyOf(commitTools);
        allowPatterns = List.copyOf(allowPatterns);
    }

    public static GatePolicy defaults() {
        return new GatePolicy(DEFAULT_PERMISSION_TOOLS, DEFAULT_COMMIT_TOOLS, List.of());
    }

    public GatePolicy withAllowPatterns(List<String> patterns) {
        return new GatePolicy(permissionTools, commitTools, patterns);
    }

    /**
     * @return the prompt type the call must wait on, or empty when the call may proceed
     */
    public Optional<PromptType> gateFor(String toolName, JsonNode toolInput) {
        if (toolName == null) {
            return Optional.empty();
        }
        if (EXIT_PLAN_MODE.equals(toolName)) {
            return Optional.of(PromptType.PLAN_APPROVAL);
        }
        if (ASK_USER_QUESTION.equals(toolName)) {
            return Optional.of(PromptType.USER_QUESTION);
        }
        if (commitTools.contains(toolName) || isGitCommit(toolName, toolInput)) {
            return Optional.of(PromptType.COMMIT_APPROVAL);
        }
        if (permissionTools.contains(toolName)
                && PermissionPatterns.firstMatch(allowPatterns, toolName, toolInput).isEmpty()) {
            return Optional.of(PromptType.PERMISSION);
        }
        return Optional.empty();
    }

    static boolean isGitCommit(String toolName, JsonNode toolInput) {
        if (!"Bash".equals(toolName) || toolInput == null) {
            return false;
        }
        String command = toolInput.path("command").asText("").trim();
        return command.equals("git commit") || command.startsWith("git commit ");
    }
}
