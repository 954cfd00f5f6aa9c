package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.prompt.PromptType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GatePolicyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GatePolicy policy = GatePolicy.defaults();

    @Test
    void exitPlanModeNeedsPlanApproval() {
        assertThat(policy.gateFor("ExitPlanMode", null)).contains(PromptType.PLAN_APPROVAL);
    }

    @Test
    void askUserQuestionNeedsAnswer() {
        assertThat(policy.gateFor("AskUserQuestion", null)).contains(PromptType.USER_QUESTION);
    }

    @Test
    void gitCommitThroughBashNeedsCommitApproval() {
        assertThat(policy.gateFor("Bash", bash("git commit -m \"fix\""))).contains(PromptType.COMMIT_APPROVAL);
        assertThat(policy.gateFor("GitCommit", null)).contains(PromptType.COMMIT_APPROVAL);
        assertThat(policy.gateFor("Bash", bash("git commit-tree abc"))).contains(PromptType.PERMISSION);
    }

    @Test
    void defaultPermissionToolsAreGated() {
        assertThat(policy.gateFor("Bash", bash("ls"))).contains(PromptType.PERMISSION);
        assertThat(policy.gateFor("Write", null)).contains(PromptType.PERMISSION);
        assertThat(policy.gateFor("WebFetch", null)).contains(PromptType.PERMISSION);
    }

    @Test
    void readOnlyToolsPassThrough() {
        assertThat(policy.gateFor("Read", null)).isEmpty();
        assertThat(policy.gateFor("Grep", null)).isEmpty();
        assertThat(policy.gateFor(null, null)).isEmpty();
    }

    @Test
    void allowPatternSkipsPermissionButNotCommit() {
        GatePolicy allowing = policy.withAllowPatterns(List.of("Bash(git:*)"));

        assertThat(allowing.gateFor("Bash", bash("git status"))).isEmpty();
        assertThat(allowing.gateFor("Bash", bash("git commit -m x"))).contains(PromptType.COMMIT_APPROVAL);
        assertThat(allowing.gateFor("Bash", bash("rm -rf build"))).contains(PromptType.PERMISSION);
    }

    @Test
    void customToolSetsReplaceDefaults() {
        GatePolicy custom = new GatePolicy(Set.of("Read"), Set.of(), List.of());

        assertThat(custom.gateFor("Read", null)).contains(PromptType.PERMISSION);
        assertThat(custom.gateFor("Write", null)).isEmpty();
        assertThat(custom.gateFor("GitCommit", null)).isEmpty();
    }

    private JsonNode bash(String command) {
        return mapper.createObjectNode().put("command", command);
    }
}
