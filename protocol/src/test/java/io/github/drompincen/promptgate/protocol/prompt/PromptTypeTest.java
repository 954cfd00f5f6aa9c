package io.github.drompincen.promptgate.protocol.prompt;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTypeTest {

    @Test
    void permissionSurfacesBeforeEverythingElse() {
        List<PromptType> types = new ArrayList<>(List.of(PromptType.values()));
        Collections.reverse(types);
        types.sort(Comparator.comparingInt(PromptType::priority));

        assertThat(types).containsExactly(
                PromptType.PERMISSION,
                PromptType.USER_QUESTION,
                PromptType.PLAN_APPROVAL,
                PromptType.COMMIT_APPROVAL);
    }

    @Test
    void prioritiesMatchWireContract() {
        assertThat(PromptType.PERMISSION.priority()).isZero();
        assertThat(PromptType.USER_QUESTION.priority()).isEqualTo(1);
        assertThat(PromptType.PLAN_APPROVAL.priority()).isEqualTo(2);
        assertThat(PromptType.COMMIT_APPROVAL.priority()).isEqualTo(3);
    }

    @Test
    void fromWireNameResolvesEveryType() {
        for (PromptType type : PromptType.values()) {
            assertThat(PromptType.fromWireName(type.wireName())).isEqualTo(type);
        }
    }

    @Test
    void fromWireNameRejectsUnknownName() {
        assertThatThrownBy(() -> PromptType.fromWireName("shell"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shell");
    }
}
