package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionResult;
import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.api.RespondRequest;
import io.github.drompincen.promptgate.protocol.api.SubmitPromptRequest;
import io.github.drompincen.promptgate.protocol.prompt.CommitApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.CommitApprovalResponse;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import io.github.drompincen.promptgate.runtime.resolution.UnknownRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PromptControllerTest {

    @Mock private ResolutionService resolutionService;

    private PromptController controller;

    @BeforeEach
    void setUp() {
        controller = new PromptController(resolutionService);
    }

    @Test
    void requestReturnsGeneratedId() {
        Prompt draft = CommitApprovalPrompt.draft("feat: x", "M a.txt");
        when(resolutionService.submit("S1", draft, null)).thenReturn("gen-1");

        var response = controller.request(new SubmitPromptRequest("S1", null, draft));

        assertThat(response.success()).isTrue();
        assertThat(response.requestId()).isEqualTo("gen-1");
    }

    @Test
    void responseCarriesTypedResponse() {
        var decision = new CommitApprovalResponse(true, true, null);
        when(resolutionService.awaitAsync("R1")).thenReturn(CompletableFuture.completedFuture(decision));
        when(resolutionService.status("R1")).thenReturn(Optional.of(ResolutionState.RESOLVED));

        PollResponse body = controller.response("R1").join();

        assertThat(body.approved()).isTrue();
        assertThat(body.response()).isEqualTo(decision);
    }

    @Test
    void respondPassesResponseThrough() {
        var decision = new CommitApprovalResponse(false, null, "not yet");
        when(resolutionService.resolve("R1", decision))
                .thenReturn(new ResolutionResult("R1", ResolutionState.RESOLVED, true));

        assertThat(controller.respond(new RespondRequest("R1", decision)).state())
                .isEqualTo(ResolutionState.RESOLVED);
    }

    @Test
    void statusOfUnknownRequestIsNotFound() {
        when(resolutionService.status("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.status("nope")).isInstanceOf(UnknownRequestException.class);
    }

    @Test
    void statusReportsState() {
        when(resolutionService.status("R1")).thenReturn(Optional.of(ResolutionState.PENDING));

        assertThat(controller.status("R1")).containsEntry("state", ResolutionState.PENDING);
    }

    @Test
    void activeReturnsNoContentWhenQueueEmpty() {
        when(resolutionService.activePrompt("S1")).thenReturn(Optional.empty());

        ResponseEntity<Prompt> response = controller.active("S1");

        assertThat(response.getStatusCode().value()).isEqualTo(204);
    }

    @Test
    void activeReturnsTopPrompt() {
        Prompt top = CommitApprovalPrompt.draft("m", "").withIdentity("R1", "S1", Instant.now());
        when(resolutionService.activePrompt("S1")).thenReturn(Optional.of(top));

        ResponseEntity<Prompt> response = controller.active("S1");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(top);
    }
}
