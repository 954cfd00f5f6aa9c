package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.PlanRequest;
import io.github.drompincen.promptgate.protocol.api.PlanRespondRequest;
import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionResult;
import io.github.drompincen.promptgate.protocol.api.SubmitResponse;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalResponse;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Plan-approval endpoints used by the exit-plan-mode hook and the confirm-plan command.
 */
@RestController
@RequestMapping("/api/plan")
public class PlanController {

    private final ResolutionService resolutionService;

    public PlanController(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @PostMapping("/request")
    public SubmitResponse request(@RequestBody PlanRequest req) {
        String requestId = resolutionService.submit(req.sessionId(),
                PlanApprovalPrompt.draft(req.planContent(), req.planPath()), req.requestId());
        return SubmitResponse.accepted(requestId);
    }

    @GetMapping("/response/{requestId}")
    public CompletableFuture<PollResponse> response(@PathVariable String requestId) {
        return LongPoll.poll(resolutionService, requestId);
    }

    @PostMapping("/respond")
    public ResolutionResult respond(@RequestBody PlanRespondRequest req) {
        if (req.requestId() == null || req.approved() == null) {
            throw new IllegalArgumentException("requestId and approved are required");
        }
        return resolutionService.resolve(req.requestId(), new PlanApprovalResponse(req.approved(), req.reason()));
    }

    @GetMapping("/pending/{sessionId}")
    public List<Prompt> pending(@PathVariable String sessionId) {
        return resolutionService.pending(sessionId).stream()
                .filter(p -> p instanceof PlanApprovalPrompt)
                .toList();
    }
}
