package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionResult;
import io.github.drompincen.promptgate.protocol.api.RespondRequest;
import io.github.drompincen.promptgate.protocol.api.SubmitPromptRequest;
import io.github.drompincen.promptgate.protocol.api.SubmitResponse;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import io.github.drompincen.promptgate.runtime.resolution.UnknownRequestException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/prompts")
public class PromptController {

    private final ResolutionService resolutionService;

    public PromptController(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @PostMapping("/request")
    public SubmitResponse request(@RequestBody SubmitPromptRequest req) {
        String requestId = resolutionService.submit(req.sessionId(), req.prompt(), req.requestId());
        return SubmitResponse.accepted(requestId);
    }

    @GetMapping("/response/{requestId}")
    public CompletableFuture<PollResponse> response(@PathVariable String requestId) {
        return LongPoll.poll(resolutionService, requestId);
    }

    @PostMapping("/respond")
    public ResolutionResult respond(@RequestBody RespondRequest req) {
        if (req.requestId() == null) {
            throw new IllegalArgumentException("requestId is required");
        }
        return resolutionService.resolve(req.requestId(), req.response());
    }

    @GetMapping("/status/{requestId}")
    public Map<String, Object> status(@PathVariable String requestId) {
        return resolutionService.status(requestId)
                .map(state -> Map.<String, Object>of("requestId", requestId, "state", state))
                .orElseThrow(() -> new UnknownRequestException(requestId));
    }

    @GetMapping("/{sessionId}")
    public List<Prompt> pending(@PathVariable String sessionId) {
        return resolutionService.pending(sessionId);
    }

    @GetMapping("/{sessionId}/active")
    public ResponseEntity<Prompt> active(@PathVariable String sessionId) {
        return resolutionService.activePrompt(sessionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }
}
