package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.api.SessionStateDto;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import io.github.drompincen.promptgate.runtime.session.SessionStateTracker;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionStateTracker stateTracker;
    private final ResolutionService resolutionService;

    public SessionController(SessionStateTracker stateTracker, ResolutionService resolutionService) {
        this.stateTracker = stateTracker;
        this.resolutionService = resolutionService;
    }

    @GetMapping("/{id}/state")
    public SessionStateDto state(@PathVariable String id) {
        return stateTracker.describe(id);
    }

    @PostMapping("/{id}/agent/start")
    public SessionStateDto agentStarted(@PathVariable String id) {
        return stateTracker.agentStarted(id);
    }

    /** A stopped run can no longer act on answers, so its pending prompts are denied. */
    @PostMapping("/{id}/agent/stop")
    public SessionStateDto agentStopped(@PathVariable String id) {
        resolutionService.denyAll(id, ResolutionService.INTERRUPTED_REASON);
        return stateTracker.agentStopped(id);
    }

    @PostMapping("/{id}/interrupt")
    public Map<String, Object> interrupt(@PathVariable String id) {
        int denied = resolutionService.denyAll(id, ResolutionService.INTERRUPTED_REASON);
        return Map.of("sessionId", id, "denied", denied);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> clear(@PathVariable String id) {
        int denied = resolutionService.clearSession(id);
        return Map.of("sessionId", id, "denied", denied);
    }
}
