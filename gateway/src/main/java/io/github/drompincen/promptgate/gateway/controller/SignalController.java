package io.github.drompincen.promptgate.gateway.controller;

import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Exposes the service's signal channel to hook processes that cannot share its file system.
 */
@RestController
@RequestMapping("/api/signals")
public class SignalController {

    private final SignalChannel signalChannel;

    public SignalController(SignalChannel signalChannel) {
        this.signalChannel = signalChannel;
    }

    @PostMapping("/{sessionId}")
    public ResponseEntity<Void> mark(@PathVariable String sessionId) {
        signalChannel.mark(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}")
    public Map<String, Object> check(@PathVariable String sessionId) {
        return Map.of("sessionId", sessionId, "marked", signalChannel.check(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public Map<String, Object> consume(@PathVariable String sessionId) {
        return Map.of("sessionId", sessionId, "consumed", signalChannel.consume(sessionId));
    }
}
