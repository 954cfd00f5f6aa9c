package io.github.drompincen.promptgate.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.api.ResolutionResult;
import io.github.drompincen.promptgate.protocol.prompt.PromptResponse;
import io.github.drompincen.promptgate.protocol.ws.WsMessage;
import io.github.drompincen.promptgate.protocol.ws.WsMessageType;
import io.github.drompincen.promptgate.runtime.event.PromptEvent;
import io.github.drompincen.promptgate.runtime.event.PromptEventBus;
import io.github.drompincen.promptgate.runtime.event.PromptEventListener;
import io.github.drompincen.promptgate.runtime.resolution.ResolutionService;
import io.github.drompincen.promptgate.runtime.session.SessionStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes prompt events to browser tabs subscribed to a session and accepts their decisions.
 */
@Component
public class PromptWebSocketHandler extends TextWebSocketHandler implements PromptEventListener {

    private static final Logger log = LoggerFactory.getLogger(PromptWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final PromptEventBus eventBus;
    private final ResolutionService resolutionService;
    private final SessionStateTracker stateTracker;
    private final Map<String, Set<WebSocketSession>> sessionSubscriptions = new ConcurrentHashMap<>();

    public PromptWebSocketHandler(ObjectMapper objectMapper, PromptEventBus eventBus,
                                  ResolutionService resolutionService, SessionStateTracker stateTracker) {
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.resolutionService = resolutionService;
        this.stateTracker = stateTracker;
    }

    @PostConstruct
    public void init() {
        eventBus.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        eventBus.removeListener(this);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionSubscriptions.keySet().forEach(sessionId -> unsubscribe(session, sessionId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String sessionId = node.path("sessionId").asText(null);

        switch (type) {
            case "SUBSCRIBE_SESSION" -> subscribe(session, sessionId);
            case "UNSUBSCRIBE" -> {
                unsubscribe(session, sessionId);
                send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, sessionId, null));
            }
            case "RESPOND_PROMPT" -> respond(session, sessionId, node.path("payload"));
            default -> send(session, WsMessage.error(sessionId,
                    objectMapper.valueToTree(Map.of("error", "Unknown message type: " + type))));
        }
    }

    private void subscribe(WebSocketSession session, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            send(session, WsMessage.error(null, objectMapper.valueToTree(Map.of("error", "sessionId is required"))));
            return;
        }
        sessionSubscriptions.compute(sessionId, (k, set) -> {
            Set<WebSocketSession> subscribers = set != null ? set : new CopyOnWriteArraySet<>();
            subscribers.add(session);
            return subscribers;
        });
        send(session, WsMessage.of(WsMessageType.SUBSCRIBED, sessionId, null));
        // a reconnecting tab must see the prompt it missed
        send(session, WsMessage.of(WsMessageType.SESSION_STATE, sessionId,
                objectMapper.valueToTree(stateTracker.describe(sessionId))));
        resolutionService.activePrompt(sessionId).ifPresent(prompt ->
                send(session, WsMessage.of(WsMessageType.PROMPT_REQUEST, sessionId, objectMapper.valueToTree(prompt))));
    }

    // the last subscriber leaving drops the entry
    private void unsubscribe(WebSocketSession session, String sessionId) {
        if (sessionId == null) {
            return;
        }
        sessionSubscriptions.computeIfPresent(sessionId, (k, set) -> {
            set.remove(session);
            return set.isEmpty() ? null : set;
        });
    }

    private void respond(WebSocketSession session, String sessionId, JsonNode payload) {
        try {
            String requestId = payload.path("requestId").asText(null);
            if (requestId == null) {
                throw new IllegalArgumentException("requestId is required");
            }
            PromptResponse response = objectMapper.treeToValue(payload.path("response"), PromptResponse.class);
            ResolutionResult result = resolutionService.resolve(requestId, response);
            log.debug("WebSocket response for {} applied={}", requestId, result.applied());
        } catch (IOException | RuntimeException e) {
            log.warn("Rejected prompt response in session {}: {}", sessionId, e.getMessage());
            send(session, WsMessage.error(sessionId, objectMapper.valueToTree(Map.of("error", String.valueOf(e.getMessage())))));
        }
    }

    @Override
    public void onEvent(PromptEvent event) {
        WsMessage message;
        if (event instanceof PromptEvent.PromptRequested requested) {
            message = WsMessage.of(WsMessageType.PROMPT_REQUEST, event.sessionId(),
                    objectMapper.valueToTree(requested.prompt()));
        } else if (event instanceof PromptEvent.PromptResolved resolved) {
            message = WsMessage.of(WsMessageType.PROMPT_RESOLVED, event.sessionId(),
                    objectMapper.valueToTree(Map.of("promptId", resolved.promptId(), "state", resolved.state())));
        } else if (event instanceof PromptEvent.SessionStateChanged changed) {
            message = WsMessage.of(WsMessageType.SESSION_STATE, event.sessionId(),
                    objectMapper.valueToTree(changed.state()));
        } else {
            return;
        }
        var subscribers = sessionSubscriptions.get(event.sessionId());
        if (subscribers != null) {
            subscribers.forEach(ws -> send(ws, message));
        }
    }

    @Override
    public void onError(Throwable t) {
        log.error("Prompt event error in WebSocket handler", t);
    }

    int subscribedSessions() {
        return sessionSubscriptions.size();
    }

    int subscriberCount(String sessionId) {
        var set = sessionSubscriptions.get(sessionId);
        return set != null ? set.size() : 0;
    }

    private void send(WebSocketSession ws, WsMessage message) {
        if (!ws.isOpen()) {
            return;
        }
        try {
            TextMessage tm = new TextMessage(objectMapper.writeValueAsString(message));
            synchronized (ws) {
                ws.sendMessage(tm);
            }
        } catch (IOException e) {
            log.debug("Dropping {} for closed socket {}: {}", message.type(), ws.getId(), e.getMessage());
        }
    }
}
