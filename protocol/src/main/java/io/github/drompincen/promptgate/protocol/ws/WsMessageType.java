package io.github.drompincen.promptgate.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_SESSION,
    UNSUBSCRIBE,
    RESPOND_PROMPT,

    // Server -> Client
    PROMPT_REQUEST,
    PROMPT_RESOLVED,
    SESSION_STATE,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
