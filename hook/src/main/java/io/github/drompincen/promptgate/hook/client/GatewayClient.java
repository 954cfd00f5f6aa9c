package io.github.drompincen.promptgate.hook.client;

import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;

public interface GatewayClient {

    /**
     * @return the request id the gateway accepted
     */
    String submit(String sessionId, String requestId, Prompt draft) throws GatewayException;

    /**
     * Blocks until the gateway answers. The gateway owns the deadline, so no client timeout applies.
     */
    PollResponse poll(String requestId) throws GatewayException, InterruptedException;
}
