package io.github.drompincen.promptgate.hook.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.api.PlanRequest;
import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.SubmitPromptRequest;
import io.github.drompincen.promptgate.protocol.api.SubmitResponse;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.Prompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Talks to the gateway's REST API. Plan prompts go through the plan endpoints, everything else
 * through the generic prompt endpoints.
 */
public class HttpGatewayClient implements GatewayClient {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayClient.class);

    private static final Duration SUBMIT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpGatewayClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String submit(String sessionId, String requestId, Prompt draft) throws GatewayException {
        String path;
        Object body;
        if (draft instanceof PlanApprovalPrompt plan) {
            path = "/api/plan/request";
            body = new PlanRequest(sessionId, requestId, plan.planContent(), plan.planPath());
        } else {
            path = "/api/prompts/request";
            body = new SubmitPromptRequest(sessionId, requestId, draft);
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .timeout(SUBMIT_TIMEOUT)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new GatewayException("Submit to " + path + " failed: HTTP " + resp.statusCode(),
                        resp.statusCode());
            }
            SubmitResponse submitted = objectMapper.readValue(resp.body(), SubmitResponse.class);
            if (!submitted.success()) {
                throw new GatewayException("Submit rejected: " + submitted.error(), resp.statusCode());
            }
            log.debug("Submitted {} as {}", draft.type().wireName(), submitted.requestId());
            return submitted.requestId() != null ? submitted.requestId() : requestId;
        } catch (IOException e) {
            throw new GatewayException("Cannot reach gateway at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while submitting", e);
        }
    }

    @Override
    public PollResponse poll(String requestId) throws GatewayException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/prompts/response/" + requestId))
                .GET()
                .build();
        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new GatewayException("Poll for " + requestId + " failed: HTTP " + resp.statusCode(),
                        resp.statusCode());
            }
            return objectMapper.readValue(resp.body(), PollResponse.class);
        } catch (IOException e) {
            throw new GatewayException("Lost connection while waiting for " + requestId, e);
        }
    }
}
