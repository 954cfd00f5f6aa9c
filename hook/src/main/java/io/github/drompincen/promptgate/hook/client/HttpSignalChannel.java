package io.github.drompincen.promptgate.hook.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Signal channel backed by the gateway's own channel, for hooks that do not share its file system.
 * Reads that fail report {@code false}.
 */
public class HttpSignalChannel implements SignalChannel {

    private static final Logger log = LoggerFactory.getLogger(HttpSignalChannel.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpSignalChannel(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void mark(String sessionId) {
        try {
            HttpResponse<String> resp = send(request(sessionId).POST(HttpRequest.BodyPublishers.noBody()));
            if (resp.statusCode() / 100 != 2) {
                throw new IllegalStateException("Mark failed: HTTP " + resp.statusCode());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot mark signal for " + sessionId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while marking signal", e);
        }
    }

    @Override
    public boolean check(String sessionId) {
        return read(sessionId, request(sessionId).GET(), "marked");
    }

    @Override
    public boolean consume(String sessionId) {
        return read(sessionId, request(sessionId).DELETE(), "consumed");
    }

    private boolean read(String sessionId, HttpRequest.Builder builder, String field) {
        try {
            HttpResponse<String> resp = send(builder);
            if (resp.statusCode() / 100 != 2) {
                log.warn("Signal {} for {} failed: HTTP {}", field, sessionId, resp.statusCode());
                return false;
            }
            JsonNode node = objectMapper.readTree(resp.body());
            return node.path(field).asBoolean(false);
        } catch (IOException e) {
            log.warn("Signal {} for {} failed: {}", field, sessionId, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest.Builder request(String sessionId) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/signals/" + pathSegment(sessionId)))
                .timeout(TIMEOUT);
    }

    // URLEncoder is form encoding; a path needs %20 for a space
    static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }
}
