package io.github.drompincen.promptgate.hook.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.api.PollResponse;
import io.github.drompincen.promptgate.protocol.api.ResolutionState;
import io.github.drompincen.promptgate.protocol.json.ProtocolJson;
import io.github.drompincen.promptgate.protocol.prompt.PermissionPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalPrompt;
import io.github.drompincen.promptgate.protocol.prompt.PlanApprovalResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpGatewayClientTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private final ObjectMapper mapper = ProtocolJson.newObjectMapper();
    private HttpGatewayClient client;

    @BeforeEach
    void setUp() {
        client = new HttpGatewayClient(httpClient, mapper, "http://localhost:3006/");
    }

    @Test
    void planDraftGoesToPlanEndpoint() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\":true,\"requestId\":\"R1\"}");

        String id = client.submit("S1", "R1", PlanApprovalPrompt.draft("# plan", null));

        assertThat(id).isEqualTo("R1");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("http://localhost:3006/api/plan/request");
        assertThat(request.getValue().method()).isEqualTo("POST");
    }

    @Test
    void otherDraftsGoToPromptEndpoint() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\":true,\"requestId\":\"R2\"}");

        client.submit("S1", "R2", PermissionPrompt.draft("Bash", null, "Run command: ls", "Bash(ls:*)"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().getPath()).isEqualTo("/api/prompts/request");
    }

    @Test
    void non2xxSubmitFailsWithStatus() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(409);

        assertThatThrownBy(() -> client.submit("S1", "R1", PlanApprovalPrompt.draft("#", null)))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).getStatus()).isEqualTo(409));
    }

    @Test
    void rejectedSubmitFails() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\":false,\"error\":\"sessionId is required\"}");

        assertThatThrownBy(() -> client.submit("S1", "R1", PlanApprovalPrompt.draft("#", null)))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("sessionId is required");
    }

    @Test
    void connectionFailureHasNoStatus() throws Exception {
        doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> client.submit("S1", "R1", PlanApprovalPrompt.draft("#", null)))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).getStatus()).isEqualTo(-1));
    }

    @Test
    void pollDecodesTypedResponse() throws Exception {
        String body = mapper.writeValueAsString(
                PollResponse.of(new PlanApprovalResponse(false, "split it"), ResolutionState.RESOLVED));
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(body);

        PollResponse poll = client.poll("R1");

        assertThat(poll.approved()).isFalse();
        assertThat(poll.reason()).isEqualTo("split it");
        assertThat(poll.state()).isEqualTo(ResolutionState.RESOLVED);
        assertThat(poll.response()).isInstanceOf(PlanApprovalResponse.class);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().getPath()).isEqualTo("/api/prompts/response/R1");
        assertThat(request.getValue().timeout()).isEmpty();
    }

    @Test
    void submitBodyCarriesSessionAndRequestId() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\":true}");

        String id = client.submit("S1", "R9", PlanApprovalPrompt.draft("#", null));

        assertThat(id).isEqualTo("R9");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.getValue().bodyPublisher()).isPresent();
    }
}
