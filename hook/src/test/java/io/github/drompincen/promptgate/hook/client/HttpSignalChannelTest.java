package io.github.drompincen.promptgate.hook.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
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
class HttpSignalChannelTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private HttpSignalChannel channel;

    @BeforeEach
    void setUp() {
        channel = new HttpSignalChannel(httpClient, new ObjectMapper(), "http://localhost:3006");
    }

    @Test
    void consumeReadsConsumedFlag() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"sessionId\":\"S1\",\"consumed\":true}");

        assertThat(channel.consume("S1")).isTrue();
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("DELETE");
        assertThat(request.getValue().uri().getPath()).isEqualTo("/api/signals/S1");
    }

    @Test
    void checkReadsMarkedFlag() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"sessionId\":\"S1\",\"marked\":false}");

        assertThat(channel.check("S1")).isFalse();
    }

    @Test
    void failuresReadAsFalse() throws Exception {
        doThrow(new IOException("refused")).when(httpClient).send(any(), any());

        assertThat(channel.check("S1")).isFalse();
        assertThat(channel.consume("S1")).isFalse();
    }

    @Test
    void errorStatusReadsAsFalse() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(500);

        assertThat(channel.consume("S1")).isFalse();
    }

    @Test
    void sessionIdIsEncoded() throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(204);

        channel.mark("a/b c");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().getRawPath()).isEqualTo("/api/signals/a%2Fb%20c");
        assertThat(request.getValue().method()).isEqualTo("POST");
    }

    @Test
    void pathSegmentKeepsSpaceAndPlusApart() {
        assertThat(HttpSignalChannel.pathSegment("a b")).isEqualTo("a%20b");
        assertThat(HttpSignalChannel.pathSegment("a+b")).isEqualTo("a%2Bb");
    }

    @Test
    void markFailurePropagates() throws Exception {
        doThrow(new IOException("refused")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> channel.mark("S1")).isInstanceOf(UncheckedIOException.class);
    }
}
