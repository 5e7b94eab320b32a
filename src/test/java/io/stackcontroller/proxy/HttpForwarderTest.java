package io.stackcontroller.proxy;

import io.stackcontroller.api.models.responses.ErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpForwarderTest {

    private static final String UPSTREAM = "http://entities:8000";

    private HttpClient client;
    private HttpForwarder forwarder;

    @BeforeEach
    void setUp() {
        client = mock(HttpClient.class);
        forwarder = new HttpForwarder(client, new ProxyTimeouts(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3)));
    }

    @SuppressWarnings("unchecked")
    private HttpResponse<byte[]> upstreamResponse(int status, String body, Map<String, List<String>> headers) {
        HttpResponse<byte[]> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        when(response.headers()).thenReturn(java.net.http.HttpHeaders.of(headers, (name, value) -> true));
        return response;
    }

    @Test
    void testForward_RelaysStatusHeadersAndBody() throws Exception {
        // Given
        HttpResponse<byte[]> response = upstreamResponse(201, "{\"id\":7}",
                Map.of("Content-Type", List.of("application/json"), "Transfer-Encoding", List.of("chunked")));
        doReturn(response).when(client).send(any(HttpRequest.class), any());
        HttpHeaders headers = new HttpHeaders();
        headers.add("Authorization", "Basic YWRtaW46c2VjcmV0");
        headers.add(HttpHeaders.HOST, "stack.example.com");

        // When
        ResponseEntity<Object> result = forwarder.forward(UPSTREAM, "POST", "/api/v1/vehicles?page=2",
                "{}".getBytes(StandardCharsets.UTF_8), headers);

        // Then
        assertThat(result.getStatusCode().value()).isEqualTo(201);
        assertThat(new String((byte[]) result.getBody(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":7}");
        assertThat(result.getHeaders().getFirst("Content-Type")).isEqualTo("application/json");
        assertThat(result.getHeaders().containsKey("Transfer-Encoding")).isFalse();

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(request.capture(), any());
        assertThat(request.getValue().uri()).isEqualTo(URI.create("http://entities:8000/api/v1/vehicles?page=2"));
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().timeout()).contains(Duration.ofSeconds(5));
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("Basic YWRtaW46c2VjcmV0");
        assertThat(request.getValue().headers().firstValue("Host")).isEmpty();
    }

    @Test
    void testForward_ConnectionRefusedIsServiceUnavailable() throws Exception {
        doThrow(new ConnectException("Connection refused")).when(client).send(any(HttpRequest.class), any());

        ResponseEntity<Object> result = forwarder.forward(UPSTREAM, "GET", "/api/v1/vehicles", null, new HttpHeaders());

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(((ErrorResponse) result.getBody()).getReason()).contains("Connection refused");
    }

    @Test
    void testForward_ConnectTimeoutIsServiceUnavailable() throws Exception {
        doThrow(new HttpConnectTimeoutException("connect timed out")).when(client).send(any(HttpRequest.class), any());

        ResponseEntity<Object> result = forwarder.forward(UPSTREAM, "GET", "/", null, null);

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void testForward_ReadTimeoutIsGatewayTimeout() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(client).send(any(HttpRequest.class), any());

        ResponseEntity<Object> result = forwarder.forward(UPSTREAM, "GET", "/slow", null, null);

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    void testForward_BrokenResponseIsBadGateway() throws Exception {
        doThrow(new IOException("malformed response")).when(client).send(any(HttpRequest.class), any());

        ResponseEntity<Object> result = forwarder.forward(UPSTREAM, "GET", "/", null, null);

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void testForward_BlankUpstreamRejected() {
        assertThatThrownBy(() -> forwarder.forward(" ", "GET", "/", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forwarder.forward(null, "GET", "/", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
