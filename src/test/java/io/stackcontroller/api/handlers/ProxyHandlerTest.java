package io.stackcontroller.api.handlers;

import io.stackcontroller.api.models.responses.ErrorResponse;
import io.stackcontroller.proxy.ReverseProxyRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProxyHandlerTest {

    private ReverseProxyRouter router;
    private ProxyHandler handler;

    @BeforeEach
    void setUp() {
        router = mock(ReverseProxyRouter.class);
        handler = new ProxyHandler(router);
    }

    @Test
    void testProxy_PassesRequestToRouter() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/vehicles");
        request.setQueryString("page=2");
        ResponseEntity<Object> upstream = ResponseEntity.ok("[]");
        when(router.route(eq("GET"), eq("/api/v1/vehicles"), eq("page=2"), isNull(), any())).thenReturn(upstream);

        // When
        ResponseEntity<Object> response = handler.proxy(null, request);

        // Then
        assertThat(response).isSameAs(upstream);
    }

    @Test
    void testProxy_AddsForwardingHeaders() {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/parser/jobs");
        request.setRemoteAddr("10.0.0.9");
        request.addHeader(HttpHeaders.HOST, "stack.example.com");
        request.addHeader("X-Forwarded-For", "203.0.113.5");
        request.setSecure(true);
        when(router.route(any(), any(), any(), any(), any())).thenReturn(ResponseEntity.ok().build());

        // When
        handler.proxy(new byte[]{1}, request);

        // Then
        ArgumentCaptor<HttpHeaders> headers = ArgumentCaptor.forClass(HttpHeaders.class);
        verify(router).route(eq("POST"), eq("/parser/jobs"), isNull(), any(), headers.capture());
        assertThat(headers.getValue().getFirst("X-Forwarded-For")).isEqualTo("203.0.113.5, 10.0.0.9");
        assertThat(headers.getValue().getFirst("X-Forwarded-Proto")).isEqualTo("https");
        assertThat(headers.getValue().getFirst("X-Forwarded-Host")).isEqualTo("stack.example.com");
    }

    @Test
    void testExtractHeaders_StartsChainWithClientAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setRemoteAddr("192.168.1.20");

        HttpHeaders headers = handler.extractHeaders(request);

        assertThat(headers.getFirst("X-Forwarded-For")).isEqualTo("192.168.1.20");
        assertThat(headers.getFirst("X-Forwarded-Proto")).isEqualTo("http");
    }

    @Test
    void testProxy_RouterFailureIsInternalError() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/vehicles");
        when(router.route(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        ResponseEntity<Object> response = handler.proxy(null, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getReason()).contains("boom");
    }
}
