package io.stackcontroller.proxy;

import io.stackcontroller.api.models.responses.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Set;

/**
 * Forwards HTTP requests to an upstream node.
 *
 * The connect timeout is set on the client. java.net.http has a single per-request timeout
 * that runs until the response headers arrive, so it is set to send + read.
 */
@Slf4j
public class HttpForwarder {

    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade", "keep-alive",
        "proxy-connection", "te", "trailer", "transfer-encoding");

    private final HttpClient httpClient;
    private final ProxyTimeouts timeouts;

    public HttpForwarder(ProxyTimeouts timeouts) {
        this(HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(timeouts.connect())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build(), timeouts);
    }

    HttpForwarder(HttpClient httpClient, ProxyTimeouts timeouts) {
        this.httpClient = httpClient;
        this.timeouts = timeouts;
    }

    /**
     * Forward a request.
     *
     * @param upstreamUrl base URL, e.g. {@code http://entities:8000}
     * @param path        path and query, e.g. {@code /api/v1/vehicles?page=2}
     * @return the upstream response, or an {@link ErrorResponse} body with 502, 503 or 504
     */
    public ResponseEntity<Object> forward(String upstreamUrl, String method, String path, byte[] body, HttpHeaders headers) {
        if (upstreamUrl == null || upstreamUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Upstream URL cannot be null or empty");
        }
        String targetUrl = upstreamUrl + path;
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(targetUrl))
            .timeout(timeouts.send().plus(timeouts.read()));

        if (headers != null) {
            headers.forEach((name, values) -> {
                if (!isRestrictedHeader(name)) {
                    values.forEach(value -> requestBuilder.header(name, value));
                }
            });
        }
        if (body != null && body.length > 0) {
            requestBuilder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        long startTime = System.currentTimeMillis();
        try {
            HttpResponse<byte[]> response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofByteArray());
            log.debug("{} {} -> {} in {}ms", method, targetUrl, response.statusCode(), System.currentTimeMillis() - startTime);

            ResponseEntity.BodyBuilder responseBuilder = ResponseEntity.status(response.statusCode());
            response.headers().map().forEach((name, values) -> {
                if (!isRestrictedHeader(name) && !name.startsWith(":")) {
                    values.forEach(value -> responseBuilder.header(name, value));
                }
            });
            return responseBuilder.body(response.body());

        } catch (HttpConnectTimeoutException e) {
            log.error("Connect to {} timed out after {}", upstreamUrl, timeouts.connect());
            return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.upstreamUnreachable(upstreamUrl, "connect timed out"));
        } catch (HttpTimeoutException e) {
            log.error("{} {} timed out after {}ms", method, targetUrl, System.currentTimeMillis() - startTime);
            return error(HttpStatus.GATEWAY_TIMEOUT, ErrorResponse.gatewayTimeout(upstreamUrl));
        } catch (ConnectException | UnknownHostException e) {
            log.error("Failed to connect to {}: {}", upstreamUrl, e.getMessage());
            return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.upstreamUnreachable(upstreamUrl, String.valueOf(e.getMessage())));
        } catch (IOException e) {
            log.error("{} {} failed: {}", method, targetUrl, e.getMessage(), e);
            return error(HttpStatus.BAD_GATEWAY, ErrorResponse.badGateway(upstreamUrl, String.valueOf(e.getMessage())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.upstreamUnreachable(upstreamUrl, "interrupted"));
        }
    }

    private static ResponseEntity<Object> error(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Headers that HttpClient sets itself or that only apply to a single hop.
     */
    private boolean isRestrictedHeader(String headerName) {
        return HOP_BY_HOP_HEADERS.contains(headerName.toLowerCase());
    }
}
