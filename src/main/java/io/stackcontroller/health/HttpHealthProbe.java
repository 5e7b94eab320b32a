package io.stackcontroller.health;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP GET against a health endpoint, e.g. {@code http://minio:9000/minio/health/live}.
 * Any 2xx or 3xx status is healthy.
 */
public class HttpHealthProbe implements HealthProbe {

    private final URI target;
    private final HttpClient httpClient;

    public HttpHealthProbe(String target) {
        this(target, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    HttpHealthProbe(String target, HttpClient httpClient) {
        this.target = URI.create(target);
        this.httpClient = httpClient;
    }

    @Override
    public void check(Duration timeout) throws ProbeException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status < 200 || status >= 400) {
                throw new ProbeException("GET " + target + " returned status " + status);
            }
        } catch (IOException e) {
            throw new ProbeException("GET " + target + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException("Probe interrupted", e);
        }
    }
}
