package io.stackcontroller.proxy;

import io.stackcontroller.api.models.responses.ErrorResponse;
import io.stackcontroller.enums.NodeState;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.orchestration.NodeStateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static io.stackcontroller.metrics.MetricsConstants.*;

/**
 * Front door of the stack: routes by path prefix, applies the auth gate, and only forwards to
 * upstream nodes the orchestrator reports as {@link NodeState#HEALTHY}. Anything else gets a
 * 503 so clients can tell "not ready yet" from a network failure.
 */
@Slf4j
public class ReverseProxyRouter {

    static final String RETRY_AFTER_SECONDS = "5";

    private final RouteTable routeTable;
    private final AuthGate authGate;
    private final NodeStateRegistry registry;
    private final HttpForwarder forwarder;
    private final MetricsProvider metricsProvider;

    public ReverseProxyRouter(RouteTable routeTable,
                              AuthGate authGate,
                              NodeStateRegistry registry,
                              HttpForwarder forwarder,
                              MetricsProvider metricsProvider) {
        this.routeTable = routeTable;
        this.authGate = authGate;
        this.registry = registry;
        this.forwarder = forwarder;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @param path  request path without query string
     * @param query raw query string or null
     */
    public ResponseEntity<Object> route(String method, String path, String query, byte[] body, HttpHeaders headers) {
        Optional<Route> match = routeTable.match(path);
        if (match.isEmpty()) {
            log.debug("No route for {} {}", method, path);
            return record("none", ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Route for " + path)));
        }
        Route route = match.get();

        if (authGate.requiresAuth(path) && !authGate.isAuthorized(headers.getFirst(HttpHeaders.AUTHORIZATION))) {
            log.info("Refused unauthenticated {} {}", method, path);
            return record(route.pathPrefix(), ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, authGate.challenge())
                    .body(ErrorResponse.unauthorized(path)));
        }

        NodeState state = registry.getState(route.upstreamNode());
        if (state != NodeState.HEALTHY) {
            String reported = state != null ? state.name() : "UNKNOWN";
            log.info("[Node: {}] Upstream is {}, refusing {} {}", route.upstreamNode(), reported, method, path);
            return record(route.pathPrefix(), ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                    .body(ErrorResponse.serviceUnavailable(route.upstreamNode(), reported)));
        }

        String target = query != null && !query.isEmpty() ? path + "?" + query : path;
        return record(route.pathPrefix(), forwarder.forward(route.upstreamUrl(), method, target, body, headers));
    }

    private ResponseEntity<Object> record(String routeTag, ResponseEntity<Object> response) {
        metricsProvider.counter(PROXY_REQUESTS_METRIC_NAME,
                Map.of(ROUTE_TAG, routeTag, STATUS_TAG, String.valueOf(response.getStatusCode().value()))).increment();
        return response;
    }
}
