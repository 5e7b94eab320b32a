package io.stackcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard error response model for the status API and the proxy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private String error;
    private String type;
    private String reason;
    private Integer status;

    public static ErrorResponse notFound(String resource) {
        return ErrorResponse.builder()
            .error("resource_not_found_exception")
            .reason(resource + " not found")
            .status(404)
            .build();
    }

    public static ErrorResponse unauthorized(String path) {
        return ErrorResponse.builder()
            .error("unauthorized")
            .reason("Authentication required for " + path)
            .status(401)
            .build();
    }

    /**
     * Upstream known but not ready; distinct from a network failure so clients can retry.
     */
    public static ErrorResponse serviceUnavailable(String upstream, String state) {
        return ErrorResponse.builder()
            .error("service_unavailable")
            .type(state)
            .reason("Upstream " + upstream + " is not healthy")
            .status(503)
            .build();
    }

    public static ErrorResponse upstreamUnreachable(String upstream, String message) {
        return ErrorResponse.builder()
            .error("service_unavailable")
            .type("unreachable")
            .reason("Cannot connect to " + upstream + ": " + message)
            .status(503)
            .build();
    }

    public static ErrorResponse badGateway(String upstream, String message) {
        return ErrorResponse.builder()
            .error("bad_gateway")
            .reason("Error talking to " + upstream + ": " + message)
            .status(502)
            .build();
    }

    public static ErrorResponse gatewayTimeout(String upstream) {
        return ErrorResponse.builder()
            .error("gateway_timeout")
            .reason("Upstream " + upstream + " did not respond in time")
            .status(504)
            .build();
    }

    public static ErrorResponse internalError(String message) {
        return ErrorResponse.builder()
            .error("internal_server_error")
            .reason(message)
            .status(500)
            .build();
    }

    public static ErrorResponse badRequest(String message) {
        return ErrorResponse.builder()
            .error("bad_request")
            .reason(message)
            .status(400)
            .build();
    }
}
