package io.stackcontroller.api.handlers;

import io.stackcontroller.api.models.responses.ErrorResponse;
import io.stackcontroller.proxy.ReverseProxyRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.Enumeration;

/**
 * REST entry point for everything that is not a controller endpoint: hands the request to the
 * {@link ReverseProxyRouter}, which picks the upstream tier by path prefix.
 *
 * Adds the usual forwarding headers:
 * - X-Forwarded-For - client address, appended to any incoming chain
 * - X-Forwarded-Proto - http or https as seen by this listener
 * - X-Forwarded-Host - original Host header
 */
@Slf4j
@RestController
public class ProxyHandler {

    private final ReverseProxyRouter router;

    public ProxyHandler(ReverseProxyRouter router) {
        this.router = router;
    }

    @RequestMapping("/**")
    public ResponseEntity<Object> proxy(@RequestBody(required = false) byte[] body, HttpServletRequest request) {
        try {
            return router.route(request.getMethod(), request.getRequestURI(), request.getQueryString(), body,
                    extractHeaders(request));
        } catch (Exception e) {
            log.error("Error proxying {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Extract headers from the incoming request and add the forwarding ones.
     */
    HttpHeaders extractHeaders(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        Enumeration<String> headerNames = request.getHeaderNames();
        if (headerNames != null) {
            for (String name : Collections.list(headerNames)) {
                for (String value : Collections.list(request.getHeaders(name))) {
                    headers.add(name, value);
                }
            }
        }

        String priorChain = headers.getFirst("X-Forwarded-For");
        String clientAddress = request.getRemoteAddr();
        headers.set("X-Forwarded-For", priorChain != null ? priorChain + ", " + clientAddress : clientAddress);
        headers.set("X-Forwarded-Proto", request.isSecure() ? "https" : "http");
        String host = request.getHeader(HttpHeaders.HOST);
        if (host != null) {
            headers.set("X-Forwarded-Host", host);
        }
        return headers;
    }
}
