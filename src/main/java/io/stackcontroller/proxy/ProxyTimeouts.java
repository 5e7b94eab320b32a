package io.stackcontroller.proxy;

import java.time.Duration;

import static io.stackcontroller.config.Constants.*;

/**
 * Upstream timeouts. {@code send} bounds writing the request, {@code read} bounds waiting for
 * the upstream's response.
 */
public record ProxyTimeouts(Duration connect, Duration send, Duration read) {

    public static ProxyTimeouts defaults() {
        return new ProxyTimeouts(Duration.ofSeconds(DEFAULT_PROXY_CONNECT_TIMEOUT_SECONDS),
                Duration.ofSeconds(DEFAULT_PROXY_SEND_TIMEOUT_SECONDS),
                Duration.ofSeconds(DEFAULT_PROXY_READ_TIMEOUT_SECONDS));
    }
}
