package io.stackcontroller.health;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Healthy when a TCP connection to {@code host:port} can be opened.
 */
public class TcpHealthProbe implements HealthProbe {

    private final String host;
    private final int port;

    public TcpHealthProbe(String target) {
        int separator = target.lastIndexOf(':');
        if (separator <= 0 || separator == target.length() - 1) {
            throw new IllegalArgumentException("TCP probe target must be host:port, got: " + target);
        }
        this.host = target.substring(0, separator);
        this.port = Integer.parseInt(target.substring(separator + 1));
    }

    @Override
    public void check(Duration timeout) throws ProbeException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
        } catch (IOException e) {
            throw new ProbeException("TCP connect to " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
    }
}
