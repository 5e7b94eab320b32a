package io.stackcontroller.health;

import io.stackcontroller.enums.ProbeType;
import io.stackcontroller.models.HealthCheckSpec;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HealthProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Test
    void testTcpProbe_HealthyWhenPortAccepts() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            TcpHealthProbe probe = new TcpHealthProbe("localhost:" + server.getLocalPort());

            assertThatCode(() -> probe.check(TIMEOUT)).doesNotThrowAnyException();
        }
    }

    @Test
    void testTcpProbe_FailsWhenNothingListens() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0)) {
            port = server.getLocalPort();
        }
        TcpHealthProbe probe = new TcpHealthProbe("localhost:" + port);

        assertThatThrownBy(() -> probe.check(TIMEOUT))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("TCP connect to localhost:" + port);
    }

    @Test
    void testTcpProbe_RejectsTargetWithoutPort() {
        assertThatThrownBy(() -> new TcpHealthProbe("localhost"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testHttpProbe_StatusDecidesHealth() throws Exception {
        // Given
        HttpClient client = mock(HttpClient.class);
        HttpResponse<Void> ok = mock(HttpResponse.class);
        HttpResponse<Void> unavailable = mock(HttpResponse.class);
        when(ok.statusCode()).thenReturn(200);
        when(unavailable.statusCode()).thenReturn(503);
        doReturn(ok).doReturn(unavailable).when(client).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
        HttpHealthProbe probe = new HttpHealthProbe("http://localhost:9000/minio/health/live", client);

        // When / Then
        assertThatCode(() -> probe.check(TIMEOUT)).doesNotThrowAnyException();
        assertThatThrownBy(() -> probe.check(TIMEOUT))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("returned status 503");
    }

    @Test
    void testCommandProbe_MissingBinaryFails() {
        CommandHealthProbe probe = new CommandHealthProbe(List.of("definitely-not-a-real-binary-4711"));

        assertThatThrownBy(() -> probe.check(TIMEOUT))
                .isInstanceOf(ProbeException.class)
                .hasMessageContaining("Cannot run probe command");
    }

    @Test
    void testFactory_CreatesProbeForEachType() {
        HealthProbeFactory factory = new HealthProbeFactory();

        assertThat(factory.create(HealthCheckSpec.builder().type(ProbeType.COMMAND).command(List.of("redis-cli", "ping")).build()))
                .isInstanceOf(CommandHealthProbe.class);
        assertThat(factory.create(HealthCheckSpec.builder().type(ProbeType.HTTP).target("http://localhost:9000").build()))
                .isInstanceOf(HttpHealthProbe.class);
        assertThat(factory.create(HealthCheckSpec.builder().type(ProbeType.TCP).target("localhost:8000").build()))
                .isInstanceOf(TcpHealthProbe.class);
    }
}
