package io.stackcontroller.health;

import io.stackcontroller.enums.ProbeType;
import io.stackcontroller.models.HealthCheckSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    @Mock
    private HealthProbe probe;

    private HealthCheckSpec spec;

    @BeforeEach
    void setUp() {
        spec = HealthCheckSpec.builder()
                .type(ProbeType.TCP)
                .target("localhost:5432")
                .timeout(Duration.ofSeconds(5))
                .retries(3)
                .successThreshold(2)
                .build();
    }

    @Test
    void testProbeOnce_HealthyAfterSuccessThreshold() throws Exception {
        // Given
        HealthMonitor monitor = new HealthMonitor("db", spec, probe);

        // When / Then
        assertThat(monitor.probeOnce()).isEqualTo(HealthMonitor.Verdict.UNDECIDED);
        assertThat(monitor.probeOnce()).isEqualTo(HealthMonitor.Verdict.HEALTHY);
        verify(probe, times(2)).check(Duration.ofSeconds(5));
    }

    @Test
    void testProbeOnce_UnhealthyAfterRetriesConsecutiveFailures() throws Exception {
        // Given
        doThrow(new ProbeException("connection refused")).when(probe).check(any());
        HealthMonitor monitor = new HealthMonitor("db", spec, probe);

        // When / Then
        assertThat(monitor.probeOnce()).isEqualTo(HealthMonitor.Verdict.UNDECIDED);
        assertThat(monitor.probeOnce()).isEqualTo(HealthMonitor.Verdict.UNDECIDED);
        assertThat(monitor.probeOnce()).isEqualTo(HealthMonitor.Verdict.UNHEALTHY);
        assertThat(monitor.getLastError()).isEqualTo("connection refused");
        assertThat(monitor.getConsecutiveFailures()).isEqualTo(3);
    }

    @Test
    void testProbeOnce_SuccessResetsFailureCount() throws Exception {
        // Given
        doThrow(new ProbeException("timeout"))
                .doThrow(new ProbeException("timeout"))
                .doNothing()
                .doThrow(new ProbeException("timeout"))
                .when(probe).check(any());
        HealthMonitor monitor = new HealthMonitor("db", spec, probe);

        // When
        monitor.probeOnce();
        monitor.probeOnce();
        monitor.probeOnce();
        HealthMonitor.Verdict verdict = monitor.probeOnce();

        // Then
        assertThat(verdict).isEqualTo(HealthMonitor.Verdict.UNDECIDED);
        assertThat(monitor.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void testProbeOnce_RuntimeExceptionCountsAsFailure() throws Exception {
        // Given
        doThrow(new IllegalStateException("boom")).when(probe).check(any());
        HealthMonitor monitor = new HealthMonitor("db", spec, probe);

        // When
        monitor.probeOnce();

        // Then
        assertThat(monitor.getConsecutiveFailures()).isEqualTo(1);
        assertThat(monitor.getLastError()).contains("IllegalStateException").contains("boom");
    }

    @Test
    void testReset_ClearsCounters() {
        HealthMonitor monitor = new HealthMonitor("db", spec, probe);
        monitor.recordFailure("refused");
        monitor.recordSuccess();

        monitor.reset();

        assertThat(monitor.getConsecutiveFailures()).isZero();
        assertThat(monitor.getConsecutiveSuccesses()).isZero();
    }
}
