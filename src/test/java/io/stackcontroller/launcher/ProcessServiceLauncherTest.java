package io.stackcontroller.launcher;

import io.stackcontroller.models.ServiceNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ProcessServiceLauncherTest {

    private final ProcessServiceLauncher launcher = new ProcessServiceLauncher();

    @Test
    void testExternalNode_AliveUntilStopped() throws Exception {
        ServiceHandle handle = launcher.start(ServiceNode.builder().name("db").build());

        assertThat(handle.isAlive()).isTrue();
        assertThat(handle.stop(Duration.ofMillis(100))).isTrue();
        assertThat(handle.isAlive()).isFalse();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testProcess_ReportsExitCode() throws Exception {
        ServiceNode migrate = ServiceNode.builder()
                .name("migrate")
                .command(List.of("sh", "-c", "exit $EXIT_WITH"))
                .environment(Map.of("EXIT_WITH", "3"))
                .build();

        ServiceHandle handle = launcher.start(migrate);

        assertThat(handle.onExit().get(5, TimeUnit.SECONDS)).isEqualTo(3);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void testProcess_StopTerminatesLongRunningCommand() throws Exception {
        ServiceHandle handle = launcher.start(ServiceNode.builder()
                .name("redis")
                .command(List.of("sleep", "30"))
                .build());

        assertThat(handle.isAlive()).isTrue();
        handle.stop(Duration.ofSeconds(5));

        assertThat(handle.onExit().get(5, TimeUnit.SECONDS)).isNotNull();
        assertThat(handle.isAlive()).isFalse();
    }

    @Test
    void testMissingExecutable_Throws() {
        ServiceNode node = ServiceNode.builder().name("ghost").command(List.of("definitely-not-a-binary-xyz")).build();

        assertThatThrownBy(() -> launcher.start(node)).isInstanceOf(java.io.IOException.class);
    }
}
