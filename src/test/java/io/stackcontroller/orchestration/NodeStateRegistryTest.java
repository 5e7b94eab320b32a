package io.stackcontroller.orchestration;

import io.stackcontroller.enums.NodeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NodeStateRegistryTest {

    private NodeStateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NodeStateRegistry();
        registry.register(List.of("redis", "db"));
    }

    @Test
    void testRegister_StartsPending() {
        assertThat(registry.getState("db")).isEqualTo(NodeState.PENDING);
        assertThat(registry.isHealthy("db")).isFalse();
        assertThat(registry.getState("unknown")).isNull();
        assertThat(registry.snapshot().keySet()).containsExactly("db", "redis");
    }

    @Test
    void testTransition_NotifiesListeners() {
        // Given
        List<String> seen = new ArrayList<>();
        registry.addListener((node, from, to) -> seen.add(node + ":" + from + "->" + to));

        // When
        registry.transition("db", NodeState.STARTING);
        registry.transition("db", NodeState.PROBING);
        registry.transition("db", NodeState.HEALTHY);

        // Then
        assertThat(seen).containsExactly("db:PENDING->STARTING", "db:STARTING->PROBING", "db:PROBING->HEALTHY");
        assertThat(registry.isHealthy("db")).isTrue();
        assertThat(registry.getStatus("db").orElseThrow().everHealthy()).isTrue();
    }

    @Test
    void testTransition_IllegalMoveRejected() {
        assertThatThrownBy(() -> registry.transition("db", NodeState.HEALTHY))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PENDING -> HEALTHY");
    }

    @Test
    void testTransition_StoppedIsTerminal() {
        registry.transition("redis", NodeState.STOPPED);

        assertThatThrownBy(() -> registry.transition("redis", NodeState.PENDING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testTransition_RestartCountedOnFailedToPending() {
        // Given
        registry.transition("db", NodeState.STARTING);
        registry.transition("db", NodeState.FAILED);

        // When
        registry.transition("db", NodeState.PENDING);

        // Then
        assertThat(registry.getStatus("db").orElseThrow().restarts()).isEqualTo(1);
    }

    @Test
    void testTransition_FailingListenerDoesNotBlockOthers() {
        // Given
        List<String> seen = new ArrayList<>();
        registry.addListener((node, from, to) -> {
            throw new IllegalStateException("boom");
        });
        registry.addListener((node, from, to) -> seen.add(node));

        // When
        registry.transition("db", NodeState.STARTING);

        // Then
        assertThat(seen).containsExactly("db");
    }

    @Test
    void testRecordProbeError_KeepsState() {
        registry.transition("db", NodeState.STARTING);
        registry.recordProbeError("db", "connection refused");

        NodeStatus status = registry.getStatus("db").orElseThrow();
        assertThat(status.state()).isEqualTo(NodeState.STARTING);
        assertThat(status.lastProbeError()).isEqualTo("connection refused");
    }
}
