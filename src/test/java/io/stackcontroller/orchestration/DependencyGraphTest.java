package io.stackcontroller.orchestration;

import io.stackcontroller.models.Dependency;
import io.stackcontroller.models.ServiceNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void testBuild_LayersFollowDependencies() {
        // Given - the development stack
        List<ServiceNode> nodes = List.of(
                node("entities", Dependency.healthy("db")),
                node("db"),
                node("pgadmin", Dependency.healthy("db")),
                node("minio"),
                node("minio_mc", Dependency.healthy("minio")),
                node("redis"),
                node("redis_1"),
                node("parsers"));

        // When
        DependencyGraph graph = DependencyGraph.build(nodes);

        // Then
        assertThat(graph.getLayers()).containsExactly(
                List.of("db", "minio", "parsers", "redis", "redis_1"),
                List.of("entities", "minio_mc", "pgadmin"));
        assertThat(graph.getDependents("db")).containsExactly("entities", "pgadmin");
    }

    @Test
    void testBuild_OrderIndependentOfDeclarationOrder() {
        // Given
        List<ServiceNode> nodes = new ArrayList<>(List.of(
                node("a"),
                node("b", Dependency.started("a")),
                node("c", Dependency.healthy("b")),
                node("d", Dependency.started("a"), Dependency.healthy("c"))));
        List<String> expected = DependencyGraph.build(nodes).getStartOrder();

        // When
        Collections.reverse(nodes);
        List<String> reversed = DependencyGraph.build(nodes).getStartOrder();

        // Then
        assertThat(reversed).isEqualTo(expected).containsExactly("a", "b", "c", "d");
    }

    @Test
    void testBuild_EveryDependencyPrecedesItsDependent() {
        // Given
        List<ServiceNode> nodes = List.of(
                node("migrator", Dependency.healthy("db")),
                node("entities", Dependency.healthy("db"), Dependency.started("redis_1")),
                node("db"),
                node("redis_1"));

        // When
        DependencyGraph graph = DependencyGraph.build(nodes);
        List<String> order = graph.getStartOrder();

        // Then
        for (ServiceNode node : graph.getNodes()) {
            for (Dependency dependency : node.getDependencies()) {
                assertThat(order.indexOf(dependency.nodeName())).isLessThan(order.indexOf(node.getName()));
            }
        }
    }

    @Test
    void testBuild_CycleIsRejectedWithFullPath() {
        // Given
        List<ServiceNode> nodes = List.of(
                node("a", Dependency.started("b")),
                node("b", Dependency.healthy("c")),
                node("c", Dependency.started("a")),
                node("d"));

        // When / Then
        assertThatThrownBy(() -> DependencyGraph.build(nodes))
                .isInstanceOf(DependencyCycleException.class)
                .hasMessageContaining("a -> b -> c -> a")
                .extracting(e -> ((DependencyCycleException) e).getCycle())
                .isEqualTo(List.of("a", "b", "c", "a"));
    }

    @Test
    void testBuild_SelfDependencyIsACycle() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(node("db", Dependency.started("db")))))
                .isInstanceOf(DependencyCycleException.class);
    }

    @Test
    void testBuild_UnknownDependencyRejected() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(node("entities", Dependency.healthy("db")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown node 'db'");
    }

    @Test
    void testBuild_DuplicateNameRejected() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(node("db"), node("db"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate service node: db");
    }

    @Test
    void testGetTransitiveDependencies() {
        // Given
        DependencyGraph graph = DependencyGraph.build(List.of(
                node("db"),
                node("migrator", Dependency.healthy("db")),
                node("entities", Dependency.started("migrator"))));

        // Then
        assertThat(graph.getTransitiveDependencies("entities")).containsExactly("migrator", "db");
        assertThat(graph.getTransitiveDependencies("db")).isEmpty();
    }

    private static ServiceNode node(String name, Dependency... dependencies) {
        return ServiceNode.builder().name(name).dependencies(List.of(dependencies)).build();
    }
}
