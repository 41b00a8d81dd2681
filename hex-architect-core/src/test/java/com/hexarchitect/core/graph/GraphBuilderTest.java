package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.ComponentEntry;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.NodeId;
import com.hexarchitect.core.model.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphBuilder}.
 */
class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    @Test
    void build_userModule_yieldsThreeNodesAndOneEdge() {
        BuildResult result = builder.build(GraphFixtures.userModule());

        ArchitectureGraph graph = result.graph();
        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.allEdges())
            .containsExactly(GraphEdge.dependsOn(NodeId.of("InMemoryUserRepository"), NodeId.of("UserRepository")));
        assertThat(result.danglingDependencies()).isEmpty();
        assertThat(result.hasFindings()).isFalse();
    }

    @Test
    void build_unregisteredDependency_reportsDanglingWithoutEdge() {
        BuildResult result = builder.build(List.of(
            ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE, "PaymentGateway")));

        assertThat(result.graph().nodeCount()).isEqualTo(1);
        assertThat(result.graph().edgeCount()).isZero();
        assertThat(result.danglingDependencies()).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(FindingSeverity.WARNING);
            assertThat(finding.nodes()).containsExactly(NodeId.of("Order"), NodeId.of("PaymentGateway"));
            assertThat(finding.explanation()).contains("PaymentGateway");
        });
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 7, 50})
    void build_distinctWellFormedEntries_nodeCountEqualsEntryCount(int size) {
        List<ComponentEntry> entries = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            entries.add(ComponentEntry.of("Component" + i, Layer.values()[i % Layer.values().length],
                Role.values()[i % Role.values().length]));
        }

        assertThat(builder.build(entries).graph().nodeCount()).isEqualTo(size);
    }

    @Test
    void build_everyMatchingDependency_yieldsExactlyOneEdge() {
        ArchitectureGraph graph = builder.build(GraphFixtures.orderModule()).graph();

        for (ComponentEntry entry : GraphFixtures.orderModule()) {
            NodeId source = NodeId.of(entry.typeName());
            for (String dependency : entry.dependencies()) {
                NodeId target = NodeId.of(dependency);
                long matching = graph.allEdges().stream()
                    .filter(e -> e.from().equals(source) && e.to().equals(target))
                    .count();
                assertThat(matching).as("%s -> %s", source, target).isEqualTo(graph.contains(target) ? 1 : 0);
            }
        }
    }

    @Test
    void build_everyUnmatchedDependency_yieldsExactlyOneDanglingFinding() {
        BuildResult result = builder.build(List.of(
            ComponentEntry.of("PlaceOrder", Layer.APPLICATION, Role.USE_CASE, "PaymentGateway", "Mailer"),
            ComponentEntry.of("CancelOrder", Layer.APPLICATION, Role.USE_CASE, "PaymentGateway")
        ));

        assertThat(result.danglingDependencies()).hasSize(3);
        assertThat(result.danglingDependencies())
            .extracting(f -> f.nodes().get(1))
            .containsExactly(NodeId.of("PaymentGateway"), NodeId.of("Mailer"), NodeId.of("PaymentGateway"));
        assertThat(result.graph().edgeCount()).isZero();
    }

    @Test
    void build_repeatedDependencyDeclaration_yieldsOneEdgePerDeclaration() {
        BuildResult result = builder.build(List.of(
            ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE),
            ComponentEntry.of("OrderRepository", Layer.PORT, Role.REPOSITORY, "Order", "Order")
        ));

        assertThat(result.graph().edgeCount()).isEqualTo(2);
    }

    @Test
    void build_malformedEntries_areExcludedAndReported() {
        List<ComponentEntry> entries = Arrays.asList(
            ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY),
            ComponentEntry.of("  ", Layer.DOMAIN, Role.ENTITY),
            new ComponentEntry("Orphan", null, Role.SERVICE, "", List.of()),
            new ComponentEntry("Ghost", Layer.ADAPTER, null, "", List.of()),
            null
        );

        BuildResult result = builder.build(entries);

        assertThat(result.graph().nodeCount()).isEqualTo(1);
        assertThat(result.malformedEntries()).hasSize(4);
        assertThat(result.malformedEntries()).extracting(Finding::explanation)
            .anySatisfy(text -> assertThat(text).contains("Entry #2", "type name is blank"))
            .anySatisfy(text -> assertThat(text).contains("Orphan", "layer is missing"))
            .anySatisfy(text -> assertThat(text).contains("Ghost", "role is missing"))
            .anySatisfy(text -> assertThat(text).contains("Entry #5", "null"));
    }

    @Test
    void build_blankDependencyName_isSkippedAndReported() {
        BuildResult result = builder.build(List.of(
            ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY),
            new ComponentEntry("UserService", Layer.APPLICATION, Role.SERVICE, "", Arrays.asList("User", null, " "))
        ));

        assertThat(result.graph().edgeCount()).isEqualTo(1);
        assertThat(result.malformedEntries()).hasSize(2)
            .allSatisfy(f -> assertThat(f.nodes()).containsExactly(NodeId.of("UserService")));
    }

    @Test
    void build_duplicateWithFirstWins_keepsFirstAndReportsDiscarded() {
        BuildResult result = builder.build(List.of(
            new ComponentEntry("Order", Layer.DOMAIN, Role.AGGREGATE, "shop::domain", List.of()),
            new ComponentEntry("Order", Layer.ADAPTER, Role.ADAPTER, "shop::legacy", List.of("Order"))
        ));

        assertThat(result.graph().nodeCount()).isEqualTo(1);
        assertThat(result.graph().node("Order")).get()
            .satisfies(node -> assertThat(node.layer()).isEqualTo(Layer.DOMAIN));
        assertThat(result.graph().edgeCount()).isZero();
        assertThat(result.duplicates()).singleElement().satisfies(finding -> {
            assertThat(finding.nodes()).containsExactly(NodeId.of("Order"));
            assertThat(finding.explanation()).contains("kept Domain/Aggregate", "discarded Adapter/Adapter", "shop::legacy");
        });
    }

    @Test
    void build_duplicateWithFailPolicy_throwsWithAllDuplicates() {
        GraphBuilder failing = new GraphBuilder(DuplicatePolicy.FAIL);
        List<ComponentEntry> entries = List.of(
            ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE),
            ComponentEntry.of("Order", Layer.DOMAIN, Role.ENTITY),
            ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY),
            ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY)
        );

        assertThatThrownBy(() -> failing.build(entries))
            .isInstanceOf(DuplicateNodeIdException.class)
            .satisfies(e -> assertThat(((DuplicateNodeIdException) e).getDuplicates()).hasSize(2))
            .hasMessageContaining("rejected");
    }

    @Test
    void build_failPolicyWithoutDuplicates_buildsNormally() {
        BuildResult result = new GraphBuilder(DuplicatePolicy.FAIL).build(GraphFixtures.userModule());

        assertThat(result.graph().nodeCount()).isEqualTo(3);
    }

    @Test
    void build_setsMetadataFromConfiguration() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        GraphBuilder configured = new GraphBuilder(DuplicatePolicy.FIRST_WINS, "Shop", Clock.fixed(now, ZoneOffset.UTC));

        GraphMetadata metadata = configured.build(List.of()).graph().metadata();

        assertThat(metadata.description()).isEqualTo("Shop");
        assertThat(metadata.version()).isEqualTo(1);
        assertThat(metadata.createdAt()).isEqualTo(now);
    }

    @Test
    void build_isDeterministic() {
        ArchitectureGraph first = builder.build(GraphFixtures.orderModule()).graph();
        ArchitectureGraph second = builder.build(GraphFixtures.orderModule()).graph();

        assertThat(second.allNodes()).containsExactlyElementsOf(first.allNodes());
        assertThat(second.allEdges()).containsExactlyElementsOf(first.allEdges());
    }

    @Test
    void build_nullEntries_throwsException() {
        assertThatThrownBy(() -> builder.build(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("entries must not be null");
    }
}
