package com.hexarchitect.core;

import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.graph.DuplicateNodeIdException;
import com.hexarchitect.core.graph.DuplicatePolicy;
import com.hexarchitect.core.graph.GraphBuilder;
import com.hexarchitect.core.model.ComponentEntry;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.Role;
import com.hexarchitect.core.registry.ComponentContributor;
import com.hexarchitect.core.registry.ComponentRegistry;
import com.hexarchitect.core.validation.ValidationEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArchitectureEngine}.
 */
class ArchitectureEngineTest {

    @Test
    void rebuild_collectsBuildsAndValidates() {
        ArchitectureEngine engine = new ArchitectureEngine(EngineConfig.defaults(), () -> List.of(
            contributor("domain", ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE, "OrderMapper")),
            contributor("adapters", ComponentEntry.of("OrderMapper", Layer.ADAPTER, Role.ADAPTER))
        ));

        EngineSnapshot snapshot = engine.rebuild();

        assertThat(snapshot.graph().nodeCount()).isEqualTo(2);
        assertThat(snapshot.buildFindings()).isEmpty();
        assertThat(snapshot.validation().violations()).extracting(Finding::ruleId)
            .containsExactly("dependency-direction");
        assertThat(snapshot.hasViolations()).isTrue();
    }

    @Test
    void rebuild_strictConfig_escalatesDanglingDependencies() {
        EngineConfig strict = new EngineConfig(null,
            new EngineConfig.ValidationSettings(true, List.of("orphan-node"), null, null), null);
        ArchitectureEngine engine = new ArchitectureEngine(strict, () -> List.of(
            contributor("domain", ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE, "PaymentGateway"))));

        EngineSnapshot snapshot = engine.rebuild();

        assertThat(snapshot.buildFindings()).singleElement()
            .extracting(Finding::severity).isEqualTo(FindingSeverity.VIOLATION);
        assertThat(snapshot.validation().hasViolations()).isFalse();
        assertThat(snapshot.hasViolations()).isTrue();
        assertThat(snapshot.allFindings()).hasSize(2);
    }

    @Test
    void rebuild_afterSourceChange_leavesEarlierSnapshotUntouched() {
        List<ComponentEntry> source = new ArrayList<>(List.of(ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY)));
        ArchitectureEngine engine = new ArchitectureEngine(EngineConfig.defaults(),
            () -> List.of(contributor("users", source.toArray(new ComponentEntry[0]))));

        EngineSnapshot first = engine.rebuild();
        source.add(ComponentEntry.of("UserRepository", Layer.PORT, Role.REPOSITORY, "User"));
        EngineSnapshot second = engine.rebuild();

        assertThat(first.graph().nodeCount()).isEqualTo(1);
        assertThat(second.graph().nodeCount()).isEqualTo(2);
        assertThat(second.graph().edgeCount()).isEqualTo(1);
    }

    @Test
    void rebuild_failPolicyWithDuplicates_throwsException() {
        ArchitectureEngine engine = new ArchitectureEngine(
            () -> List.of(contributor("twice",
                ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY),
                ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY))),
            new GraphBuilder(DuplicatePolicy.FAIL),
            ValidationEngine.withDefaultRules());

        assertThatThrownBy(engine::rebuild).isInstanceOf(DuplicateNodeIdException.class);
    }

    @Test
    void withDiscoveredContributors_usesServiceLoaderContributors() {
        EngineSnapshot snapshot = ArchitectureEngine.withDiscoveredContributors().rebuild();

        assertThat(snapshot.graph().node("UserRepository")).isPresent();
        assertThat(snapshot.graph().edgeCount()).isEqualTo(1);
    }

    private static ComponentContributor contributor(String id, ComponentEntry... entries) {
        return new ComponentContributor() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public void contribute(ComponentRegistry registry) {
                registry.registerAll(List.of(entries));
            }
        };
    }
}
