package com.hexarchitect.core.validation;

import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.graph.GraphBuilder;
import com.hexarchitect.core.graph.GraphFixtures;
import com.hexarchitect.core.model.ComponentEntry;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.NodeId;
import com.hexarchitect.core.model.Role;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidationEngine} and {@link ValidationReport}.
 */
class ValidationEngineTest {

    @Test
    void validate_userModule_reportsNoViolations() {
        ValidationReport report = ValidationEngine.withDefaultRules()
            .validate(GraphFixtures.build(GraphFixtures.userModule()));

        assertThat(report.violations()).isEmpty();
        assertThat(report.hasViolations()).isFalse();
    }

    @Test
    void validate_concatenatesFindingsInRuleOrder() {
        ValidationReport report = ValidationEngine.withDefaultRules()
            .validate(GraphFixtures.build(GraphFixtures.orderModule()));

        assertThat(report.findings()).extracting(Finding::ruleId).containsExactly(
            DependencyDirectionRule.ID,
            OrphanNodeRule.ID,
            CircularDependencyRule.ID,
            UnimplementedPortRule.ID);
        assertThat(report.byRule(DependencyDirectionRule.ID)).singleElement()
            .satisfies(f -> assertThat(f.nodes()).containsExactly(NodeId.of("Order"), NodeId.of("OrderMapper")));
        assertThat(report.countBySeverity())
            .containsEntry(FindingSeverity.VIOLATION, 2L)
            .containsEntry(FindingSeverity.WARNING, 1L)
            .containsEntry(FindingSeverity.INFO, 1L);
    }

    @Test
    void validate_ruleSubset_runsOnlySelectedRules() {
        ValidationReport report = ValidationEngine.withDefaultRules()
            .validate(GraphFixtures.build(GraphFixtures.orderModule()), List.of(OrphanNodeRule.ID, "unknown"));

        assertThat(report.findings()).extracting(Finding::ruleId).containsOnly(OrphanNodeRule.ID);
    }

    @Test
    void validate_doesNotMutateGraph() {
        ArchitectureGraph graph = GraphFixtures.build(GraphFixtures.orderModule());
        int edges = graph.edgeCount();

        ValidationEngine.withDefaultRules().validate(graph);

        assertThat(graph.edgeCount()).isEqualTo(edges);
    }

    @Test
    void escalate_strictMode_upgradesDanglingDependencies() {
        List<Finding> buildFindings = new GraphBuilder().build(List.of(
            ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE, "PaymentGateway"),
            ComponentEntry.of(" ", Layer.DOMAIN, Role.ENTITY))).findings();

        List<Finding> strict = new ValidationEngine(List.of(), true).escalate(buildFindings);
        List<Finding> lenient = new ValidationEngine(List.of(), false).escalate(buildFindings);

        assertThat(strict).extracting(Finding::severity)
            .containsExactly(FindingSeverity.WARNING, FindingSeverity.VIOLATION);
        assertThat(lenient).extracting(Finding::severity)
            .containsOnly(FindingSeverity.WARNING);
    }

    @Test
    void validate_longDependencyChain_completesWithoutStackOverflow() {
        List<ComponentEntry> chain = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            chain.add(i + 1 < 20_000
                ? ComponentEntry.of("Step" + i, Layer.DOMAIN, Role.ENTITY, "Step" + (i + 1))
                : ComponentEntry.of("Step" + i, Layer.DOMAIN, Role.ENTITY));
        }
        ArchitectureGraph graph = GraphFixtures.build(chain);

        assertThatCode(() -> ValidationEngine.withDefaultRules().validate(graph)).doesNotThrowAnyException();
        assertThat(ValidationEngine.withDefaultRules().validate(graph).byRule(CircularDependencyRule.ID)).isEmpty();
    }

    @Test
    void constructor_duplicateRuleIds_throwsException() {
        assertThatThrownBy(() -> new ValidationEngine(List.of(new OrphanNodeRule(), new OrphanNodeRule()), false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(OrphanNodeRule.ID);
    }

    @Test
    void fromConfig_defaults_includesBuiltInAndDiscoveredRules() {
        ValidationEngine engine = ValidationEngine.fromConfig(EngineConfig.defaults().validation());

        assertThat(engine.getRules()).extracting(ValidationRule::getId).containsExactly(
            DependencyDirectionRule.ID,
            OrphanNodeRule.ID,
            MissingLayerRule.ID,
            CircularDependencyRule.ID,
            GodComponentRule.ID,
            UnimplementedPortRule.ID,
            ImplSuffixRule.ID);
        assertThat(engine.isStrict()).isFalse();
    }

    @Test
    void fromConfig_enabledRules_restrictsAndAppliesSettings() {
        EngineConfig.ValidationSettings settings = new EngineConfig.ValidationSettings(
            true, List.of(GodComponentRule.ID, ImplSuffixRule.ID, "not-a-rule"), null, 2);

        ValidationEngine engine = ValidationEngine.fromConfig(settings);

        assertThat(engine.isStrict()).isTrue();
        assertThat(engine.getRules()).extracting(ValidationRule::getId)
            .containsExactly(GodComponentRule.ID, ImplSuffixRule.ID);
        assertThat(engine.getRules().get(0)).isInstanceOfSatisfying(GodComponentRule.class,
            rule -> assertThat(rule.getThreshold()).isEqualTo(2));
    }

    @Test
    void discoverRules_findsServiceLoaderRegistrations() {
        assertThat(ValidationEngine.discoverRules()).hasAtLeastOneElementOfType(ImplSuffixRule.class);
    }
}
