package com.hexarchitect.core.validation;

import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.graph.GraphBuilder;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Runs a set of independent {@link ValidationRule}s over a graph.
 *
 * <p>The full run is the concatenation of each rule's findings in rule order. Validation is
 * advisory: nothing is thrown for graph content, every result is returned in the
 * {@link ValidationReport}.
 *
 * <p>In strict mode, {@link #escalate(List)} re-grades dangling dependencies reported by the
 * builder to violations.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationEngine engine = ValidationEngine.withDefaultRules();
 * ValidationReport report = engine.validate(graph);
 * if (report.hasViolations()) {
 *     report.violations().forEach(System.out::println);
 * }
 * }</pre>
 */
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final Map<String, ValidationRule> rules;
    private final boolean strict;

    /**
     * Creates an engine over the given rules.
     *
     * @param rules rules in evaluation order; ids must be unique
     * @param strict whether {@link #escalate(List)} re-grades dangling dependencies
     * @throws IllegalArgumentException if two rules share an id
     */
    public ValidationEngine(List<? extends ValidationRule> rules, boolean strict) {
        Objects.requireNonNull(rules, "rules must not be null");
        Map<String, ValidationRule> byId = new LinkedHashMap<>();
        for (ValidationRule rule : rules) {
            if (byId.putIfAbsent(rule.getId(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.getId());
            }
        }
        this.rules = byId;
        this.strict = strict;
    }

    /**
     * Creates a non-strict engine with the built-in rules and their default settings.
     *
     * @return engine with all built-in rules
     */
    public static ValidationEngine withDefaultRules() {
        return new ValidationEngine(builtInRules(EngineConfig.defaults().validation()), false);
    }

    /**
     * Creates an engine from configuration: built-in rules with configured settings plus rules
     * discovered via {@link ServiceLoader}, restricted to the enabled rule ids.
     *
     * @param settings validation settings
     * @return configured engine
     */
    public static ValidationEngine fromConfig(EngineConfig.ValidationSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");

        Map<String, ValidationRule> available = new LinkedHashMap<>();
        builtInRules(settings).forEach(rule -> available.put(rule.getId(), rule));
        for (ValidationRule rule : discoverRules()) {
            if (available.putIfAbsent(rule.getId(), rule) != null) {
                log.warn("Ignoring discovered rule {} ({}): id already in use",
                    rule.getId(), rule.getClass().getName());
            }
        }

        for (String ruleId : settings.rules()) {
            if (!available.containsKey(ruleId)) {
                log.warn("Unknown validation rule in configuration: {}. Available: {}", ruleId, available.keySet());
            }
        }

        List<ValidationRule> enabled = available.values().stream()
            .filter(rule -> settings.isEnabled(rule.getId()))
            .toList();
        log.debug("Enabled {} of {} validation rules (strict={})", enabled.size(), available.size(), settings.isStrict());
        return new ValidationEngine(enabled, settings.isStrict());
    }

    private static List<ValidationRule> builtInRules(EngineConfig.ValidationSettings settings) {
        return List.of(
            new DependencyDirectionRule(),
            new OrphanNodeRule(),
            new MissingLayerRule(settings.expectedLayers()),
            new CircularDependencyRule(),
            new GodComponentRule(settings.godComponentThreshold()),
            new UnimplementedPortRule()
        );
    }

    /**
     * Discovers additional rules registered via SPI.
     *
     * @return discovered rules
     */
    public static List<ValidationRule> discoverRules() {
        List<ValidationRule> discovered = new ArrayList<>();
        ServiceLoader.load(ValidationRule.class).forEach(discovered::add);
        log.debug("Discovered {} validation rules via ServiceLoader", discovered.size());
        return discovered;
    }

    public List<ValidationRule> getRules() {
        return List.copyOf(rules.values());
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Runs every rule.
     *
     * @param graph graph to validate
     * @return concatenated findings of all rules
     */
    public ValidationReport validate(ArchitectureGraph graph) {
        return validate(graph, rules.keySet());
    }

    /**
     * Runs a subset of rules; ids that name no configured rule are skipped.
     *
     * @param graph graph to validate
     * @param ruleIds ids of rules to run
     * @return concatenated findings of the selected rules
     */
    public ValidationReport validate(ArchitectureGraph graph, Collection<String> ruleIds) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(ruleIds, "ruleIds must not be null");

        Set<String> selected = Set.copyOf(ruleIds);
        List<Finding> findings = new ArrayList<>();
        for (ValidationRule rule : rules.values()) {
            if (selected.contains(rule.getId())) {
                List<Finding> ruleFindings = rule.evaluate(graph);
                log.debug("Rule {} produced {} findings", rule.getId(), ruleFindings.size());
                findings.addAll(ruleFindings);
            }
        }
        return new ValidationReport(findings);
    }

    /**
     * Applies strict mode to build findings.
     *
     * @param buildFindings findings returned by {@link GraphBuilder}
     * @return the findings unchanged, or with dangling dependencies re-graded to violations in strict mode
     */
    public List<Finding> escalate(List<Finding> buildFindings) {
        Objects.requireNonNull(buildFindings, "buildFindings must not be null");
        if (!strict) {
            return List.copyOf(buildFindings);
        }
        return buildFindings.stream()
            .map(f -> GraphBuilder.DANGLING_DEPENDENCY.equals(f.ruleId())
                ? f.withSeverity(FindingSeverity.VIOLATION)
                : f)
            .toList();
    }
}
