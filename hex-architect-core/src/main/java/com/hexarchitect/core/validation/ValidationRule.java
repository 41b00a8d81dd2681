package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;

import java.util.List;

/**
 * An architectural rule evaluated against a built graph.
 *
 * <p>Rules are independent of each other, never mutate the graph and never throw because of
 * graph content: everything they observe is returned as {@link Finding}s. Running several
 * rules is simply concatenating their findings, which is what {@link ValidationEngine} does.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class NoAdapterWithoutPortRule implements ValidationRule {
 *     @Override
 *     public String getId() {
 *         return "adapter-without-port";
 *     }
 *
 *     @Override
 *     public String getDescription() {
 *         return "Adapters should depend on at least one port";
 *     }
 *
 *     @Override
 *     public List<Finding> evaluate(ArchitectureGraph graph) {
 *         return graph.nodesByLayer(Layer.ADAPTER).stream()
 *             .filter(adapter -> graph.edgesFrom(adapter.id()).stream()
 *                 .noneMatch(e -> graph.node(e.to()).map(n -> n.layer() == Layer.PORT).orElse(false)))
 *             .map(adapter -> Finding.warning(getId(), List.of(adapter.id()),
 *                 adapter.typeName() + " implements no port"))
 *             .toList();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Additional rules are discovered from
 * {@code META-INF/services/com.hexarchitect.core.validation.ValidationRule} and need a public
 * no-argument constructor.
 *
 * @see ValidationEngine
 */
public interface ValidationRule {

    /**
     * Returns the unique rule identifier, used in findings and configuration
     * (e.g., "dependency-direction").
     *
     * @return rule identifier
     */
    String getId();

    /**
     * Returns a one-line description for listings.
     *
     * @return description
     */
    String getDescription();

    /**
     * Evaluates the rule.
     *
     * @param graph graph to inspect
     * @return findings, empty if the graph satisfies the rule
     */
    List<Finding> evaluate(ArchitectureGraph graph);
}
