package com.hexarchitect.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Metadata declared by a single component, the unit of input to the graph builder.
 *
 * <p>Entries are accepted as declared: a blank type name or a missing layer or role is not
 * rejected here but reported by {@link com.hexarchitect.core.graph.GraphBuilder} as a
 * {@code malformed-entry} finding.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ComponentEntry entry = new ComponentEntry(
 *     "InMemoryUserRepository", Layer.ADAPTER, Role.ADAPTER,
 *     "app::adapters", List.of("UserRepository"));
 * }</pre>
 *
 * @param typeName globally unique component type name
 * @param layer architectural layer, may be null if undeclared
 * @param role structural role, may be null if undeclared
 * @param modulePath informational module or package path
 * @param dependencies type names this component depends on, in declaration order
 */
public record ComponentEntry(
    String typeName,
    Layer layer,
    Role role,
    String modulePath,
    List<String> dependencies
) {
    /**
     * Compact constructor normalizing optional fields.
     */
    public ComponentEntry {
        if (modulePath == null) {
            modulePath = "";
        }
        // null elements are kept for the builder to report
        dependencies = dependencies == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    /**
     * Creates an entry without a module path.
     *
     * @param typeName component type name
     * @param layer architectural layer
     * @param role structural role
     * @param dependencies type names depended on
     * @return a new entry
     */
    public static ComponentEntry of(String typeName, Layer layer, Role role, String... dependencies) {
        return new ComponentEntry(typeName, layer, role, "",
            dependencies == null ? List.of() : Arrays.asList(dependencies));
    }
}
