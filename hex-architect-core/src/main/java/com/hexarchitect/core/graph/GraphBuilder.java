package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.ComponentEntry;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a set of component entries into an immutable {@link ArchitectureGraph}.
 *
 * <p>The build never fails because of a single bad entry. It proceeds in four steps:
 * <ol>
 *   <li>Entries with a blank type name or a missing layer or role are excluded and reported
 *       as {@value #MALFORMED_ENTRY} findings.</li>
 *   <li>Each remaining entry becomes a node keyed by {@link NodeId}. Entries resolving to an
 *       identifier already taken are handled by the {@link DuplicatePolicy} and reported as
 *       {@value #DUPLICATE_NODE_ID} findings.</li>
 *   <li>Every declared dependency that names a node yields exactly one
 *       {@link com.hexarchitect.core.model.Relationship#DEPENDS_ON} edge; every other one
 *       yields a {@value #DANGLING_DEPENDENCY} finding and no edge.</li>
 *   <li>Nodes and edges are frozen into the graph together with their adjacency indices.</li>
 * </ol>
 *
 * <p>Builds are O(entries + dependencies), perform no I/O and do not retain any state, so a
 * single builder may be used concurrently.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BuildResult result = new GraphBuilder().build(List.of(
 *     ComponentEntry.of("User", Layer.DOMAIN, Role.ENTITY),
 *     ComponentEntry.of("UserRepository", Layer.PORT, Role.REPOSITORY),
 *     ComponentEntry.of("InMemoryUserRepository", Layer.ADAPTER, Role.ADAPTER, "UserRepository")
 * ));
 * result.graph().edgeCount(); // 1
 * }</pre>
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    /** Rule id of findings for entries excluded as structurally invalid. */
    public static final String MALFORMED_ENTRY = "malformed-entry";

    /** Rule id of findings for entries sharing a node identifier. */
    public static final String DUPLICATE_NODE_ID = "duplicate-node-id";

    /** Rule id of findings for dependency names matching no node. */
    public static final String DANGLING_DEPENDENCY = "dangling-dependency";

    private final DuplicatePolicy duplicatePolicy;
    private final String description;
    private final Clock clock;

    /**
     * Creates a builder using {@link DuplicatePolicy#FIRST_WINS}.
     */
    public GraphBuilder() {
        this(DuplicatePolicy.FIRST_WINS);
    }

    /**
     * Creates a builder with the given duplicate policy.
     *
     * @param duplicatePolicy duplicate resolution policy
     */
    public GraphBuilder(DuplicatePolicy duplicatePolicy) {
        this(duplicatePolicy, GraphMetadata.DEFAULT_DESCRIPTION, Clock.systemUTC());
    }

    /**
     * Creates a fully configured builder.
     *
     * @param duplicatePolicy duplicate resolution policy
     * @param description description stored in the graph metadata
     * @param clock clock used for the metadata timestamp
     */
    public GraphBuilder(DuplicatePolicy duplicatePolicy, String description, Clock clock) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy must not be null");
        this.description = description;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    /**
     * Builds a graph from the given entries.
     *
     * @param entries entries to consume; enumerated exactly once
     * @return the graph and all build findings
     * @throws DuplicateNodeIdException if duplicates exist and the policy is {@link DuplicatePolicy#FAIL}
     */
    public BuildResult build(Iterable<ComponentEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");

        List<Finding> findings = new ArrayList<>();
        List<Finding> duplicates = new ArrayList<>();
        Map<NodeId, ComponentEntry> accepted = new LinkedHashMap<>();
        Map<NodeId, GraphNode> nodes = new LinkedHashMap<>();

        int position = 0;
        for (ComponentEntry entry : entries) {
            position++;
            Finding malformed = checkWellFormed(entry, position);
            if (malformed != null) {
                findings.add(malformed);
                continue;
            }

            NodeId id = NodeId.of(entry.typeName());
            ComponentEntry kept = accepted.get(id);
            if (kept != null) {
                Finding duplicate = duplicateFinding(id, kept, entry);
                duplicates.add(duplicate);
                findings.add(duplicate);
                continue;
            }

            accepted.put(id, entry);
            nodes.put(id, new GraphNode(id, entry.layer(), entry.role(), entry.modulePath()));
        }

        if (!duplicates.isEmpty() && duplicatePolicy == DuplicatePolicy.FAIL) {
            throw new DuplicateNodeIdException(duplicates);
        }

        List<GraphEdge> edges = new ArrayList<>();
        accepted.forEach((source, entry) -> resolveDependencies(source, entry, nodes, edges, findings));

        ArchitectureGraph graph = ArchitectureGraph.freeze(nodes, edges,
            GraphMetadata.of(description, clock.instant()));

        log.debug("Built graph from {} entries: {} nodes, {} edges, {} findings",
            position, graph.nodeCount(), graph.edgeCount(), findings.size());

        return new BuildResult(graph, findings);
    }

    /**
     * Checks the required fields of an entry.
     *
     * @return a malformed-entry finding, or null if the entry is well-formed
     */
    private Finding checkWellFormed(ComponentEntry entry, int position) {
        if (entry == null) {
            return Finding.warning(MALFORMED_ENTRY, List.of(),
                "Entry #" + position + " is null and was skipped");
        }

        boolean blankName = entry.typeName() == null || entry.typeName().isBlank();
        List<String> problems = new ArrayList<>();
        if (blankName) {
            problems.add("type name is blank");
        }
        if (entry.layer() == null) {
            problems.add("layer is missing or unknown");
        }
        if (entry.role() == null) {
            problems.add("role is missing or unknown");
        }
        if (problems.isEmpty()) {
            return null;
        }

        String subject = blankName ? "Entry #" + position : "Entry #" + position + " (" + entry.typeName().strip() + ")";
        List<NodeId> affected = blankName ? List.of() : List.of(NodeId.of(entry.typeName()));
        return Finding.warning(MALFORMED_ENTRY, affected,
            subject + " was excluded: " + String.join(", ", problems));
    }

    private Finding duplicateFinding(NodeId id, ComponentEntry kept, ComponentEntry discarded) {
        String explanation = String.format(
            "%s registered more than once; kept %s/%s from '%s', %s %s/%s from '%s' with %d dependencies",
            id,
            kept.layer(), kept.role(), kept.modulePath(),
            duplicatePolicy == DuplicatePolicy.FAIL ? "rejected" : "discarded",
            discarded.layer(), discarded.role(), discarded.modulePath(),
            discarded.dependencies().size());
        return Finding.warning(DUPLICATE_NODE_ID, List.of(id), explanation);
    }

    private void resolveDependencies(NodeId source, ComponentEntry entry, Map<NodeId, GraphNode> nodes,
                                     List<GraphEdge> edges, List<Finding> findings) {
        for (String dependency : entry.dependencies()) {
            if (dependency == null || dependency.isBlank()) {
                findings.add(Finding.warning(MALFORMED_ENTRY, List.of(source),
                    source + " declares a blank dependency name, which was ignored"));
                continue;
            }

            NodeId target = NodeId.of(dependency);
            if (nodes.containsKey(target)) {
                edges.add(GraphEdge.dependsOn(source, target));
            } else {
                findings.add(Finding.warning(DANGLING_DEPENDENCY, List.of(source, target),
                    source + " depends on " + target + ", which is not registered"));
            }
        }
    }
}
