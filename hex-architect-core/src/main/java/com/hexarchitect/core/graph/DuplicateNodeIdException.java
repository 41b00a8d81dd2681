package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.Finding;

import java.util.List;

/**
 * Thrown by {@link GraphBuilder} under {@link DuplicatePolicy#FAIL} when two or more entries
 * resolve to the same node identifier.
 */
public class DuplicateNodeIdException extends RuntimeException {

    private final transient List<Finding> duplicates;

    /**
     * Creates the exception from the duplicate findings of a build.
     *
     * @param duplicates one {@code duplicate-node-id} finding per discarded entry
     */
    public DuplicateNodeIdException(List<Finding> duplicates) {
        super(duplicates.size() + " duplicate component registration(s): "
            + duplicates.stream().map(Finding::explanation).toList());
        this.duplicates = List.copyOf(duplicates);
    }

    /**
     * Returns the findings describing each duplicate.
     *
     * @return duplicate findings
     */
    public List<Finding> getDuplicates() {
        return duplicates;
    }
}
