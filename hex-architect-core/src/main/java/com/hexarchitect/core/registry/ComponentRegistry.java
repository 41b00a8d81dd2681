package com.hexarchitect.core.registry;

import com.hexarchitect.core.model.ComponentEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the component entries contributed during program initialization.
 *
 * <p>The registry has two phases. While open, any part of the program may
 * {@link #register(ComponentEntry)} entries; duplicates are accepted and resolved later by the
 * graph builder. {@link #seal()} ends the registration phase, after which the registry is
 * read-only and may be collected from any number of threads. Registration itself is expected
 * to happen on a single thread.
 *
 * <p>A registry is an ordinary object passed through the initialization path, not global
 * state; {@link ComponentContributor}s receive it as an argument.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComponentRegistry registry = new ComponentRegistry();
 * ContributorDiscovery.contributeAll(registry, ContributorDiscovery.discover());
 * registry.seal();
 *
 * BuildResult result = new GraphBuilder().build(registry.collectAll());
 * }</pre>
 */
public class ComponentRegistry {

    private final List<ComponentEntry> entries = new ArrayList<>();
    private volatile boolean sealed;

    /**
     * Appends an entry.
     *
     * @param entry entry to register
     * @throws IllegalStateException if the registry is sealed
     */
    public void register(ComponentEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (sealed) {
            throw new IllegalStateException("Registry is sealed; cannot register " + entry.typeName());
        }
        entries.add(entry);
    }

    /**
     * Appends several entries in iteration order.
     *
     * @param newEntries entries to register
     * @throws IllegalStateException if the registry is sealed
     */
    public void registerAll(Collection<ComponentEntry> newEntries) {
        Objects.requireNonNull(newEntries, "newEntries must not be null");
        newEntries.forEach(this::register);
    }

    /**
     * Returns every entry registered so far as a restartable sequence.
     *
     * <p>Each call to {@code iterator()} enumerates a snapshot of the registry taken at that
     * moment, so independent builds can each consume the full set.
     *
     * @return restartable view of all entries
     */
    public Iterable<ComponentEntry> collectAll() {
        return () -> List.copyOf(entries).iterator();
    }

    /**
     * Ends the registration phase. Idempotent.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return entries.size();
    }
}
