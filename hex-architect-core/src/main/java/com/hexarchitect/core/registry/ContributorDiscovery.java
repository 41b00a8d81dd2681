package com.hexarchitect.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Discovers {@link ComponentContributor}s via {@link ServiceLoader} and runs them against a
 * registry.
 */
public final class ContributorDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ContributorDiscovery.class);

    private ContributorDiscovery() {
        // Utility class
    }

    /**
     * Discovers contributors on the context class path, ordered by id.
     *
     * @return discovered contributors
     */
    public static List<ComponentContributor> discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Discovers contributors visible to a class loader, ordered by id.
     *
     * @param classLoader class loader to search
     * @return discovered contributors
     */
    public static List<ComponentContributor> discover(ClassLoader classLoader) {
        log.debug("Discovering component contributors via ServiceLoader");
        List<ComponentContributor> contributors = new ArrayList<>();
        ServiceLoader.load(ComponentContributor.class, classLoader).forEach(contributors::add);
        contributors.sort(Comparator.comparing(ComponentContributor::getId));

        log.info("Discovered {} component contributors", contributors.size());
        if (log.isDebugEnabled()) {
            contributors.forEach(c -> log.debug("  - {} ({})", c.getId(), c.getClass().getName()));
        }
        return contributors;
    }

    /**
     * Runs every contributor against the registry.
     *
     * @param registry open registry
     * @param contributors contributors to run, in order
     * @return number of entries added
     */
    public static int contributeAll(ComponentRegistry registry, List<? extends ComponentContributor> contributors) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(contributors, "contributors must not be null");

        int before = registry.size();
        for (ComponentContributor contributor : contributors) {
            int start = registry.size();
            contributor.contribute(registry);
            log.debug("Contributor {} registered {} entries", contributor.getId(), registry.size() - start);
        }
        return registry.size() - before;
    }
}
