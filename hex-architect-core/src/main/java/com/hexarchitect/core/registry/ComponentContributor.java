package com.hexarchitect.core.registry;

/**
 * Contributes a module's component entries to a {@link ComponentRegistry}.
 *
 * <p>Every module that declares components ships one contributor. Contributors are discovered
 * with the Java Service Provider Interface, so no central list of components or modules has
 * to be maintained by hand.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class OrderModuleContributor implements ComponentContributor {
 *     @Override
 *     public String getId() {
 *         return "order-module";
 *     }
 *
 *     @Override
 *     public void contribute(ComponentRegistry registry) {
 *         registry.register(ComponentEntry.of("Order", Layer.DOMAIN, Role.AGGREGATE));
 *         registry.register(ComponentEntry.of("OrderRepository", Layer.PORT, Role.REPOSITORY, "Order"));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.hexarchitect.core.registry.ComponentContributor}
 *
 * @see ContributorDiscovery
 */
public interface ComponentContributor {

    /**
     * Returns unique identifier for this contributor, used in logs and listings.
     *
     * @return contributor identifier
     */
    String getId();

    /**
     * Registers this contributor's entries.
     *
     * @param registry open registry to register into
     */
    void contribute(ComponentRegistry registry);
}
