package io.lslite.server.routing;

/**
 * Signal to the routing layer that topology-relevant neighbor state changed.
 * Idempotent; receivers coalesce bursts.
 */
@FunctionalInterface
public interface RoutingTrigger {
    void requestRecalculation();
}
