package io.lslite.server.routing;

/**
 * How the routing layer reacts to a neighbor status change.
 *
 *  - LINK_STATE: rebuild and flood the adjacency advertisement; routes follow.
 *  - HYPERBOLIC: recompute the routing table directly from coordinates.
 */
public enum RoutingMode {
    LINK_STATE,
    HYPERBOLIC
}
