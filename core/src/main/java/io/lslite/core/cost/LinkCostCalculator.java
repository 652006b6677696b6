package io.lslite.core.cost;

import io.lslite.core.LinkMetrics;
import io.lslite.core.Name;

/**
 * Strategy turning a base link cost into the cost handed to the
 * shortest-path computation.
 *
 * Implementations are called synchronously from routing computation and
 * must not block or perform I/O.
 */
@FunctionalInterface
public interface LinkCostCalculator {

    /**
     * @param neighbor neighbor the link leads to
     * @param baseCost cost the routing computation would otherwise use
     * @param metrics  current metrics snapshot for that link
     * @return adjusted cost
     */
    double adjustCost(Name neighbor, double baseCost, LinkMetrics metrics);

    /**
     * Same result {@link #adjustCost} would return right now, without touching
     * any state the strategy keeps. Used by monitoring.
     */
    default double previewCost(Name neighbor, double baseCost, LinkMetrics metrics) {
        return adjustCost(neighbor, baseCost, metrics);
    }
}
