package io.lslite.core.cost;

import io.lslite.core.LinkMetrics;
import io.lslite.core.Name;

/**
 * Non-adaptive strategy: the base cost is returned unchanged.
 */
public final class IdentityCostCalculator implements LinkCostCalculator {

    public static final IdentityCostCalculator INSTANCE = new IdentityCostCalculator();

    private IdentityCostCalculator() {
    }

    @Override
    public double adjustCost(Name neighbor, double baseCost, LinkMetrics metrics) {
        return baseCost;
    }

    @Override
    public String toString() {
        return "identity";
    }
}
