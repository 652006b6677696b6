package io.lslite.core.cost;

/**
 * Tunables of the load-aware cost model.
 *
 * Weights are not required to sum to 1. The adjusted cost is clamped to
 * [minMultiplier * originalCost, maxMultiplier * originalCost].
 */
public record CostModel(
        double rttWeight,
        double loadWeight,
        double stabilityWeight,
        double minMultiplier,
        double maxMultiplier
) {
    public static final double DEFAULT_RTT_WEIGHT = 0.3;
    public static final double DEFAULT_LOAD_WEIGHT = 0.4;
    public static final double DEFAULT_STABILITY_WEIGHT = 0.3;
    public static final double DEFAULT_MIN_MULTIPLIER = 0.5;
    public static final double DEFAULT_MAX_MULTIPLIER = 3.0;

    public CostModel {
        if (rttWeight < 0 || loadWeight < 0 || stabilityWeight < 0) {
            throw new IllegalArgumentException("weights must be >= 0");
        }
        if (!(minMultiplier > 0.0)) {
            throw new IllegalArgumentException("minMultiplier must be > 0");
        }
        if (maxMultiplier < minMultiplier) {
            throw new IllegalArgumentException("maxMultiplier must be >= minMultiplier");
        }
    }

    public static CostModel defaults() {
        return new CostModel(
                DEFAULT_RTT_WEIGHT,
                DEFAULT_LOAD_WEIGHT,
                DEFAULT_STABILITY_WEIGHT,
                DEFAULT_MIN_MULTIPLIER,
                DEFAULT_MAX_MULTIPLIER
        );
    }
}
