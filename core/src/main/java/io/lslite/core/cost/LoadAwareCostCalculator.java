package io.lslite.core.cost;

import io.lslite.core.LatencyHistory;
import io.lslite.core.LinkMetrics;
import io.lslite.core.Name;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Load-aware link cost strategy.
 *
 * The adjusted cost is
 * <pre>
 *   base * (1 + wRtt * rttFactor + wLoad * loadFactor + wStability * stabilityFactor)
 * </pre>
 * clamped to the {@link CostModel} multipliers of the link's original cost.
 *
 * Factors:
 *  - rtt:       step function of the latest round-trip sample.
 *  - load:      step function of the coefficient of variation of the
 *               neighbor's latency history (needs at least 3 samples).
 *  - stability: 0.2 per timed-out probe, plus a penalty once the last
 *               success is more than a minute old.
 *
 * Side effect: when the metrics carry a current RTT sample it is appended to
 * the shared {@link LatencyHistory} before the load factor is computed.
 * {@link #previewCost} evaluates the same formula against a copy of the
 * history and records nothing.
 */
public final class LoadAwareCostCalculator implements LinkCostCalculator {

    private static final Logger log = Logger.getLogger(LoadAwareCostCalculator.class.getName());

    static final double RTT_THRESHOLD_EXCELLENT = 10.0;  // ms
    static final double RTT_THRESHOLD_GOOD = 50.0;       // ms
    static final double RTT_THRESHOLD_FAIR = 100.0;      // ms
    static final double RTT_THRESHOLD_POOR = 200.0;      // ms

    static final int MIN_LOAD_SAMPLES = 3;
    static final double TIMEOUT_PENALTY = 0.2;
    static final long STALE_AFTER_SECONDS = 60;
    static final double MAX_STALENESS_PENALTY = 2.0;

    private final CostModel model;
    private final LatencyHistory history;
    private final Clock clock;
    private final AtomicLong adjustmentCount = new AtomicLong();

    public LoadAwareCostCalculator(CostModel model, LatencyHistory history, Clock clock) {
        this.model = Objects.requireNonNull(model, "model");
        this.history = Objects.requireNonNull(history, "history");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public double adjustCost(Name neighbor, double baseCost, LinkMetrics metrics) {
        if (bypass(baseCost, metrics)) {
            return baseCost;
        }
        if (metrics.hasRtt()) {
            history.record(neighbor, metrics.currentRttMillis());
        }
        double adjusted = evaluate(neighbor, baseCost, metrics, history.samples(neighbor));
        adjustmentCount.incrementAndGet();
        return adjusted;
    }

    @Override
    public double previewCost(Name neighbor, double baseCost, LinkMetrics metrics) {
        if (bypass(baseCost, metrics)) {
            return baseCost;
        }
        return evaluate(neighbor, baseCost, metrics, withCurrentSample(neighbor, metrics));
    }

    // NaN fails both comparisons and takes the bypass too
    private static boolean bypass(double baseCost, LinkMetrics metrics) {
        return !(baseCost > 0) || !(metrics.originalCost() > 0);
    }

    private double evaluate(Name neighbor, double baseCost, LinkMetrics metrics, double[] samples) {
        double rttFactor = rttFactor(metrics);
        double loadFactor = loadFactor(samples);
        double stabilityFactor = stabilityFactor(metrics);

        double adjustmentFactor = model.rttWeight() * rttFactor
                + model.loadWeight() * loadFactor
                + model.stabilityWeight() * stabilityFactor;

        double adjusted = baseCost * (1.0 + adjustmentFactor);
        adjusted = Math.min(adjusted, metrics.originalCost() * model.maxMultiplier());
        adjusted = Math.max(adjusted, metrics.originalCost() * model.minMultiplier());

        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format(
                    "load-aware cost for %s: base=%.3f factors(rtt=%.2f, load=%.2f, stability=%.2f) final=%.3f",
                    neighbor, baseCost, rttFactor, loadFactor, stabilityFactor, adjusted));
        }
        return adjusted;
    }

    /** History as it would look after recording the current sample, oldest dropped at capacity. */
    private double[] withCurrentSample(Name neighbor, LinkMetrics metrics) {
        double[] samples = history.samples(neighbor);
        if (!metrics.hasRtt() || Double.isNaN(metrics.currentRttMillis()) || metrics.currentRttMillis() < 0.0) {
            return samples;
        }
        int keep = Math.min(samples.length, history.capacity() - 1);
        double[] out = new double[keep + 1];
        System.arraycopy(samples, samples.length - keep, out, 0, keep);
        out[keep] = metrics.currentRttMillis();
        return out;
    }

    public long adjustmentCount() {
        return adjustmentCount.get();
    }

    public CostModel model() {
        return model;
    }

    double rttFactor(LinkMetrics metrics) {
        if (!metrics.hasRtt()) {
            return 0.0;
        }
        double rtt = metrics.currentRttMillis();
        if (rtt <= RTT_THRESHOLD_EXCELLENT) {
            return 0.0;
        } else if (rtt <= RTT_THRESHOLD_GOOD) {
            return 0.2;
        } else if (rtt <= RTT_THRESHOLD_FAIR) {
            return 0.5;
        } else if (rtt <= RTT_THRESHOLD_POOR) {
            return 1.0;
        } else {
            return 2.0;
        }
    }

    static double loadFactor(double[] samples) {
        if (samples.length < MIN_LOAD_SAMPLES) {
            return 0.0;
        }

        double sum = 0.0;
        for (double s : samples) {
            sum += s;
        }
        double mean = sum / samples.length;

        double variance = 0.0;
        for (double s : samples) {
            variance += (s - mean) * (s - mean);
        }
        double stddev = Math.sqrt(variance / samples.length);

        double variation = mean > 0 ? stddev / mean : 0.0;
        if (variation <= 0.1) {
            return 0.0;
        } else if (variation <= 0.2) {
            return 0.3;
        } else if (variation <= 0.5) {
            return 0.7;
        } else {
            return 1.5;
        }
    }

    double stabilityFactor(LinkMetrics metrics) {
        double factor = 0.0;
        if (metrics.timeoutCount() != null) {
            factor += metrics.timeoutCount() * TIMEOUT_PENALTY;
        }
        if (metrics.lastSuccess() != null) {
            long seconds = Duration.between(metrics.lastSuccess(), clock.instant()).getSeconds();
            if (seconds > STALE_AFTER_SECONDS) {
                factor += Math.min(MAX_STALENESS_PENALTY, seconds / 60.0 * 0.1);
            }
        }
        return factor;
    }

    @Override
    public String toString() {
        return "load-aware " + model;
    }
}
