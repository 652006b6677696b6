package io.lslite.server.cost;

import io.lslite.core.Adjacency;
import io.lslite.core.AdjacencyList;
import io.lslite.core.AdjacencyStatus;
import io.lslite.core.LatencyHistory;
import io.lslite.core.LinkMetrics;
import io.lslite.core.Name;
import io.lslite.core.cost.IdentityCostCalculator;
import io.lslite.core.cost.LinkCostCalculator;
import io.lslite.server.hello.HelloListener;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Sits between the hello engine (metric producer) and the routing
 * computation (cost consumer).
 *
 * Responsibilities:
 *  - Hold one active {@link LinkCostCalculator}; clearing it falls back to
 *    {@link IdentityCostCalculator}, i.e. non-adaptive costs.
 *  - Keep per-neighbor metrics fed by hello events and RTT samples.
 *  - Answer {@link #getCost(Name, double)} without blocking: metrics are
 *    immutable records swapped in a ConcurrentHashMap and the calculator slot
 *    is volatile, so readers never wait on the event loop.
 */
public final class LinkCostManager implements HelloListener {

    private static final Logger log = Logger.getLogger(LinkCostManager.class.getName());

    /**
     * What the manager knows about one neighbor.
     *
     * @param lastRttMillis latest RTT sample, null when unknown or the link went down
     * @param timeoutCount  timed-out probes since the last validated response
     * @param lastSuccess   instant of the last validated response, null if never
     * @param lastProbeSent instant the last probe went out, null if never
     * @param probesSent    probes sent to this neighbor so far
     */
    public record NeighborMetrics(
            Double lastRttMillis,
            int timeoutCount,
            Instant lastSuccess,
            Instant lastProbeSent,
            long probesSent
    ) {
        static final NeighborMetrics EMPTY = new NeighborMetrics(null, 0, null, null, 0L);
    }

    private final AdjacencyList adjacencies;
    private final LatencyHistory history;
    private final Clock clock;
    private final ConcurrentHashMap<Name, NeighborMetrics> metrics = new ConcurrentHashMap<>();

    private volatile LinkCostCalculator calculator = IdentityCostCalculator.INSTANCE;

    public LinkCostManager(AdjacencyList adjacencies, LatencyHistory history, Clock clock) {
        this.adjacencies = Objects.requireNonNull(adjacencies, "adjacencies");
        this.history = Objects.requireNonNull(history, "history");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------- strategy slot ----------

    /** Install the active cost strategy, replacing any previous one. */
    public void setCostCalculator(LinkCostCalculator strategy) {
        this.calculator = Objects.requireNonNull(strategy, "strategy");
        log.info("link cost calculator set to " + strategy);
    }

    /** Revert to non-adaptive costs. */
    public void clearCostCalculator() {
        this.calculator = IdentityCostCalculator.INSTANCE;
        log.info("link cost calculator cleared, costs are no longer adjusted");
    }

    public LinkCostCalculator costCalculator() {
        return calculator;
    }

    public boolean isAdaptive() {
        return calculator != IdentityCostCalculator.INSTANCE;
    }

    // ---------- producer side ----------

    /** Append an RTT sample to the neighbor's history and remember it as current. */
    public void recordSample(Name neighbor, double rttMillis) {
        history.record(neighbor, rttMillis);
        update(neighbor, m -> new NeighborMetrics(
                rttMillis, m.timeoutCount(), m.lastSuccess(), m.lastProbeSent(), m.probesSent()));
    }

    @Override
    public void onProbeSent(Name neighbor) {
        Instant now = clock.instant();
        update(neighbor, m -> new NeighborMetrics(
                m.lastRttMillis(), m.timeoutCount(), m.lastSuccess(), now, m.probesSent() + 1));
    }

    @Override
    public void onResponseReceived(Name neighbor) {
        Instant now = clock.instant();
        update(neighbor, m -> new NeighborMetrics(
                m.lastRttMillis(), 0, now, m.lastProbeSent(), m.probesSent()));
    }

    @Override
    public void onTimeout(Name neighbor, int timedOutProbeCount) {
        update(neighbor, m -> new NeighborMetrics(
                m.lastRttMillis(), timedOutProbeCount, m.lastSuccess(), m.lastProbeSent(), m.probesSent()));
    }

    @Override
    public void onNeighborStatusChanged(Name neighbor, AdjacencyStatus newStatus) {
        if (newStatus == AdjacencyStatus.INACTIVE) {
            // A dead link has no current RTT; history is kept for when it returns.
            update(neighbor, m -> new NeighborMetrics(
                    null, m.timeoutCount(), m.lastSuccess(), m.lastProbeSent(), m.probesSent()));
        }
    }

    // ---------- consumer side ----------

    /**
     * Cost of the link to {@code neighbor} as the active strategy sees it.
     * Never blocks and never schedules work.
     */
    public double getCost(Name neighbor, double baseCost) {
        return calculator.adjustCost(neighbor, baseCost, linkMetrics(neighbor));
    }

    /**
     * What {@link #getCost} would return now, leaving the strategy's state
     * (latency history, counters) as it is. For the admin surface.
     */
    public double previewCost(Name neighbor, double baseCost) {
        return calculator.previewCost(neighbor, baseCost, linkMetrics(neighbor));
    }

    /** Metrics snapshot as handed to the strategy. Unknown neighbors get originalCost 0. */
    public LinkMetrics linkMetrics(Name neighbor) {
        double originalCost = adjacencies.findAdjacent(neighbor)
                .map(Adjacency::linkCost)
                .orElse(0.0);
        NeighborMetrics m = metrics(neighbor);
        return new LinkMetrics(
                neighbor,
                originalCost,
                m.lastRttMillis(),
                m.timeoutCount(),
                m.lastSuccess()
        );
    }

    public NeighborMetrics metrics(Name neighbor) {
        return metrics.getOrDefault(neighbor, NeighborMetrics.EMPTY);
    }

    public Map<Name, NeighborMetrics> snapshot() {
        return Map.copyOf(metrics);
    }

    public LatencyHistory history() {
        return history;
    }

    private void update(Name neighbor, UnaryOperator<NeighborMetrics> fn) {
        metrics.compute(neighbor, (k, prev) -> fn.apply(prev == null ? NeighborMetrics.EMPTY : prev));
    }
}
