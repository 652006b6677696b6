package io.lslite.core.cost;

import io.lslite.core.LatencyHistory;
import io.lslite.core.LinkMetrics;
import io.lslite.core.Name;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class LoadAwareCostCalculatorTest {

    private static final Name N = Name.parse("/site/router-b");
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final LatencyHistory history = new LatencyHistory(10);
    private final LoadAwareCostCalculator calc = new LoadAwareCostCalculator(
            CostModel.defaults(), history, Clock.fixed(NOW, ZoneOffset.UTC));

    private static LinkMetrics metrics(double original, Double rtt, Integer timeouts, Instant lastSuccess) {
        return new LinkMetrics(N, original, rtt, timeouts, lastSuccess);
    }

    @Test
    void fastStableLinkIsNotAdjusted() {
        double cost = calc.adjustCost(N, 100, metrics(100, 5.0, 0, NOW));
        assertEquals(100.0, cost, 1e-9);
        assertEquals(1, calc.adjustmentCount());
    }

    @Test
    void combinesAllThreeFactors() {
        // Five samples plus the current 150 ms sample: coefficient of variation > 0.5.
        for (double s : new double[]{10, 10, 10, 10, 300}) {
            history.record(N, s);
        }

        double cost = calc.adjustCost(N, 100, metrics(100, 150.0, 2, NOW));

        // 0.3 * 1.0 + 0.4 * 1.5 + 0.3 * 0.4 = 1.02
        assertEquals(202.0, cost, 1e-9);
        assertEquals(6, history.size(N), "current sample is appended before the load factor is computed");
    }

    @Test
    void clampsToThreeTimesOriginalCost() {
        double cost = calc.adjustCost(N, 1000, metrics(100, 500.0, 10, NOW));
        assertEquals(300.0, cost, 1e-9);
    }

    @Test
    void clampsUpToHalfOriginalCost() {
        double cost = calc.adjustCost(N, 10, metrics(100, null, null, null));
        assertEquals(50.0, cost, 1e-9);
    }

    @Test
    void bypassesDegenerateCosts() {
        history.record(N, 1);
        history.record(N, 500);
        history.record(N, 3);

        assertEquals(77.0, calc.adjustCost(N, 77, metrics(0, 900.0, 9, NOW.minusSeconds(3600))));
        assertEquals(-5.0, calc.adjustCost(N, -5, metrics(100, 900.0, 9, null)));
        assertEquals(0L, calc.adjustmentCount());
        assertEquals(3, history.size(N), "bypass must not touch the history");
    }

    @Test
    void rttFactorSteps() {
        assertEquals(0.0, calc.rttFactor(metrics(1, null, null, null)));
        assertEquals(0.0, calc.rttFactor(metrics(1, 10.0, null, null)));
        assertEquals(0.2, calc.rttFactor(metrics(1, 10.5, null, null)));
        assertEquals(0.2, calc.rttFactor(metrics(1, 50.0, null, null)));
        assertEquals(0.5, calc.rttFactor(metrics(1, 100.0, null, null)));
        assertEquals(1.0, calc.rttFactor(metrics(1, 200.0, null, null)));
        assertEquals(2.0, calc.rttFactor(metrics(1, 200.1, null, null)));
    }

    @Test
    void loadFactorNeedsThreeSamples() {
        assertEquals(0.0, LoadAwareCostCalculator.loadFactor(new double[]{10, 500}), "two samples are not enough");
        assertTrue(LoadAwareCostCalculator.loadFactor(new double[]{10, 500, 10}) > 0.0);
    }

    @Test
    void loadFactorOfSteadyHistoryIsZero() {
        assertEquals(0.0, LoadAwareCostCalculator.loadFactor(new double[]{40, 40, 40, 40, 40}));
    }

    @Test
    void previewMatchesAdjustmentWithoutRecording() {
        for (double s : new double[]{100, 10, 100, 10}) {
            history.record(N, s);
        }
        LinkMetrics m = metrics(100, 10.0, 0, NOW);

        double preview = calc.previewCost(N, 100, m);
        for (int i = 0; i < 10; i++) {
            assertEquals(preview, calc.previewCost(N, 100, m), 1e-9);
        }
        assertArrayEquals(new double[]{100, 10, 100, 10}, history.samples(N));
        assertEquals(0, calc.adjustmentCount());

        assertEquals(preview, calc.adjustCost(N, 100, m), 1e-9);
        assertEquals(5, history.size(N));
        assertEquals(1, calc.adjustmentCount());
    }

    @Test
    void previewDropsOldestSampleAtCapacity() {
        LatencyHistory small = new LatencyHistory(3);
        LoadAwareCostCalculator c = new LoadAwareCostCalculator(
                CostModel.defaults(), small, Clock.fixed(NOW, ZoneOffset.UTC));
        for (double s : new double[]{500, 40, 40}) {
            small.record(N, s);
        }
        LinkMetrics m = metrics(100, 40.0, 0, NOW);

        // {40, 40, 40} once 500 falls out: no load penalty
        double preview = c.previewCost(N, 100, m);
        assertEquals(c.adjustCost(N, 100, m), preview, 1e-9);
        assertEquals(0.0, LoadAwareCostCalculator.loadFactor(small.samples(N)));
    }

    @Test
    void nanBaseCostBypassesTheModel() {
        double cost = calc.adjustCost(N, Double.NaN, metrics(100, 50.0, 0, NOW));

        assertTrue(Double.isNaN(cost));
        assertEquals(0, history.size(N), "bypass must not record the sample");
        assertEquals(0, calc.adjustmentCount());
    }

    @Test
    void describesItselfWithSeparatedModel() {
        assertTrue(calc.toString().startsWith("load-aware CostModel["), calc.toString());
    }

    @Test
    void stabilityFactorPenalisesTimeoutsAndStaleSuccess() {
        assertEquals(0.0, calc.stabilityFactor(metrics(1, null, null, null)));
        assertEquals(0.6, calc.stabilityFactor(metrics(1, null, 3, null)), 1e-9);

        // exactly 60 s is not stale yet
        assertEquals(0.0, calc.stabilityFactor(metrics(1, null, 0, NOW.minusSeconds(60))));
        // 10 minutes: 600 / 60 * 0.1 = 1.0
        assertEquals(1.0, calc.stabilityFactor(metrics(1, null, 0, NOW.minusSeconds(600))), 1e-9);
        // capped at 2.0
        assertEquals(2.0, calc.stabilityFactor(metrics(1, null, 0, NOW.minusSeconds(86_400))), 1e-9);
    }

    @Test
    void customModelMovesTheClampBounds() {
        CostModel narrow = new CostModel(0.3, 0.4, 0.3, 0.9, 1.1);
        LoadAwareCostCalculator c = new LoadAwareCostCalculator(narrow, history, Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(110.0, c.adjustCost(N, 100, metrics(100, 500.0, 5, NOW)), 1e-9);
        assertEquals(90.0, c.adjustCost(N, 10, metrics(100, null, null, null)), 1e-9);
    }

    @Test
    void modelRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new CostModel(0.3, 0.4, 0.3, 2.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new CostModel(-0.1, 0.4, 0.3, 0.5, 3.0));
    }
}
