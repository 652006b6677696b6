package io.lslite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of a link handed to a cost calculator.
 *
 * @param neighbor         neighbor the link leads to
 * @param originalCost     configured link cost before any adjustment
 * @param currentRttMillis latest round-trip sample, or null if none is known
 * @param timeoutCount     timed-out probes since the last success, or null if unknown
 * @param lastSuccess      when the last validated response arrived, or null if never
 */
public record LinkMetrics(
        Name neighbor,
        double originalCost,
        Double currentRttMillis,
        Integer timeoutCount,
        Instant lastSuccess
) {
    public LinkMetrics {
        Objects.requireNonNull(neighbor, "neighbor");
    }

    public static LinkMetrics of(Name neighbor, double originalCost) {
        return new LinkMetrics(neighbor, originalCost, null, null, null);
    }

    public boolean hasRtt() {
        return currentRttMillis != null;
    }
}
