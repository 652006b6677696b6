package io.lslite.core;

import java.util.Objects;

/**
 * Per-neighbor configuration and liveness state.
 *
 * Configured fields (name, link cost) never change. Liveness fields are
 * written only by the hello engine's event loop and read from other threads
 * (admin surface, cost queries), hence volatile.
 */
public final class Adjacency {

    private final Name name;
    private final double linkCost;

    private volatile Endpoint endpoint;     // null when no face is known
    private volatile AdjacencyStatus status = AdjacencyStatus.INACTIVE;
    private volatile int timedOutProbeCount;

    public Adjacency(Name name, Endpoint endpoint, double linkCost) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) throw new IllegalArgumentException("neighbor name must not be empty");
        if (Double.isNaN(linkCost)) throw new IllegalArgumentException("linkCost must be a number");
        this.endpoint = endpoint;
        this.linkCost = linkCost;
    }

    public Name name() {
        return name;
    }

    public double linkCost() {
        return linkCost;
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    public boolean hasEndpoint() {
        return endpoint != null;
    }

    public void setEndpoint(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    public AdjacencyStatus status() {
        return status;
    }

    public void setStatus(AdjacencyStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public int timedOutProbeCount() {
        return timedOutProbeCount;
    }

    public void setTimedOutProbeCount(int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        this.timedOutProbeCount = count;
    }

    public int incrementTimedOutProbeCount() {
        return ++timedOutProbeCount;
    }

    @Override
    public String toString() {
        return "Adjacency{" +
                "name=" + name +
                ", endpoint=" + (endpoint == null ? "none" : endpoint.target()) +
                ", linkCost=" + linkCost +
                ", status=" + status +
                ", timedOutProbeCount=" + timedOutProbeCount +
                '}';
    }
}
