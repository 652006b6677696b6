package io.lslite.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The configured set of neighbors, keyed by name.
 *
 * Responsibilities:
 *  - Built once from configuration; membership never changes afterwards.
 *  - Name-keyed accessors for status and timed-out-probe counters so the
 *    hello engine never has to hold on to Adjacency references.
 *
 * Lookups for an unknown neighbor throw IllegalArgumentException, except
 * {@link #findAdjacent(Name)} and {@link #isNeighbor(Name)} which are the
 * intended way to test membership.
 */
public final class AdjacencyList {

    private final Map<Name, Adjacency> byName;

    public AdjacencyList(List<Adjacency> adjacencies) {
        Map<Name, Adjacency> m = new LinkedHashMap<>();
        for (Adjacency a : adjacencies) {
            if (m.putIfAbsent(a.name(), a) != null) {
                throw new IllegalArgumentException("duplicate neighbor: " + a.name());
            }
        }
        this.byName = Collections.unmodifiableMap(m);
    }

    public boolean isNeighbor(Name name) {
        return byName.containsKey(name);
    }

    public Optional<Adjacency> findAdjacent(Name name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<Adjacency> adjacencies() {
        return new ArrayList<>(byName.values());
    }

    public int size() {
        return byName.size();
    }

    public AdjacencyStatus getStatusOfNeighbor(Name name) {
        return require(name).status();
    }

    public void setStatusOfNeighbor(Name name, AdjacencyStatus status) {
        require(name).setStatus(status);
    }

    public int getTimedOutProbeCount(Name name) {
        return require(name).timedOutProbeCount();
    }

    public void setTimedOutProbeCount(Name name, int count) {
        require(name).setTimedOutProbeCount(count);
    }

    public int incrementTimedOutProbeCount(Name name) {
        return require(name).incrementTimedOutProbeCount();
    }

    public void setEndpoint(Name name, Endpoint endpoint) {
        require(name).setEndpoint(endpoint);
    }

    /** Number of neighbors currently ACTIVE. */
    public int activeCount() {
        int n = 0;
        for (Adjacency a : byName.values()) {
            if (a.status() == AdjacencyStatus.ACTIVE) {
                n++;
            }
        }
        return n;
    }

    private Adjacency require(Name name) {
        Adjacency a = byName.get(name);
        if (a == null) {
            throw new IllegalArgumentException("not a configured neighbor: " + name);
        }
        return a;
    }
}
