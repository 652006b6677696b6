package io.lslite.core;

/**
 * Binary liveness classification of a neighbor.
 * Every adjacency starts INACTIVE until a hello response has been validated.
 */
public enum AdjacencyStatus {
    INACTIVE,
    ACTIVE
}
