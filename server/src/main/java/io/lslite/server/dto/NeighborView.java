package io.lslite.server.dto;

/**
 * JSON view of one adjacency for GET /neighbors and GET /neighbors/{name}.
 * Example shape:
 * {
 *   "name": "/site/router-b",
 *   "status": "ACTIVE",
 *   "timedOutProbes": 0,
 *   "endpoint": "10.0.0.2:6363",
 *   "linkCost": 10.0,
 *   "lastRttMillis": 42.5,
 *   "lastSuccess": "2024-05-01T12:00:00Z",
 *   "probesSent": 17,
 *   "latencySamples": [40.1, 42.5]
 * }
 */
public class NeighborView {
    public String name;
    public String status;
    public int timedOutProbes;
    public String endpoint;         // null until known
    public double linkCost;
    public Double lastRttMillis;    // null when the link is down or never answered
    public String lastSuccess;      // ISO-8601, null if never
    public long probesSent;
    public double[] latencySamples; // oldest first
}
