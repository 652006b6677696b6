package io.lslite.server.dto;

import java.util.Map;

/**
 * JSON response for GET /stats.
 * {
 *   "router": "/site/router-a",
 *   "neighbors": 3,
 *   "activeNeighbors": 2,
 *   "costCalculator": "identity",
 *   "adaptiveCosts": false,
 *   "packets": { "PROBE_SENT": 12, "PROBE_RECEIVED": 9, ... }
 * }
 */
public class StatsView {
    public String router;
    public int neighbors;
    public int activeNeighbors;
    public String costCalculator;
    public boolean adaptiveCosts;
    public Map<String, Long> packets;
}
