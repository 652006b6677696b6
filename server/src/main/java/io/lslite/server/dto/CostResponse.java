package io.lslite.server.dto;

/**
 * JSON response for GET /neighbors/{name}/cost?base=...
 */
public class CostResponse {
    public String neighbor;
    public double baseCost;
    public double adjustedCost;
    public String calculator;
}
