package io.lslite.server.dto;

import java.util.List;

/**
 * JSON shape of the router configuration file. Absent numeric fields take
 * the defaults documented on RouterConfig.
 */
public class JsonRouterConfig {
    public String routerName;
    public String routingMode;           // "link-state" | "hyperbolic"
    public String signingSecretBase64;
    public Integer grpcPort;
    public Integer httpPort;
    public Hello hello;
    public CostModel costModel;
    public List<Neighbor> neighbors;

    public static class Hello {
        public Integer intervalSeconds;
        public Integer lifetimeSeconds;
        public Integer retries;
    }

    public static class CostModel {
        public Boolean loadAware;
        public Double rttWeight;
        public Double loadWeight;
        public Double stabilityWeight;
        public Double minMultiplier;
        public Double maxMultiplier;
        public Integer historyCapacity;
    }

    public static class Neighbor {
        public String name;
        public String host;
        public Integer port;
        public Double linkCost;
    }
}
