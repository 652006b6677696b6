package io.lslite.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lslite.core.Adjacency;
import io.lslite.core.AdjacencyList;
import io.lslite.core.Endpoint;
import io.lslite.core.Name;
import io.lslite.core.cost.CostModel;
import io.lslite.server.dto.JsonRouterConfig;
import io.lslite.server.routing.RoutingMode;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Router configuration: identity, neighbors, hello timing and cost model.
 *
 * Valid ranges (defaults in parentheses):
 *  - hello interval:   30..90 s (60)
 *  - probe lifetime:   1..15 s  (1)
 *  - retry limit:      1..10    (3)
 *  - history capacity: 1..1000  (10)
 *  - link cost:        >= 0     (10)
 */
public final class RouterConfig {

    public static final int MIN_INTERVAL_SECONDS = 30;
    public static final int MAX_INTERVAL_SECONDS = 90;
    public static final int DEFAULT_INTERVAL_SECONDS = 60;
    public static final int MIN_LIFETIME_SECONDS = 1;
    public static final int MAX_LIFETIME_SECONDS = 15;
    public static final int DEFAULT_LIFETIME_SECONDS = 1;
    public static final int MIN_RETRIES = 1;
    public static final int MAX_RETRIES = 10;
    public static final int DEFAULT_RETRIES = 3;
    public static final int MAX_HISTORY_CAPACITY = 1000;
    public static final double DEFAULT_LINK_COST = 10.0;
    public static final int DEFAULT_NEIGHBOR_PORT = 6363;

    public record Neighbor(Name name, Endpoint endpoint, double linkCost) {
        public Neighbor {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) throw new IllegalArgumentException("neighbor name must not be empty");
            if (!(linkCost >= 0)) throw new IllegalArgumentException("linkCost must be >= 0 for " + name);
        }
    }

    public record HelloSettings(Duration interval, Duration lifetime, int retryLimit) {
        public HelloSettings {
            Objects.requireNonNull(interval, "interval");
            Objects.requireNonNull(lifetime, "lifetime");
            long iv = interval.getSeconds();
            long lt = lifetime.getSeconds();
            if (iv < MIN_INTERVAL_SECONDS || iv > MAX_INTERVAL_SECONDS) {
                throw new IllegalArgumentException("hello interval must be in [30,90] s, got " + iv);
            }
            if (lt < MIN_LIFETIME_SECONDS || lt > MAX_LIFETIME_SECONDS) {
                throw new IllegalArgumentException("probe lifetime must be in [1,15] s, got " + lt);
            }
            if (retryLimit < MIN_RETRIES || retryLimit > MAX_RETRIES) {
                throw new IllegalArgumentException("retry limit must be in [1,10], got " + retryLimit);
            }
        }

        public static HelloSettings defaults() {
            return new HelloSettings(
                    Duration.ofSeconds(DEFAULT_INTERVAL_SECONDS),
                    Duration.ofSeconds(DEFAULT_LIFETIME_SECONDS),
                    DEFAULT_RETRIES
            );
        }
    }

    public record CostSettings(boolean loadAware, CostModel model, int historyCapacity) {
        public CostSettings {
            Objects.requireNonNull(model, "model");
            if (historyCapacity < 1 || historyCapacity > MAX_HISTORY_CAPACITY) {
                throw new IllegalArgumentException("history capacity must be in [1,1000], got " + historyCapacity);
            }
        }

        public static CostSettings defaults() {
            return new CostSettings(true, CostModel.defaults(), 10);
        }
    }

    private final Name routerName;
    private final List<Neighbor> neighbors;
    private final HelloSettings hello;
    private final CostSettings cost;
    private final RoutingMode routingMode;
    private final byte[] signingSecret;
    private final int grpcPort;
    private final int httpPort;

    public RouterConfig(
            Name routerName,
            List<Neighbor> neighbors,
            HelloSettings hello,
            CostSettings cost,
            RoutingMode routingMode,
            byte[] signingSecret,
            int grpcPort,
            int httpPort
    ) {
        Objects.requireNonNull(routerName, "routerName");
        if (routerName.isEmpty()) throw new IllegalArgumentException("routerName must not be empty");
        if (neighbors == null) throw new IllegalArgumentException("neighbors must not be null");
        Set<Name> seen = new HashSet<>();
        for (Neighbor n : neighbors) {
            if (n.name().equals(routerName)) throw new IllegalArgumentException("router cannot be its own neighbor");
            if (!seen.add(n.name())) throw new IllegalArgumentException("duplicate neighbor: " + n.name());
        }
        if (signingSecret == null || signingSecret.length < 16) {
            throw new IllegalArgumentException("signing secret must be at least 16 bytes");
        }
        if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");

        this.routerName = routerName;
        this.neighbors = List.copyOf(neighbors);
        this.hello = Objects.requireNonNull(hello, "hello");
        this.cost = Objects.requireNonNull(cost, "cost");
        this.routingMode = Objects.requireNonNull(routingMode, "routingMode");
        this.signingSecret = signingSecret.clone();
        this.grpcPort = grpcPort;
        this.httpPort = httpPort;
    }

    public static RouterConfig fromJsonFile(Path path) {
        return fromJsonFile(path, null);
    }

    /**
     * Load configuration from JSON; {@code overrideRouterName} (from the CLI)
     * wins over the file when non-blank.
     */
    public static RouterConfig fromJsonFile(Path path, String overrideRouterName) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            JsonRouterConfig cfg = mapper.readValue(path.toFile(), JsonRouterConfig.class);
            return fromJson(cfg, overrideRouterName);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load RouterConfig from " + path, e);
        }
    }

    static RouterConfig fromJson(JsonRouterConfig cfg, String overrideRouterName) {
        String name = (overrideRouterName != null && !overrideRouterName.isBlank())
                ? overrideRouterName
                : cfg.routerName;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("routerName is required");
        }

        List<Neighbor> neighbors = new ArrayList<>();
        if (cfg.neighbors != null) {
            for (JsonRouterConfig.Neighbor n : cfg.neighbors) {
                if (n.name == null || n.name.isBlank()) {
                    throw new IllegalArgumentException("neighbor name is required");
                }
                Endpoint endpoint = (n.host == null || n.host.isBlank())
                        ? null
                        : new Endpoint(n.host, orDefault(n.port, DEFAULT_NEIGHBOR_PORT));
                neighbors.add(new Neighbor(
                        Name.parse(n.name),
                        endpoint,
                        orDefault(n.linkCost, DEFAULT_LINK_COST)
                ));
            }
        }

        JsonRouterConfig.Hello h = cfg.hello == null ? new JsonRouterConfig.Hello() : cfg.hello;
        HelloSettings hello = new HelloSettings(
                Duration.ofSeconds(orDefault(h.intervalSeconds, DEFAULT_INTERVAL_SECONDS)),
                Duration.ofSeconds(orDefault(h.lifetimeSeconds, DEFAULT_LIFETIME_SECONDS)),
                orDefault(h.retries, DEFAULT_RETRIES)
        );

        JsonRouterConfig.CostModel c = cfg.costModel == null ? new JsonRouterConfig.CostModel() : cfg.costModel;
        CostSettings cost = new CostSettings(
                c.loadAware == null || c.loadAware,
                new CostModel(
                        orDefault(c.rttWeight, CostModel.DEFAULT_RTT_WEIGHT),
                        orDefault(c.loadWeight, CostModel.DEFAULT_LOAD_WEIGHT),
                        orDefault(c.stabilityWeight, CostModel.DEFAULT_STABILITY_WEIGHT),
                        orDefault(c.minMultiplier, CostModel.DEFAULT_MIN_MULTIPLIER),
                        orDefault(c.maxMultiplier, CostModel.DEFAULT_MAX_MULTIPLIER)
                ),
                orDefault(c.historyCapacity, 10)
        );

        if (cfg.signingSecretBase64 == null || cfg.signingSecretBase64.isBlank()) {
            throw new IllegalArgumentException("signingSecretBase64 is required");
        }
        byte[] secret;
        try {
            secret = Base64.getDecoder().decode(cfg.signingSecretBase64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("signingSecretBase64 is not valid base64", e);
        }

        return new RouterConfig(
                Name.parse(name),
                neighbors,
                hello,
                cost,
                parseRoutingMode(cfg.routingMode),
                secret,
                orDefault(cfg.grpcPort, 6363),
                orDefault(cfg.httpPort, 8080)
        );
    }

    static RoutingMode parseRoutingMode(String raw) {
        if (raw == null || raw.isBlank()) {
            return RoutingMode.LINK_STATE;
        }
        return switch (raw.trim().toLowerCase()) {
            case "link-state", "link_state", "ls" -> RoutingMode.LINK_STATE;
            case "hyperbolic", "hr" -> RoutingMode.HYPERBOLIC;
            default -> throw new IllegalArgumentException("unknown routingMode: " + raw);
        };
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    /** Fresh adjacency store for the configured neighbors, all INACTIVE. */
    public AdjacencyList buildAdjacencyList() {
        List<Adjacency> out = new ArrayList<>(neighbors.size());
        for (Neighbor n : neighbors) {
            out.add(new Adjacency(n.name(), n.endpoint(), n.linkCost()));
        }
        return new AdjacencyList(out);
    }

    public Name routerName() {
        return routerName;
    }

    public List<Neighbor> neighbors() {
        return neighbors;
    }

    public HelloSettings hello() {
        return hello;
    }

    public CostSettings cost() {
        return cost;
    }

    public RoutingMode routingMode() {
        return routingMode;
    }

    public byte[] signingSecret() {
        return signingSecret.clone();
    }

    public int grpcPort() {
        return grpcPort;
    }

    public int httpPort() {
        return httpPort;
    }
}
