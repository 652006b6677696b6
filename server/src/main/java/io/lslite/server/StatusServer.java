package io.lslite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lslite.core.Adjacency;
import io.lslite.core.AdjacencyList;
import io.lslite.core.Name;
import io.lslite.server.cost.LinkCostManager;
import io.lslite.server.dto.CostResponse;
import io.lslite.server.dto.NeighborView;
import io.lslite.server.dto.StatsView;
import io.lslite.server.hello.HelloStatistics;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only admin HTTP surface over the hello engine and the cost manager.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Render adjacency state, adjusted costs and packet counters as JSON.
 *  - Map bad input to 400, unknown neighbors to 404, failures to 500.
 *
 * Path layout:
 *   - GET /admin/health                          Basic health check
 *   - GET /neighbors                             All adjacencies
 *   - GET /neighbors/{name}                      One adjacency
 *   - GET /neighbors/{name}/cost?base=<double>   Adjusted cost (base defaults to the link cost)
 *   - GET /stats                                 Hello counters and cost strategy
 *
 * {name} is the neighbor's name URI without the leading slash, e.g.
 * /neighbors/site/router-b/cost.
 */
public final class StatusServer {

    private static final String NEIGHBORS = "/neighbors";
    private static final String COST_SUFFIX = "/cost";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Name routerName;
    private final AdjacencyList adjacencies;
    private final LinkCostManager costs;
    private final HelloStatistics stats;

    public StatusServer(int port,
                        Name routerName,
                        AdjacencyList adjacencies,
                        LinkCostManager costs,
                        HelloStatistics stats) {
        this.routerName = routerName;
        this.adjacencies = adjacencies;
        this.costs = costs;
        this.stats = stats;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::handle)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        int status;
        Throwable error = null;
        try {
            if (!"GET".equals(method)) {
                status = send(ex, 405, Map.of("error", "method not allowed"));
            } else if ("/admin/health".equals(path)) {
                status = send(ex, 200, Map.of("status", "ok", "router", routerName.toUri()));
            } else if (NEIGHBORS.equals(path) || (NEIGHBORS + "/").equals(path)) {
                status = handleNeighbors(ex);
            } else if (path.startsWith(NEIGHBORS + "/") && path.endsWith(COST_SUFFIX)) {
                String uri = path.substring(NEIGHBORS.length(), path.length() - COST_SUFFIX.length());
                status = handleCost(ex, uri);
            } else if (path.startsWith(NEIGHBORS + "/")) {
                status = handleNeighbor(ex, path.substring(NEIGHBORS.length()));
            } else if ("/stats".equals(path)) {
                status = handleStats(ex);
            } else {
                status = send(ex, 404, Map.of("error", "not found"));
            }
        } catch (IllegalArgumentException bad) {
            status = send(ex, 400, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            error = e;
            status = send(ex, 500, Map.of("error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, error);
    }

    // ---------- handlers ----------

    /** GET /neighbors */
    private int handleNeighbors(HttpServerExchange ex) {
        List<NeighborView> out = new ArrayList<>();
        for (Adjacency a : adjacencies.adjacencies()) {
            out.add(view(a));
        }
        return send(ex, 200, out);
    }

    /** GET /neighbors/{name} */
    private int handleNeighbor(HttpServerExchange ex, String uri) {
        Optional<Adjacency> adj = adjacencies.findAdjacent(Name.parse(uri));
        if (adj.isEmpty()) {
            return send(ex, 404, Map.of("error", "unknown neighbor " + uri));
        }
        return send(ex, 200, view(adj.get()));
    }

    /** GET /neighbors/{name}/cost?base=... */
    private int handleCost(HttpServerExchange ex, String uri) {
        Name neighbor = Name.parse(uri);
        Optional<Adjacency> adj = adjacencies.findAdjacent(neighbor);
        if (adj.isEmpty()) {
            return send(ex, 404, Map.of("error", "unknown neighbor " + neighbor));
        }

        double base = adj.get().linkCost();
        String baseStr = firstOrNull(ex.getQueryParameters().get("base"));
        if (baseStr != null && !baseStr.isBlank()) {
            try {
                base = Double.parseDouble(baseStr);
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("base must be a number", nfe);
            }
        }

        CostResponse dto = new CostResponse();
        dto.neighbor = neighbor.toUri();
        dto.baseCost = base;
        dto.adjustedCost = costs.previewCost(neighbor, base);
        dto.calculator = costs.costCalculator().toString();
        return send(ex, 200, dto);
    }

    /** GET /stats */
    private int handleStats(HttpServerExchange ex) {
        StatsView dto = new StatsView();
        dto.router = routerName.toUri();
        dto.neighbors = adjacencies.size();
        dto.activeNeighbors = adjacencies.activeCount();
        dto.costCalculator = costs.costCalculator().toString();
        dto.adaptiveCosts = costs.isAdaptive();
        dto.packets = new LinkedHashMap<>();
        stats.snapshot().forEach((type, count) -> dto.packets.put(type.name(), count));
        return send(ex, 200, dto);
    }

    // ---------- helpers ----------

    /**
     * Read-only view of an adjacency. The adjusted cost needs a base, so it
     * lives under /cost.
     */
    private NeighborView view(Adjacency a) {
        LinkCostManager.NeighborMetrics m = costs.metrics(a.name());
        NeighborView v = new NeighborView();
        v.name = a.name().toUri();
        v.status = a.status().name();
        v.timedOutProbes = a.timedOutProbeCount();
        v.endpoint = a.hasEndpoint() ? a.endpoint().target() : null;
        v.linkCost = a.linkCost();
        v.lastRttMillis = m.lastRttMillis();
        v.lastSuccess = m.lastSuccess() == null ? null : m.lastSuccess().toString();
        v.probesSent = m.probesSent();
        v.latencySamples = costs.history().samples(a.name());
        return v;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON, write it with the given status and return the status actually sent. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
