package io.lslite.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.lslite.core.AdjacencyList;
import io.lslite.core.LatencyHistory;
import io.lslite.core.cost.LoadAwareCostCalculator;
import io.lslite.server.config.RouterConfig;
import io.lslite.server.cost.LinkCostManager;
import io.lslite.server.hello.HelloProtocol;
import io.lslite.server.hello.HelloStatistics;
import io.lslite.server.loop.ExecutorEventLoop;
import io.lslite.server.routing.DebouncedRoutingTrigger;
import io.lslite.server.security.HmacHelloSigner;
import io.lslite.server.security.HmacHelloValidator;
import io.lslite.server.transport.GrpcHelloService;
import io.lslite.server.transport.GrpcHelloTransport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single router.
 *
 * Responsibilities:
 *  - Parse CLI options and load the JSON router configuration.
 *  - Wire the adjacency list, latency history and link cost manager
 *    (with the load-aware strategy when enabled).
 *  - Start the gRPC server that answers hello probes, and the transport
 *    that sends them.
 *  - Start the hello engine and the admin HTTP surface.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    /** Coalescing window for routing recalculation after adjacency changes. */
    static final Duration ROUTING_RECALCULATION_DELAY = Duration.ofSeconds(5);

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        var cli = ServerConfig.fromArgs(args);

        RouterConfig cfg = RouterConfig.fromJsonFile(Path.of(cli.configPath()), cli.routerName());
        int grpcPort = cli.grpcPort() != null ? cli.grpcPort() : cfg.grpcPort();
        int httpPort = cli.httpPort() != null ? cli.httpPort() : cfg.httpPort();

        Clock clock = Clock.systemUTC();
        var loop = new ExecutorEventLoop("hello-loop");

        // ------ Adjacencies + link cost ------
        AdjacencyList adjacencies = cfg.buildAdjacencyList();
        var history = new LatencyHistory(cfg.cost().historyCapacity());
        var costManager = new LinkCostManager(adjacencies, history, clock);
        if (cfg.cost().loadAware()) {
            costManager.setCostCalculator(new LoadAwareCostCalculator(cfg.cost().model(), history, clock));
        }

        // ------ Security ------
        var signer = new HmacHelloSigner(cfg.routerName(), cfg.signingSecret());
        var validator = new HmacHelloValidator(cfg.signingSecret());

        // ------ Transport ------
        var service = new GrpcHelloService();
        var transport = new GrpcHelloTransport(service);
        Server grpcServer = ServerBuilder
                .forPort(grpcPort)
                .addService(service)
                .build();

        // ------ Routing hook ------
        var routing = new DebouncedRoutingTrigger(
                loop,
                ROUTING_RECALCULATION_DELAY,
                cfg.routingMode(),
                () -> log.info("building adjacency advertisement, "
                        + adjacencies.activeCount() + "/" + adjacencies.size() + " neighbors active"),
                () -> log.info("recalculating hyperbolic routing table, "
                        + adjacencies.activeCount() + "/" + adjacencies.size() + " neighbors active")
        );

        // ------ Hello engine ------
        var stats = new HelloStatistics();
        var hello = new HelloProtocol(
                cfg.routerName(),
                cfg.hello(),
                adjacencies,
                transport,
                signer,
                validator,
                routing,
                costManager,
                loop,
                clock,
                stats
        );

        // ------ Admin HTTP ------
        var status = new StatusServer(httpPort, cfg.routerName(), adjacencies, costManager, stats);

        try {
            grpcServer.start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start gRPC server", e);
        }
        status.start();
        hello.start();

        System.out.printf(
                "Router %s probing %d neighbors every %ds; hello on grpc://0.0.0.0:%d, admin on http://localhost:%d%n",
                cfg.routerName(),
                adjacencies.size(),
                cfg.hello().interval().toSeconds(),
                grpcPort,
                httpPort
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                hello.close();
                transport.close();
                grpcServer.shutdown();
                status.stop();
                loop.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "error during shutdown", e);
            }
        }));

        grpcServer.awaitTermination();
    }

    /**
     * Load logging.properties from the classpath unless a config file was
     * given with -Djava.util.logging.config.file.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
