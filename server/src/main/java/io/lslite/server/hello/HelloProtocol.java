package io.lslite.server.hello;

import io.lslite.core.Adjacency;
import io.lslite.core.AdjacencyList;
import io.lslite.core.AdjacencyStatus;
import io.lslite.core.Name;
import io.lslite.server.config.RouterConfig;
import io.lslite.server.cost.LinkCostManager;
import io.lslite.server.loop.EventLoop;
import io.lslite.server.loop.RecurringTimer;
import io.lslite.server.routing.RoutingTrigger;
import io.lslite.server.security.HelloSigner;
import io.lslite.server.security.HelloValidator;
import io.lslite.server.transport.HelloResponse;
import io.lslite.server.transport.HelloTransport;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Neighbor liveness engine (the hello protocol).
 *
 * Requester side, per neighbor:
 *  - A {@link RecurringTimer} sends one probe every hello interval, whatever
 *    happened to the previous probe.
 *  - A timeout bumps the neighbor's timed-out-probe counter. Below the retry
 *    limit the probe is re-sent at once; at the limit an ACTIVE neighbor
 *    becomes INACTIVE and routing is asked to recalculate.
 *  - A negative acknowledgement is treated as a timeout after twice the
 *    probe lifetime, leaving room for a retransmission in flight.
 *  - A validated response resets the counter, records the RTT and, if the
 *    neighbor was not ACTIVE, flips it to ACTIVE and asks routing to
 *    recalculate.
 *
 * Responder side: probes addressed to this router from a configured neighbor
 * get a signed, non-cacheable reply. If that neighbor is INACTIVE we probe it
 * back right away instead of waiting for its timer.
 *
 * Threading: every state change runs on the {@link EventLoop}. Transport and
 * validator callbacks are re-posted onto it.
 *
 * Several probes to one neighbor may be in flight at once (periodic timer plus
 * retries). Each probe carries an attempt number; a timeout for an attempt
 * older than the most recently acknowledged one is stale and ignored.
 */
public final class HelloProtocol implements AutoCloseable {

    private static final Logger log = Logger.getLogger(HelloProtocol.class.getName());

    static final byte[] INFO_CONTENT = HelloNames.INFO_COMPONENT.getBytes(StandardCharsets.UTF_8);

    private final Name routerName;
    private final RouterConfig.HelloSettings settings;
    private final AdjacencyList adjacencies;
    private final HelloTransport transport;
    private final HelloSigner signer;
    private final HelloValidator validator;
    private final RoutingTrigger routing;
    private final LinkCostManager costManager;
    private final EventLoop loop;
    private final Clock clock;
    private final HelloStatistics stats;
    private final List<HelloListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<Name, RecurringTimer> probeTimers = new ConcurrentHashMap<>();

    // Loop-confined.
    private final Map<Name, Long> lastAcknowledgedAttempt = new HashMap<>();
    private long lastAttempt;

    public HelloProtocol(Name routerName,
                         RouterConfig.HelloSettings settings,
                         AdjacencyList adjacencies,
                         HelloTransport transport,
                         HelloSigner signer,
                         HelloValidator validator,
                         RoutingTrigger routing,
                         LinkCostManager costManager,
                         EventLoop loop,
                         Clock clock,
                         HelloStatistics stats) {
        this.routerName = Objects.requireNonNull(routerName, "routerName");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.adjacencies = Objects.requireNonNull(adjacencies, "adjacencies");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.routing = Objects.requireNonNull(routing, "routing");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.costManager = Objects.requireNonNull(costManager, "costManager");
        listeners.add(costManager);
    }

    /**
     * Listen for probes addressed to this router and start the probe timer
     * of every configured neighbor.
     */
    public void start() {
        Name prefix = HelloNames.listenPrefix(routerName);
        log.info("listening for hello probes under " + prefix);
        transport.registerProbeListener(prefix, probe -> loop.execute(() -> handleProbe(probe)));
        for (Adjacency a : adjacencies.adjacencies()) {
            scheduleProbe(a.name());
        }
    }

    @Override
    public void close() {
        probeTimers.values().forEach(RecurringTimer::stop);
        probeTimers.clear();
    }

    public void addListener(HelloListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public HelloStatistics statistics() {
        return stats;
    }

    public boolean isProbing(Name neighbor) {
        RecurringTimer t = probeTimers.get(neighbor);
        return t != null && t.isRunning();
    }

    // ---------- requester side ----------

    /**
     * Send a probe to the neighbor now and every hello interval from now on.
     * Calling it again for the same neighbor has no effect.
     */
    public void scheduleProbe(Name neighbor) {
        loop.execute(() -> {
            if (!adjacencies.isNeighbor(neighbor)) {
                log.warning("not scheduling hello for unknown neighbor " + neighbor);
                return;
            }
            if (probeTimers.containsKey(neighbor)) {
                return;
            }
            RecurringTimer timer = new RecurringTimer(
                    "hello " + neighbor, loop, settings.interval(), () -> sendProbe(neighbor));
            probeTimers.put(neighbor, timer);
            timer.start();
        });
    }

    /**
     * Send a single probe without touching the periodic timer.
     * Nothing is sent while the neighbor has no endpoint.
     */
    void sendProbe(Name neighbor) {
        Optional<Adjacency> adjacent = adjacencies.findAdjacent(neighbor);
        if (adjacent.isEmpty()) {
            return;
        }
        Adjacency adj = adjacent.get();
        if (!adj.hasEndpoint()) {
            log.fine(() -> "no endpoint for " + neighbor + ", hello probe skipped");
            return;
        }

        Name probeName = HelloNames.probeName(neighbor, routerName);
        Duration lifetime = settings.lifetime();
        long attempt = ++lastAttempt;
        Instant sentAt = clock.instant();

        log.fine(() -> "sending hello probe " + probeName + " (attempt " + attempt + ")");
        onProbeSent(neighbor);

        transport.sendProbe(adj.endpoint(), probeName, lifetime, new HelloTransport.ProbeCallback() {
            @Override
            public void onResponse(HelloResponse response) {
                loop.execute(() -> onResponseReceived(neighbor, attempt, probeName, sentAt, response));
            }

            @Override
            public void onNack(String reason) {
                loop.execute(() -> onNegativeAck(neighbor, attempt, lifetime, reason));
            }

            @Override
            public void onTimeout() {
                loop.execute(() -> HelloProtocol.this.onTimeout(neighbor, attempt));
            }
        });
    }

    void onProbeSent(Name neighbor) {
        stats.increment(HelloStatistics.PacketType.PROBE_SENT);
        notifyListeners(l -> l.onProbeSent(neighbor));
    }

    void onNegativeAck(Name neighbor, long attempt, Duration lifetime, String reason) {
        Duration grace = lifetime.multipliedBy(2);
        log.fine(() -> "nack for " + neighbor + " (attempt " + attempt + "): " + reason
                + ", treating as timeout in " + grace.toMillis() + " ms");
        loop.schedule(grace, () -> onTimeout(neighbor, attempt));
    }

    void onTimeout(Name neighbor, long attempt) {
        if (!adjacencies.isNeighbor(neighbor)) {
            return;
        }
        if (attempt <= lastAcknowledgedAttempt.getOrDefault(neighbor, 0L)) {
            log.fine(() -> "ignoring stale timeout for " + neighbor + " (attempt " + attempt + ")");
            return;
        }

        int timedOut = adjacencies.incrementTimedOutProbeCount(neighbor);
        AdjacencyStatus status = adjacencies.getStatusOfNeighbor(neighbor);
        log.fine(() -> "hello probe to " + neighbor + " timed out, status=" + status
                + ", timedOutProbes=" + timedOut);

        notifyListeners(l -> l.onTimeout(neighbor, timedOut));

        if (timedOut < settings.retryLimit()) {
            log.fine(() -> "resending hello probe to " + neighbor);
            sendProbe(neighbor);
        } else if (status == AdjacencyStatus.ACTIVE) {
            adjacencies.setStatusOfNeighbor(neighbor, AdjacencyStatus.INACTIVE);
            log.info("neighbor " + neighbor + " status changed to INACTIVE after "
                    + timedOut + " timed-out probes");
            notifyListeners(l -> l.onNeighborStatusChanged(neighbor, AdjacencyStatus.INACTIVE));
            routing.requestRecalculation();
        }
    }

    void onResponseReceived(Name neighbor, long attempt, Name probeName, Instant sentAt, HelloResponse response) {
        Instant receivedAt = clock.instant();

        Optional<HelloNames.Response> parsed = HelloNames.parseResponse(response.name());
        if (parsed.isEmpty() || !parsed.get().requestName().equals(probeName)) {
            log.fine(() -> "dropping hello response with unexpected name " + response.name()
                    + " for probe " + probeName);
            return;
        }
        log.fine(() -> "received hello response " + response.name() + ", signed by " + response.signer());

        Duration rtt = Duration.between(sentAt, receivedAt);
        validator.validate(response, new HelloValidator.ValidationCallback() {
            @Override
            public void onValidated(HelloResponse validated) {
                loop.execute(() -> onResponseValidated(neighbor, attempt, rtt));
            }

            @Override
            public void onFailed(HelloResponse rejected, String reason) {
                loop.execute(() -> onResponseValidationFailed(neighbor, reason));
            }
        });
    }

    void onResponseValidated(Name neighbor, long attempt, Duration rtt) {
        if (!adjacencies.isNeighbor(neighbor)) {
            return;
        }
        stats.increment(HelloStatistics.PacketType.RESPONSE_RECEIVED);
        lastAcknowledgedAttempt.merge(neighbor, attempt, Math::max);

        AdjacencyStatus oldStatus = adjacencies.getStatusOfNeighbor(neighbor);
        adjacencies.setStatusOfNeighbor(neighbor, AdjacencyStatus.ACTIVE);
        adjacencies.setTimedOutProbeCount(neighbor, 0);

        double rttMillis = rtt.toNanos() / 1_000_000.0;
        log.fine(() -> "hello response from " + neighbor + " validated, rtt=" + rttMillis
                + " ms, old status=" + oldStatus);

        // before listeners run, so a listener calling getCost sees the new sample
        costManager.recordSample(neighbor, rttMillis);
        notifyListeners(l -> l.onResponseReceived(neighbor));

        if (oldStatus != AdjacencyStatus.ACTIVE) {
            log.info("neighbor " + neighbor + " status changed to ACTIVE");
            notifyListeners(l -> l.onNeighborStatusChanged(neighbor, AdjacencyStatus.ACTIVE));
            routing.requestRecalculation();
            notifyListeners(l -> l.onInitialResponseValidated(neighbor));
        }
    }

    void onResponseValidationFailed(Name neighbor, String reason) {
        log.fine(() -> "hello response from " + neighbor + " failed validation: " + reason);
    }

    // ---------- responder side ----------

    void handleProbe(HelloTransport.InboundProbe probe) {
        stats.increment(HelloStatistics.PacketType.PROBE_RECEIVED);
        Name name = probe.name();
        log.fine(() -> "hello probe received: " + name);

        Optional<HelloNames.Probe> parsed = HelloNames.parseProbe(name);
        if (parsed.isEmpty()) {
            log.fine(() -> "dropping malformed hello probe " + name);
            probe.drop("malformed probe name");
            return;
        }
        if (!parsed.get().target().equals(routerName)) {
            log.fine(() -> "dropping hello probe not addressed to " + routerName + ": " + name);
            probe.drop("not addressed to " + routerName);
            return;
        }

        Name requester = parsed.get().requester();
        Optional<Adjacency> adjacent = adjacencies.findAdjacent(requester);
        if (adjacent.isEmpty()) {
            log.fine(() -> "dropping hello probe from non-neighbor " + requester);
            probe.drop("unknown requester");
            return;
        }

        HelloResponse response = signer.sign(HelloNames.responseName(name), INFO_CONTENT, Duration.ZERO);
        try {
            probe.reply(response);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "failed to reply to hello probe " + name, e);
            return;
        }
        stats.increment(HelloStatistics.PacketType.RESPONSE_SENT);
        log.fine(() -> "sent hello response " + response.name());

        Adjacency adj = adjacent.get();
        if (adj.status() == AdjacencyStatus.INACTIVE && adj.hasEndpoint()) {
            sendProbe(requester);
        }
    }

    private void notifyListeners(Consumer<HelloListener> event) {
        for (HelloListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "hello listener " + l + " failed: " + e.getMessage(), e);
            }
        }
    }
}
