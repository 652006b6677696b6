package io.lslite.server.hello;

import io.lslite.core.Adjacency;
import io.lslite.core.AdjacencyList;
import io.lslite.core.AdjacencyStatus;
import io.lslite.core.Endpoint;
import io.lslite.core.LatencyHistory;
import io.lslite.core.Name;
import io.lslite.server.config.RouterConfig;
import io.lslite.server.cost.LinkCostManager;
import io.lslite.server.security.HelloValidator;
import io.lslite.server.security.HmacHelloSigner;
import io.lslite.server.security.HmacHelloValidator;
import io.lslite.server.testutil.FakeHelloTransport;
import io.lslite.server.testutil.ManualClock;
import io.lslite.server.testutil.ManualEventLoop;
import io.lslite.server.transport.HelloResponse;
import io.lslite.server.transport.HelloTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the hello engine through a fake transport on a manual loop:
 *  - periodic probing and retries up to the retry limit,
 *  - ACTIVE/INACTIVE transitions and the recalculation requests they emit,
 *  - nack grace period and stale timeouts,
 *  - the responder side, including the probe-back fast path.
 */
class HelloProtocolTest {

    private static final byte[] SECRET = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
    private static final Name A = Name.parse("/site/router-a");
    private static final Name B = Name.parse("/site/router-b");
    private static final Name C = Name.parse("/site/router-c");
    private static final Endpoint B_ENDPOINT = new Endpoint("10.0.0.2", 6363);

    private static final Duration INTERVAL = Duration.ofSeconds(60);
    private static final Duration LIFETIME = Duration.ofSeconds(1);

    private ManualClock clock;
    private ManualEventLoop loop;
    private FakeHelloTransport transport;
    private AdjacencyList adjacencies;
    private LinkCostManager costs;
    private AtomicInteger recalculations;
    private HelloStatistics stats;
    private HelloProtocol hello;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-05-01T12:00:00Z"));
        loop = new ManualEventLoop(clock);
        transport = new FakeHelloTransport();
        adjacencies = new AdjacencyList(List.of(
                new Adjacency(B, B_ENDPOINT, 10),
                new Adjacency(C, null, 25)
        ));
        costs = new LinkCostManager(adjacencies, new LatencyHistory(10), clock);
        recalculations = new AtomicInteger();
        stats = new HelloStatistics();
        hello = new HelloProtocol(
                A,
                new RouterConfig.HelloSettings(INTERVAL, LIFETIME, 3),
                adjacencies,
                transport,
                new HmacHelloSigner(A, SECRET),
                new HmacHelloValidator(SECRET),
                recalculations::incrementAndGet,
                costs,
                loop,
                clock,
                stats
        );
    }

    private static HelloResponse responseFrom(Name neighbor, Name probeName) {
        return new HmacHelloSigner(neighbor, SECRET)
                .sign(HelloNames.responseName(probeName), HelloProtocol.INFO_CONTENT, Duration.ZERO);
    }

    private void respond(FakeHelloTransport.SentProbe probe) {
        probe.respond(responseFrom(B, probe.name()));
    }

    private void bringUpB() {
        hello.start();
        respond(transport.last());
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
    }

    // ---------- requester side ----------

    @Test
    void startListensAndProbesNeighborsWithKnownEndpoint() {
        hello.start();

        assertTrue(transport.isListening(HelloNames.listenPrefix(A)));
        assertEquals(1, transport.sent().size(), "C has no endpoint yet");

        FakeHelloTransport.SentProbe p = transport.sent(0);
        assertEquals(B_ENDPOINT, p.endpoint());
        assertEquals(HelloNames.probeName(B, A), p.name());
        assertEquals(LIFETIME, p.lifetime());
        assertEquals(1, stats.get(HelloStatistics.PacketType.PROBE_SENT));
        assertTrue(hello.isProbing(B));
        assertTrue(hello.isProbing(C));
        assertEquals(1L, costs.metrics(B).probesSent());
    }

    @Test
    void probesOncePerIntervalRegardlessOfOutcome() {
        hello.start();
        loop.advance(INTERVAL.minusMillis(1));
        assertEquals(1, transport.sent().size());

        loop.advance(Duration.ofMillis(1));
        assertEquals(2, transport.sent().size());

        loop.advance(INTERVAL);
        assertEquals(3, transport.sent().size());
    }

    @Test
    void scheduleProbeIsIdempotent() {
        hello.start();
        hello.scheduleProbe(B);
        hello.scheduleProbe(B);

        assertEquals(1, transport.sent().size());
        loop.advance(INTERVAL);
        assertEquals(2, transport.sent().size());
    }

    @Test
    void neighborWithoutEndpointStartsProbingOnceEndpointIsKnown() {
        hello.start();
        adjacencies.setEndpoint(C, new Endpoint("10.0.0.3", 6363));

        loop.advance(INTERVAL);

        long toC = transport.sent().stream().filter(p -> p.name().equals(HelloNames.probeName(C, A))).count();
        assertEquals(1, toC);
    }

    @Test
    void firstValidatedResponseActivatesNeighborAndRequestsRecalculation() {
        List<String> events = new ArrayList<>();
        hello.addListener(new HelloListener() {
            @Override
            public void onInitialResponseValidated(Name neighbor) {
                events.add("initial " + neighbor);
            }

            @Override
            public void onNeighborStatusChanged(Name neighbor, AdjacencyStatus newStatus) {
                events.add(newStatus + " " + neighbor);
            }
        });

        hello.start();
        clock.advance(Duration.ofMillis(40));
        respond(transport.last());

        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        assertEquals(1, recalculations.get());
        assertEquals(List.of("ACTIVE " + B, "initial " + B), events);
        assertEquals(1, stats.get(HelloStatistics.PacketType.RESPONSE_RECEIVED));

        LinkCostManager.NeighborMetrics m = costs.metrics(B);
        assertEquals(40.0, m.lastRttMillis(), 1e-9);
        assertEquals(clock.instant(), m.lastSuccess());
        assertArrayEquals(new double[]{40.0}, costs.history().samples(B), 1e-9);
    }

    @Test
    void responseWhileAlreadyActiveDoesNotRequestRecalculation() {
        bringUpB();
        List<String> events = new ArrayList<>();
        hello.addListener(new HelloListener() {
            @Override
            public void onResponseReceived(Name neighbor) {
                events.add("response " + neighbor);
            }

            @Override
            public void onInitialResponseValidated(Name neighbor) {
                events.add("initial " + neighbor);
            }

            @Override
            public void onNeighborStatusChanged(Name neighbor, AdjacencyStatus newStatus) {
                events.add(newStatus + " " + neighbor);
            }
        });

        loop.advance(INTERVAL);
        transport.last().timeout();
        transport.last().timeout();
        assertEquals(2, adjacencies.getTimedOutProbeCount(B));
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));

        clock.advance(Duration.ofMillis(25));
        respond(transport.last());

        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        assertEquals(2, costs.history().size(B), "second validated response adds a sample");
        assertEquals(25.0, costs.metrics(B).lastRttMillis(), 1e-9);
        assertEquals(1, recalculations.get());
        assertEquals(List.of("response " + B), events, "no status change, no initial-response event");
    }

    @Test
    void goesInactiveOnlyWhenRetryLimitIsReached() {
        bringUpB();
        loop.advance(INTERVAL);
        assertEquals(2, transport.sent().size());

        transport.last().timeout();
        assertEquals(1, adjacencies.getTimedOutProbeCount(B));
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(3, transport.sent().size(), "retry goes out immediately");

        transport.last().timeout();
        assertEquals(2, adjacencies.getTimedOutProbeCount(B));
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(4, transport.sent().size());

        transport.last().timeout();
        assertEquals(3, adjacencies.getTimedOutProbeCount(B));
        assertEquals(AdjacencyStatus.INACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(4, transport.sent().size(), "no retry once the limit is reached");
        assertEquals(2, recalculations.get(), "one for going up, one for going down");
        assertNull(costs.metrics(B).lastRttMillis(), "a dead link has no current RTT");
        assertEquals(3, costs.metrics(B).timeoutCount());
    }

    @Test
    void timeoutsOfAnInactiveNeighborNeverRequestRecalculation() {
        hello.start();
        for (int i = 0; i < 3; i++) {
            transport.last().timeout();
        }
        assertEquals(3, transport.sent().size());
        loop.advance(INTERVAL);
        transport.last().timeout();

        assertEquals(AdjacencyStatus.INACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(0, recalculations.get());
        assertEquals(4, adjacencies.getTimedOutProbeCount(B));
    }

    @Test
    void validatedResponseResetsTimeoutCounter() {
        hello.start();
        transport.last().timeout();
        transport.last().timeout();
        assertEquals(2, adjacencies.getTimedOutProbeCount(B));

        respond(transport.last());

        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        assertEquals(0, costs.metrics(B).timeoutCount());
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
    }

    @Test
    void timeoutOfProbeSentBeforeLastAcknowledgedOneIsIgnored() {
        hello.start();
        FakeHelloTransport.SentProbe first = transport.last();
        loop.advance(INTERVAL);
        respond(transport.last());

        first.timeout();

        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        assertEquals(2, transport.sent().size(), "stale timeout must not trigger a retry");
    }

    @Test
    void nackIsTreatedAsTimeoutAfterTwiceTheLifetime() {
        hello.start();
        transport.last().nack("NO_ROUTE");

        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        loop.advance(LIFETIME.multipliedBy(2).minusMillis(1));
        assertEquals(0, adjacencies.getTimedOutProbeCount(B));

        loop.advance(Duration.ofMillis(1));
        assertEquals(1, adjacencies.getTimedOutProbeCount(B));
        assertEquals(2, transport.sent().size());
    }

    @Test
    void responseToRetryAfterNackResetsCounter() {
        hello.start();
        transport.last().nack("CONGESTION");
        loop.advance(LIFETIME.multipliedBy(2));
        assertEquals(1, adjacencies.getTimedOutProbeCount(B));
        assertEquals(2, transport.sent().size());

        respond(transport.last());
        assertEquals(0, adjacencies.getTimedOutProbeCount(B));
        assertEquals(AdjacencyStatus.ACTIVE, adjacencies.getStatusOfNeighbor(B));
    }

    @Test
    void responseWithBadSignatureIsIgnored() {
        hello.start();
        byte[] otherSecret = "fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.UTF_8);
        FakeHelloTransport.SentProbe p = transport.last();
        p.respond(new HmacHelloSigner(B, otherSecret)
                .sign(HelloNames.responseName(p.name()), HelloProtocol.INFO_CONTENT, Duration.ZERO));

        assertEquals(AdjacencyStatus.INACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(0, recalculations.get());
        assertEquals(0, stats.get(HelloStatistics.PacketType.RESPONSE_RECEIVED), "only validated responses count");
        assertEquals(0, costs.history().size(B));
    }

    @Test
    void responseSignedByAnotherRouterIsIgnored() {
        hello.start();
        FakeHelloTransport.SentProbe p = transport.last();
        p.respond(responseFrom(C, p.name()));

        assertEquals(AdjacencyStatus.INACTIVE, adjacencies.getStatusOfNeighbor(B));
    }

    @Test
    void responseForAnotherProbeNameIsIgnored() {
        hello.start();
        transport.last().respond(responseFrom(B, HelloNames.probeName(B, C)));

        assertEquals(AdjacencyStatus.INACTIVE, adjacencies.getStatusOfNeighbor(B));
        assertEquals(0, recalculations.get());
        assertEquals(0, stats.get(HelloStatistics.PacketType.RESPONSE_RECEIVED));
    }

    @Test
    void closeStopsPeriodicProbing() {
        hello.start();
        hello.close();
        loop.advance(INTERVAL.multipliedBy(3));

        assertEquals(1, transport.sent().size());
        assertFalse(hello.isProbing(B));
    }

    // ---------- responder side ----------

    @Test
    void answersProbeFromNeighborWithSignedResponse() {
        bringUpB();
        int before = transport.sent().size();

        Name probeName = HelloNames.probeName(A, B);
        FakeHelloTransport.RecordedInbound in = transport.deliver(probeName);

        assertNotNull(in.reply());
        assertNull(in.dropReason());
        HelloResponse r = in.reply();
        assertEquals(probeName, r.name().getPrefix(-1));
        assertTrue(r.name().get(-1).startsWith(HelloNames.VERSION_PREFIX));
        assertEquals(A, r.signer());
        assertEquals(Duration.ZERO, r.freshness());
        assertArrayEquals("INFO".getBytes(StandardCharsets.UTF_8), r.content());

        AtomicInteger valid = new AtomicInteger();
        new HmacHelloValidator(SECRET).validate(r, new HelloValidator.ValidationCallback() {
            @Override
            public void onValidated(HelloResponse response) {
                valid.incrementAndGet();
            }

            @Override
            public void onFailed(HelloResponse response, String reason) {
                fail(reason);
            }
        });
        assertEquals(1, valid.get());

        assertEquals(1, stats.get(HelloStatistics.PacketType.PROBE_RECEIVED));
        assertEquals(1, stats.get(HelloStatistics.PacketType.RESPONSE_SENT));
        assertEquals(before, transport.sent().size(), "B is ACTIVE, no probe back");
    }

    @Test
    void probeFromInactiveNeighborTriggersImmediateProbeBack() {
        hello.start();
        assertEquals(1, transport.sent().size());

        transport.deliver(HelloNames.probeName(A, B));

        assertEquals(2, transport.sent().size());
        assertEquals(HelloNames.probeName(B, A), transport.last().name());
    }

    @Test
    void probeFromInactiveNeighborWithoutEndpointIsAnsweredOnly() {
        hello.start();
        FakeHelloTransport.RecordedInbound in = transport.deliver(HelloNames.probeName(A, C));

        assertNotNull(in.reply());
        assertEquals(1, transport.sent().size());
    }

    @Test
    void probeFromUnknownRouterIsDropped() {
        hello.start();
        FakeHelloTransport.RecordedInbound in = transport.deliver(
                HelloNames.probeName(A, Name.parse("/elsewhere/router-z")));

        assertNull(in.reply());
        assertNotNull(in.dropReason());
        assertEquals(1, stats.get(HelloStatistics.PacketType.PROBE_RECEIVED));
        assertEquals(0, stats.get(HelloStatistics.PacketType.RESPONSE_SENT));
    }

    @Test
    void malformedProbeIsDropped() {
        hello.start();
        FakeHelloTransport.RecordedInbound in = transport.deliver(
                HelloNames.listenPrefix(A).append("%ZZ"));

        assertNull(in.reply());
        assertNotNull(in.dropReason());
        assertEquals(0, stats.get(HelloStatistics.PacketType.RESPONSE_SENT));
    }

    @Test
    void probeAddressedToAnotherRouterIsDropped() {
        Name elsewhere = HelloNames.probeName(Name.parse("/site/router-x"), B);
        RecordingProbe probe = new RecordingProbe(elsewhere);
        hello.handleProbe(probe);

        assertNull(probe.reply);
        assertNotNull(probe.dropReason);
    }

    private static final class RecordingProbe implements HelloTransport.InboundProbe {
        private final Name name;
        HelloResponse reply;
        String dropReason;

        RecordingProbe(Name name) {
            this.name = name;
        }

        @Override
        public Name name() {
            return name;
        }

        @Override
        public void reply(HelloResponse response) {
            reply = response;
        }

        @Override
        public void drop(String reason) {
            dropReason = reason;
        }
    }
}
