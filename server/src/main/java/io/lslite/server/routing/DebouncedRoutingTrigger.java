package io.lslite.server.routing;

import io.lslite.server.loop.EventLoop;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Coalesces recalculation requests and dispatches them by routing mode.
 *
 * The first request of a burst arms a single delayed dispatch; requests that
 * arrive before it fires are folded into it.
 */
public final class DebouncedRoutingTrigger implements RoutingTrigger {

    private static final Logger log = Logger.getLogger(DebouncedRoutingTrigger.class.getName());

    private final EventLoop loop;
    private final Duration delay;
    private final RoutingMode mode;
    private final Runnable adjacencyAdvertisementBuild;
    private final Runnable routingTableCalculation;

    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong dispatches = new AtomicLong();

    /**
     * @param loop                         loop the dispatch runs on
     * @param delay                        coalescing window
     * @param mode                         which action a dispatch runs
     * @param adjacencyAdvertisementBuild  LINK_STATE action
     * @param routingTableCalculation      HYPERBOLIC action
     */
    public DebouncedRoutingTrigger(EventLoop loop,
                                   Duration delay,
                                   RoutingMode mode,
                                   Runnable adjacencyAdvertisementBuild,
                                   Runnable routingTableCalculation) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.adjacencyAdvertisementBuild = Objects.requireNonNull(adjacencyAdvertisementBuild, "adjacencyAdvertisementBuild");
        this.routingTableCalculation = Objects.requireNonNull(routingTableCalculation, "routingTableCalculation");
    }

    @Override
    public void requestRecalculation() {
        requests.incrementAndGet();
        if (pending.compareAndSet(false, true)) {
            loop.schedule(delay, this::dispatch);
        }
    }

    public long requests() {
        return requests.get();
    }

    public long dispatches() {
        return dispatches.get();
    }

    public RoutingMode mode() {
        return mode;
    }

    private void dispatch() {
        pending.set(false);
        dispatches.incrementAndGet();
        log.fine(() -> "routing recalculation dispatched, mode=" + mode);
        if (mode == RoutingMode.HYPERBOLIC) {
            routingTableCalculation.run();
        } else {
            adjacencyAdvertisementBuild.run();
        }
    }
}
