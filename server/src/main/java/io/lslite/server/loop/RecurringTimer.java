package io.lslite.server.loop;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-period timer that re-arms itself after every firing, whether or not
 * the task succeeded.
 *
 * The first firing happens immediately on {@link #start()}. Each later firing
 * is scheduled {@code period} after the previous one ran. Safe to start only
 * once; {@link #stop()} cancels the pending firing.
 */
public final class RecurringTimer {

    private static final Logger log = Logger.getLogger(RecurringTimer.class.getName());

    private final String name;
    private final EventLoop loop;
    private final Duration period;
    private final Runnable task;

    private volatile boolean started;
    private volatile boolean stopped;
    private volatile EventLoop.ScheduledTask next;
    private volatile long firings;

    public RecurringTimer(String name, EventLoop loop, Duration period, Runnable task) {
        this.name = Objects.requireNonNull(name, "name");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.period = Objects.requireNonNull(period, "period");
        this.task = Objects.requireNonNull(task, "task");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive, got: " + period);
        }
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        loop.execute(this::fire);
    }

    public synchronized void stop() {
        stopped = true;
        EventLoop.ScheduledTask pending = next;
        if (pending != null) {
            pending.cancel();
        }
    }

    public boolean isRunning() {
        return started && !stopped;
    }

    public long firings() {
        return firings;
    }

    public Duration period() {
        return period;
    }

    private void fire() {
        if (stopped) {
            return;
        }
        try {
            firings++;
            task.run();
        } catch (Exception e) {
            log.log(Level.WARNING, "timer " + name + " task failed: " + e.getMessage(), e);
        } finally {
            synchronized (this) {
                if (!stopped) {
                    next = loop.schedule(period, this::fire);
                }
            }
        }
    }
}
