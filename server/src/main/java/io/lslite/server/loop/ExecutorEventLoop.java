package io.lslite.server.loop;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Production event loop backed by a single-threaded scheduler.
 *
 * A task that throws is logged and dropped; the loop thread keeps running.
 */
public final class ExecutorEventLoop implements EventLoop, AutoCloseable {

    private static final Logger log = Logger.getLogger(ExecutorEventLoop.class.getName());

    private final ScheduledExecutorService scheduler;

    public ExecutorEventLoop(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(() -> runSafe(task));
    }

    @Override
    public ScheduledTask schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> f = scheduler.schedule(
                () -> runSafe(task),
                Math.max(0L, delay.toNanos()),
                TimeUnit.NANOSECONDS
        );
        return new ScheduledTask() {
            @Override
            public void cancel() {
                f.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return f.isCancelled();
            }
        };
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private static void runSafe(Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.log(Level.WARNING, "event loop task failed: " + e.getMessage(), e);
        }
    }
}
