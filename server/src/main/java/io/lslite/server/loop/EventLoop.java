package io.lslite.server.loop;

import java.time.Duration;

/**
 * Cooperative, single-threaded executor for all hello-engine state changes.
 *
 * Tasks submitted through either method never run concurrently with each
 * other, so the engine's per-neighbor state needs no locking.
 */
public interface EventLoop {

    /** Run the task on the loop as soon as possible. */
    void execute(Runnable task);

    /** Run the task on the loop after the given delay. */
    ScheduledTask schedule(Duration delay, Runnable task);

    /**
     * Handle to a delayed task.
     */
    interface ScheduledTask {
        void cancel();

        boolean isCancelled();
    }
}
