package io.lslite.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-neighbor round-trip history for load-aware cost computation.
 *
 * For each neighbor we keep a circular buffer of the most recent
 * {@code capacity} samples in milliseconds. Appending past capacity
 * overwrites the oldest sample (strict FIFO); there is no explicit reset.
 */
public final class LatencyHistory {

    public static final int DEFAULT_CAPACITY = 10;

    private static final class Window {
        private final double[] samples;
        private final int capacity;
        private int size;
        private int index;

        Window(int capacity) {
            this.samples = new double[capacity];
            this.capacity = capacity;
        }

        synchronized void add(double millis) {
            samples[index] = millis;
            index = (index + 1) % capacity;
            if (size < capacity) {
                size++;
            }
        }

        /** Oldest first. */
        synchronized double[] snapshot() {
            double[] copy = new double[size];
            int start = (index - size + capacity) % capacity;
            for (int i = 0; i < size; i++) {
                copy[i] = samples[(start + i) % capacity];
            }
            return copy;
        }

        synchronized int size() {
            return size;
        }
    }

    private final int capacity;
    private final ConcurrentHashMap<Name, Window> windows = new ConcurrentHashMap<>();

    public LatencyHistory() {
        this(DEFAULT_CAPACITY);
    }

    public LatencyHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public void record(Name neighbor, double millis) {
        if (neighbor == null || Double.isNaN(millis) || millis < 0.0) return;
        windows.computeIfAbsent(neighbor, n -> new Window(capacity)).add(millis);
    }

    /** Samples for the neighbor, oldest first; empty if none were recorded. */
    public double[] samples(Name neighbor) {
        Window w = windows.get(neighbor);
        return w == null ? new double[0] : w.snapshot();
    }

    public int size(Name neighbor) {
        Window w = windows.get(neighbor);
        return w == null ? 0 : w.size();
    }

    public Map<Name, double[]> snapshotAll() {
        return windows.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> e.getValue().snapshot()
                ));
    }
}
