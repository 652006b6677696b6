package io.lslite.server.hello;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory packet counters for the hello exchange. Thread-safe via AtomicLong.
 */
public final class HelloStatistics {

    public enum PacketType {
        PROBE_SENT,
        PROBE_RECEIVED,
        RESPONSE_SENT,
        RESPONSE_RECEIVED
    }

    private final Map<PacketType, AtomicLong> counters = new EnumMap<>(PacketType.class);

    public HelloStatistics() {
        for (PacketType t : PacketType.values()) {
            counters.put(t, new AtomicLong());
        }
    }

    public void increment(PacketType type) {
        counters.get(type).incrementAndGet();
    }

    public long get(PacketType type) {
        return counters.get(type).get();
    }

    public Map<PacketType, Long> snapshot() {
        Map<PacketType, Long> out = new EnumMap<>(PacketType.class);
        counters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    @Override
    public String toString() {
        return "HelloStatistics" + snapshot();
    }
}
