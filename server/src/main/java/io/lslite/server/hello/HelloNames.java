package io.lslite.server.hello;

import io.lslite.core.Name;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Naming convention of the hello exchange.
 *
 *   probe:    /&lt;neighbor&gt;/LSR/INFO/&lt;requester router name as one component&gt;
 *   response: probe name + /v=&lt;version&gt;
 */
public final class HelloNames {

    public static final String ROUTING_COMPONENT = "LSR";
    public static final String INFO_COMPONENT = "INFO";
    public static final String VERSION_PREFIX = "v=";

    private static final AtomicLong lastVersion = new AtomicLong();

    private HelloNames() {
        // utility
    }

    /** Parsed probe name. */
    public record Probe(Name target, Name requester) {}

    /** Parsed response name. */
    public record Response(Name neighbor, Name requester, Name requestName, long version) {}

    /** Prefix under which a router listens for probes addressed to it. */
    public static Name listenPrefix(Name router) {
        return router.append(ROUTING_COMPONENT).append(INFO_COMPONENT);
    }

    public static Name probeName(Name neighbor, Name requester) {
        return listenPrefix(neighbor).append(requester);
    }

    /**
     * Response name for the given probe. Versions are strictly increasing
     * within the process and start near the current epoch milliseconds.
     */
    public static Name responseName(Name probeName) {
        long version = lastVersion.updateAndGet(prev -> Math.max(prev + 1, System.currentTimeMillis()));
        return probeName.append(VERSION_PREFIX + version);
    }

    public static Optional<Probe> parseProbe(Name name) {
        if (name.size() < 4) {
            return Optional.empty();
        }
        if (!INFO_COMPONENT.equals(name.get(-2)) || !ROUTING_COMPONENT.equals(name.get(-3))) {
            return Optional.empty();
        }
        try {
            Name requester = Name.parse(name.get(-1));
            if (requester.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Probe(name.getPrefix(-3), requester));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static Optional<Response> parseResponse(Name name) {
        if (name.size() < 5) {
            return Optional.empty();
        }
        String last = name.get(-1);
        if (!last.startsWith(VERSION_PREFIX)) {
            return Optional.empty();
        }
        long version;
        try {
            version = Long.parseLong(last.substring(VERSION_PREFIX.length()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        Name requestName = name.getPrefix(-1);
        return parseProbe(requestName)
                .map(p -> new Response(p.target(), p.requester(), requestName, version));
    }
}
