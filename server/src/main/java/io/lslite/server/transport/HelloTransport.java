package io.lslite.server.transport;

import io.lslite.core.Endpoint;
import io.lslite.core.Name;

import java.time.Duration;

/**
 * Named request/response transport used by the hello protocol.
 *
 * Implementations can be:
 *  - gRPC client/server pair,
 *  - in-process fake for tests.
 *
 * Every probe ends in exactly one {@link ProbeCallback} outcome.
 */
public interface HelloTransport extends AutoCloseable {

    /**
     * Send a probe to the endpoint; the callback fires once with a response,
     * a negative acknowledgement, or a timeout after {@code lifetime}.
     */
    void sendProbe(Endpoint endpoint, Name requestName, Duration lifetime, ProbeCallback callback);

    /**
     * Deliver inbound probes whose name starts with {@code prefix} to the listener.
     */
    void registerProbeListener(Name prefix, ProbeListener listener);

    @Override
    void close();

    /**
     * Outcome of one outgoing probe.
     */
    interface ProbeCallback {
        void onResponse(HelloResponse response);

        void onNack(String reason);

        void onTimeout();
    }

    /**
     * Receives inbound probes.
     */
    @FunctionalInterface
    interface ProbeListener {
        void onProbe(InboundProbe probe);
    }

    /**
     * A probe received from the network. The listener either replies once or
     * drops it, which the requester observes as a nack or a timeout.
     */
    interface InboundProbe {
        Name name();

        void reply(HelloResponse response);

        void drop(String reason);
    }
}
