package io.lslite.server.transport;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.lslite.core.Endpoint;
import io.lslite.core.Name;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * gRPC-based {@link HelloTransport}.
 *
 * Outgoing probes are unary calls on a channel per neighbor endpoint, with
 * the probe lifetime as the call deadline:
 *  - reply              -> {@link ProbeCallback#onResponse}
 *  - DEADLINE_EXCEEDED  -> {@link ProbeCallback#onTimeout}
 *  - any other status   -> {@link ProbeCallback#onNack} with the status code
 *
 * Inbound probes arrive through the {@link GrpcHelloService} this transport
 * registers listeners with; the gRPC server hosting it is owned by the caller.
 */
public final class GrpcHelloTransport implements HelloTransport {

    private static final Logger log = Logger.getLogger(GrpcHelloTransport.class.getName());

    private final GrpcHelloService service;
    private final Function<Endpoint, ManagedChannel> channelFactory;
    private final Map<Endpoint, ManagedChannel> channels = new ConcurrentHashMap<>();

    /**
     * Production constructor: plaintext channels to host:port.
     */
    public GrpcHelloTransport(GrpcHelloService service) {
        this(service, endpoint -> ManagedChannelBuilder
                .forAddress(endpoint.host(), endpoint.port())
                .usePlaintext() // router-to-router traffic, responses are signed
                .build());
    }

    /**
     * Test constructor allowing pre-built channels (e.g., in-process).
     */
    public GrpcHelloTransport(GrpcHelloService service, Function<Endpoint, ManagedChannel> channelFactory) {
        this.service = Objects.requireNonNull(service, "service");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    @Override
    public void sendProbe(Endpoint endpoint, Name requestName, Duration lifetime, ProbeCallback callback) {
        ManagedChannel channel = channels.computeIfAbsent(endpoint, channelFactory);

        HelloProto.ProbeRequest request = HelloProto.ProbeRequest.newBuilder()
                .setName(requestName.toUri())
                .setLifetimeMillis(lifetime.toMillis())
                .build();

        HelloExchangeGrpc.newStub(channel)
                .withDeadlineAfter(lifetime.toMillis(), TimeUnit.MILLISECONDS)
                .probe(request, new OutcomeObserver(endpoint, requestName, callback));
    }

    @Override
    public void registerProbeListener(Name prefix, ProbeListener listener) {
        service.register(prefix, listener);
    }

    @Override
    public void close() {
        for (ManagedChannel channel : channels.values()) {
            channel.shutdown();
        }
        for (ManagedChannel channel : channels.values()) {
            try {
                if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                    channel.shutdownNow();
                }
            } catch (InterruptedException ie) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
    }

    static HelloResponse fromProto(HelloProto.ProbeReply reply) {
        return new HelloResponse(
                Name.parse(reply.getName()),
                reply.getContent().toByteArray(),
                Duration.ofMillis(reply.getFreshnessMillis()),
                Name.parse(reply.getSigner()),
                reply.getSignature().toByteArray()
        );
    }

    /**
     * Turns the gRPC call outcome into exactly one ProbeCallback invocation.
     */
    private static final class OutcomeObserver implements StreamObserver<HelloProto.ProbeReply> {

        private final Endpoint endpoint;
        private final Name requestName;
        private final ProbeCallback callback;
        private final AtomicBoolean done = new AtomicBoolean();

        OutcomeObserver(Endpoint endpoint, Name requestName, ProbeCallback callback) {
            this.endpoint = endpoint;
            this.requestName = requestName;
            this.callback = callback;
        }

        @Override
        public void onNext(HelloProto.ProbeReply reply) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            HelloResponse response;
            try {
                response = fromProto(reply);
            } catch (IllegalArgumentException iae) {
                callback.onNack("malformed reply: " + iae.getMessage());
                return;
            }
            callback.onResponse(response);
        }

        @Override
        public void onError(Throwable t) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            Status status = Status.fromThrowable(t);
            log.fine(() -> "probe " + requestName + " to " + endpoint.target() + " failed: " + status);
            if (status.getCode() == Status.Code.DEADLINE_EXCEEDED) {
                callback.onTimeout();
            } else {
                callback.onNack(status.getCode().name());
            }
        }

        @Override
        public void onCompleted() {
            // outcome already delivered by onNext or onError
        }
    }
}
