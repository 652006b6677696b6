package io.lslite.server.transport;

import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import io.lslite.core.Name;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC service that receives hello probes from other routers.
 *
 * Responsibilities:
 *  - Decode the probe name and hand the probe to the listener registered
 *    under the longest matching prefix.
 *  - Keep the call open until the listener replies or drops the probe;
 *    a reply becomes a ProbeReply, a drop becomes NOT_FOUND.
 *  - Map a name that does not parse to INVALID_ARGUMENT and listener
 *    failures to INTERNAL.
 *
 * Listeners may answer from any thread.
 */
public final class GrpcHelloService extends HelloExchangeGrpc.HelloExchangeImplBase {

    private static final Logger log = Logger.getLogger(GrpcHelloService.class.getName());

    private final Map<Name, HelloTransport.ProbeListener> listeners = new ConcurrentHashMap<>();

    public void register(Name prefix, HelloTransport.ProbeListener listener) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(listener, "listener");
        if (listeners.putIfAbsent(prefix, listener) != null) {
            throw new IllegalStateException("probe listener already registered for " + prefix);
        }
    }

    @Override
    public void probe(HelloProto.ProbeRequest request, StreamObserver<HelloProto.ProbeReply> responseObserver) {
        Name name;
        try {
            name = Name.parse(request.getName());
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
            return;
        }

        HelloTransport.ProbeListener listener = longestMatch(name);
        if (listener == null) {
            responseObserver.onError(
                    Status.NOT_FOUND
                            .withDescription("no hello listener for " + name)
                            .asException()
            );
            return;
        }

        GrpcInboundProbe probe = new GrpcInboundProbe(name, responseObserver);
        try {
            listener.onProbe(probe);
        } catch (Exception e) {
            log.log(Level.WARNING, "hello listener failed for " + name, e);
            probe.fail(Status.INTERNAL.withDescription(e.getMessage()));
        }
    }

    private HelloTransport.ProbeListener longestMatch(Name name) {
        Name best = null;
        for (Name prefix : listeners.keySet()) {
            if (prefix.isPrefixOf(name) && (best == null || prefix.size() > best.size())) {
                best = prefix;
            }
        }
        return best == null ? null : listeners.get(best);
    }

    static HelloProto.ProbeReply toProto(HelloResponse response) {
        return HelloProto.ProbeReply.newBuilder()
                .setName(response.name().toUri())
                .setContent(ByteString.copyFrom(response.content()))
                .setFreshnessMillis(response.freshness().toMillis())
                .setSigner(response.signer().toUri())
                .setSignature(ByteString.copyFrom(response.signature()))
                .build();
    }

    /**
     * One pending call. Only the first reply/drop/fail reaches the wire.
     */
    private static final class GrpcInboundProbe implements HelloTransport.InboundProbe {

        private final Name name;
        private final StreamObserver<HelloProto.ProbeReply> observer;
        private final AtomicBoolean answered = new AtomicBoolean();

        GrpcInboundProbe(Name name, StreamObserver<HelloProto.ProbeReply> observer) {
            this.name = name;
            this.observer = observer;
        }

        @Override
        public Name name() {
            return name;
        }

        @Override
        public void reply(HelloResponse response) {
            Objects.requireNonNull(response, "response");
            if (!answered.compareAndSet(false, true)) {
                throw new IllegalStateException("probe " + name + " already answered");
            }
            try {
                observer.onNext(toProto(response));
                observer.onCompleted();
            } catch (StatusRuntimeException sre) {
                // requester gave up (deadline or cancel) before we answered
                log.fine(() -> "reply to " + name + " not delivered: " + sre.getStatus());
            }
        }

        @Override
        public void drop(String reason) {
            fail(Status.NOT_FOUND.withDescription(reason));
        }

        void fail(Status status) {
            if (!answered.compareAndSet(false, true)) {
                return;
            }
            try {
                observer.onError(status.asException());
            } catch (StatusRuntimeException sre) {
                log.fine(() -> "error for " + name + " not delivered: " + sre.getStatus());
            }
        }
    }
}
