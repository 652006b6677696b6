package io.lslite.server.security;

import io.lslite.core.Name;
import io.lslite.server.transport.HelloResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * Signs hello responses with a secret shared by all routers of the network.
 */
public final class HmacHelloSigner implements HelloSigner {

    private final Name identity;
    private final byte[] secret;

    public HmacHelloSigner(Name identity, byte[] secret) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.secret = HelloSignatures.requireSecret(secret);
    }

    @Override
    public Name identity() {
        return identity;
    }

    @Override
    public HelloResponse sign(Name name, byte[] content, Duration freshness) {
        byte[] sig = HelloSignatures.compute(secret, name, identity, content);
        return new HelloResponse(name, content.clone(), freshness, identity, sig);
    }
}
