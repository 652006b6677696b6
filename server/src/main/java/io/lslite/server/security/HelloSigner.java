package io.lslite.server.security;

import io.lslite.core.Name;
import io.lslite.server.transport.HelloResponse;

import java.time.Duration;

/**
 * Produces signed hello responses on behalf of this router.
 */
public interface HelloSigner {

    /** Identity that appears as the signer of every response. */
    Name identity();

    HelloResponse sign(Name name, byte[] content, Duration freshness);
}
