package io.lslite.server.transport;

import io.lslite.core.Name;

import java.time.Duration;
import java.util.Objects;

/**
 * Signed reply to a hello probe.
 *
 * @param name       request name plus a version component
 * @param content    small fixed payload
 * @param freshness  how long caches may serve it (always zero for hello replies)
 * @param signer     identity that signed the reply
 * @param signature  signature bytes over name and content
 */
public record HelloResponse(
        Name name,
        byte[] content,
        Duration freshness,
        Name signer,
        byte[] signature
) {
    public HelloResponse {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(freshness, "freshness");
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(signature, "signature");
    }
}
