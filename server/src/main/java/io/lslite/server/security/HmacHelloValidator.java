package io.lslite.server.security;

import io.lslite.server.hello.HelloNames;
import io.lslite.server.transport.HelloResponse;

import java.security.MessageDigest;
import java.util.Optional;

/**
 * Validates hello responses signed by {@link HmacHelloSigner}.
 *
 * A response is accepted when:
 *  - its name parses as a hello response name,
 *  - the signer is the neighbor the response name says it came from,
 *  - the HMAC matches.
 *
 * Validation is synchronous; the callback runs on the caller's thread.
 */
public final class HmacHelloValidator implements HelloValidator {

    private final byte[] secret;

    public HmacHelloValidator(byte[] secret) {
        this.secret = HelloSignatures.requireSecret(secret);
    }

    @Override
    public void validate(HelloResponse response, ValidationCallback callback) {
        Optional<HelloNames.Response> parsed = HelloNames.parseResponse(response.name());
        if (parsed.isEmpty()) {
            callback.onFailed(response, "not a hello response name: " + response.name());
            return;
        }
        if (!parsed.get().neighbor().equals(response.signer())) {
            callback.onFailed(response, "signer " + response.signer()
                    + " does not match neighbor " + parsed.get().neighbor());
            return;
        }
        byte[] expected = HelloSignatures.compute(secret, response.name(), response.signer(), response.content());
        if (!MessageDigest.isEqual(expected, response.signature())) {
            callback.onFailed(response, "bad signature from " + response.signer());
            return;
        }
        callback.onValidated(response);
    }
}
