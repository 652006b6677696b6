package io.lslite.server.security;

import io.lslite.core.Name;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * HMAC-SHA256 over (name URI, 0x00, signer URI, 0x00, content).
 */
final class HelloSignatures {

    static final String ALGORITHM = "HmacSHA256";

    private HelloSignatures() {
        // utility
    }

    static byte[] compute(byte[] secret, Name name, Name signer, byte[] content) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            mac.update(name.toUri().getBytes(StandardCharsets.UTF_8));
            mac.update((byte) 0);
            mac.update(signer.toUri().getBytes(StandardCharsets.UTF_8));
            mac.update((byte) 0);
            mac.update(content);
            return mac.doFinal();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC unavailable", e);
        }
    }

    static byte[] requireSecret(byte[] secret) {
        if (secret == null || secret.length < 16) {
            throw new IllegalArgumentException("signing secret must be at least 16 bytes");
        }
        return secret.clone();
    }
}
