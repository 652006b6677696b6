package io.lslite.server.security;

import io.lslite.server.transport.HelloResponse;

/**
 * Authenticates hello responses. The result may be delivered on any thread.
 */
public interface HelloValidator {

    void validate(HelloResponse response, ValidationCallback callback);

    /**
     * Outcome of one validation; exactly one method is called.
     */
    interface ValidationCallback {
        void onValidated(HelloResponse response);

        void onFailed(HelloResponse response, String reason);
    }
}
