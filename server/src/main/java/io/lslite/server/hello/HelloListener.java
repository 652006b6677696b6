package io.lslite.server.hello;

import io.lslite.core.AdjacencyStatus;
import io.lslite.core.Name;

/**
 * Notifications emitted by {@link HelloProtocol}. All callbacks run on the
 * engine's event loop and must return quickly.
 */
public interface HelloListener {

    default void onProbeSent(Name neighbor) {
    }

    /** A validated response arrived, whether or not the status changed. */
    default void onResponseReceived(Name neighbor) {
    }

    /** First validated response after the neighbor was not ACTIVE. */
    default void onInitialResponseValidated(Name neighbor) {
    }

    default void onTimeout(Name neighbor, int timedOutProbeCount) {
    }

    default void onNeighborStatusChanged(Name neighbor, AdjacencyStatus newStatus) {
    }
}
