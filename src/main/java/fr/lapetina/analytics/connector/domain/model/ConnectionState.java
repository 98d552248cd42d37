package fr.lapetina.analytics.connector.domain.model;

import java.util.Optional;

/**
 * An active session bound to one server endpoint.
 * Owned by the server registry; the resolver only reads it.
 */
public interface ConnectionState {

    /** Endpoint the session talks to (a worker endpoint for gateway sessions). */
    Endpoint getEndpoint();

    boolean isConnected();

    boolean isRunningCode();

    /** Tag identifying the session, when the registry assigned one. */
    default Optional<String> getTagId() {
        return Optional.empty();
    }
}
