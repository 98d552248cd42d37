package fr.lapetina.analytics.connector.connection;

import fr.lapetina.analytics.connector.domain.model.CodeSession;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ResolutionError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of resolving a connection: either a ready session with its panel URL format,
 * or a structured failure carrying a message, details and an optional hint.
 */
public record ConnectionResult(
        boolean success,
        CodeSession connection,
        String panelUrlFormat,
        ResolutionError error,
        String errorMessage,
        Map<String, Object> details,
        String hint
) {
    public ConnectionResult {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isError() {
        return !success;
    }

    /**
     * Creates a successful result. {@code panelUrlFormat} may be null when the server
     * cannot embed panels for this connection.
     */
    public static ConnectionResult success(CodeSession connection, String panelUrlFormat) {
        Objects.requireNonNull(connection, "Connection is required");
        return new ConnectionResult(true, connection, panelUrlFormat, null, null, null, null);
    }

    /**
     * Creates a failure for the given endpoint.
     */
    public static ConnectionResult failure(ResolutionError error, Endpoint endpoint, String hint) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("connectionUrl", endpoint.toUri().toString());
        return new ConnectionResult(false, null, null, error, error.getMessage(), details, hint);
    }

    public static ConnectionResult failure(ResolutionError error, Endpoint endpoint) {
        return failure(error, endpoint, null);
    }
}
