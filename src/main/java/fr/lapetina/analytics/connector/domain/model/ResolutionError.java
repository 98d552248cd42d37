package fr.lapetina.analytics.connector.domain.model;

/**
 * Reasons a connection could not be resolved for an endpoint.
 * Returned as values so the tool layer can render a hint.
 */
public enum ResolutionError {
    /** No registered server matches the endpoint */
    SERVER_NOT_FOUND("No connections or server found"),

    /** The matched server is registered but not running */
    SERVER_NOT_RUNNING("Server is not running"),

    /** Gateway server without a session; login needs interactive credentials */
    NO_ACTIVE_CONNECTION("No active connection"),

    /** Auto-connect to a direct server did not produce a session */
    CONNECTION_FAILED("Failed to connect to server"),

    /** The session cannot execute code */
    UNSUPPORTED_CONNECTION_KIND("Connection does not support code execution");

    private final String message;

    ResolutionError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
