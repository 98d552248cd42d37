package fr.lapetina.analytics.connector.domain.model;

import java.util.Locale;

/**
 * Designated status of a query as reported by the gateway's status events.
 *
 * Only RUNNING, ERROR and FAILED end a readiness wait; everything else is an
 * intermediate state the wait ignores.
 */
public enum QueryStatus {
    UNINITIALIZED,
    PENDING,
    ACQUIRING_WORKER,
    INITIALIZING,
    RUNNING,
    ERROR,
    FAILED,
    STOPPED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == RUNNING || isFailure();
    }

    public boolean isFailure() {
        return this == ERROR || this == FAILED;
    }

    /**
     * Maps the server's status name ("Running", "AcquiringWorker", ...) to a constant.
     * Unrecognized names map to UNKNOWN.
     */
    public static QueryStatus fromServerName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String normalized = name.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return QueryStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
