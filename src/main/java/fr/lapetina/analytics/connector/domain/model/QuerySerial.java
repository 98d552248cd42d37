package fr.lapetina.analytics.connector.domain.model;

import java.util.Objects;

/**
 * Server-assigned identifier of a provisioned worker request.
 */
public record QuerySerial(String value) {

    public QuerySerial {
        Objects.requireNonNull(value, "Query serial is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Query serial must not be blank");
        }
    }

    public static QuerySerial of(String value) {
        return new QuerySerial(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
