package fr.lapetina.analytics.connector.domain.model;

import java.util.Locale;

/**
 * Category of a remote analytics server.
 *
 * DIRECT: connectable without a provisioning queue
 * GATEWAY: requires interactive authentication and provisions ephemeral workers
 */
public enum ServerType {
    DIRECT,
    GATEWAY;

    /**
     * Parses the configuration spelling ("direct", "gateway", case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public static ServerType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return DIRECT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "direct", "core" -> DIRECT;
            case "gateway", "enterprise" -> GATEWAY;
            default -> throw new IllegalArgumentException("Unknown server type: " + value);
        };
    }
}
