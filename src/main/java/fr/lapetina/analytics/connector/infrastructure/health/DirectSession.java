package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.domain.model.CodeSession;
import fr.lapetina.analytics.connector.domain.model.Endpoint;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Session on a directly-addressable server.
 */
public final class DirectSession implements CodeSession, AutoCloseable {

    public static final Set<String> DEFAULT_CONSOLE_TYPES = Set.of("python", "groovy");

    private final Endpoint endpoint;
    private final String accessToken;
    private final Set<String> consoleTypes;
    private volatile boolean connected = true;
    private volatile boolean runningCode;

    public DirectSession(Endpoint endpoint, String accessToken, Set<String> consoleTypes) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint is required");
        this.accessToken = accessToken == null || accessToken.isBlank() ? null : accessToken;
        this.consoleTypes = consoleTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public DirectSession(Endpoint endpoint, String accessToken) {
        this(endpoint, accessToken, DEFAULT_CONSOLE_TYPES);
    }

    @Override
    public Endpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean isRunningCode() {
        return runningCode;
    }

    public void setRunningCode(boolean runningCode) {
        this.runningCode = runningCode;
    }

    @Override
    public Optional<String> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    @Override
    public boolean supportsConsoleType(String consoleType) {
        return consoleType != null && consoleTypes.contains(consoleType.toLowerCase(Locale.ROOT));
    }

    @Override
    public void close() {
        connected = false;
    }

    @Override
    public String toString() {
        return "DirectSession{endpoint=" + endpoint + ", connected=" + connected + "}";
    }
}
