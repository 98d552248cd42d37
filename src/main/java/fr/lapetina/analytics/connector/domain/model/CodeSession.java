package fr.lapetina.analytics.connector.domain.model;

import java.util.Optional;

/**
 * A connection able to execute code.
 */
public interface CodeSession extends ConnectionState {

    /**
     * Short-lived access token to append to embed URLs, if the server issued one.
     */
    Optional<String> getAccessToken();

    /**
     * Whether the session accepts code in the given console language ("python", "groovy").
     */
    boolean supportsConsoleType(String consoleType);
}
