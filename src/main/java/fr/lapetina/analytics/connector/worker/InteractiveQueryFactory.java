package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.QuerySerial;

import java.util.concurrent.CompletableFuture;

/**
 * UI-driven query creation flow, used when a gateway advertises it.
 * Completes with {@code null} when the user cancels.
 */
@FunctionalInterface
public interface InteractiveQueryFactory {

    CompletableFuture<QuerySerial> create(Endpoint endpoint, String tagId, String consoleType);
}
