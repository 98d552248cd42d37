package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.QuerySerial;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Logged-in session to a gateway server.
 *
 * Instances are created by a {@link CredentialProvider} and shared through the
 * authenticated-client store; a {@link WorkerLifecycleManager} only reads them.
 */
public interface GatewayClient {

    Endpoint getEndpoint();

    /**
     * Name of the user the session operates as. Used as the owner of drafted queries.
     */
    String getUsername();

    CompletableFuture<FeatureFlags> getFeatureFlags();

    CompletableFuture<ServerConfigValues> getServerConfigValues();

    CompletableFuture<QueryConstants> getQueryConstants();

    CompletableFuture<List<String>> getDbServerNames();

    /**
     * Submits a query. The future completes with the serial the server assigned, or
     * {@code null} when the server accepted nothing.
     */
    CompletableFuture<QuerySerial> createQuery(QueryDraft draft);

    CompletableFuture<Void> deleteQueries(List<QuerySerial> serials);

    /**
     * Registers a listener for server-pushed query status updates. Every update for every
     * query visible to the session is delivered; filtering is up to the listener.
     */
    StatusSubscription subscribeQueryStatus(Consumer<QueryStatusEvent> listener);

    /**
     * Handle returned by {@link #subscribeQueryStatus}. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    interface StatusSubscription {
        void unsubscribe();
    }
}
