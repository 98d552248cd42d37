package fr.lapetina.analytics.connector.connection;

import fr.lapetina.analytics.connector.domain.model.ConnectionState;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Source of truth for known servers and their open connections.
 */
public interface ServerRegistry {

    /**
     * All registered servers, in registration order.
     */
    List<ServerDescriptor> getServers();

    /**
     * Open connections to the given server, in the order they were opened.
     */
    List<ConnectionState> getConnections(Endpoint serverEndpoint);

    /**
     * All open connections across servers.
     */
    List<ConnectionState> getConnections();

    /**
     * Worker backing a gateway connection, if the connection is a provisioned worker.
     */
    CompletableFuture<Optional<WorkerDescriptor>> getWorkerInfo(Endpoint connectionEndpoint);

    /**
     * Feature flags of the gateway behind a connection, empty when unknown.
     */
    CompletableFuture<Optional<FeatureFlags>> getServerFeatures(Endpoint connectionEndpoint);
}
