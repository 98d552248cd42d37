package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry;
import fr.lapetina.analytics.connector.infrastructure.health.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Opens and closes code sessions backed by gateway workers.
 *
 * Workers are provisioned through the {@link WorkerLifecycleManager} cached for the gateway,
 * and the resulting session is registered with the server registry so the connection
 * resolver can hand it out.
 */
public final class WorkerSessionService {

    private static final Logger log = LoggerFactory.getLogger(WorkerSessionService.class);

    private final InMemoryServerRegistry registry;
    private final AsyncResourceCache<WorkerLifecycleManager> managers;

    public WorkerSessionService(InMemoryServerRegistry registry, AsyncResourceCache<WorkerLifecycleManager> managers) {
        this.registry = Objects.requireNonNull(registry, "Server registry is required");
        this.managers = Objects.requireNonNull(managers, "Manager cache is required");
    }

    /**
     * Provisions a worker on a running gateway and registers a session for it.
     *
     * @param consoleType console language of the worker, may be null
     */
    public CompletableFuture<WorkerSession> openSession(Endpoint gatewayEndpoint, String consoleType) {
        Optional<ServerDescriptor> server = registry.getServer(gatewayEndpoint);
        if (server.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown server: " + gatewayEndpoint));
        }
        if (!server.get().isGateway()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Not a gateway server: " + gatewayEndpoint));
        }
        if (!server.get().isRunning()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Server is not running: " + gatewayEndpoint));
        }

        String tagId = UUID.randomUUID().toString();
        log.info("Opening worker session: server={}, tagId={}, consoleType={}", gatewayEndpoint, tagId, consoleType);

        return managers.get(gatewayEndpoint)
                .thenCompose(manager -> manager.createWorker(tagId, consoleType))
                .thenApply(worker -> {
                    WorkerSession session = new WorkerSession(gatewayEndpoint, worker, consoleType);
                    registry.registerConnection(gatewayEndpoint, session);
                    return session;
                });
    }

    /**
     * Closes the session of a worker and deletes the worker. Completes with false when no
     * such session is open.
     */
    public CompletableFuture<Boolean> closeSession(Endpoint workerEndpoint) {
        Optional<WorkerSession> session = registry.getConnections().stream()
                .filter(connection -> connection instanceof WorkerSession)
                .map(connection -> (WorkerSession) connection)
                .filter(connection -> connection.getEndpoint().equals(workerEndpoint))
                .findFirst();
        if (session.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }

        registry.removeConnection(session.get());
        Endpoint gatewayEndpoint = session.get().getGatewayEndpoint();
        if (!managers.has(gatewayEndpoint)) {
            return CompletableFuture.completedFuture(true);
        }
        return managers.get(gatewayEndpoint)
                .thenCompose(manager -> manager.deleteWorker(workerEndpoint))
                .thenApply(ignored -> true);
    }

    /**
     * Finds a worker among the managers already created. Never creates a manager.
     */
    public static CompletableFuture<Optional<WorkerDescriptor>> findWorker(
            AsyncResourceCache<WorkerLifecycleManager> managers,
            Endpoint gatewayEndpoint,
            Endpoint workerEndpoint
    ) {
        if (!managers.has(gatewayEndpoint)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return managers.get(gatewayEndpoint)
                .thenApply(manager -> manager.getWorkerInfo(workerEndpoint))
                .exceptionally(ex -> Optional.empty());
    }

    /**
     * Feature flags of a gateway, from its manager if one exists. Never creates a manager.
     */
    public static CompletableFuture<Optional<FeatureFlags>> findServerFeatures(
            AsyncResourceCache<WorkerLifecycleManager> managers,
            Endpoint gatewayEndpoint
    ) {
        if (!managers.has(gatewayEndpoint)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return managers.get(gatewayEndpoint)
                .thenApply(WorkerLifecycleManager::getServerFeatures)
                .exceptionally(ex -> Optional.empty());
    }
}
