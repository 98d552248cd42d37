package fr.lapetina.analytics.connector.connection;

import fr.lapetina.analytics.connector.domain.model.CodeSession;
import fr.lapetina.analytics.connector.domain.model.ConnectionState;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.ResolutionError;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.ServerType;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Produces a ready code session for an endpoint, reusing an open connection or opening
 * one when the server allows it.
 *
 * Resolution never throws: every failure is returned as a {@link ConnectionResult} so the
 * tool layer can show the message and hint.
 */
public final class ConnectionResolver {

    private static final Logger log = LoggerFactory.getLogger(ConnectionResolver.class);

    static final String GATEWAY_CONNECTION_HINT = "Use connectToServer first";

    private final ServerRegistry registry;
    private final ConnectAction connectAction;

    public ConnectionResolver(ServerRegistry registry, ConnectAction connectAction) {
        this.registry = Objects.requireNonNull(registry, "Server registry is required");
        this.connectAction = Objects.requireNonNull(connectAction, "Connect action is required");
    }

    /**
     * Resolves a connection for an endpoint.
     *
     * @param endpoint   server the caller wants to run code against
     * @param languageId optional console language, only used to build hints
     */
    public CompletableFuture<ConnectionResult> resolve(Endpoint endpoint, String languageId) {
        Optional<ServerDescriptor> match = findServer(endpoint);
        if (match.isEmpty()) {
            log.info("Connection resolution failed: endpoint={}, error={}", endpoint, ResolutionError.SERVER_NOT_FOUND);
            return CompletableFuture.completedFuture(ConnectionResult.failure(
                    ResolutionError.SERVER_NOT_FOUND, endpoint, connectionNotFoundHint(endpoint, languageId)));
        }

        ServerDescriptor server = match.get();
        if (!server.isRunning()) {
            log.info("Connection resolution failed: endpoint={}, error={}", endpoint, ResolutionError.SERVER_NOT_RUNNING);
            return CompletableFuture.completedFuture(
                    ConnectionResult.failure(ResolutionError.SERVER_NOT_RUNNING, endpoint));
        }

        CompletableFuture<ConnectionResult> result = server.getType() == ServerType.GATEWAY
                ? resolveGateway(endpoint, server)
                : resolveDirect(endpoint, server);

        return result.whenComplete((r, ex) -> {
            if (r != null && r.isSuccess()) {
                log.debug("Connection resolved: endpoint={}, connection={}", endpoint, r.connection().getEndpoint());
            } else if (r != null) {
                log.info("Connection resolution failed: endpoint={}, error={}", endpoint, r.error());
            }
        });
    }

    public CompletableFuture<ConnectionResult> resolve(Endpoint endpoint) {
        return resolve(endpoint, null);
    }

    /**
     * Finds the registered server for an endpoint. Loopback hosts must match on port as
     * well, since several local servers may run side by side; remote hosts match on
     * scheme and host only, so a proxied port still finds its server.
     */
    Optional<ServerDescriptor> findServer(Endpoint endpoint) {
        return registry.getServers().stream()
                .filter(server -> matches(endpoint, server.getEndpoint()))
                .findFirst();
    }

    static boolean matches(Endpoint requested, Endpoint registered) {
        if (!requested.host().equals(registered.host())) {
            return false;
        }
        if (requested.isLoopback()) {
            return requested.port() == registered.port();
        }
        return requested.scheme().equals(registered.scheme());
    }

    private CompletableFuture<ConnectionResult> resolveGateway(Endpoint endpoint, ServerDescriptor server) {
        // Gateway login needs interactive credentials, so never connect implicitly.
        List<ConnectionState> connections = registry.getConnections(server.getEndpoint());
        if (connections.isEmpty()) {
            return CompletableFuture.completedFuture(ConnectionResult.failure(
                    ResolutionError.NO_ACTIVE_CONNECTION, endpoint, GATEWAY_CONNECTION_HINT));
        }

        ConnectionState first = connections.get(0);
        if (!(first instanceof CodeSession)) {
            return CompletableFuture.completedFuture(
                    ConnectionResult.failure(ResolutionError.UNSUPPORTED_CONNECTION_KIND, endpoint));
        }
        CodeSession session = (CodeSession) first;

        return gatewayPanelUrlFormat(endpoint, session)
                .thenApply(panelUrlFormat -> ConnectionResult.success(session, panelUrlFormat))
                .exceptionally(ex -> {
                    log.warn("Worker lookup failed, no panel URL format: endpoint={}, error={}",
                            endpoint, ex.getMessage());
                    return ConnectionResult.success(session, null);
                });
    }

    /**
     * Panel URL format for a gateway session, or null unless the gateway embeds widgets
     * and the session is a known worker. The worker is only looked up when the gateway
     * advertises widget embedding.
     */
    private CompletableFuture<String> gatewayPanelUrlFormat(Endpoint endpoint, CodeSession session) {
        return registry.getServerFeatures(session.getEndpoint())
                .thenCompose(features -> {
                    if (!features.map(FeatureFlags::embedDashboardsAndWidgets).orElse(false)) {
                        return CompletableFuture.completedFuture(Optional.<WorkerDescriptor>empty());
                    }
                    return registry.getWorkerInfo(session.getEndpoint());
                })
                .thenApply(workerInfo -> workerInfo
                        .map(worker -> PanelUrlFormats.gateway(endpoint, worker.serial()))
                        .orElse(null));
    }

    private CompletableFuture<ConnectionResult> resolveDirect(Endpoint endpoint, ServerDescriptor server) {
        List<ConnectionState> existing = registry.getConnections(server.getEndpoint());
        CompletableFuture<List<ConnectionState>> connections;

        if (existing.isEmpty()) {
            log.info("No connection for direct server, connecting: server={}", server.getEndpoint());
            connections = connect(server)
                    .thenApply(ignored -> registry.getConnections(server.getEndpoint()));
        } else {
            connections = CompletableFuture.completedFuture(existing);
        }

        return connections.thenApply(list -> {
            if (list.isEmpty()) {
                return ConnectionResult.failure(ResolutionError.CONNECTION_FAILED, endpoint);
            }
            ConnectionState first = list.get(0);
            if (!(first instanceof CodeSession)) {
                return ConnectionResult.failure(ResolutionError.UNSUPPORTED_CONNECTION_KIND, endpoint);
            }
            CodeSession session = (CodeSession) first;
            return ConnectionResult.success(
                    session, PanelUrlFormats.direct(endpoint, session.getAccessToken().orElse(null)));
        });
    }

    private CompletableFuture<Void> connect(ServerDescriptor server) {
        CompletableFuture<Void> attempt;
        try {
            attempt = connectAction.connect(server);
        } catch (Exception e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        if (attempt == null) {
            return CompletableFuture.completedFuture(null);
        }
        return attempt.exceptionally(ex -> {
            log.warn("Connect action failed: server={}, error={}", server.getEndpoint(), ex.getMessage());
            return null;
        });
    }

    private String connectionNotFoundHint(Endpoint endpoint, String languageId) {
        if (languageId == null || languageId.isBlank()) {
            return null;
        }

        List<String> candidates = registry.getConnections().stream()
                .filter(connection -> connection instanceof CodeSession
                        && ((CodeSession) connection).supportsConsoleType(languageId))
                .map(connection -> "- " + connection.getEndpoint())
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return "No available connections supporting languageId " + languageId + ".";
        }
        return "Connection for URL " + endpoint + " not found. Did you mean to use one of these connections?\n"
                + String.join("\n", candidates);
    }
}
