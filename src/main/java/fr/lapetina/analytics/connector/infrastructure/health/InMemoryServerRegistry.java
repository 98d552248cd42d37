package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.cache.EndpointMap;
import fr.lapetina.analytics.connector.connection.ConnectAction;
import fr.lapetina.analytics.connector.connection.ServerRegistry;
import fr.lapetina.analytics.connector.domain.model.ConnectionState;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of configured servers and of the sessions open on them.
 *
 * Servers are kept in configuration order. Thread-safe: the server list is replaced
 * atomically and connection lists are copy-on-write.
 */
public final class InMemoryServerRegistry implements ServerRegistry, ConnectAction {

    private static final Logger log = LoggerFactory.getLogger(InMemoryServerRegistry.class);

    private final Object lock = new Object();
    private volatile List<ServerDescriptor> servers = List.of();
    private final EndpointMap<List<ConnectionState>> connections = new EndpointMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final WorkerInfoLookup workerInfoLookup;
    private final ServerFeaturesLookup serverFeaturesLookup;

    public InMemoryServerRegistry(WorkerInfoLookup workerInfoLookup, ServerFeaturesLookup serverFeaturesLookup) {
        this.workerInfoLookup = Objects.requireNonNull(workerInfoLookup, "Worker info lookup is required");
        this.serverFeaturesLookup = Objects.requireNonNull(serverFeaturesLookup, "Server features lookup is required");
    }

    public InMemoryServerRegistry(WorkerInfoLookup workerInfoLookup) {
        this(workerInfoLookup, server -> CompletableFuture.completedFuture(Optional.empty()));
    }

    public InMemoryServerRegistry() {
        this((server, worker) -> CompletableFuture.completedFuture(Optional.empty()));
    }

    @Override
    public List<ServerDescriptor> getServers() {
        return servers;
    }

    public Optional<ServerDescriptor> getServer(Endpoint endpoint) {
        return servers.stream()
                .filter(server -> server.getEndpoint().equals(endpoint))
                .findFirst();
    }

    public List<ServerDescriptor> getRunningServers() {
        return servers.stream()
                .filter(ServerDescriptor::isRunning)
                .toList();
    }

    @Override
    public List<ConnectionState> getConnections(Endpoint serverEndpoint) {
        List<ConnectionState> open = connections.get(serverEndpoint);
        return open == null ? List.of() : List.copyOf(open);
    }

    @Override
    public List<ConnectionState> getConnections() {
        List<ConnectionState> all = new ArrayList<>();
        for (List<ConnectionState> open : connections.values()) {
            all.addAll(open);
        }
        return all;
    }

    /**
     * Finds the server owning the connection and asks the worker lookup for the worker
     * behind it. Completes empty for connections that are not gateway worker sessions.
     */
    @Override
    public CompletableFuture<Optional<WorkerDescriptor>> getWorkerInfo(Endpoint connectionEndpoint) {
        return findOwningGateway(connectionEndpoint)
                .map(gateway -> workerInfoLookup.find(gateway, connectionEndpoint))
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty()));
    }

    /**
     * Feature flags of the gateway owning the connection. Completes empty for direct
     * sessions and for gateways whose flags are not known yet.
     */
    @Override
    public CompletableFuture<Optional<FeatureFlags>> getServerFeatures(Endpoint connectionEndpoint) {
        return findOwningGateway(connectionEndpoint)
                .map(serverFeaturesLookup::find)
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty()));
    }

    private Optional<Endpoint> findOwningGateway(Endpoint connectionEndpoint) {
        for (Map.Entry<Endpoint, List<ConnectionState>> entry : connections.entries()) {
            boolean owned = entry.getValue().stream()
                    .anyMatch(connection -> connection.getEndpoint().equals(connectionEndpoint));
            if (owned) {
                return getServer(entry.getKey())
                        .filter(ServerDescriptor::isGateway)
                        .map(ServerDescriptor::getEndpoint);
            }
        }
        return Optional.empty();
    }

    /**
     * Opens a session on a running direct server. Gateway servers need an interactive
     * login and are refused.
     */
    @Override
    public CompletableFuture<Void> connect(ServerDescriptor server) {
        Optional<ServerDescriptor> registered = getServer(server.getEndpoint());
        if (registered.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Unknown server: " + server.getEndpoint()));
        }
        ServerDescriptor current = registered.get();
        if (current.isGateway()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Gateway servers require an interactive login: " + current.getEndpoint()));
        }
        if (!current.isRunning()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Server is not running: " + current.getEndpoint()));
        }

        registerConnection(current.getEndpoint(),
                new DirectSession(current.getEndpoint(), current.getAccessToken()));
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Adds a session opened outside the registry, such as a gateway worker session.
     */
    public void registerConnection(Endpoint serverEndpoint, ConnectionState connection) {
        ServerDescriptor server = getServer(serverEndpoint)
                .orElseThrow(() -> new IllegalArgumentException("Unknown server: " + serverEndpoint));

        connections.computeIfAbsent(serverEndpoint, key -> new CopyOnWriteArrayList<>()).add(connection);
        log.info("Connection opened: server={}, connection={}", serverEndpoint, connection.getEndpoint());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.CONNECTED, server));
    }

    /**
     * Closes and forgets one session.
     */
    public boolean removeConnection(ConnectionState connection) {
        for (Map.Entry<Endpoint, List<ConnectionState>> entry : connections.entries()) {
            if (entry.getValue().remove(connection)) {
                close(connection);
                log.info("Connection closed: server={}, connection={}", entry.getKey(), connection.getEndpoint());
                getServer(entry.getKey()).ifPresent(server ->
                        notifyListeners(new RegistryEvent(RegistryEvent.Type.DISCONNECTED, server)));
                return true;
            }
        }
        return false;
    }

    /**
     * Closes every session of a server.
     *
     * @return the sessions that were open
     */
    public List<ConnectionState> disconnect(Endpoint serverEndpoint) {
        return disconnect(serverEndpoint, getServer(serverEndpoint).orElse(null));
    }

    private List<ConnectionState> disconnect(Endpoint serverEndpoint, ServerDescriptor server) {
        List<ConnectionState> removed = connections.remove(serverEndpoint);
        if (removed == null || removed.isEmpty()) {
            return List.of();
        }
        removed.forEach(InMemoryServerRegistry::close);
        log.info("Server disconnected: server={}, connections={}", serverEndpoint, removed.size());
        if (server != null) {
            notifyListeners(new RegistryEvent(RegistryEvent.Type.DISCONNECTED, server));
        }
        return List.copyOf(removed);
    }

    /**
     * Records a probe result. A server that stops loses its sessions.
     */
    public void updateRunning(Endpoint serverEndpoint, boolean running) {
        ServerDescriptor updated = null;
        synchronized (lock) {
            List<ServerDescriptor> next = new ArrayList<>(servers.size());
            for (ServerDescriptor server : servers) {
                if (server.getEndpoint().equals(serverEndpoint) && server.isRunning() != running) {
                    updated = server.withRunning(running);
                    next.add(updated);
                } else {
                    next.add(server);
                }
            }
            if (updated == null) {
                return;
            }
            servers = List.copyOf(next);
        }

        log.info("Server running state changed: server={}, running={}", serverEndpoint, running);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.RUNNING_CHANGED, updated));
        if (!running) {
            disconnect(serverEndpoint);
        }
    }

    /**
     * Replaces the server list, typically after a configuration reload. Servers still present
     * keep their running state and sessions; servers no longer present are disconnected.
     */
    public void replaceAll(Collection<ServerDescriptor> newServers) {
        List<ServerDescriptor> added = new ArrayList<>();
        List<ServerDescriptor> updated = new ArrayList<>();
        List<ServerDescriptor> removed = new ArrayList<>();

        synchronized (lock) {
            List<ServerDescriptor> previous = servers;
            List<ServerDescriptor> next = new ArrayList<>();
            for (ServerDescriptor server : newServers) {
                if (next.stream().anyMatch(s -> s.getEndpoint().equals(server.getEndpoint()))) {
                    log.warn("Duplicate server ignored: server={}", server.getEndpoint());
                    continue;
                }
                Optional<ServerDescriptor> existing = previous.stream()
                        .filter(s -> s.getEndpoint().equals(server.getEndpoint()))
                        .findFirst();
                if (existing.isPresent()) {
                    ServerDescriptor merged = server.withRunning(existing.get().isRunning());
                    next.add(merged);
                    if (!merged.equals(existing.get())) {
                        updated.add(merged);
                    }
                } else {
                    next.add(server);
                    added.add(server);
                }
            }
            for (ServerDescriptor server : previous) {
                if (next.stream().noneMatch(s -> s.getEndpoint().equals(server.getEndpoint()))) {
                    removed.add(server);
                }
            }
            servers = List.copyOf(next);
        }

        for (ServerDescriptor server : removed) {
            disconnect(server.getEndpoint(), server);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, server));
        }
        added.forEach(server -> notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, server)));
        updated.forEach(server -> notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, server)));

        log.info("Server registry replaced: servers={}, added={}, removed={}",
                servers.size(), added.size(), removed.size());
    }

    public int size() {
        return servers.size();
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    private static void close(ConnectionState connection) {
        if (connection instanceof AutoCloseable) {
            try {
                ((AutoCloseable) connection).close();
            } catch (Exception e) {
                log.warn("Error closing connection: connection={}", connection.getEndpoint(), e);
            }
        }
    }

    /**
     * Resolves the worker behind a gateway session.
     */
    @FunctionalInterface
    public interface WorkerInfoLookup {
        CompletableFuture<Optional<WorkerDescriptor>> find(Endpoint serverEndpoint, Endpoint workerEndpoint);
    }

    /**
     * Resolves the feature flags advertised by a gateway.
     */
    @FunctionalInterface
    public interface ServerFeaturesLookup {
        CompletableFuture<Optional<FeatureFlags>> find(Endpoint serverEndpoint);
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, ServerDescriptor server) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            RUNNING_CHANGED,
            CONNECTED,
            DISCONNECTED
        }
    }
}
