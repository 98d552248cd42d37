package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.domain.model.CodeSession;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;

import java.util.Objects;
import java.util.Optional;

/**
 * Session on a worker provisioned by a gateway. Its endpoint is the worker's gRPC endpoint.
 */
public final class WorkerSession implements CodeSession, AutoCloseable {

    private final Endpoint gatewayEndpoint;
    private final WorkerDescriptor worker;
    private final String consoleType;
    private volatile boolean connected = true;

    public WorkerSession(Endpoint gatewayEndpoint, WorkerDescriptor worker, String consoleType) {
        this.gatewayEndpoint = Objects.requireNonNull(gatewayEndpoint, "Gateway endpoint is required");
        this.worker = Objects.requireNonNull(worker, "Worker is required");
        this.consoleType = consoleType;
    }

    public Endpoint getGatewayEndpoint() {
        return gatewayEndpoint;
    }

    public WorkerDescriptor getWorker() {
        return worker;
    }

    @Override
    public Endpoint getEndpoint() {
        return worker.grpcEndpoint();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean isRunningCode() {
        return false;
    }

    @Override
    public Optional<String> getTagId() {
        return Optional.ofNullable(worker.tagId());
    }

    @Override
    public Optional<String> getAccessToken() {
        return Optional.empty();
    }

    /**
     * A worker runs a single console language; without one requested, any type is accepted.
     */
    @Override
    public boolean supportsConsoleType(String type) {
        return consoleType == null || consoleType.equalsIgnoreCase(type);
    }

    @Override
    public void close() {
        connected = false;
    }

    @Override
    public String toString() {
        return "WorkerSession{serial=" + worker.serial() + ", endpoint=" + getEndpoint() + "}";
    }
}
