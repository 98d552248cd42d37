package fr.lapetina.analytics.connector.domain.model;

import java.util.Objects;

/**
 * A remote analytics server known to the registry.
 * Immutable; status changes produce a new descriptor via {@link #withRunning(boolean)}.
 */
public final class ServerDescriptor {
    private final Endpoint endpoint;
    private final ServerType type;
    private final String label;
    private final boolean running;
    private final boolean managed;
    private final String accessToken;
    private final WorkerConfig workerConfig;

    private ServerDescriptor(Builder builder) {
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        this.type = Objects.requireNonNull(builder.type, "Server type is required");
        this.label = builder.label;
        this.running = builder.running;
        this.managed = builder.managed;
        this.accessToken = builder.accessToken;
        this.workerConfig = builder.workerConfig != null ? builder.workerConfig : WorkerConfig.DEFAULTS;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public ServerType getType() {
        return type;
    }

    public boolean isGateway() {
        return type == ServerType.GATEWAY;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * True for servers whose process this tool started itself.
     */
    public boolean isManaged() {
        return managed;
    }

    /**
     * Pre-shared key handed to direct sessions opened against this server.
     */
    public String getAccessToken() {
        return accessToken;
    }

    public WorkerConfig getWorkerConfig() {
        return workerConfig;
    }

    public ServerDescriptor withRunning(boolean running) {
        if (this.running == running) {
            return this;
        }
        return toBuilder().running(running).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .endpoint(endpoint)
                .type(type)
                .label(label)
                .running(running)
                .managed(managed)
                .accessToken(accessToken)
                .workerConfig(workerConfig);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerDescriptor that = (ServerDescriptor) o;
        return running == that.running
                && managed == that.managed
                && endpoint.equals(that.endpoint)
                && type == that.type
                && Objects.equals(label, that.label)
                && Objects.equals(accessToken, that.accessToken)
                && workerConfig.equals(that.workerConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, type, label, running, managed, accessToken, workerConfig);
    }

    @Override
    public String toString() {
        return "ServerDescriptor{" +
                "endpoint=" + endpoint +
                ", type=" + type +
                ", label='" + label + '\'' +
                ", running=" + running +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Endpoint endpoint;
        private ServerType type = ServerType.DIRECT;
        private String label;
        private boolean running;
        private boolean managed;
        private String accessToken;
        private WorkerConfig workerConfig;

        public Builder endpoint(Endpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder url(String url) {
            this.endpoint = Endpoint.parse(url);
            return this;
        }

        public Builder type(ServerType type) {
            this.type = type;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder running(boolean running) {
            this.running = running;
            return this;
        }

        public Builder managed(boolean managed) {
            this.managed = managed;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder workerConfig(WorkerConfig workerConfig) {
            this.workerConfig = workerConfig;
            return this;
        }

        public ServerDescriptor build() {
            return new ServerDescriptor(this);
        }
    }
}
