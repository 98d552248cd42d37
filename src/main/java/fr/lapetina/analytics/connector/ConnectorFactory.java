package fr.lapetina.analytics.connector;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.cache.EndpointMap;
import fr.lapetina.analytics.connector.connection.ConnectionResolver;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.WorkerConfig;
import fr.lapetina.analytics.connector.infrastructure.config.ConfigLoader;
import fr.lapetina.analytics.connector.infrastructure.config.ConnectorConfig;
import fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry;
import fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry.RegistryEvent;
import fr.lapetina.analytics.connector.infrastructure.health.ServerStatusChecker;
import fr.lapetina.analytics.connector.infrastructure.http.ApiModule;
import fr.lapetina.analytics.connector.infrastructure.http.ServerProbeClient;
import fr.lapetina.analytics.connector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.analytics.connector.worker.CredentialProvider;
import fr.lapetina.analytics.connector.worker.GatewayClient;
import fr.lapetina.analytics.connector.worker.InteractiveQueryFactory;
import fr.lapetina.analytics.connector.worker.QueryDraftFactory;
import fr.lapetina.analytics.connector.worker.WorkerLifecycleManager;
import fr.lapetina.analytics.connector.worker.WorkerLifecycleManagerFactory;
import fr.lapetina.analytics.connector.worker.WorkerSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Composition root: builds every cache, registry and service from configuration and owns
 * their lifetime. Nothing is looked up statically; collaborators receive what they need
 * from here.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ConnectorFactory factory = ConnectorFactory.create("connector.yaml").start()) {
 *     ConnectionResult result = factory.getConnectionResolver()
 *             .resolve(Endpoint.parse("http://localhost:10000"), "python")
 *             .join();
 * }
 * }</pre>
 */
public class ConnectorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorFactory.class);

    private static final Duration DISPOSE_TIMEOUT = Duration.ofSeconds(10);

    private final ConfigLoader configLoader;
    private final ConnectorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ServerProbeClient probeClient;
    private final EndpointMap<GatewayClient> clientStore;
    private final AsyncResourceCache<ApiModule> apiModules;
    private final AsyncResourceCache<WorkerLifecycleManager> workerManagers;
    private final InMemoryServerRegistry serverRegistry;
    private final ServerStatusChecker statusChecker;
    private final ConnectionResolver connectionResolver;
    private final WorkerSessionService workerSessions;

    protected ConnectorFactory(
            String configPath,
            ServerProbeClient probeClientOverride,
            Function<EndpointMap<GatewayClient>, CredentialProvider> credentialProviderOverride,
            InteractiveQueryFactory interactiveQueryFactoryOverride
    ) {
        log.info("Initializing ConnectorFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.probeClient = probeClientOverride != null ? probeClientOverride : createProbeClient();

        this.clientStore = new EndpointMap<>();
        CredentialProvider credentialProvider = credentialProviderOverride != null
                ? credentialProviderOverride.apply(clientStore)
                : ConnectorFactory::loginUnavailable;
        InteractiveQueryFactory interactiveQueryFactory = interactiveQueryFactoryOverride != null
                ? interactiveQueryFactoryOverride
                : (endpoint, tagId, consoleType) -> CompletableFuture.completedFuture(null);

        this.apiModules = new AsyncResourceCache<>("api-modules", counted("api-modules", probeClient::downloadApiModule));

        // The registry is needed by the manager factory and needs the manager cache for
        // worker lookups, so the cache loader reads the field lazily.
        WorkerLifecycleManagerFactory[] managerFactory = new WorkerLifecycleManagerFactory[1];
        this.workerManagers = new AsyncResourceCache<>("worker-managers", counted("worker-managers",
                endpoint -> CompletableFuture.completedFuture(managerFactory[0].create(endpoint))));

        this.serverRegistry = new InMemoryServerRegistry(
                (server, worker) -> WorkerSessionService.findWorker(workerManagers, server, worker),
                server -> WorkerSessionService.findServerFeatures(workerManagers, server));
        serverRegistry.replaceAll(config.toServerDescriptors());
        serverRegistry.addListener(this::onRegistryEvent);

        managerFactory[0] = new WorkerLifecycleManagerFactory(
                clientStore,
                apiModules,
                credentialProvider,
                interactiveQueryFactory,
                new QueryDraftFactory(config.getWorker().toWorkerDefaults()),
                this::lookupWorkerConfig,
                metricsRegistry);

        this.statusChecker = new ServerStatusChecker(
                serverRegistry,
                probeClient,
                Duration.ofMillis(config.getStatusCheck().getIntervalMs()),
                Duration.ofMillis(config.getTimeouts().getProbeTimeoutMs())
        );

        this.connectionResolver = new ConnectionResolver(serverRegistry, serverRegistry);
        this.workerSessions = new WorkerSessionService(serverRegistry, workerManagers);

        configLoader.addListener(this::onConfigChanged);

        log.info("ConnectorFactory initialized with {} servers", serverRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ConnectorFactory create(String configPath) {
        return new ConnectorFactory(configPath, null, null, null);
    }

    /**
     * Creates a factory from the default configuration (connector.yaml).
     */
    public static ConnectorFactory create() {
        return create("connector.yaml");
    }

    /**
     * Starts status checks and configuration watching.
     */
    public ConnectorFactory start() {
        if (config.getStatusCheck().isEnabled()) {
            statusChecker.start();
        }
        configLoader.startWatching();
        log.info("Connector started");
        return this;
    }

    public ConnectorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ServerProbeClient getProbeClient() {
        return probeClient;
    }

    public EndpointMap<GatewayClient> getClientStore() {
        return clientStore;
    }

    public AsyncResourceCache<ApiModule> getApiModules() {
        return apiModules;
    }

    public AsyncResourceCache<WorkerLifecycleManager> getWorkerManagers() {
        return workerManagers;
    }

    public InMemoryServerRegistry getServerRegistry() {
        return serverRegistry;
    }

    public ServerStatusChecker getStatusChecker() {
        return statusChecker;
    }

    public ConnectionResolver getConnectionResolver() {
        return connectionResolver;
    }

    public WorkerSessionService getWorkerSessions() {
        return workerSessions;
    }

    private ServerProbeClient createProbeClient() {
        String directory = config.getApiModules().getDirectory();
        Path downloadDirectory = directory != null && !directory.isBlank()
                ? Path.of(directory)
                : Path.of(System.getProperty("java.io.tmpdir"), "analytics-connector");

        return new ServerProbeClient(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getProbeTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getDownloadTimeoutMs()),
                config.getApiModules().getPath(),
                downloadDirectory
        );
    }

    private <T> Function<Endpoint, CompletableFuture<T>> counted(
            String cacheName,
            Function<Endpoint, CompletableFuture<T>> loader
    ) {
        return endpoint -> {
            metricsRegistry.incrementCacheLoad(cacheName);
            return loader.apply(endpoint);
        };
    }

    private WorkerConfig lookupWorkerConfig(Endpoint endpoint) {
        return serverRegistry.getServer(endpoint)
                .map(ServerDescriptor::getWorkerConfig)
                .orElse(null);
    }

    private static CompletableFuture<Void> loginUnavailable(Endpoint endpoint, boolean operateAsAnotherUser) {
        log.warn("No interactive login available for gateway: server={}", endpoint);
        return CompletableFuture.completedFuture(null);
    }

    private void onRegistryEvent(RegistryEvent event) {
        switch (event.type()) {
            case REMOVED -> forgetServer(event.server().getEndpoint());
            case RUNNING_CHANGED -> metricsRegistry.setRunningServers(serverRegistry.getRunningServers().size());
            case CONNECTED, DISCONNECTED -> metricsRegistry.setOpenConnections(serverRegistry.getConnections().size());
            default -> {
            }
        }
    }

    private void forgetServer(Endpoint endpoint) {
        if (workerManagers.has(endpoint)) {
            workerManagers.invalidate(endpoint);
        }
        if (apiModules.has(endpoint)) {
            apiModules.invalidate(endpoint);
        }
        clientStore.delete(endpoint);
        log.info("Server resources released: server={}", endpoint);
    }

    private void onConfigChanged(ConnectorConfig oldConfig, ConnectorConfig newConfig) {
        log.info("Configuration changed, applying updates...");
        serverRegistry.replaceAll(newConfig.toServerDescriptors());
        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down ConnectorFactory...");

        try {
            statusChecker.close();
        } catch (Exception e) {
            log.warn("Error closing status checker", e);
        }

        try {
            workerManagers.dispose().get(DISPOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disposing worker managers");
        } catch (Exception e) {
            log.warn("Error disposing worker managers", e);
        }

        try {
            apiModules.dispose().get(DISPOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disposing API modules");
        } catch (Exception e) {
            log.warn("Error disposing API modules", e);
        }

        try {
            probeClient.close();
        } catch (Exception e) {
            log.warn("Error closing probe client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("ConnectorFactory shut down");
    }
}
