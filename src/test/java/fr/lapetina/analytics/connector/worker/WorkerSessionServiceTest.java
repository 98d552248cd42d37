package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.cache.EndpointMap;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.QuerySerial;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.ServerType;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry;
import fr.lapetina.analytics.connector.infrastructure.health.WorkerSession;
import fr.lapetina.analytics.connector.infrastructure.http.ApiModule;
import fr.lapetina.analytics.connector.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerSessionServiceTest {

    private static final Endpoint LOCAL = Endpoint.parse("http://localhost:10000");
    private static final Endpoint GATEWAY = Endpoint.parse("https://gateway.example.com:8123");
    private static final String WORKER_URL = "https://worker-1.example.com:8443";

    private MetricsRegistry metrics;
    private StubGatewayClient client;
    private AsyncResourceCache<WorkerLifecycleManager> managers;
    private InMemoryServerRegistry registry;
    private WorkerSessionService service;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
        client = new StubGatewayClient(GATEWAY);

        EndpointMap<GatewayClient> clientStore = new EndpointMap<>();
        WorkerLifecycleManagerFactory factory = new WorkerLifecycleManagerFactory(
                clientStore,
                new AsyncResourceCache<>(endpoint ->
                        CompletableFuture.completedFuture(new ApiModule(endpoint, Path.of("unused-module.js")))),
                (endpoint, operateAsAnotherUser) -> {
                    clientStore.set(endpoint, client);
                    return CompletableFuture.completedFuture(null);
                },
                (endpoint, tagId, consoleType) -> CompletableFuture.completedFuture(null),
                new QueryDraftFactory(WorkerDefaults.DEFAULTS),
                endpoint -> null,
                metrics);
        managers = new AsyncResourceCache<>(endpoint -> CompletableFuture.completedFuture(factory.create(endpoint)));

        registry = new InMemoryServerRegistry(
                (server, worker) -> WorkerSessionService.findWorker(managers, server, worker),
                server -> WorkerSessionService.findServerFeatures(managers, server));
        registry.replaceAll(List.of(
                ServerDescriptor.builder().endpoint(LOCAL).type(ServerType.DIRECT).build(),
                ServerDescriptor.builder().endpoint(GATEWAY).type(ServerType.GATEWAY).build()
        ));
        registry.updateRunning(LOCAL, true);
        registry.updateRunning(GATEWAY, true);

        service = new WorkerSessionService(registry, managers);
    }

    @AfterEach
    void tearDown() {
        managers.dispose().join();
        metrics.close();
    }

    @Test
    @DisplayName("should register a session once the worker runs")
    void shouldRegisterSession() throws Exception {
        CompletableFuture<WorkerSession> future = service.openSession(GATEWAY, "python");
        assertThat(registry.getConnections(GATEWAY)).isEmpty();

        client.emitRunning(client.lastSerial(), WORKER_URL);

        WorkerSession session = future.get(5, TimeUnit.SECONDS);
        assertThat(session.getEndpoint()).isEqualTo(Endpoint.parse(WORKER_URL));
        assertThat(session.getGatewayEndpoint()).isEqualTo(GATEWAY);
        assertThat(session.getTagId()).isPresent();
        assertThat(registry.getConnections(GATEWAY)).containsExactly(session);

        Optional<WorkerDescriptor> worker = registry.getWorkerInfo(session.getEndpoint()).join();
        assertThat(worker).map(WorkerDescriptor::serial).contains(client.lastSerial());
    }

    @Test
    @DisplayName("should close the session and delete its worker")
    void shouldCloseSession() throws Exception {
        CompletableFuture<WorkerSession> future = service.openSession(GATEWAY, "python");
        QuerySerial serial = client.lastSerial();
        client.emitRunning(serial, WORKER_URL);
        future.get(5, TimeUnit.SECONDS);

        assertThat(service.closeSession(Endpoint.parse(WORKER_URL)).join()).isTrue();

        assertThat(registry.getConnections(GATEWAY)).isEmpty();
        assertThat(client.getDeletions()).containsExactly(List.of(serial));
        assertThat(service.closeSession(Endpoint.parse(WORKER_URL)).join()).isFalse();
    }

    @Test
    @DisplayName("should reject direct and unknown servers")
    void shouldRejectNonGateways() {
        assertThatThrownBy(() -> service.openSession(LOCAL, "python").join())
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a gateway");
        assertThatThrownBy(() -> service.openSession(Endpoint.parse("https://nowhere.example.com"), null).join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject stopped gateways")
    void shouldRejectStoppedGateway() {
        registry.updateRunning(GATEWAY, false);

        assertThatThrownBy(() -> service.openSession(GATEWAY, "python").join())
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(managers.has(GATEWAY)).isFalse();
    }

    @Test
    @DisplayName("should report the features of the gateway behind a session")
    void shouldReportGatewayFeatures() throws Exception {
        FeatureFlags embedding = new FeatureFlags(false, true);
        client.setFeatureFlags(embedding);
        CompletableFuture<WorkerSession> future = service.openSession(GATEWAY, "python");
        client.emitRunning(client.lastSerial(), WORKER_URL);
        WorkerSession session = future.get(5, TimeUnit.SECONDS);

        assertThat(registry.getServerFeatures(session.getEndpoint()).join()).contains(embedding);
    }

    @Test
    @DisplayName("should not create a manager to look up features")
    void shouldNotCreateManagerForFeatures() {
        assertThat(WorkerSessionService.findServerFeatures(managers, GATEWAY).join()).isEmpty();
        assertThat(managers.has(GATEWAY)).isFalse();
    }

    @Test
    @DisplayName("should not create a manager to look up a worker")
    void shouldNotCreateManagerOnLookup() {
        Optional<WorkerDescriptor> worker =
                WorkerSessionService.findWorker(managers, GATEWAY, Endpoint.parse(WORKER_URL)).join();

        assertThat(worker).isEmpty();
        assertThat(managers.has(GATEWAY)).isFalse();
    }
}
