package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.cache.EndpointMap;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.FeatureFlags;
import fr.lapetina.analytics.connector.domain.model.QuerySerial;
import fr.lapetina.analytics.connector.domain.model.QueryStatus;
import fr.lapetina.analytics.connector.domain.model.WorkerConfig;
import fr.lapetina.analytics.connector.domain.model.WorkerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.http.ApiModule;
import fr.lapetina.analytics.connector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.analytics.connector.worker.WorkerProvisioningException.ProvisioningFailure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerLifecycleManagerTest {

    private static final Endpoint GATEWAY = Endpoint.parse("https://gateway.example.com:8123");
    private static final String WORKER_URL = "https://worker-1.example.com:8443";

    private EndpointMap<GatewayClient> clientStore;
    private StubGatewayClient client;
    private CountingCredentialProvider credentials;
    private MetricsRegistry metrics;
    private AtomicInteger interactiveCalls;
    private WorkerLifecycleManager manager;

    @BeforeEach
    void setUp() {
        clientStore = new EndpointMap<>();
        client = new StubGatewayClient(GATEWAY);
        credentials = new CountingCredentialProvider(clientStore, client);
        metrics = new MetricsRegistry("test");
        interactiveCalls = new AtomicInteger();
        manager = newManager();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private WorkerLifecycleManager newManager() {
        AsyncResourceCache<ApiModule> apiModules = new AsyncResourceCache<>("api-modules",
                endpoint -> CompletableFuture.completedFuture(new ApiModule(endpoint, Path.of("unused-module.js"))));
        return new WorkerLifecycleManager(
                GATEWAY,
                clientStore,
                apiModules,
                credentials,
                (endpoint, tagId, consoleType) -> {
                    interactiveCalls.incrementAndGet();
                    return CompletableFuture.completedFuture(QuerySerial.of("interactive-1"));
                },
                new QueryDraftFactory(WorkerDefaults.DEFAULTS, () -> "test"),
                endpoint -> new WorkerConfig(null, 2.0, null, null, null),
                metrics);
    }

    @Nested
    @DisplayName("Client")
    class Client {

        @Test
        @DisplayName("should return null without login when not asked to initialize")
        void shouldNotInitializeOnDemand() {
            assertThat(manager.getClient(false).join()).isNull();
            assertThat(credentials.calls.get()).isZero();
            assertThat(manager.isConnected()).isFalse();
        }

        @Test
        @DisplayName("should share one login between concurrent callers")
        void shouldShareOneLogin() {
            CompletableFuture<Void> login = new CompletableFuture<>();
            credentials.pending = login;

            CompletableFuture<GatewayClient> first = manager.getClient(true);
            CompletableFuture<GatewayClient> second = manager.getClient(true);
            login.complete(null);

            assertThat(first.join()).isSameAs(client);
            assertThat(second.join()).isSameAs(client);
            assertThat(credentials.calls.get()).isEqualTo(1);
            assertThat(manager.isConnected()).isTrue();
        }

        @Test
        @DisplayName("should skip login when the store already holds a client")
        void shouldReuseStoredClient() {
            clientStore.set(GATEWAY, client);

            assertThat(manager.getClient(true).join()).isSameAs(client);
            assertThat(credentials.calls.get()).isZero();
        }

        @Test
        @DisplayName("should retry after a login that produced no client")
        void shouldRetryAfterEmptyLogin() {
            credentials.storeClient = false;
            assertThat(manager.getClient(true).join()).isNull();

            credentials.storeClient = true;
            assertThat(manager.getClient(true).join()).isSameAs(client);
            assertThat(credentials.calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should forget the client when it leaves the store")
        void shouldResetOnStoreRemoval() {
            assertThat(manager.getClient(true).join()).isSameAs(client);

            clientStore.delete(GATEWAY);

            assertThat(manager.isConnected()).isFalse();
            assertThat(manager.getClient(false).join()).isNull();
        }

        @Test
        @DisplayName("should hand out the new client once the stored one is replaced")
        void shouldFollowReplacedClient() {
            StubGatewayClient replacement = new StubGatewayClient(GATEWAY);
            clientStore.set(GATEWAY, client);
            assertThat(manager.getClient(true).join()).isSameAs(client);

            clientStore.set(GATEWAY, replacement);

            assertThat(manager.isConnected()).isFalse();
            assertThat(manager.getClient(true).join()).isSameAs(replacement);
            assertThat(credentials.calls.get()).isZero();
        }

        @Test
        @DisplayName("should pick up a client replaced while the first one was initializing")
        void shouldFollowClientReplacedDuringInitialization() {
            CompletableFuture<FeatureFlags> pendingFlags = new CompletableFuture<>();
            StubGatewayClient slow = new StubGatewayClient(GATEWAY) {
                @Override
                public CompletableFuture<FeatureFlags> getFeatureFlags() {
                    return pendingFlags;
                }
            };
            StubGatewayClient replacement = new StubGatewayClient(GATEWAY);
            clientStore.set(GATEWAY, slow);

            CompletableFuture<GatewayClient> first = manager.getClient(true);
            clientStore.set(GATEWAY, replacement);
            pendingFlags.complete(FeatureFlags.NONE);

            assertThat(first.join()).isSameAs(slow);
            assertThat(manager.getClient(true).join()).isSameAs(replacement);
        }

        @Test
        @DisplayName("should keep the client stored by its own login")
        void shouldKeepClientFromOwnLogin() {
            assertThat(manager.getClient(true).join()).isSameAs(client);

            assertThat(manager.getClient(false).join()).isSameAs(client);
            assertThat(credentials.calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore store changes for other endpoints")
        void shouldIgnoreOtherEndpoints() {
            manager.getClient(true).join();

            Endpoint other = Endpoint.parse("https://other.example.com:8123");
            clientStore.set(other, new StubGatewayClient(other));
            clientStore.delete(other);

            assertThat(manager.getClient(false).join()).isSameAs(client);
        }

        @Test
        @DisplayName("should fall back to no feature flags when the fetch fails")
        void shouldDefaultFeatureFlags() {
            StubGatewayClient failing = new StubGatewayClient(GATEWAY) {
                @Override
                public CompletableFuture<FeatureFlags> getFeatureFlags() {
                    return CompletableFuture.failedFuture(new IllegalStateException("forbidden"));
                }
            };
            clientStore.set(GATEWAY, failing);

            assertThat(manager.getClient(true).join()).isSameAs(failing);
            assertThat(manager.getServerFeatures()).contains(FeatureFlags.NONE);
        }
    }

    @Nested
    @DisplayName("Worker creation")
    class WorkerCreation {

        @Test
        @DisplayName("should complete with the descriptor once the worker runs")
        void shouldCompleteWhenRunning() throws Exception {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");
            QuerySerial serial = client.lastSerial();

            assertThat(future).isNotDone();
            assertThat(manager.getTrackedQuerySerials()).containsExactly(serial);

            client.emit(QueryStatusEvent.of(serial, QueryStatus.INITIALIZING));
            client.emit(QueryStatusEvent.of(serial, QueryStatus.RUNNING));
            assertThat(future).isNotDone();

            client.emitRunning(serial, WORKER_URL);

            WorkerDescriptor worker = future.get(5, TimeUnit.SECONDS);
            assertThat(worker.tagId()).isEqualTo("tag-1");
            assertThat(worker.serial()).isEqualTo(serial);
            assertThat(worker.grpcEndpoint()).isEqualTo(Endpoint.parse(WORKER_URL));
            assertThat(manager.getWorkerInfo(Endpoint.parse(WORKER_URL))).contains(worker);
            assertThat(client.getListenerCount()).isZero();
            assertThat(client.getDrafts()).hasSize(1);
            assertThat(client.getDrafts().get(0).heapSizeGb()).isEqualTo(2.0);
            assertThat(metrics.getTrackedWorkers()).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore events for other queries")
        void shouldIgnoreOtherSerials() {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");

            client.emit(QueryStatusEvent.of(QuerySerial.of("someone-else"), QueryStatus.FAILED));

            assertThat(future).isNotDone();
            assertThat(client.getDeletions()).isEmpty();
        }

        @Test
        @DisplayName("should delete the query exactly once when it fails")
        void shouldDeleteFailedQueryOnce() {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");
            QuerySerial serial = client.lastSerial();

            client.emit(QueryStatusEvent.of(serial, QueryStatus.ERROR));
            client.emit(QueryStatusEvent.of(serial, QueryStatus.FAILED));

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(WorkerProvisioningException.class)
                    .hasMessageContaining("Worker failed to start");
            assertThat(client.getDeletions()).containsExactly(List.of(serial));
            assertThat(manager.getTrackedQuerySerials()).isEmpty();
            assertThat(client.getListenerCount()).isZero();
        }

        @Test
        @DisplayName("should fail and delete the query when the running worker address is unusable")
        void shouldDeleteQueryWithUnusableAddress() {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");
            QuerySerial serial = client.lastSerial();

            client.emitRunning(serial, "not a url");

            Throwable failure = future.handle((worker, ex) -> ex.getCause()).join();
            assertThat(failure).isInstanceOf(WorkerProvisioningException.class);
            assertThat(((WorkerProvisioningException) failure).getReason())
                    .isEqualTo(ProvisioningFailure.WORKER_FAILED);
            assertThat(failure.getCause()).isInstanceOf(IllegalArgumentException.class);
            assertThat(client.getDeletions()).containsExactly(List.of(serial));
            assertThat(manager.getTrackedQuerySerials()).isEmpty();
            assertThat(client.getListenerCount()).isZero();
            assertThat(metrics.getTrackedWorkers()).isZero();
        }

        @Test
        @DisplayName("should fail when the server creates no query")
        void shouldFailWithoutSerial() {
            client.setCreateNothing(true);

            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", null);

            Throwable failure = future.handle((worker, ex) -> ex.getCause()).join();
            assertThat(failure).isInstanceOf(WorkerProvisioningException.class);
            assertThat(((WorkerProvisioningException) failure).getReason())
                    .isEqualTo(ProvisioningFailure.QUERY_NOT_CREATED);
            assertThat(manager.getTrackedQuerySerials()).isEmpty();
        }

        @Test
        @DisplayName("should fail when no client is available")
        void shouldFailWithoutClient() {
            credentials.storeClient = false;

            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", null);

            assertThatThrownBy(future::join)
                    .hasCauseInstanceOf(WorkerProvisioningException.class)
                    .hasMessageContaining("gateway client failed to initialize");
            assertThat(client.getDrafts()).isEmpty();
        }

        @Test
        @DisplayName("should use the interactive flow when the server offers it")
        void shouldUseInteractiveFlow() {
            client.setFeatureFlags(new FeatureFlags(true, true));

            manager.createWorker("tag-1", "python");

            assertThat(interactiveCalls.get()).isEqualTo(1);
            assertThat(client.getDrafts()).isEmpty();
            assertThat(manager.getTrackedQuerySerials()).containsExactly(QuerySerial.of("interactive-1"));
        }

        @Test
        @DisplayName("should refuse to create workers once disposed")
        void shouldRefuseAfterDispose() {
            manager.dispose().join();

            assertThatThrownBy(() -> manager.createWorker("tag-1", null).join())
                    .hasCauseInstanceOf(WorkerProvisioningException.class)
                    .hasMessageContaining("disposed");
        }
    }

    @Nested
    @DisplayName("Deletion")
    class Deletion {

        @Test
        @DisplayName("should ignore unknown workers")
        void shouldIgnoreUnknownWorker() {
            manager.getClient(true).join();

            manager.deleteWorker(Endpoint.parse("https://unknown.example.com")).join();

            assertThat(client.getDeletions()).isEmpty();
        }

        @Test
        @DisplayName("should delete a running worker and forget it")
        void shouldDeleteRunningWorker() {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");
            QuerySerial serial = client.lastSerial();
            client.emitRunning(serial, WORKER_URL);
            future.join();

            manager.deleteWorker(Endpoint.parse(WORKER_URL)).join();

            assertThat(client.getDeletions()).containsExactly(List.of(serial));
            assertThat(manager.getWorkerInfo(Endpoint.parse(WORKER_URL))).isEmpty();
            assertThat(manager.getTrackedQuerySerials()).isEmpty();
        }

        @Test
        @DisplayName("should swallow deletion failures")
        void shouldSwallowDeletionFailure() {
            CompletableFuture<WorkerDescriptor> future = manager.createWorker("tag-1", "python");
            client.emitRunning(client.lastSerial(), WORKER_URL);
            future.join();
            client.setDeleteFailure(new IllegalStateException("gone"));

            CompletableFuture<Void> deletion = manager.deleteWorker(Endpoint.parse(WORKER_URL));

            assertThat(deletion).isCompleted();
            assertThat(deletion).isNotCompletedExceptionally();
        }
    }

    @Nested
    @DisplayName("Disposal")
    class Disposal {

        @Test
        @DisplayName("should delete every tracked query in one batch")
        void shouldDeleteInOneBatch() {
            manager.createWorker("tag-1", "python");
            QuerySerial first = client.lastSerial();
            manager.createWorker("tag-2", "groovy");
            QuerySerial second = client.lastSerial();

            manager.dispose().join();

            assertThat(client.getDeletions()).containsExactly(List.of(first, second));
            assertThat(manager.getTrackedQuerySerials()).isEmpty();
            assertThat(manager.isDisposed()).isTrue();
            assertThat(metrics.getTrackedWorkers()).isZero();
        }

        @Test
        @DisplayName("should not delete anything when nothing is tracked")
        void shouldSkipEmptyBatch() {
            manager.getClient(true).join();

            manager.dispose().join();
            manager.dispose().join();

            assertThat(client.getDeletions()).isEmpty();
        }

        @Test
        @DisplayName("should stop listening to the client store")
        void shouldStopListening() {
            manager.getClient(true).join();
            manager.dispose().join();

            clientStore.delete(GATEWAY);

            assertThat(manager.isConnected()).isTrue();
        }
    }

    /**
     * Login flow that stores the client, optionally after a caller-controlled delay.
     */
    static final class CountingCredentialProvider implements CredentialProvider {
        final AtomicInteger calls = new AtomicInteger();
        private final EndpointMap<GatewayClient> store;
        private final GatewayClient client;
        volatile CompletableFuture<Void> pending;
        volatile boolean storeClient = true;

        CountingCredentialProvider(EndpointMap<GatewayClient> store, GatewayClient client) {
            this.store = store;
            this.client = client;
        }

        @Override
        public CompletableFuture<Void> provision(Endpoint endpoint, boolean operateAsAnotherUser) {
            calls.incrementAndGet();
            CompletableFuture<Void> login = pending != null ? pending : CompletableFuture.completedFuture(null);
            return login.thenRun(() -> {
                if (storeClient) {
                    store.set(endpoint, client);
                }
            });
        }
    }
}
