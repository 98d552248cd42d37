package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.cache.Disposable;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Manages the authenticated session and the ephemeral workers of one gateway server.
 *
 * A manager is bound to a single endpoint for its whole life. Workers are interactive
 * console queries: each one is tracked by serial from the moment the server accepts it
 * until it is deleted, and is listed in the worker directory (keyed by its gRPC endpoint)
 * once the server reports it RUNNING.
 *
 * Thread-safe. All remote calls are asynchronous.
 */
public final class WorkerLifecycleManager implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycleManager.class);

    private final Endpoint endpoint;
    private final EndpointMap<GatewayClient> clientStore;
    private final AsyncResourceCache<ApiModule> apiModules;
    private final CredentialProvider credentialProvider;
    private final InteractiveQueryFactory interactiveQueryFactory;
    private final QueryDraftFactory draftFactory;
    private final Function<Endpoint, WorkerConfig> workerConfigLookup;
    private final MetricsRegistry metrics;

    private final Object clientLock = new Object();
    private CompletableFuture<GatewayClient> clientFuture;
    private volatile boolean connected;
    private volatile FeatureFlags featureFlags;

    private final Set<QuerySerial> trackedQuerySerials = new LinkedHashSet<>();
    private final EndpointMap<WorkerDescriptor> workerDirectory = new EndpointMap<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final Consumer<Endpoint> clientStoreListener = this::onClientStoreChanged;

    WorkerLifecycleManager(
            Endpoint endpoint,
            EndpointMap<GatewayClient> clientStore,
            AsyncResourceCache<ApiModule> apiModules,
            CredentialProvider credentialProvider,
            InteractiveQueryFactory interactiveQueryFactory,
            QueryDraftFactory draftFactory,
            Function<Endpoint, WorkerConfig> workerConfigLookup,
            MetricsRegistry metrics
    ) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint is required");
        this.clientStore = Objects.requireNonNull(clientStore, "Client store is required");
        this.apiModules = Objects.requireNonNull(apiModules, "API module cache is required");
        this.credentialProvider = Objects.requireNonNull(credentialProvider, "Credential provider is required");
        this.interactiveQueryFactory = Objects.requireNonNull(interactiveQueryFactory, "Interactive query factory is required");
        this.draftFactory = Objects.requireNonNull(draftFactory, "Draft factory is required");
        this.workerConfigLookup = Objects.requireNonNull(workerConfigLookup, "Worker config lookup is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");

        clientStore.addChangeListener(clientStoreListener);
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Whether the last client lookup produced a client.
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * Feature flags fetched when the client was initialized, if any.
     */
    public Optional<FeatureFlags> getServerFeatures() {
        return Optional.ofNullable(featureFlags);
    }

    /**
     * Returns the authenticated client for the bound gateway.
     *
     * Concurrent callers share one initialization. The future completes with {@code null}
     * when there is no client and {@code initializeIfNull} is false, or when
     * initialization failed; a failed initialization is forgotten so the next call retries.
     *
     * @param initializeIfNull     start the login flow when no client is cached
     * @param operateAsAnotherUser passed to the login flow
     */
    public CompletableFuture<GatewayClient> getClient(boolean initializeIfNull, boolean operateAsAnotherUser) {
        CompletableFuture<GatewayClient> future;
        synchronized (clientLock) {
            if (clientFuture == null) {
                if (!initializeIfNull) {
                    return CompletableFuture.completedFuture(null);
                }
                clientFuture = initClient(operateAsAnotherUser);
            }
            future = clientFuture;
        }

        return future.thenApply(client -> {
            connected = client != null;
            if (client == null || clientStore.get(endpoint) != client) {
                synchronized (clientLock) {
                    if (clientFuture == future) {
                        clientFuture = null;
                    }
                }
            }
            return client;
        });
    }

    public CompletableFuture<GatewayClient> getClient(boolean initializeIfNull) {
        return getClient(initializeIfNull, false);
    }

    private CompletableFuture<GatewayClient> initClient(boolean operateAsAnotherUser) {
        log.info("Initializing gateway client: server={}, operateAsAnotherUser={}", endpoint, operateAsAnotherUser);

        CompletableFuture<Void> provisioned;
        if (clientStore.has(endpoint)) {
            provisioned = CompletableFuture.completedFuture(null);
        } else {
            try {
                provisioned = credentialProvider.provision(endpoint, operateAsAnotherUser);
            } catch (Exception e) {
                provisioned = CompletableFuture.failedFuture(e);
            }
        }

        return provisioned
                .thenCompose(ignored -> {
                    GatewayClient client = clientStore.get(endpoint);
                    if (client == null) {
                        log.warn("Gateway client initialization produced no client: server={}", endpoint);
                        return CompletableFuture.<GatewayClient>completedFuture(null);
                    }
                    return loadFeatureFlags(client).thenApply(flags -> {
                        featureFlags = flags;
                        return client;
                    });
                })
                .exceptionally(ex -> {
                    log.error("Gateway client initialization failed: server={}, error={}",
                            endpoint, rootMessage(ex));
                    return null;
                });
    }

    private CompletableFuture<FeatureFlags> loadFeatureFlags(GatewayClient client) {
        CompletableFuture<FeatureFlags> flags;
        try {
            flags = client.getFeatureFlags();
        } catch (Exception e) {
            flags = CompletableFuture.failedFuture(e);
        }
        return flags
                .thenApply(value -> value == null ? FeatureFlags.NONE : value)
                .exceptionally(ex -> {
                    log.warn("Unable to fetch feature flags: server={}, error={}", endpoint, rootMessage(ex));
                    return FeatureFlags.NONE;
                });
    }

    /**
     * Any change to the bound endpoint's entry drops a settled client. An initialization
     * still in flight is left alone: it reads the store after the login, and a client
     * replaced after that read is caught when the initialization settles.
     */
    private void onClientStoreChanged(Endpoint changed) {
        if (!endpoint.equals(changed)) {
            return;
        }
        synchronized (clientLock) {
            if (clientFuture == null || !clientFuture.isDone()) {
                return;
            }
            clientFuture = null;
        }
        connected = false;
        log.debug("Gateway client invalidated: server={}", endpoint);
    }

    /**
     * Provisions a worker and waits until the server reports it RUNNING.
     *
     * The future fails with {@link WorkerProvisioningException} when no client is available,
     * when the server creates no query, when the query reaches ERROR or FAILED, or when it
     * reports RUNNING with addresses that do not parse. In the last two cases the query is
     * deleted in the background. There is no timeout.
     *
     * @param tagId       caller's identifier, copied into the descriptor
     * @param consoleType requested console language, may be null
     */
    public CompletableFuture<WorkerDescriptor> createWorker(String tagId, String consoleType) {
        if (disposed.get()) {
            return CompletableFuture.failedFuture(
                    new WorkerProvisioningException(ProvisioningFailure.MANAGER_DISPOSED, endpoint.toString()));
        }

        long startNanos = System.nanoTime();
        log.info("Creating worker: server={}, tagId={}, consoleType={}", endpoint, tagId, consoleType);

        return getClient(true, false)
                .thenCompose(client -> {
                    if (client == null) {
                        log.error("Cannot create worker without a gateway client: server={}", endpoint);
                        throw new WorkerProvisioningException(ProvisioningFailure.CLIENT_UNAVAILABLE, endpoint.toString());
                    }
                    return apiModules.get(endpoint)
                            .thenCompose(module -> submitQuery(client, tagId, consoleType))
                            .thenCompose(serial -> {
                                if (serial == null) {
                                    throw new WorkerProvisioningException(
                                            ProvisioningFailure.QUERY_NOT_CREATED, endpoint.toString());
                                }
                                track(serial);
                                return awaitRunning(client, tagId, serial);
                            });
                })
                .whenComplete((worker, ex) -> {
                    if (worker != null) {
                        metrics.incrementWorkerProvisioning(endpoint.toString(), "running");
                        metrics.recordWorkerStartup(Duration.ofNanos(System.nanoTime() - startNanos));
                        log.info("Worker running: server={}, serial={}, grpc={}",
                                endpoint, worker.serial(), worker.grpcEndpoint());
                    } else if (ex != null) {
                        metrics.incrementWorkerProvisioning(endpoint.toString(), "failed");
                        log.warn("Worker creation failed: server={}, tagId={}, error={}",
                                endpoint, tagId, rootMessage(ex));
                    }
                });
    }

    private CompletableFuture<QuerySerial> submitQuery(GatewayClient client, String tagId, String consoleType) {
        FeatureFlags flags = featureFlags == null ? FeatureFlags.NONE : featureFlags;
        if (flags.createQueryUi()) {
            log.debug("Delegating query creation to interactive flow: server={}", endpoint);
            return interactiveQueryFactory.create(endpoint, tagId, consoleType);
        }
        WorkerConfig config = workerConfigLookup.apply(endpoint);
        return draftFactory.createDraft(client, config, consoleType)
                .thenCompose(draft -> {
                    log.debug("Submitting query: server={}, name={}, language={}, heapGb={}",
                            endpoint, draft.name(), draft.scriptLanguage(), draft.heapSizeGb());
                    return client.createQuery(draft);
                });
    }

    /**
     * Settles once, on the first terminal status event for the serial. The subscription is
     * removed when the returned future completes.
     */
    private CompletableFuture<WorkerDescriptor> awaitRunning(GatewayClient client, String tagId, QuerySerial serial) {
        CompletableFuture<WorkerDescriptor> result = new CompletableFuture<>();
        AtomicBoolean settled = new AtomicBoolean(false);

        GatewayClient.StatusSubscription subscription = client.subscribeQueryStatus(event -> {
            if (!serial.equals(event.serial()) || !event.status().isTerminal()) {
                return;
            }
            if (event.status() == QueryStatus.RUNNING && !event.hasDesignatedWorker()) {
                return;
            }
            if (!settled.compareAndSet(false, true)) {
                return;
            }

            if (event.status().isFailure()) {
                log.warn("Worker query reported {}: server={}, serial={}", event.status(), endpoint, serial);
                untrack(serial);
                deleteInBackground(client, List.of(serial));
                result.completeExceptionally(new WorkerProvisioningException(
                        ProvisioningFailure.WORKER_FAILED, "serial=" + serial + ", status=" + event.status()));
                return;
            }

            WorkerDescriptor worker;
            try {
                worker = toDescriptor(tagId, event);
            } catch (IllegalArgumentException e) {
                log.warn("Worker query reported unusable addresses: server={}, serial={}, grpcUrl={}, ideUrl={}",
                        endpoint, serial, event.grpcUrl(), event.ideUrl());
                untrack(serial);
                deleteInBackground(client, List.of(serial));
                result.completeExceptionally(new WorkerProvisioningException(
                        ProvisioningFailure.WORKER_FAILED, "serial=" + serial + ", " + e.getMessage(), e));
                return;
            }
            workerDirectory.set(worker.grpcEndpoint(), worker);
            result.complete(worker);
        });

        result.whenComplete((worker, ex) -> subscription.unsubscribe());
        return result;
    }

    private static WorkerDescriptor toDescriptor(String tagId, QueryStatusEvent event) {
        return new WorkerDescriptor(
                tagId,
                event.serial(),
                event.workerName(),
                event.processInfoId(),
                Endpoint.parse(event.grpcUrl()),
                event.ideUrl() == null ? null : URI.create(event.ideUrl()));
    }

    /**
     * Returns the descriptor of a running worker, if this manager created it.
     */
    public Optional<WorkerDescriptor> getWorkerInfo(Endpoint workerEndpoint) {
        return Optional.ofNullable(workerDirectory.get(workerEndpoint));
    }

    /**
     * Forgets a worker and deletes its query. Unknown endpoints are ignored. Uses the
     * client only if one is already available; never starts a login to delete.
     */
    public CompletableFuture<Void> deleteWorker(Endpoint workerEndpoint) {
        WorkerDescriptor worker = workerDirectory.remove(workerEndpoint);
        if (worker == null) {
            log.debug("Delete ignored, unknown worker: server={}, worker={}", endpoint, workerEndpoint);
            return CompletableFuture.completedFuture(null);
        }

        untrack(worker.serial());
        log.info("Deleting worker: server={}, serial={}, worker={}", endpoint, worker.serial(), workerEndpoint);
        return deleteQueries(List.of(worker.serial()));
    }

    /**
     * Serials of every query this manager provisioned and has not deleted yet.
     */
    public List<QuerySerial> getTrackedQuerySerials() {
        synchronized (trackedQuerySerials) {
            return new ArrayList<>(trackedQuerySerials);
        }
    }

    /**
     * Deletes every tracked query in one batch and stops listening to the client store.
     * Readiness waits still in progress keep their subscription until they settle.
     */
    @Override
    public CompletableFuture<Void> dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        clientStore.removeChangeListener(clientStoreListener);

        List<QuerySerial> serials;
        synchronized (trackedQuerySerials) {
            serials = new ArrayList<>(trackedQuerySerials);
            trackedQuerySerials.clear();
        }
        metrics.addTrackedWorkers(-serials.size());
        workerDirectory.clear();

        log.info("Disposing worker manager: server={}, queries={}", endpoint, serials.size());
        if (serials.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return deleteQueries(serials);
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private CompletableFuture<Void> deleteQueries(List<QuerySerial> serials) {
        return getClient(false, false)
                .thenCompose(client -> {
                    if (client == null) {
                        log.warn("No gateway client, queries not deleted: server={}, serials={}", endpoint, serials);
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return client.deleteQueries(serials)
                            .thenRun(() -> metrics.incrementWorkerDeletion(endpoint.toString(), "success"));
                })
                .exceptionally(ex -> {
                    metrics.incrementWorkerDeletion(endpoint.toString(), "failure");
                    log.warn("Query deletion failed: server={}, serials={}, error={}",
                            endpoint, serials, rootMessage(ex));
                    return null;
                });
    }

    private void deleteInBackground(GatewayClient client, List<QuerySerial> serials) {
        CompletableFuture<Void> deletion;
        try {
            deletion = client.deleteQueries(serials);
        } catch (Exception e) {
            deletion = CompletableFuture.failedFuture(e);
        }
        deletion.whenComplete((ignored, ex) -> {
            if (ex != null) {
                metrics.incrementWorkerDeletion(endpoint.toString(), "failure");
                log.warn("Cleanup deletion failed: server={}, serials={}, error={}", endpoint, serials, rootMessage(ex));
            } else {
                metrics.incrementWorkerDeletion(endpoint.toString(), "success");
            }
        });
    }

    private void track(QuerySerial serial) {
        boolean added;
        synchronized (trackedQuerySerials) {
            added = trackedQuerySerials.add(serial);
        }
        if (added) {
            metrics.addTrackedWorkers(1);
        }
    }

    private void untrack(QuerySerial serial) {
        boolean removed;
        synchronized (trackedQuerySerials) {
            removed = trackedQuerySerials.remove(serial);
        }
        if (removed) {
            metrics.addTrackedWorkers(-1);
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && (cause instanceof CompletionException
                || cause instanceof ExecutionException)) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    @Override
    public String toString() {
        return "WorkerLifecycleManager{endpoint=" + endpoint + ", connected=" + connected
                + ", trackedQueries=" + getTrackedQuerySerials().size() + "}";
    }
}
