package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.cache.AsyncResourceCache;
import fr.lapetina.analytics.connector.cache.EndpointMap;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.WorkerConfig;
import fr.lapetina.analytics.connector.infrastructure.http.ApiModule;
import fr.lapetina.analytics.connector.infrastructure.metrics.MetricsRegistry;

import java.util.Objects;
import java.util.function.Function;

/**
 * Creates {@link WorkerLifecycleManager}s sharing the same collaborators.
 */
public final class WorkerLifecycleManagerFactory {

    private final EndpointMap<GatewayClient> clientStore;
    private final AsyncResourceCache<ApiModule> apiModules;
    private final CredentialProvider credentialProvider;
    private final InteractiveQueryFactory interactiveQueryFactory;
    private final QueryDraftFactory draftFactory;
    private final Function<Endpoint, WorkerConfig> workerConfigLookup;
    private final MetricsRegistry metrics;

    public WorkerLifecycleManagerFactory(
            EndpointMap<GatewayClient> clientStore,
            AsyncResourceCache<ApiModule> apiModules,
            CredentialProvider credentialProvider,
            InteractiveQueryFactory interactiveQueryFactory,
            QueryDraftFactory draftFactory,
            Function<Endpoint, WorkerConfig> workerConfigLookup,
            MetricsRegistry metrics
    ) {
        this.clientStore = Objects.requireNonNull(clientStore, "Client store is required");
        this.apiModules = Objects.requireNonNull(apiModules, "API module cache is required");
        this.credentialProvider = Objects.requireNonNull(credentialProvider, "Credential provider is required");
        this.interactiveQueryFactory = Objects.requireNonNull(interactiveQueryFactory, "Interactive query factory is required");
        this.draftFactory = Objects.requireNonNull(draftFactory, "Draft factory is required");
        this.workerConfigLookup = Objects.requireNonNull(workerConfigLookup, "Worker config lookup is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
    }

    public WorkerLifecycleManager create(Endpoint endpoint) {
        return new WorkerLifecycleManager(
                endpoint,
                clientStore,
                apiModules,
                credentialProvider,
                interactiveQueryFactory,
                draftFactory,
                workerConfigLookup,
                metrics);
    }
}
