package fr.lapetina.analytics.connector.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Cache load counters per cache
 * - Worker provisioning outcomes and startup latency
 * - Worker deletion counters
 * - Connection resolution outcomes
 * - Gauges for running servers, open connections and tracked workers
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> cacheLoadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> provisioningCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deletionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resolutionCounters = new ConcurrentHashMap<>();
    private final Timer workerStartupTimer;

    private final AtomicInteger runningServers = new AtomicInteger(0);
    private final AtomicInteger openConnections = new AtomicInteger(0);
    private final AtomicInteger trackedWorkers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_running_servers", runningServers, AtomicInteger::get)
                .description("Number of configured servers currently running")
                .register(registry);

        Gauge.builder(prefix + "_open_connections", openConnections, AtomicInteger::get)
                .description("Number of open server connections")
                .register(registry);

        Gauge.builder(prefix + "_tracked_workers", trackedWorkers, AtomicInteger::get)
                .description("Number of provisioned worker queries not yet deleted")
                .register(registry);

        workerStartupTimer = Timer.builder(prefix + "_worker_startup")
                .description("Time from worker request to running worker")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("analytics_connector");
    }

    /**
     * Counts a loader invocation of an {@code AsyncResourceCache}.
     */
    public void incrementCacheLoad(String cacheName) {
        cacheLoadCounters.computeIfAbsent(cacheName, k ->
                Counter.builder(prefix + "_cache_loads_total")
                        .description("Total number of cache loader invocations")
                        .tag("cache", cacheName)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a worker provisioning outcome ({@code running}, {@code failed}, ...).
     */
    public void incrementWorkerProvisioning(String server, String outcome) {
        String key = server + ":" + outcome;
        provisioningCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_worker_provisioning_total")
                        .description("Total number of worker provisioning attempts by outcome")
                        .tag("server", server)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementWorkerDeletion(String server, String outcome) {
        String key = server + ":" + outcome;
        deletionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_worker_deletions_total")
                        .description("Total number of worker deletion requests by outcome")
                        .tag("server", server)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a connection resolution outcome: {@code success} or the resolution error name.
     */
    public void incrementResolution(String outcome) {
        resolutionCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_connection_resolutions_total")
                        .description("Total number of connection resolutions by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordWorkerStartup(Duration latency) {
        workerStartupTimer.record(latency);
    }

    public void setRunningServers(int value) {
        runningServers.set(value);
    }

    public void setOpenConnections(int value) {
        openConnections.set(value);
    }

    /**
     * Adjusts the tracked worker gauge by a delta.
     */
    public void addTrackedWorkers(int delta) {
        trackedWorkers.addAndGet(delta);
    }

    public int getTrackedWorkers() {
        return trackedWorkers.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
