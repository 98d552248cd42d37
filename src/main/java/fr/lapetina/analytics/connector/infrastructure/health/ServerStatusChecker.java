package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.http.ServerProbeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background poller keeping the registry's running flags current.
 *
 * Each cycle probes every configured server; a server whose probe fails or times out is
 * marked not running, which closes its sessions.
 */
public final class ServerStatusChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerStatusChecker.class);

    private final InMemoryServerRegistry registry;
    private final ServerProbeClient probeClient;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ServerStatusChecker(
            InMemoryServerRegistry registry,
            ServerProbeClient probeClient,
            Duration checkInterval,
            Duration probeTimeout
    ) {
        this.registry = registry;
        this.probeClient = probeClient;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "status-checker");
            t.setDaemon(true);
            return t;
        });
    }

    public ServerStatusChecker(InMemoryServerRegistry registry, ServerProbeClient probeClient) {
        this(registry, probeClient, Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    /**
     * Starts the periodic status checks.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllServers,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Status checker started with interval: {}", checkInterval);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Probes every server once. The returned future completes when all probes have been
     * recorded; it never fails.
     */
    public CompletableFuture<Void> checkAllServers() {
        List<ServerDescriptor> servers = registry.getServers();
        log.debug("Starting status check cycle: serverCount={}", servers.size());

        List<CompletableFuture<Void>> checks = new ArrayList<>();
        for (ServerDescriptor server : servers) {
            checks.add(checkServer(server));
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]));
    }

    /**
     * Probes a single server and records the result.
     */
    public CompletableFuture<Void> checkServer(ServerDescriptor server) {
        CompletableFuture<Boolean> probe;
        try {
            probe = probeClient.isRunning(server);
        } catch (Exception e) {
            probe = CompletableFuture.failedFuture(e);
        }

        return probe
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((isRunning, ex) -> {
                    if (ex != null) {
                        log.warn("Status check failed: server={}, error={}", server.getEndpoint(), ex.getMessage());
                        return false;
                    }
                    return Boolean.TRUE.equals(isRunning);
                })
                .thenAccept(isRunning -> {
                    if (isRunning != server.isRunning()) {
                        log.info("Server status changed: server={}, running={}", server.getEndpoint(), isRunning);
                    }
                    registry.updateRunning(server.getEndpoint(), isRunning);
                });
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Status checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
