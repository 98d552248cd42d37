package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.http.ApiModule;
import fr.lapetina.analytics.connector.infrastructure.http.ServerProbeClient;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probe client answering from a map instead of the network.
 * Unknown endpoints are reported as not running.
 */
public class StubProbeClient extends ServerProbeClient {

    private final Map<Endpoint, CompletableFuture<Boolean>> answers = new ConcurrentHashMap<>();
    private final AtomicInteger downloads = new AtomicInteger();

    public void setRunning(Endpoint endpoint, boolean running) {
        answers.put(endpoint, CompletableFuture.completedFuture(running));
    }

    public void setAnswer(Endpoint endpoint, CompletableFuture<Boolean> answer) {
        answers.put(endpoint, answer);
    }

    public int getDownloads() {
        return downloads.get();
    }

    @Override
    public CompletableFuture<Boolean> isRunning(ServerDescriptor server) {
        return answers.getOrDefault(server.getEndpoint(), CompletableFuture.completedFuture(false));
    }

    @Override
    public CompletableFuture<ApiModule> downloadApiModule(Endpoint endpoint) {
        downloads.incrementAndGet();
        return CompletableFuture.completedFuture(
                new ApiModule(endpoint, Path.of("target", "stub-modules", endpoint.host() + ".js")));
    }
}
