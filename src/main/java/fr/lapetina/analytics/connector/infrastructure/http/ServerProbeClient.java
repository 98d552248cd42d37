package fr.lapetina.analytics.connector.infrastructure.http;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client for the plain web endpoints of analytics servers.
 *
 * Uses java.net.http.HttpClient. Probes tell whether a server is up by fetching the
 * client script it serves; gateways also serve the API module downloaded for workers.
 */
public class ServerProbeClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerProbeClient.class);

    static final String DIRECT_PROBE_PATH = "jsapi/dh-core.js";
    static final String GATEWAY_PROBE_PATH = "irisapi/irisapi.nocache.js";

    private final HttpClient httpClient;
    private final Duration probeTimeout;
    private final Duration downloadTimeout;
    private final String apiModulePath;
    private final Path downloadDirectory;

    public ServerProbeClient(
            Duration connectTimeout,
            Duration probeTimeout,
            Duration downloadTimeout,
            String apiModulePath,
            Path downloadDirectory
    ) {
        this.probeTimeout = probeTimeout;
        this.downloadTimeout = downloadTimeout;
        this.apiModulePath = apiModulePath;
        this.downloadDirectory = downloadDirectory;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public ServerProbeClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(30),
                GATEWAY_PROBE_PATH, Path.of(System.getProperty("java.io.tmpdir"), "analytics-connector"));
    }

    /**
     * Checks whether a server answers on its client script URL. A 200 or 204 means running;
     * any other status or a network error means not running.
     */
    public CompletableFuture<Boolean> isRunning(ServerDescriptor server) {
        URI uri = server.getEndpoint().resolve(server.isGateway() ? GATEWAY_PROBE_PATH : DIRECT_PROBE_PATH);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(probeTimeout)
                .GET()
                .build();

        log.debug("Status probe started: server={}, uri={}", server.getEndpoint(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean running = response.statusCode() == 200 || response.statusCode() == 204;
                    if (running) {
                        log.debug("Status probe passed: server={}, status={}", server.getEndpoint(), response.statusCode());
                    } else {
                        log.debug("Status probe failed: server={}, status={}", server.getEndpoint(), response.statusCode());
                    }
                    return running;
                })
                .exceptionally(ex -> {
                    log.debug("Status probe error: server={}, error={}", server.getEndpoint(), ex.getMessage());
                    return false;
                });
    }

    /**
     * Downloads the API module of a gateway into a directory dedicated to that endpoint.
     * Fails with an {@link IOException} when the server does not answer 200.
     */
    public CompletableFuture<ApiModule> downloadApiModule(Endpoint endpoint) {
        URI uri = endpoint.resolve(apiModulePath);
        Path target;
        try {
            Path directory = downloadDirectory.resolve(endpoint.host() + "_" + endpoint.port());
            Files.createDirectories(directory);
            target = directory.resolve(fileName(apiModulePath));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(downloadTimeout)
                .GET()
                .build();

        log.info("Downloading API module: server={}, uri={}, target={}", endpoint, uri, target);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(target))
                .thenCompose(response -> {
                    if (response.statusCode() != 200) {
                        return CompletableFuture.<ApiModule>failedFuture(new IOException(
                                "API module download failed: uri=" + uri + ", status=" + response.statusCode()));
                    }
                    return CompletableFuture.completedFuture(new ApiModule(endpoint, response.body()));
                });
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21
    }
}
