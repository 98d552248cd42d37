package fr.lapetina.analytics.connector.infrastructure.http;

import fr.lapetina.analytics.connector.cache.Disposable;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A client API script downloaded from a gateway. Disposing it deletes the local copy.
 */
public final class ApiModule implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(ApiModule.class);

    private final Endpoint endpoint;
    private final Path path;

    public ApiModule(Endpoint endpoint, Path path) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint is required");
        this.path = Objects.requireNonNull(path, "Path is required");
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public CompletableFuture<Void> dispose() {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("API module deleted: endpoint={}, path={}", endpoint, path);
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException(e));
        }
    }

    @Override
    public String toString() {
        return "ApiModule{endpoint=" + endpoint + ", path=" + path + "}";
    }
}
