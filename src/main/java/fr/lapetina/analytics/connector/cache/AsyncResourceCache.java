package fr.lapetina.analytics.connector.cache;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Memoizes an expensive asynchronous loader per endpoint.
 *
 * The in-flight future is stored before it settles, so callers racing for the same
 * endpoint share a single load. A failed load stays cached until {@link #invalidate}
 * is called. Disposing the cache disposes every resolved value that is
 * {@link Disposable} or {@link AutoCloseable}.
 *
 * @param <T> type of the loaded resource
 */
public class AsyncResourceCache<T> implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(AsyncResourceCache.class);

    private final String name;
    private final Function<Endpoint, CompletableFuture<T>> loader;
    private final EndpointMap<CompletableFuture<T>> entries = new EndpointMap<>();
    private final List<Consumer<Endpoint>> invalidationListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public AsyncResourceCache(String name, Function<Endpoint, CompletableFuture<T>> loader) {
        this.name = Objects.requireNonNull(name, "Cache name is required");
        this.loader = Objects.requireNonNull(loader, "Loader is required");
    }

    public AsyncResourceCache(Function<Endpoint, CompletableFuture<T>> loader) {
        this("resource", loader);
    }

    /**
     * Returns the cached future for an endpoint, starting a load if there is none.
     *
     * @throws IllegalStateException if the cache has been disposed
     */
    public CompletableFuture<T> get(Endpoint endpoint) {
        checkNotDisposed();
        return entries.computeIfAbsent(endpoint, key -> {
            checkNotDisposed();
            return load(key);
        });
    }

    private void checkNotDisposed() {
        if (disposed.get()) {
            throw new IllegalStateException("Cache '" + name + "' has been disposed");
        }
    }

    /**
     * Membership check. Never triggers a load.
     */
    public boolean has(Endpoint endpoint) {
        return entries.has(endpoint);
    }

    /**
     * Drops the entry for an endpoint so the next {@link #get} loads afresh.
     * Callers already holding the previous future keep it; a load still in flight is not
     * cancelled. A value that had already resolved is disposed in the background.
     */
    public void invalidate(Endpoint endpoint) {
        CompletableFuture<T> removed = entries.remove(endpoint);
        log.debug("Cache entry invalidated: cache={}, endpoint={}", name, endpoint);

        if (removed != null && removed.isDone() && !removed.isCompletedExceptionally()) {
            disposeValue(removed.join());
        }

        for (Consumer<Endpoint> listener : invalidationListeners) {
            try {
                listener.accept(endpoint);
            } catch (Exception e) {
                log.error("Error notifying invalidation listener: cache={}, endpoint={}", name, endpoint, e);
            }
        }
    }

    public void addInvalidationListener(Consumer<Endpoint> listener) {
        invalidationListeners.add(listener);
    }

    public void removeInvalidationListener(Consumer<Endpoint> listener) {
        invalidationListeners.remove(listener);
    }

    /**
     * Number of entries, pending or settled.
     */
    public int size() {
        return entries.size();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Clears the cache, waits for every entry to settle and disposes the resolved values.
     * Disposals run concurrently; the returned future completes when all of them have.
     */
    @Override
    public CompletableFuture<Void> dispose() {
        disposed.set(true);
        List<CompletableFuture<T>> pending = entries.drain();

        log.debug("Disposing cache: cache={}, entries={}", name, pending.size());

        List<CompletableFuture<Void>> disposing = new ArrayList<>();
        for (CompletableFuture<T> future : pending) {
            disposing.add(future
                    .handle((value, ex) -> ex == null ? value : null)
                    .thenCompose(this::disposeValue));
        }

        return CompletableFuture.allOf(disposing.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<T> load(Endpoint endpoint) {
        log.debug("Loading cache entry: cache={}, endpoint={}", name, endpoint);
        try {
            CompletableFuture<T> future = loader.apply(endpoint);
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Loader for cache '" + name + "' returned no future"));
            }
            return future;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> disposeValue(T value) {
        if (value instanceof Disposable) {
            CompletableFuture<Void> disposal;
            try {
                disposal = ((Disposable) value).dispose();
            } catch (Exception e) {
                log.warn("Error disposing cached value: cache={}", name, e);
                return CompletableFuture.completedFuture(null);
            }
            if (disposal == null) {
                return CompletableFuture.completedFuture(null);
            }
            return disposal.exceptionally(ex -> {
                log.warn("Error disposing cached value: cache={}, error={}", name, rootMessage(ex));
                return null;
            });
        }
        if (value instanceof AutoCloseable) {
            try {
                ((AutoCloseable) value).close();
            } catch (Exception e) {
                log.warn("Error closing cached value: cache={}", name, e);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }
}
