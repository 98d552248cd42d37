package fr.lapetina.analytics.connector.cache;

import java.util.concurrent.CompletableFuture;

/**
 * A resource whose teardown is asynchronous.
 * Caches dispose their resolved values through this interface.
 */
@FunctionalInterface
public interface Disposable {

    /**
     * Releases the resource. The returned future completes once teardown is done.
     */
    CompletableFuture<Void> dispose();
}
