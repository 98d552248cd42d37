/**
 * Endpoint-keyed stores and asynchronous caches.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.cache.KeyedStore} - Map comparing keys by a serialized form, with change notification</li>
 *   <li>{@link fr.lapetina.analytics.connector.cache.EndpointMap} - KeyedStore for {@code Endpoint} keys</li>
 *   <li>{@link fr.lapetina.analytics.connector.cache.AsyncResourceCache} - One in-flight load per endpoint, invalidation and cascading disposal</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <p>Caches are plain instances created by the composition root and passed to whoever
 * needs them. There is no static registry.
 */
package fr.lapetina.analytics.connector.cache;
