/**
 * Domain model classes shared by the caches, the resolver and the worker lifecycle.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.Endpoint} - Normalized (scheme, host, port) server address</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.ServerDescriptor} - A registered server and its running state</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.ConnectionState} - A session bound to one endpoint</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.CodeSession} - A session that can execute code</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.WorkerDescriptor} - A running gateway worker</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.QueryStatus} - Query states reported by a gateway</li>
 *   <li>{@link fr.lapetina.analytics.connector.domain.model.ResolutionError} - Why a connection could not be resolved</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything here is immutable: records, enums and the builder-made {@code ServerDescriptor}.
 * {@code ConnectionState} implementations are owned by the registry.
 */
package fr.lapetina.analytics.connector.domain.model;
