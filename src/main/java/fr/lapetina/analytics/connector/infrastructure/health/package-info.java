/**
 * Server registry and running-state monitoring.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry} - Configured servers and their open sessions</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.health.ServerStatusChecker} - Periodic probes updating the running flags</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.health.DirectSession} - Session on a direct server</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.health.WorkerSession} - Session on a gateway worker</li>
 * </ul>
 */
package fr.lapetina.analytics.connector.infrastructure.health;
