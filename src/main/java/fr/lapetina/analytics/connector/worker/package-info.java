/**
 * Provisioning and teardown of ephemeral workers on gateway servers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.worker.WorkerLifecycleManager} - Session and workers of one gateway</li>
 *   <li>{@link fr.lapetina.analytics.connector.worker.WorkerLifecycleManagerFactory} - Builds managers from shared collaborators</li>
 *   <li>{@link fr.lapetina.analytics.connector.worker.QueryDraftFactory} - Computes the parameters of a new worker query</li>
 *   <li>{@link fr.lapetina.analytics.connector.worker.GatewayClient} - Remote gateway session (login, queries, status events)</li>
 * </ul>
 *
 * <h2>Worker States</h2>
 * <pre>
 * created (pending) -&gt; RUNNING                  worker listed, future completes
 *                   -&gt; ERROR | FAILED           query deleted, future fails
 * RUNNING           -&gt; deleted via deleteWorker
 * </pre>
 */
package fr.lapetina.analytics.connector.worker;
