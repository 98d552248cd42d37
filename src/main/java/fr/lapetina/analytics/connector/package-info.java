/**
 * Analytics connector - resolves connections to analytics servers for code-execution tools.
 *
 * <p>Given a server URL, the connector finds the configured server, makes sure it is running,
 * opens or reuses a session, and returns the URL format used to embed result panels.
 * Gateway servers get on-demand workers whose lifetime is tracked and cleaned up.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.ConnectorFactory} - Builds every component
 *       from YAML configuration and owns their lifetime</li>
 *   <li>{@link fr.lapetina.analytics.connector.ConnectorApplication} - Standalone HTTP server
 *       exposing the tool endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ConnectorFactory factory = ConnectorFactory.create("connector.yaml").start()) {
 *     ConnectionResult result = factory.getConnectionResolver()
 *             .resolve(Endpoint.parse("http://localhost:10000"), "python")
 *             .join();
 *
 *     if (result.success()) {
 *         System.out.println(result.panelUrlFormat());
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Connection resolution with hints for near-miss URLs</li>
 *   <li>Worker provisioning and cleanup on gateway servers</li>
 *   <li>Keyed async caches with single-flight loading and disposal</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.analytics.connector.ConnectorFactory
 * @see fr.lapetina.analytics.connector.connection.ConnectionResolver
 */
package fr.lapetina.analytics.connector;
