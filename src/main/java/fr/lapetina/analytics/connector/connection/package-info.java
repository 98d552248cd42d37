/**
 * Connection resolution for tool-facing operations.
 *
 * <p>{@link fr.lapetina.analytics.connector.connection.ConnectionResolver} decides, for an
 * endpoint, whether to reuse an open session, open one through the
 * {@link fr.lapetina.analytics.connector.connection.ConnectAction}, or refuse with a
 * structured {@link fr.lapetina.analytics.connector.connection.ConnectionResult}.
 *
 * <h2>Server Matching</h2>
 * <ul>
 *   <li>Loopback endpoints match on host and port</li>
 *   <li>Remote endpoints match on scheme and host; the port may differ</li>
 * </ul>
 *
 * <h2>Server Categories</h2>
 * <ul>
 *   <li>{@code DIRECT} - connected automatically when no session exists</li>
 *   <li>{@code GATEWAY} - requires a session opened through interactive login</li>
 * </ul>
 */
package fr.lapetina.analytics.connector.connection;
