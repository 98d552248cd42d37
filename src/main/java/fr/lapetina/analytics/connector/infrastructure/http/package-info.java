/**
 * HTTP access to the web endpoints of analytics servers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.http.ServerProbeClient} - Running-state probes and API module downloads</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.http.ApiModule} - A downloaded API module, deleted on disposal</li>
 * </ul>
 */
package fr.lapetina.analytics.connector.infrastructure.http;
