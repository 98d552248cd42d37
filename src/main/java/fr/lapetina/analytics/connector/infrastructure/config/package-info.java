/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.config.ConnectorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.analytics.connector.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - tool HTTP endpoint (host, port, backlog)</li>
 *   <li>{@code servers} - analytics servers, direct or gateway, with optional worker overrides</li>
 *   <li>{@code statusCheck} - running-state polling</li>
 *   <li>{@code timeouts} - connect, probe and download timeouts</li>
 *   <li>{@code worker} - defaults for new worker queries</li>
 *   <li>{@code apiModules} - gateway API module download</li>
 *   <li>{@code metrics} - Prometheus metrics</li>
 * </ul>
 */
package fr.lapetina.analytics.connector.infrastructure.config;
