/**
 * Micrometer metrics with Prometheus exposition.
 */
package fr.lapetina.analytics.connector.infrastructure.metrics;
