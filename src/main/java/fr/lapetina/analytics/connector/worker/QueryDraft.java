package fr.lapetina.analytics.connector.worker;

import java.util.Objects;

/**
 * Parameters of an interactive console query submitted to a gateway.
 *
 * @param name                display name, unique per request
 * @param type                query type, always the interactive console type for workers
 * @param owner               user owning the query
 * @param dbServerName        server the worker is scheduled on
 * @param heapSizeGb          worker heap in gigabytes
 * @param jvmArgs             extra JVM arguments for the worker process
 * @param jvmProfile          named JVM profile, may be null
 * @param scriptLanguage      console language of the worker
 * @param workerKind          worker kind, may be null
 * @param timeZone            time zone used by the query scheduler
 * @param schedulerQueue      temporary queue the query is scheduled on
 * @param autoDeleteTimeoutMs delay after which the server deletes an idle temporary query
 */
public record QueryDraft(
        String name,
        String type,
        String owner,
        String dbServerName,
        double heapSizeGb,
        String jvmArgs,
        String jvmProfile,
        String scriptLanguage,
        String workerKind,
        String timeZone,
        String schedulerQueue,
        long autoDeleteTimeoutMs
) {
    public QueryDraft {
        Objects.requireNonNull(name, "Query name is required");
        Objects.requireNonNull(type, "Query type is required");
        Objects.requireNonNull(dbServerName, "DB server name is required");
        Objects.requireNonNull(scriptLanguage, "Script language is required");
        if (heapSizeGb <= 0) {
            throw new IllegalArgumentException("Heap size must be positive: " + heapSizeGb);
        }
    }
}
