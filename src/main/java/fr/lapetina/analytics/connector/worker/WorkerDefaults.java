package fr.lapetina.analytics.connector.worker;

import java.util.Objects;

/**
 * Defaults applied to every drafted worker query.
 *
 * @param queryType             type of the query submitted to the gateway
 * @param temporaryQueueName    scheduler queue for temporary queries
 * @param autoDeleteTimeoutMs   idle time before the server deletes a temporary query
 * @param jvmArgs               JVM arguments forced on the worker (websocket transport)
 * @param scriptLanguage        fallback console language
 * @param dbServerName          fallback server name when the gateway lists none
 * @param queryNamePrefix       prefix of generated query names
 */
public record WorkerDefaults(
        String queryType,
        String temporaryQueueName,
        long autoDeleteTimeoutMs,
        String jvmArgs,
        String scriptLanguage,
        String dbServerName,
        String queryNamePrefix
) {
    public static final String INTERACTIVE_CONSOLE_QUERY_TYPE = "InteractiveConsole";

    public static final WorkerDefaults DEFAULTS = new WorkerDefaults(
            INTERACTIVE_CONSOLE_QUERY_TYPE,
            "InteractiveConsoleTemporaryQueue",
            600_000L,
            "-Dhttp.websockets=true",
            "Python",
            "Query 1",
            "analytics connector - ");

    public WorkerDefaults {
        Objects.requireNonNull(queryType, "Query type is required");
        Objects.requireNonNull(temporaryQueueName, "Temporary queue name is required");
        Objects.requireNonNull(scriptLanguage, "Script language is required");
        Objects.requireNonNull(dbServerName, "DB server name is required");
        if (autoDeleteTimeoutMs <= 0) {
            throw new IllegalArgumentException("Auto delete timeout must be positive: " + autoDeleteTimeoutMs);
        }
        jvmArgs = jvmArgs == null ? "" : jvmArgs;
        queryNamePrefix = queryNamePrefix == null ? "" : queryNamePrefix;
    }
}
