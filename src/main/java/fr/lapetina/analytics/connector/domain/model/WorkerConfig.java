package fr.lapetina.analytics.connector.domain.model;

/**
 * Optional per-gateway overrides applied when drafting a new worker query.
 * Any field may be null, meaning "use the server default".
 */
public record WorkerConfig(
        String dbServerName,
        Double heapSizeGb,
        String jvmArgs,
        String jvmProfile,
        String scriptLanguage
) {
    public static final WorkerConfig DEFAULTS = new WorkerConfig(null, null, null, null, null);
}
