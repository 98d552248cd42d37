package fr.lapetina.analytics.connector.worker;

import java.util.List;

/**
 * Server configuration values a gateway advertises to its clients.
 */
public record ServerConfigValues(
        List<String> scriptSessionProviders,
        String jvmProfileDefault,
        List<String> workerKinds,
        String timeZone
) {
    public ServerConfigValues {
        scriptSessionProviders = scriptSessionProviders == null ? List.of() : List.copyOf(scriptSessionProviders);
        workerKinds = workerKinds == null ? List.of() : List.copyOf(workerKinds);
    }

    public static final ServerConfigValues EMPTY = new ServerConfigValues(List.of(), null, List.of(), null);
}
