package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.WorkerConfig;

import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Drafts interactive console queries from server-published defaults, per-gateway
 * overrides and {@link WorkerDefaults}.
 */
public final class QueryDraftFactory {

    static final double FALLBACK_HEAP_GB = 4.0;

    private final WorkerDefaults defaults;
    private final Supplier<String> uniqueSuffix;

    public QueryDraftFactory(WorkerDefaults defaults) {
        this(defaults, () -> UUID.randomUUID().toString());
    }

    QueryDraftFactory(WorkerDefaults defaults, Supplier<String> uniqueSuffix) {
        this.defaults = Objects.requireNonNull(defaults, "Worker defaults are required");
        this.uniqueSuffix = Objects.requireNonNull(uniqueSuffix, "Suffix supplier is required");
    }

    /**
     * Fetches the gateway's server names, query constants and config values concurrently
     * and combines them into a draft.
     *
     * @param config      per-gateway overrides, may be null
     * @param consoleType requested console language, may be null
     */
    public CompletableFuture<QueryDraft> createDraft(GatewayClient client, WorkerConfig config, String consoleType) {
        WorkerConfig overrides = config == null ? WorkerConfig.DEFAULTS : config;

        CompletableFuture<List<String>> dbServers = client.getDbServerNames();
        CompletableFuture<QueryConstants> constants = client.getQueryConstants();
        CompletableFuture<ServerConfigValues> values = client.getServerConfigValues();

        return CompletableFuture.allOf(dbServers, constants, values)
                .thenApply(ignored -> buildDraft(
                        client.getUsername(),
                        overrides,
                        consoleType,
                        dbServers.join(),
                        constants.join(),
                        values.join()));
    }

    QueryDraft buildDraft(
            String owner,
            WorkerConfig overrides,
            String consoleType,
            List<String> dbServerNames,
            QueryConstants constants,
            ServerConfigValues values
    ) {
        ServerConfigValues serverValues = values == null ? ServerConfigValues.EMPTY : values;

        String dbServerName = overrides.dbServerName() != null
                ? overrides.dbServerName()
                : firstOr(dbServerNames, defaults.dbServerName());

        String scriptLanguage = overrides.scriptLanguage() != null
                ? overrides.scriptLanguage()
                : negotiateLanguage(consoleType, serverValues.scriptSessionProviders());

        String timeZone = serverValues.timeZone() != null
                ? serverValues.timeZone()
                : ZoneId.systemDefault().getId();

        return new QueryDraft(
                defaults.queryNamePrefix() + uniqueSuffix.get(),
                defaults.queryType(),
                owner,
                dbServerName,
                heapSize(overrides, constants),
                jvmArgs(overrides),
                overrides.jvmProfile() != null ? overrides.jvmProfile() : serverValues.jvmProfileDefault(),
                scriptLanguage,
                firstOr(serverValues.workerKinds(), null),
                timeZone,
                defaults.temporaryQueueName(),
                defaults.autoDeleteTimeoutMs());
    }

    /**
     * Picks the server provider matching the console type, ignoring case, and returns the
     * server's spelling of it. Falls back to the default language.
     */
    String negotiateLanguage(String consoleType, List<String> providers) {
        if (consoleType == null || consoleType.isBlank()) {
            return defaults.scriptLanguage();
        }
        String wanted = consoleType.trim().toLowerCase(Locale.ROOT);
        return providers.stream()
                .filter(provider -> provider != null && provider.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst()
                .orElse(defaults.scriptLanguage());
    }

    private double heapSize(WorkerConfig overrides, QueryConstants constants) {
        if (overrides.heapSizeGb() != null && overrides.heapSizeGb() > 0) {
            return overrides.heapSizeGb();
        }
        if (constants != null && constants.pqDefaultHeap() > 0) {
            return constants.pqDefaultHeap();
        }
        return FALLBACK_HEAP_GB;
    }

    private String jvmArgs(WorkerConfig overrides) {
        if (overrides.jvmArgs() == null || overrides.jvmArgs().isBlank()) {
            return defaults.jvmArgs();
        }
        if (defaults.jvmArgs().isEmpty()) {
            return overrides.jvmArgs().trim();
        }
        return defaults.jvmArgs() + " " + overrides.jvmArgs().trim();
    }

    private static String firstOr(List<String> values, String fallback) {
        if (values == null) {
            return fallback;
        }
        return values.stream().filter(Objects::nonNull).findFirst().orElse(fallback);
    }
}
