package fr.lapetina.analytics.connector.infrastructure.config;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.ServerType;
import fr.lapetina.analytics.connector.domain.model.WorkerConfig;
import fr.lapetina.analytics.connector.worker.WorkerDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the connector.
 * Designed to be populated from YAML.
 */
public class ConnectorConfig {

    private ServerConfig server = new ServerConfig();
    private List<ServerEntry> servers = new ArrayList<>();
    private StatusCheckConfig statusCheck = new StatusCheckConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private WorkerDefaultsConfig worker = new WorkerDefaultsConfig();
    private ApiModulesConfig apiModules = new ApiModulesConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ServerEntry> getServers() { return servers; }
    public void setServers(List<ServerEntry> servers) { this.servers = servers; }

    public StatusCheckConfig getStatusCheck() { return statusCheck; }
    public void setStatusCheck(StatusCheckConfig statusCheck) { this.statusCheck = statusCheck; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public WorkerDefaultsConfig getWorker() { return worker; }
    public void setWorker(WorkerDefaultsConfig worker) { this.worker = worker; }

    public ApiModulesConfig getApiModules() { return apiModules; }
    public void setApiModules(ApiModulesConfig apiModules) { this.apiModules = apiModules; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts the enabled server entries to descriptors, in configuration order.
     * Servers start as not running until the first status check.
     */
    public List<ServerDescriptor> toServerDescriptors() {
        List<ServerDescriptor> descriptors = new ArrayList<>();
        if (servers == null) {
            return descriptors;
        }
        for (ServerEntry entry : servers) {
            if (entry.isEnabled()) {
                descriptors.add(entry.toDescriptor());
            }
        }
        return descriptors;
    }

    /**
     * HTTP server configuration for the tool endpoints.
     */
    public static class ServerConfig {
        private int port = 4040;
        private String host = "127.0.0.1";
        private int backlog = 50;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * One analytics server the connector may attach to.
     */
    public static class ServerEntry {
        private String url;
        private String type = "direct";
        private String label;
        private String accessToken;
        private boolean enabled = true;
        private WorkerOverrides worker;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }

        public String getAccessToken() { return accessToken; }
        public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public WorkerOverrides getWorker() { return worker; }
        public void setWorker(WorkerOverrides worker) { this.worker = worker; }

        public ServerDescriptor toDescriptor() {
            return ServerDescriptor.builder()
                    .endpoint(Endpoint.parse(url))
                    .type(ServerType.fromConfig(type))
                    .label(label)
                    .accessToken(accessToken)
                    .workerConfig(worker == null ? null : worker.toWorkerConfig())
                    .build();
        }
    }

    /**
     * Per-gateway overrides for new workers.
     */
    public static class WorkerOverrides {
        private String dbServerName;
        private Double heapSizeGb;
        private String jvmArgs;
        private String jvmProfile;
        private String scriptLanguage;

        public String getDbServerName() { return dbServerName; }
        public void setDbServerName(String dbServerName) { this.dbServerName = dbServerName; }

        public Double getHeapSizeGb() { return heapSizeGb; }
        public void setHeapSizeGb(Double heapSizeGb) { this.heapSizeGb = heapSizeGb; }

        public String getJvmArgs() { return jvmArgs; }
        public void setJvmArgs(String jvmArgs) { this.jvmArgs = jvmArgs; }

        public String getJvmProfile() { return jvmProfile; }
        public void setJvmProfile(String jvmProfile) { this.jvmProfile = jvmProfile; }

        public String getScriptLanguage() { return scriptLanguage; }
        public void setScriptLanguage(String scriptLanguage) { this.scriptLanguage = scriptLanguage; }

        public WorkerConfig toWorkerConfig() {
            return new WorkerConfig(dbServerName, heapSizeGb, jvmArgs, jvmProfile, scriptLanguage);
        }
    }

    /**
     * Server status polling configuration.
     */
    public static class StatusCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 10000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 5000;
        private long probeTimeoutMs = 5000;
        private long downloadTimeoutMs = 30000;
        private long toolTimeoutMs = 300000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public long getDownloadTimeoutMs() { return downloadTimeoutMs; }
        public void setDownloadTimeoutMs(long downloadTimeoutMs) { this.downloadTimeoutMs = downloadTimeoutMs; }

        public long getToolTimeoutMs() { return toolTimeoutMs; }
        public void setToolTimeoutMs(long toolTimeoutMs) { this.toolTimeoutMs = toolTimeoutMs; }
    }

    /**
     * Defaults applied to every new worker query.
     */
    public static class WorkerDefaultsConfig {
        private String queryType = WorkerDefaults.DEFAULTS.queryType();
        private String temporaryQueueName = WorkerDefaults.DEFAULTS.temporaryQueueName();
        private long autoDeleteTimeoutMs = WorkerDefaults.DEFAULTS.autoDeleteTimeoutMs();
        private String jvmArgs = WorkerDefaults.DEFAULTS.jvmArgs();
        private String scriptLanguage = WorkerDefaults.DEFAULTS.scriptLanguage();
        private String dbServerName = WorkerDefaults.DEFAULTS.dbServerName();
        private String queryNamePrefix = WorkerDefaults.DEFAULTS.queryNamePrefix();

        public String getQueryType() { return queryType; }
        public void setQueryType(String queryType) { this.queryType = queryType; }

        public String getTemporaryQueueName() { return temporaryQueueName; }
        public void setTemporaryQueueName(String temporaryQueueName) { this.temporaryQueueName = temporaryQueueName; }

        public long getAutoDeleteTimeoutMs() { return autoDeleteTimeoutMs; }
        public void setAutoDeleteTimeoutMs(long autoDeleteTimeoutMs) { this.autoDeleteTimeoutMs = autoDeleteTimeoutMs; }

        public String getJvmArgs() { return jvmArgs; }
        public void setJvmArgs(String jvmArgs) { this.jvmArgs = jvmArgs; }

        public String getScriptLanguage() { return scriptLanguage; }
        public void setScriptLanguage(String scriptLanguage) { this.scriptLanguage = scriptLanguage; }

        public String getDbServerName() { return dbServerName; }
        public void setDbServerName(String dbServerName) { this.dbServerName = dbServerName; }

        public String getQueryNamePrefix() { return queryNamePrefix; }
        public void setQueryNamePrefix(String queryNamePrefix) { this.queryNamePrefix = queryNamePrefix; }

        public WorkerDefaults toWorkerDefaults() {
            return new WorkerDefaults(queryType, temporaryQueueName, autoDeleteTimeoutMs,
                    jvmArgs, scriptLanguage, dbServerName, queryNamePrefix);
        }
    }

    /**
     * Where gateway API modules are downloaded from and stored.
     */
    public static class ApiModulesConfig {
        private String path = "irisapi/irisapi.nocache.js";
        private String directory;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        /** Local download root; the system temp directory when unset. */
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "analytics_connector";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
