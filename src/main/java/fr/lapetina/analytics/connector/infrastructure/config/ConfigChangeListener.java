package fr.lapetina.analytics.connector.infrastructure.config;

/**
 * Notified after the connector configuration has been loaded or reloaded.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig previous configuration, null on the first load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(ConnectorConfig oldConfig, ConnectorConfig newConfig);
}
