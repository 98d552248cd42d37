package fr.lapetina.analytics.connector.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.analytics.connector.domain.model.Endpoint;

/**
 * Body of the tool endpoints.
 *
 * {@code connectionUrl} names a server for {@code /tools/connection} and
 * {@code /tools/workers}, and a worker for {@code /tools/workers/delete}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolRequest {

    private String connectionUrl;
    private String languageId;

    public String getConnectionUrl() { return connectionUrl; }
    public void setConnectionUrl(String connectionUrl) { this.connectionUrl = connectionUrl; }

    public String getLanguageId() { return languageId; }
    public void setLanguageId(String languageId) { this.languageId = languageId; }

    /**
     * Parses the connection URL.
     *
     * @throws IllegalArgumentException if it is missing or malformed
     */
    public Endpoint toEndpoint() {
        if (connectionUrl == null || connectionUrl.isBlank()) {
            throw new IllegalArgumentException("Missing 'connectionUrl' field");
        }
        return Endpoint.parse(connectionUrl.trim());
    }
}
