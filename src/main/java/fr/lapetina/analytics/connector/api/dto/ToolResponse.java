package fr.lapetina.analytics.connector.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.analytics.connector.connection.ConnectionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result shape shared by every tool endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResponse {

    private boolean success;
    private String message;
    private long executionTimeMs;
    private String hint;
    private Map<String, Object> details;

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public String getHint() { return hint; }
    public void setHint(String hint) { this.hint = hint; }

    public Map<String, Object> getDetails() { return details; }
    public void setDetails(Map<String, Object> details) { this.details = details; }

    public static ToolResponse success(String message, Map<String, Object> details, long executionTimeMs) {
        ToolResponse response = new ToolResponse();
        response.setSuccess(true);
        response.setMessage(message);
        response.setDetails(details);
        response.setExecutionTimeMs(executionTimeMs);
        return response;
    }

    public static ToolResponse error(String message, Map<String, Object> details, String hint, long executionTimeMs) {
        ToolResponse response = new ToolResponse();
        response.setSuccess(false);
        response.setMessage(message);
        response.setDetails(details == null || details.isEmpty() ? null : details);
        response.setHint(hint);
        response.setExecutionTimeMs(executionTimeMs);
        return response;
    }

    /**
     * Creates from a connection resolution outcome.
     */
    public static ToolResponse fromConnectionResult(ConnectionResult result, long executionTimeMs) {
        if (result.isError()) {
            return error(result.errorMessage(), result.details(), result.hint(), executionTimeMs);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("connectionUrl", result.connection().getEndpoint().toUri().toString());
        result.connection().getTagId().ifPresent(tagId -> details.put("tagId", tagId));
        if (result.panelUrlFormat() != null) {
            details.put("panelUrlFormat", result.panelUrlFormat());
        }
        return success("Connection ready", details, executionTimeMs);
    }
}
