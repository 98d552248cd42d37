package fr.lapetina.analytics.connector.connection;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.QuerySerial;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builders for panel URL templates. Callers replace {@link #VARIABLE_TITLE_PLACEHOLDER}
 * with the title of a result variable.
 */
public final class PanelUrlFormats {

    public static final String VARIABLE_TITLE_PLACEHOLDER = "<variableTitle>";

    private PanelUrlFormats() {
    }

    /**
     * Panel URL format for a directly-addressable server. The access token, if any, is
     * appended as the {@code psk} query parameter.
     */
    public static String direct(Endpoint endpoint, String accessToken) {
        String url = endpoint.origin() + "/iframe/widget/?name=" + VARIABLE_TITLE_PLACEHOLDER;
        if (accessToken == null || accessToken.isEmpty()) {
            return url;
        }
        return url + "&psk=" + URLEncoder.encode(accessToken, StandardCharsets.UTF_8);
    }

    /**
     * Panel URL format for a gateway server; the worker's query serial scopes the widget.
     */
    public static String gateway(Endpoint endpoint, QuerySerial serial) {
        return endpoint.origin() + "/iriside/embed/widget/serial/" + serial.value() + "/" + VARIABLE_TITLE_PLACEHOLDER;
    }

    /**
     * Fills the placeholder of a panel URL format with a variable title.
     */
    public static String forVariable(String panelUrlFormat, String variableTitle) {
        return panelUrlFormat.replace(VARIABLE_TITLE_PLACEHOLDER,
                URLEncoder.encode(variableTitle, StandardCharsets.UTF_8).replace("+", "%20"));
    }
}
