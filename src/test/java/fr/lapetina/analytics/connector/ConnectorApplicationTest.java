package fr.lapetina.analytics.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.analytics.connector.integration.TestConnectorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static fr.lapetina.analytics.connector.integration.TestConnectorFactory.GATEWAY;
import static fr.lapetina.analytics.connector.integration.TestConnectorFactory.LOCAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the HTTP surface against a factory with stubbed servers.
 */
class ConnectorApplicationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private TestConnectorFactory factory;
    private ConnectorApplication app;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestConnectorFactory.create();
        app = new ConnectorApplication(factory);
        app.start();
    }

    @AfterEach
    void tearDown() {
        app.close();
    }

    @Test
    @DisplayName("should return the panel URL format for a running direct server")
    void shouldResolveConnection() throws Exception {
        factory.setRunning(LOCAL, true);

        HttpResponse<String> response = post("/tools/connection",
                "{\"connectionUrl\":\"http://localhost:10000\",\"languageId\":\"python\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("message").asText()).isEqualTo("Connection ready");
        assertThat(body.get("details").get("connectionUrl").asText()).isEqualTo("http://localhost:10000/");
        assertThat(body.get("details").get("panelUrlFormat").asText())
                .isEqualTo("http://localhost:10000/iframe/widget/?name=<variableTitle>&psk=secret-token");
    }

    @Test
    @DisplayName("should return the failure message and hint")
    void shouldReturnFailure() throws Exception {
        factory.setRunning(GATEWAY, true);

        HttpResponse<String> response = post("/tools/connection",
                "{\"connectionUrl\":\"https://gateway.example.com:8123\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = objectMapper.readTree(response.body());
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("message").asText()).isEqualTo("No active connection");
        assertThat(body.get("hint").asText()).isEqualTo("Use connectToServer first");
        assertThat(body.get("details").get("connectionUrl").asText()).isEqualTo("https://gateway.example.com:8123/");
    }

    @Test
    @DisplayName("should reject a request without connection URL")
    void shouldRejectMissingUrl() throws Exception {
        HttpResponse<String> response = post("/tools/connection", "{\"languageId\":\"python\"}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(objectMapper.readTree(response.body()).get("message").asText())
                .contains("connectionUrl");
    }

    @Test
    @DisplayName("should reject GET on tool endpoints")
    void shouldRejectGet() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(uri("/tools/connection")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("should list servers with their connections")
    void shouldListServers() throws Exception {
        factory.setRunning(LOCAL, true);
        post("/tools/connection", "{\"connectionUrl\":\"http://localhost:10000\"}");

        HttpResponse<String> response = get("/servers");

        JsonNode servers = objectMapper.readTree(response.body()).get("servers");
        assertThat(servers.size()).isEqualTo(2);
        assertThat(servers.get(0).get("url").asText()).isEqualTo("http://localhost:10000");
        assertThat(servers.get(0).get("isRunning").asBoolean()).isTrue();
        assertThat(servers.get(0).get("connectionCount").asInt()).isEqualTo(1);
        assertThat(servers.get(1).get("type").asText()).isEqualTo("GATEWAY");
    }

    @Test
    @DisplayName("should report degraded health when some servers are down")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> down = get("/health");
        assertThat(down.statusCode()).isEqualTo(503);
        assertThat(objectMapper.readTree(down.body()).get("status").asText()).isEqualTo("DOWN");

        factory.setRunning(LOCAL, true);

        HttpResponse<String> degraded = get("/health");
        assertThat(degraded.statusCode()).isEqualTo(200);
        assertThat(objectMapper.readTree(degraded.body()).get("status").asText()).isEqualTo("DEGRADED");
    }

    @Test
    @DisplayName("should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("test_connector_running_servers");
    }

    @Test
    @DisplayName("should release waiters once and tolerate repeated close")
    void shouldCloseOnce() throws Exception {
        assertThat(app.awaitShutdown(Duration.ofMillis(50))).isFalse();

        app.close();
        app.close();

        assertThat(app.isClosed()).isTrue();
        assertThat(app.awaitShutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(factory.getWorkerManagers().isDisposed()).isTrue();
    }

    @Test
    @DisplayName("should release the connector when its port is taken")
    void shouldReleaseFactoryOnBindFailure() {
        TestConnectorFactory second = TestConnectorFactory.create();
        second.getConfig().getServer().setPort(app.getPort());

        assertThatThrownBy(() -> new ConnectorApplication(second))
                .isInstanceOf(IOException.class);
        assertThat(second.getWorkerManagers().isDisposed()).isTrue();
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder(uri(path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + app.getPort() + path);
    }
}
