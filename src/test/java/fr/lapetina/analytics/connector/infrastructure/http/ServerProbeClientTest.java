package fr.lapetina.analytics.connector.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.ServerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerProbeClientTest {

    private static final String MODULE_SOURCE = "var irisapi = {};";

    @TempDir
    Path downloadDirectory;

    private HttpServer server;
    private Endpoint endpoint;
    private ServerProbeClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/jsapi/dh-core.js", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/irisapi/irisapi.nocache.js", exchange -> {
            byte[] body = MODULE_SOURCE.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();

        endpoint = Endpoint.parse("http://127.0.0.1:" + server.getAddress().getPort());
        client = new ServerProbeClient(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(5),
                "irisapi/irisapi.nocache.js", downloadDirectory);
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    @Test
    @DisplayName("should report a direct server running when its script answers")
    void shouldProbeDirectServer() throws Exception {
        ServerDescriptor direct = ServerDescriptor.builder().endpoint(endpoint).type(ServerType.DIRECT).build();

        assertThat(client.isRunning(direct).get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should probe gateways on the API module path")
    void shouldProbeGateway() throws Exception {
        ServerDescriptor gateway = ServerDescriptor.builder().endpoint(endpoint).type(ServerType.GATEWAY).build();

        assertThat(client.isRunning(gateway).get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should report not running on 404 or connection failure")
    void shouldReportNotRunning() throws Exception {
        server.removeContext("/jsapi/dh-core.js");
        ServerDescriptor direct = ServerDescriptor.builder().endpoint(endpoint).type(ServerType.DIRECT).build();
        assertThat(client.isRunning(direct).get(5, TimeUnit.SECONDS)).isFalse();

        ServerDescriptor unreachable = ServerDescriptor.builder().url("http://127.0.0.1:1").build();
        assertThat(client.isRunning(unreachable).get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    @DisplayName("should download the API module into a per-endpoint directory")
    void shouldDownloadApiModule() throws Exception {
        ApiModule module = client.downloadApiModule(endpoint).get(5, TimeUnit.SECONDS);

        assertThat(module.getEndpoint()).isEqualTo(endpoint);
        assertThat(module.getPath().getParent().getFileName().toString())
                .isEqualTo("127.0.0.1_" + endpoint.port());
        assertThat(Files.readString(module.getPath())).isEqualTo(MODULE_SOURCE);

        module.dispose().get(5, TimeUnit.SECONDS);
        assertThat(module.getPath()).doesNotExist();
    }

    @Test
    @DisplayName("should fail the download on a non-200 answer")
    void shouldFailDownload() {
        server.removeContext("/irisapi/irisapi.nocache.js");

        assertThatThrownBy(() -> client.downloadApiModule(endpoint).get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("status=404");
    }
}
