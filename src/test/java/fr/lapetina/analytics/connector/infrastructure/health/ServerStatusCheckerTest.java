package fr.lapetina.analytics.connector.infrastructure.health;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.domain.model.ServerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ServerStatusCheckerTest {

    private static final Endpoint LOCAL = Endpoint.parse("http://localhost:10000");
    private static final Endpoint GATEWAY = Endpoint.parse("https://gateway.example.com:8123");

    private InMemoryServerRegistry registry;
    private StubProbeClient probeClient;
    private ServerStatusChecker checker;

    @BeforeEach
    void setUp() {
        registry = new InMemoryServerRegistry();
        registry.replaceAll(List.of(
                ServerDescriptor.builder().endpoint(LOCAL).type(ServerType.DIRECT).build(),
                ServerDescriptor.builder().endpoint(GATEWAY).type(ServerType.GATEWAY).build()
        ));
        probeClient = new StubProbeClient();
        checker = new ServerStatusChecker(registry, probeClient, Duration.ofMillis(50), Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        checker.close();
    }

    @Test
    @DisplayName("should record probe results in the registry")
    void shouldRecordProbeResults() throws Exception {
        probeClient.setRunning(LOCAL, true);

        checker.checkAllServers().get(5, TimeUnit.SECONDS);

        assertThat(registry.getServer(LOCAL).orElseThrow().isRunning()).isTrue();
        assertThat(registry.getServer(GATEWAY).orElseThrow().isRunning()).isFalse();
    }

    @Test
    @DisplayName("should mark a server stopped when its probe fails")
    void shouldMarkStoppedOnFailure() throws Exception {
        registry.updateRunning(LOCAL, true);
        probeClient.setAnswer(LOCAL, CompletableFuture.failedFuture(new IllegalStateException("refused")));

        checker.checkAllServers().get(5, TimeUnit.SECONDS);

        assertThat(registry.getServer(LOCAL).orElseThrow().isRunning()).isFalse();
    }

    @Test
    @DisplayName("should mark a server stopped when its probe times out")
    void shouldMarkStoppedOnTimeout() throws Exception {
        registry.updateRunning(LOCAL, true);
        probeClient.setAnswer(LOCAL, new CompletableFuture<>());

        checker.checkAllServers().get(5, TimeUnit.SECONDS);

        assertThat(registry.getServer(LOCAL).orElseThrow().isRunning()).isFalse();
    }

    @Test
    @DisplayName("should poll periodically once started")
    void shouldPollPeriodically() throws Exception {
        checker.start();
        assertThat(checker.isRunning()).isTrue();

        probeClient.setRunning(GATEWAY, true);

        long deadline = System.currentTimeMillis() + 5000;
        while (!registry.getServer(GATEWAY).orElseThrow().isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(registry.getServer(GATEWAY).orElseThrow().isRunning()).isTrue();
    }
}
