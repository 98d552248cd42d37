package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.WorkerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryDraftFactoryTest {

    private QueryDraftFactory factory;

    @BeforeEach
    void setUp() {
        factory = new QueryDraftFactory(WorkerDefaults.DEFAULTS, () -> "fixed");
    }

    @Test
    @DisplayName("should draft from server values when there are no overrides")
    void shouldDraftFromServerValues() {
        StubGatewayClient client = new StubGatewayClient(Endpoint.parse("https://gateway.example.com:8123"));

        QueryDraft draft = factory.createDraft(client, null, "python").join();

        assertThat(draft.name()).isEqualTo("analytics connector - fixed");
        assertThat(draft.type()).isEqualTo("InteractiveConsole");
        assertThat(draft.owner()).isEqualTo("alice");
        assertThat(draft.dbServerName()).isEqualTo("Query 1");
        assertThat(draft.heapSizeGb()).isEqualTo(8.0);
        assertThat(draft.jvmArgs()).isEqualTo("-Dhttp.websockets=true");
        assertThat(draft.jvmProfile()).isEqualTo("Default");
        assertThat(draft.scriptLanguage()).isEqualTo("Python");
        assertThat(draft.workerKind()).isEqualTo("DeephavenCommunity");
        assertThat(draft.timeZone()).isEqualTo("America/New_York");
        assertThat(draft.schedulerQueue()).isEqualTo("InteractiveConsoleTemporaryQueue");
        assertThat(draft.autoDeleteTimeoutMs()).isEqualTo(600_000L);
    }

    @Test
    @DisplayName("should apply per-gateway overrides")
    void shouldApplyOverrides() {
        WorkerConfig overrides = new WorkerConfig("Query 9", 2.5, "-Xss4m", "Large", "Groovy");

        QueryDraft draft = factory.buildDraft("bob", overrides, "python",
                List.of("Query 1"), new QueryConstants(8.0), ServerConfigValues.EMPTY);

        assertThat(draft.dbServerName()).isEqualTo("Query 9");
        assertThat(draft.heapSizeGb()).isEqualTo(2.5);
        assertThat(draft.jvmArgs()).isEqualTo("-Dhttp.websockets=true -Xss4m");
        assertThat(draft.jvmProfile()).isEqualTo("Large");
        assertThat(draft.scriptLanguage()).isEqualTo("Groovy");
    }

    @Test
    @DisplayName("should fall back when the server publishes nothing")
    void shouldFallBackWithoutServerValues() {
        QueryDraft draft = factory.buildDraft("bob", WorkerConfig.DEFAULTS, null,
                List.of(), null, null);

        assertThat(draft.dbServerName()).isEqualTo("Query 1");
        assertThat(draft.heapSizeGb()).isEqualTo(QueryDraftFactory.FALLBACK_HEAP_GB);
        assertThat(draft.scriptLanguage()).isEqualTo("Python");
        assertThat(draft.workerKind()).isNull();
        assertThat(draft.timeZone()).isEqualTo(ZoneId.systemDefault().getId());
    }

    @Test
    @DisplayName("should negotiate the server's spelling of the language")
    void shouldNegotiateLanguage() {
        List<String> providers = List.of("Groovy", "Python");

        assertThat(factory.negotiateLanguage("GROOVY", providers)).isEqualTo("Groovy");
        assertThat(factory.negotiateLanguage("python", providers)).isEqualTo("Python");
        assertThat(factory.negotiateLanguage("scala", providers)).isEqualTo("Python");
        assertThat(factory.negotiateLanguage(null, providers)).isEqualTo("Python");
    }
}
