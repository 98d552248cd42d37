package fr.lapetina.analytics.connector;

import fr.lapetina.analytics.connector.api.HttpServer;
import fr.lapetina.analytics.connector.infrastructure.config.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone connector process: a started {@link ConnectorFactory} behind the tool HTTP
 * surface.
 *
 * The factory is started before the HTTP server is bound and is closed again if binding
 * fails. Closing is idempotent, so the shutdown hook and an explicit close may both run.
 */
public class ConnectorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorApplication.class);

    static final String DEFAULT_CONFIG = "connector.yaml";

    private final ConnectorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ConnectorApplication(String configPath) throws Exception {
        this(ConnectorFactory.create(configPath));
    }

    ConnectorApplication(ConnectorFactory factory) throws Exception {
        this.factory = factory.start();
        try {
            this.httpServer = bind(factory);
        } catch (Exception e) {
            log.error("Unable to bind tool HTTP server, releasing connector resources");
            factory.close();
            throw e;
        }
    }

    private static HttpServer bind(ConnectorFactory factory) throws Exception {
        ConnectorConfig config = factory.getConfig();
        ConnectorConfig.ServerConfig server = config.getServer();
        return new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                factory.getConnectionResolver(),
                factory.getWorkerSessions(),
                factory.getServerRegistry(),
                factory.getStatusChecker(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader(),
                Duration.ofMillis(config.getTimeouts().getToolTimeoutMs()));
    }

    public void start() {
        httpServer.start();
        log.info("Connector listening: port={}, servers={}", httpServer.getPort(), factory.getServerRegistry().size());
    }

    /**
     * Blocks until {@link #close()} runs.
     */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    /**
     * Blocks until {@link #close()} runs or the timeout elapses.
     *
     * @return true if the connector was closed
     */
    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public ConnectorFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops accepting tool calls, then releases workers, caches and watchers.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Connector stopping: port={}", httpServer.getPort());

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing connector factory", e);
        }

        stopped.countDown();
        log.info("Connector stopped");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : DEFAULT_CONFIG;

        ConnectorApplication app;
        try {
            app = new ConnectorApplication(configPath);
        } catch (Exception e) {
            log.error("Connector failed to start: config={}", configPath, e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "connector-shutdown"));
        app.start();

        try {
            app.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.close();
        }
    }
}
