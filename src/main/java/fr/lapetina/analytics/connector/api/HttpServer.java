package fr.lapetina.analytics.connector.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.analytics.connector.api.dto.ToolRequest;
import fr.lapetina.analytics.connector.api.dto.ToolResponse;
import fr.lapetina.analytics.connector.connection.ConnectionResolver;
import fr.lapetina.analytics.connector.connection.ConnectionResult;
import fr.lapetina.analytics.connector.domain.model.CodeSession;
import fr.lapetina.analytics.connector.domain.model.ConnectionState;
import fr.lapetina.analytics.connector.domain.model.Endpoint;
import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;
import fr.lapetina.analytics.connector.infrastructure.config.ConfigLoader;
import fr.lapetina.analytics.connector.infrastructure.config.ConnectorConfig;
import fr.lapetina.analytics.connector.infrastructure.health.InMemoryServerRegistry;
import fr.lapetina.analytics.connector.infrastructure.health.ServerStatusChecker;
import fr.lapetina.analytics.connector.infrastructure.health.WorkerSession;
import fr.lapetina.analytics.connector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.analytics.connector.worker.WorkerSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /tools/connection - Resolve a ready connection for a server URL
 * - POST /tools/workers - Provision a worker session on a gateway
 * - POST /tools/workers/delete - Close a worker session and delete the worker
 * - GET /servers - List servers and their connections
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 * - POST /admin/status - Probe every server now
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ConnectionResolver resolver;
    private final WorkerSessionService workerSessions;
    private final InMemoryServerRegistry registry;
    private final ServerStatusChecker statusChecker;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Duration toolTimeout;

    public HttpServer(
            String host,
            int port,
            int backlog,
            ConnectionResolver resolver,
            WorkerSessionService workerSessions,
            InMemoryServerRegistry registry,
            ServerStatusChecker statusChecker,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader,
            Duration toolTimeout
    ) throws IOException {
        this.resolver = resolver;
        this.workerSessions = workerSessions;
        this.registry = registry;
        this.statusChecker = statusChecker;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.toolTimeout = toolTimeout;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/tools/connection", new ConnectionToolHandler());
        server.createContext("/tools/workers", new WorkerToolHandler());
        server.createContext("/servers", new ServersHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== TOOL HANDLERS ====================

    private class ConnectionToolHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            long start = System.nanoTime();

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                ToolRequest request = readToolRequest(exchange);
                Endpoint endpoint = request.toEndpoint();

                ConnectionResult result = resolver.resolve(endpoint, request.getLanguageId())
                        .get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
                metricsRegistry.incrementResolution(result.isSuccess() ? "success" : result.error().name());

                sendJson(exchange, 200, ToolResponse.fromConnectionResult(result, elapsedMs(start)));

            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, ToolResponse.error(e.getMessage(), null, null, elapsedMs(start)));
            } catch (Exception e) {
                log.error("Error handling connection tool request", e);
                sendJson(exchange, 500, ToolResponse.error(
                        "Internal server error: " + rootMessage(e), null, null, elapsedMs(start)));
            } finally {
                MDC.clear();
            }
        }
    }

    private class WorkerToolHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            long start = System.nanoTime();
            String path = exchange.getRequestURI().getPath();

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                ToolRequest request = readToolRequest(exchange);
                Endpoint endpoint = request.toEndpoint();

                if (path.equals("/tools/workers")) {
                    handleOpen(exchange, endpoint, request.getLanguageId(), start);
                } else if (path.equals("/tools/workers/delete")) {
                    handleClose(exchange, endpoint, start);
                } else {
                    sendError(exchange, 404, "Not Found");
                }

            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, ToolResponse.error(e.getMessage(), null, null, elapsedMs(start)));
            } catch (ExecutionException e) {
                log.warn("Worker tool request failed: path={}, error={}", path, rootMessage(e));
                sendJson(exchange, 200, ToolResponse.error(rootMessage(e), null, null, elapsedMs(start)));
            } catch (TimeoutException e) {
                sendJson(exchange, 504, ToolResponse.error(
                        "Timed out after " + toolTimeout.toMillis() + " ms", null, null, elapsedMs(start)));
            } catch (Exception e) {
                log.error("Error handling worker tool request", e);
                sendJson(exchange, 500, ToolResponse.error(
                        "Internal server error: " + rootMessage(e), null, null, elapsedMs(start)));
            } finally {
                MDC.clear();
            }
        }

        private void handleOpen(HttpExchange exchange, Endpoint gateway, String languageId, long start)
                throws Exception {
            WorkerSession session = workerSessions.openSession(gateway, languageId)
                    .get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connectionUrl", session.getEndpoint().toUri().toString());
            details.put("serial", session.getWorker().serial().value());
            if (session.getWorker().workerName() != null) {
                details.put("workerName", session.getWorker().workerName());
            }
            if (session.getWorker().ideUrl() != null) {
                details.put("ideUrl", session.getWorker().ideUrl().toString());
            }
            sendJson(exchange, 200, ToolResponse.success("Worker session opened", details, elapsedMs(start)));
        }

        private void handleClose(HttpExchange exchange, Endpoint worker, long start) throws Exception {
            boolean closed = workerSessions.closeSession(worker)
                    .get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connectionUrl", worker.toUri().toString());
            if (closed) {
                sendJson(exchange, 200, ToolResponse.success("Worker session closed", details, elapsedMs(start)));
            } else {
                sendJson(exchange, 200, ToolResponse.error("No worker session found", details, null, elapsedMs(start)));
            }
        }
    }

    // ==================== SERVERS HANDLER ====================

    private class ServersHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<Map<String, Object>> servers = new ArrayList<>();
            for (ServerDescriptor server : registry.getServers()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("url", server.getEndpoint().toString());
                info.put("type", server.getType().name());
                if (server.getLabel() != null) {
                    info.put("label", server.getLabel());
                }
                info.put("isRunning", server.isRunning());
                info.put("isManaged", server.isManaged());

                List<Map<String, Object>> connections = new ArrayList<>();
                for (ConnectionState connection : registry.getConnections(server.getEndpoint())) {
                    Map<String, Object> connectionInfo = new LinkedHashMap<>();
                    connectionInfo.put("url", connection.getEndpoint().toString());
                    connectionInfo.put("isConnected", connection.isConnected());
                    connectionInfo.put("isRunningCode", connection.isRunningCode());
                    connectionInfo.put("supportsCodeExecution", connection instanceof CodeSession);
                    connection.getTagId().ifPresent(tagId -> connectionInfo.put("tagId", tagId));
                    connections.add(connectionInfo);
                }
                info.put("connectionCount", connections.size());
                info.put("connections", connections);
                servers.add(info);
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("servers", servers);
            sendJson(exchange, 200, body);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            int total = registry.size();
            int running = registry.getRunningServers().size();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(total, running));
            health.put("timestamp", System.currentTimeMillis());
            health.put("servers", total);
            health.put("runningServers", running);
            health.put("connections", registry.getConnections().size());
            health.put("trackedWorkers", metricsRegistry.getTrackedWorkers());
            health.put("statusChecks", statusChecker.isRunning());

            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(int total, int running) {
            if (total == 0 || running == total) {
                return "UP";
            }
            return running == 0 ? "DOWN" : "DEGRADED";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            metricsRegistry.setRunningServers(registry.getRunningServers().size());
            metricsRegistry.setOpenConnections(registry.getConnections().size());

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else if (path.equals("/admin/status") && "POST".equals(method)) {
                    handleStatusCheck(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, rootMessage(e));
            }
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            ConnectorConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "servers", newConfig == null ? 0 : newConfig.getServers().size()
            ));
        }

        private void handleStatusCheck(HttpExchange exchange) throws Exception {
            statusChecker.checkAllServers().get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
            sendJson(exchange, 200, Map.of(
                    "message", "Status check completed",
                    "runningServers", registry.getRunningServers().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private ToolRequest readToolRequest(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return objectMapper.readValue(is, ToolRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid request body: " + e.getOriginalMessage(), e);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message == null ? "Unknown error" : message);
        sendJson(exchange, statusCode, error);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
