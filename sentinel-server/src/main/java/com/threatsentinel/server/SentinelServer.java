package com.threatsentinel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.threatsentinel.core.engine.SentinelEngine;
import com.threatsentinel.core.json.JsonSupport;
import com.threatsentinel.core.model.MonitorConfig;
import com.threatsentinel.core.model.SecurityEvent;
import com.threatsentinel.core.monitor.MonitorNotFoundException;
import com.threatsentinel.core.monitor.MonitorStartResult;
import com.threatsentinel.core.service.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP front end of the engine, on the JDK built-in {@link HttpServer}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST /log_event}: submit a security event</li>
 * <li>{@code POST /run_simulation}: start the attack simulator</li>
 * <li>{@code GET /attack_log}: persisted incidents</li>
 * <li>{@code POST /monitor/website}: start monitoring a website</li>
 * <li>{@code DELETE /monitor/website/{url}}: stop monitoring it</li>
 * <li>{@code GET /monitor/websites}: monitored websites and latest health</li>
 * <li>{@code GET /analytics}: attack statistics</li>
 * <li>{@code GET /metrics}: current metrics snapshot</li>
 * <li>{@code GET /stream}: live broadcast messages as server-sent events</li>
 * <li>{@code GET /health}, {@code GET /readiness}: probes</li>
 * </ul>
 *
 * <p>
 * Invalid input maps to 400, unknown monitors to 404 and unexpected failures
 * to 500, always with a JSON body {@code {"error": "..."}}.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    static final String MONITOR_PATH = "/monitor/website";

    /** Default interval between keep-alive comments on idle streams. */
    static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final SentinelEngine engine;
    private final ObjectMapper mapper;
    private final Duration heartbeat;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong streamIds = new AtomicLong();

    private HttpServer server;
    private ExecutorService executor;

    public SentinelServer(SentinelEngine engine) {
        this(engine, JsonSupport.newObjectMapper(), HEARTBEAT_INTERVAL);
    }

    SentinelServer(SentinelEngine engine, ObjectMapper mapper, Duration heartbeat) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat must not be null");
    }

    /**
     * Bind and start serving.
     *
     * @param port TCP port in range [0, 65535]; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start HTTP server on port " + port, e);
        }
        server.createContext("/log_event", endpoint("POST", this::handleLogEvent));
        server.createContext("/run_simulation", endpoint("POST", this::handleRunSimulation));
        server.createContext("/attack_log", endpoint("GET", this::handleAttackLog));
        server.createContext(MONITOR_PATH, this::handleMonitor);
        server.createContext("/monitor/websites", endpoint("GET", this::handleListMonitors));
        server.createContext("/analytics", endpoint("GET",
                exchange -> sendJson(exchange, 200, engine.getAnalytics().summarize())));
        server.createContext("/metrics", endpoint("GET",
                exchange -> sendJson(exchange, 200, engine.getMetrics().snapshot())));
        server.createContext("/stream", endpoint("GET", this::handleStream));
        server.createContext("/health", endpoint("GET", SentinelServer::handleHealthCheck));
        server.createContext("/readiness", endpoint("GET", SentinelServer::handleHealthCheck));

        // Streams hold their thread for the lifetime of the connection.
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-worker");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop accepting requests and release open streams.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port; useful after {@code start(0)}
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleLogEvent(HttpExchange exchange) throws IOException {
        SecurityEvent event = mapper.readValue(exchange.getRequestBody(), SecurityEvent.class);
        if (event == null) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        SecurityEvent.Builder enriched = event.toBuilder();
        if (event.getSourceIp() == null || event.getSourceIp().isBlank()) {
            enriched.sourceIp(clientIp(exchange));
        }
        if (event.getUserAgent() == null) {
            enriched.userAgent(exchange.getRequestHeaders().getFirst("User-Agent"));
        }
        SubmissionResult result = engine.getService().submitEvent(enriched.build());
        sendJson(exchange, result.httpStatus(), result);
    }

    private void handleRunSimulation(HttpExchange exchange) throws IOException {
        if (engine.getSimulator().start()) {
            sendJson(exchange, 202, Map.of("message", "Attack simulation scheduled successfully."));
        } else {
            sendJson(exchange, 409, Map.of("error", "Attack simulation already running."));
        }
    }

    private void handleAttackLog(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, engine.getIncidentLog().readAll());
    }

    private void handleMonitor(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getRawPath();
        if (path.equals(MONITOR_PATH) || path.equals(MONITOR_PATH + "/")) {
            endpoint("POST", this::handleStartMonitor).handle(exchange);
        } else if (path.startsWith(MONITOR_PATH + "/")) {
            endpoint("DELETE", this::handleStopMonitor).handle(exchange);
        } else {
            endpoint(exchange.getRequestMethod(), e -> sendError(e, 404, "Not found: " + path)).handle(exchange);
        }
    }

    private void handleStartMonitor(HttpExchange exchange) throws IOException {
        MonitorConfig config = mapper.readValue(exchange.getRequestBody(), MonitorConfig.class);
        if (config == null) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        MonitorStartResult result = engine.getMonitors().start(config);
        sendJson(exchange, 200, result);
    }

    private void handleStopMonitor(HttpExchange exchange) throws IOException {
        String raw = exchange.getRequestURI().getRawPath().substring(MONITOR_PATH.length() + 1);
        String url = URLDecoder.decode(raw, StandardCharsets.UTF_8);
        if (url.isBlank()) {
            throw new IllegalArgumentException("Monitor URL is required");
        }
        engine.getMonitors().stop(url);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "STOPPED");
        body.put("url", url);
        body.put("message", "Stopped monitoring " + url);
        sendJson(exchange, 200, body);
    }

    private void handleListMonitors(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, Map.of("websites", engine.getMonitors().list()));
    }

    private void handleStream(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.sendResponseHeaders(200, 0);

        SseObserver observer = new SseObserver("sse-" + streamIds.incrementAndGet(), exchange.getResponseBody());
        observer.comment("connected");
        engine.getContext().getHub().register(observer);
        try {
            observer.serve(heartbeat);
        } finally {
            engine.getContext().getHub().unregister(observer.id());
            observer.close();
        }
    }

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }

    /**
     * Wrap a route with method checking and the error-to-status mapping.
     */
    private HttpHandler endpoint(String method, Route route) {
        return exchange -> {
            try {
                if (!method.equals(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    sendError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed");
                    return;
                }
                route.handle(exchange);
            } catch (JsonProcessingException e) {
                LOG.debug("Malformed JSON on {}: {}", exchange.getRequestURI(), e.getOriginalMessage());
                sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (MonitorNotFoundException e) {
                sendError(exchange, 404, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.getMessage(), e);
                sendError(exchange, 500, "Internal server error");
            } finally {
                exchange.close();
            }
        };
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        sendJson(exchange, status, Map.of("error", message != null ? message : "error"));
    }

    /**
     * Client address for events without an explicit {@code source_ip}: the
     * first {@code X-Forwarded-For} hop, else the remote address.
     */
    static String clientIp(HttpExchange exchange) {
        String forwarded = exchange.getRequestHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
