package fr.lapetina.seedrl.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.seedrl.api.dto.ErrorResponse;
import fr.lapetina.seedrl.api.dto.SessionRequest;
import fr.lapetina.seedrl.api.dto.SubmitRequest;
import fr.lapetina.seedrl.api.dto.SubmitResponse;
import fr.lapetina.seedrl.disruptor.exception.BackpressureException;
import fr.lapetina.seedrl.domain.exception.DuplicateSessionException;
import fr.lapetina.seedrl.domain.exception.ModelEvaluationException;
import fr.lapetina.seedrl.domain.exception.OutstandingRequestException;
import fr.lapetina.seedrl.domain.exception.ProtocolViolationException;
import fr.lapetina.seedrl.domain.exception.UnknownSessionException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.learner.Learner;
import fr.lapetina.seedrl.learner.LearnerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Remote surface of a learner, on the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/sessions/check-in - Register a caller
 * - POST /v1/sessions/check-out - Unregister a caller
 * - POST /v1/inference - Submit one environment state, answered with its action
 * - GET /health - Learner state and queue depths
 * - GET /metrics - Prometheus metrics endpoint (when enabled)
 *
 * Every error body is an {@link ErrorResponse} whose {@code type} is one of the
 * {@code TYPE_*} constants.
 */
public final class LearnerHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LearnerHttpServer.class);

    public static final String TYPE_DUPLICATE_SESSION = "duplicate_session";
    public static final String TYPE_UNKNOWN_SESSION = "unknown_session";
    public static final String TYPE_OUTSTANDING_REQUEST = "outstanding_request";
    public static final String TYPE_PROTOCOL_VIOLATION = "protocol_violation";
    public static final String TYPE_INVALID_REQUEST = "invalid_request";
    public static final String TYPE_BACKPRESSURE = "backpressure";
    public static final String TYPE_UNAVAILABLE = "unavailable";
    public static final String TYPE_MODEL_ERROR = "model_error";
    public static final String TYPE_TIMEOUT = "timeout";
    public static final String TYPE_INTERNAL = "internal_error";

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Learner learner;
    private final MetricsRegistry metricsRegistry;
    private final long requestTimeoutMs;

    public LearnerHttpServer(
            String host,
            int port,
            int backlog,
            Learner learner,
            MetricsRegistry metricsRegistry,
            long requestTimeoutMs,
            boolean metricsEnabled
    ) throws IOException {
        this.learner = learner;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeoutMs = requestTimeoutMs;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);

        // Each inference call blocks until its batch cycle completes
        this.executor = Executors.newCachedThreadPool(new ServerThreadFactory());
        server.setExecutor(executor);

        server.createContext("/v1/sessions/check-in", new CheckInHandler());
        server.createContext("/v1/sessions/check-out", new CheckOutHandler());
        server.createContext("/v1/inference", new InferenceHandler());
        server.createContext("/health", new HealthHandler());
        if (metricsEnabled) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
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

    // ==================== SESSION HANDLERS ====================

    private class CheckInHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", TYPE_INVALID_REQUEST);
                return;
            }
            try {
                SessionRequest request = readBody(exchange, SessionRequest.class);
                if (request == null || request.getCallerId() == null || request.getCallerId().isBlank()) {
                    sendError(exchange, 400, "Missing 'caller_id' field", TYPE_INVALID_REQUEST);
                    return;
                }
                MDC.put("callerId", request.getCallerId());
                learner.checkIn(request.getCallerId(), request.getRank());
                log.info("Caller checked in: callerId={}, rank={}", request.getCallerId(), request.getRank());
                sendJson(exchange, 200, Map.of("caller_id", request.getCallerId(), "status", "checked_in"));
            } catch (Exception e) {
                handleFailure(exchange, e);
            } finally {
                MDC.clear();
            }
        }
    }

    private class CheckOutHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", TYPE_INVALID_REQUEST);
                return;
            }
            try {
                SessionRequest request = readBody(exchange, SessionRequest.class);
                if (request == null || request.getCallerId() == null || request.getCallerId().isBlank()) {
                    sendError(exchange, 400, "Missing 'caller_id' field", TYPE_INVALID_REQUEST);
                    return;
                }
                MDC.put("callerId", request.getCallerId());
                learner.checkOut(request.getCallerId());
                log.info("Caller checked out: callerId={}", request.getCallerId());
                sendJson(exchange, 200, Map.of("caller_id", request.getCallerId(), "status", "checked_out"));
            } catch (Exception e) {
                handleFailure(exchange, e);
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== INFERENCE HANDLER ====================

    private class InferenceHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", TYPE_INVALID_REQUEST);
                return;
            }
            try {
                SubmitRequest request = readBody(exchange, SubmitRequest.class);
                if (request == null) {
                    sendError(exchange, 400, "Empty request body", TYPE_INVALID_REQUEST);
                    return;
                }
                MDC.put("sourceId", String.valueOf(request.getSourceId()));

                EnvironmentState state = request.toEnvironmentState();
                CompletableFuture<SubmitResult> future =
                        learner.submit(request.getSourceId(), state, request.getMetrics());

                SubmitResult result = future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
                sendJson(exchange, 200, SubmitResponse.fromSubmitResult(result));

            } catch (ExecutionException e) {
                handleFailure(exchange, e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                log.warn("Inference request timed out after {} ms", requestTimeoutMs);
                sendError(exchange, 504, "Inference timed out after " + requestTimeoutMs + " ms", TYPE_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted", TYPE_UNAVAILABLE);
            } catch (Exception e) {
                handleFailure(exchange, e);
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", TYPE_INVALID_REQUEST);
                return;
            }

            LearnerState state = learner.getState();
            boolean up = state == LearnerState.IDLE || state == LearnerState.TRAINING;

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", up ? "UP" : "DOWN");
            health.put("timestamp", System.currentTimeMillis());
            health.put("learner", learner.getName());
            health.put("state", state.name());
            health.put("sessions", learner.getSessions().size());

            Map<String, Object> queues = new LinkedHashMap<>();
            queues.put("pendingRequests", learner.getPendingRequests());
            queues.put("dropOff", learner.getDropOffQueue().size());
            queues.put("training", learner.getTrainingQueue().size());
            health.put("queues", queues);

            sendJson(exchange, up ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed", TYPE_INVALID_REQUEST);
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] body = is.readAllBytes();
            if (body.length == 0) {
                return null;
            }
            return objectMapper.readValue(body, type);
        }
    }

    private void handleFailure(HttpExchange exchange, Throwable e) throws IOException {
        if (e instanceof DuplicateSessionException) {
            log.error("Protocol violation: {}", e.getMessage());
            sendError(exchange, 409, e.getMessage(), TYPE_DUPLICATE_SESSION);
        } else if (e instanceof UnknownSessionException) {
            log.error("Protocol violation: {}", e.getMessage());
            sendError(exchange, 404, e.getMessage(), TYPE_UNKNOWN_SESSION);
        } else if (e instanceof OutstandingRequestException) {
            log.error("Protocol violation: {}", e.getMessage());
            sendError(exchange, 409, e.getMessage(), TYPE_OUTSTANDING_REQUEST);
        } else if (e instanceof ProtocolViolationException) {
            log.error("Protocol violation: {}", e.getMessage());
            sendError(exchange, 409, e.getMessage(), TYPE_PROTOCOL_VIOLATION);
        } else if (e instanceof JsonProcessingException || e instanceof IllegalArgumentException) {
            log.debug("Rejected request: {}", e.getMessage());
            sendError(exchange, 400, e.getMessage(), TYPE_INVALID_REQUEST);
        } else if (e instanceof BackpressureException) {
            log.warn("Backpressure: {}", e.getMessage());
            sendError(exchange, 503, e.getMessage(), TYPE_BACKPRESSURE);
        } else if (e instanceof IllegalStateException) {
            log.warn("Learner unavailable: {}", e.getMessage());
            sendError(exchange, 503, e.getMessage(), TYPE_UNAVAILABLE);
        } else if (e instanceof ModelEvaluationException) {
            log.error("Model evaluation failed: {}", e.getMessage());
            sendError(exchange, 500, e.getMessage(), TYPE_MODEL_ERROR);
        } else {
            log.error("Error handling request", e);
            sendError(exchange, 500, "Internal server error: " + e.getMessage(), TYPE_INTERNAL);
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

    private void sendError(HttpExchange exchange, int statusCode, String message, String type) throws IOException {
        sendJson(exchange, statusCode, new ErrorResponse(message, type));
    }

    private static class ServerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "learner-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
