package fr.lapetina.seedrl.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.seedrl.actor.LearnerEndpoint;
import fr.lapetina.seedrl.api.LearnerHttpServer;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LearnerEndpoint} backed by a remote {@link LearnerHttpServer}, for actors running
 * in another process.
 *
 * Session calls are synchronous; {@link #submit} is asynchronous. Error responses are
 * turned back into the exception the learner raised, based on their {@code type}.
 */
public class LearnerHttpClient implements LearnerEndpoint, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LearnerHttpClient.class);

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public LearnerHttpClient(URI baseUri, Duration connectTimeout, Duration requestTimeout) {
        this.baseUri = baseUri;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public LearnerHttpClient(URI baseUri) {
        this(baseUri, Duration.ofSeconds(10), Duration.ofSeconds(120));
    }

    @Override
    public void checkIn(String callerId, int rank) {
        HttpResponse<String> response = sendBlocking("/v1/sessions/check-in", new SessionRequest(callerId, rank));
        if (response.statusCode() != 200) {
            throw toException(response, callerId, -1);
        }
        log.debug("Checked in: callerId={}, rank={}", callerId, rank);
    }

    @Override
    public void checkOut(String callerId) {
        HttpResponse<String> response = sendBlocking("/v1/sessions/check-out", new SessionRequest(callerId, 0));
        if (response.statusCode() != 200) {
            throw toException(response, callerId, -1);
        }
        log.debug("Checked out: callerId={}", callerId);
    }

    @Override
    public CompletableFuture<SubmitResult> submit(int sourceId, EnvironmentState state, Map<String, Object> metrics) {
        HttpRequest request;
        try {
            request = buildRequest("/v1/inference", SubmitRequest.from(sourceId, state, metrics));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Cannot serialize state", e));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw toException(response, null, sourceId);
                    }
                    try {
                        return objectMapper.readValue(response.body(), SubmitResponse.class).toSubmitResult();
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Malformed inference response", e);
                    }
                });
    }

    @Override
    public void close() {
        // java.net.http.HttpClient has no close() before JDK 21
        log.debug("Learner client closed: baseUri={}", baseUri);
    }

    private HttpResponse<String> sendBlocking(String path, Object body) {
        try {
            return httpClient.send(buildRequest(path, body), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UncheckedIOException("Request to " + path + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + path, e);
        }
    }

    private HttpRequest buildRequest(String path, Object body) throws JsonProcessingException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        return HttpRequest.newBuilder()
                .uri(baseUri.resolve(path))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
    }

    private RuntimeException toException(HttpResponse<String> response, String callerId, int sourceId) {
        ErrorResponse error = parseError(response.body());
        String type = error.getType() != null ? error.getType() : LearnerHttpServer.TYPE_INTERNAL;
        String message = error.getError() != null
                ? error.getError()
                : "HTTP " + response.statusCode();

        return switch (type) {
            case LearnerHttpServer.TYPE_DUPLICATE_SESSION -> new DuplicateSessionException(callerId);
            case LearnerHttpServer.TYPE_UNKNOWN_SESSION -> new UnknownSessionException(callerId);
            case LearnerHttpServer.TYPE_OUTSTANDING_REQUEST -> new OutstandingRequestException(sourceId);
            case LearnerHttpServer.TYPE_PROTOCOL_VIOLATION -> new ProtocolViolationException(message);
            case LearnerHttpServer.TYPE_INVALID_REQUEST -> new IllegalArgumentException(message);
            case LearnerHttpServer.TYPE_BACKPRESSURE -> new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL, message);
            case LearnerHttpServer.TYPE_MODEL_ERROR -> new ModelEvaluationException(message);
            default -> new IllegalStateException(message);
        };
    }

    private ErrorResponse parseError(String body) {
        if (body == null || body.isBlank()) {
            return new ErrorResponse();
        }
        try {
            return objectMapper.readValue(body, ErrorResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable error body: {}", body);
            return new ErrorResponse(body, null);
        }
    }
}
