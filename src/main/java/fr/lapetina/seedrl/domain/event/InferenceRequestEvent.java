package fr.lapetina.seedrl.domain.event;

import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import fr.lapetina.seedrl.domain.model.StepRecord;
import fr.lapetina.seedrl.domain.model.SubmitResult;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one submitted environment state through the pipeline.
 *
 * Mutable and reused across the ring buffer; each handler stage updates it as the
 * request moves along. It must never be touched outside the pipeline handlers.
 */
public final class InferenceRequestEvent {

    // Submitted data
    private int sourceId;
    private EnvironmentState environmentState;
    private Map<String, Object> metrics;

    // Mutable state tracking
    private EventState state;
    private StepRecord step;
    private int batchSize;
    private ErrorType errorType;
    private String errorMessage;
    private Throwable error;

    // Timing
    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant inferredAt;
    private Instant storedAt;
    private Instant completedAt;

    private CompletableFuture<SubmitResult> responseFuture;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.sourceId = -1;
        this.environmentState = null;
        this.metrics = null;
        this.state = null;
        this.step = null;
        this.batchSize = 0;
        this.errorType = null;
        this.errorMessage = null;
        this.error = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.inferredAt = null;
        this.storedAt = null;
        this.completedAt = null;
        this.responseFuture = null;
        this.sequence = -1;
    }

    public void initialize(
            int sourceId,
            EnvironmentState environmentState,
            Map<String, Object> metrics,
            CompletableFuture<SubmitResult> responseFuture
    ) {
        clear();
        this.sourceId = sourceId;
        this.environmentState = environmentState;
        this.metrics = metrics != null ? metrics : Map.of();
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    // Getters
    public int getSourceId() {
        return sourceId;
    }

    public EnvironmentState getEnvironmentState() {
        return environmentState;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public EventState getState() {
        return state;
    }

    public StepRecord getStep() {
        return step;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Throwable getError() {
        return error;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getInferredAt() {
        return inferredAt;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public CompletableFuture<SubmitResult> getResponseFuture() {
        return responseFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void setState(EventState state) {
        this.state = state;
    }

    public void setError(ErrorType errorType, String message) {
        this.errorType = errorType;
        this.errorMessage = message;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markInferred(StepRecord step, int batchSize) {
        this.step = step;
        this.batchSize = batchSize;
        this.state = EventState.INFERRED;
        this.inferredAt = Instant.now();
    }

    public void markStored() {
        this.state = EventState.STORED;
        this.storedAt = Instant.now();
    }

    public void markCompleted() {
        this.state = EventState.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void markFailed(ErrorType errorType, Throwable error) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = error.getMessage();
        this.error = error;
        this.completedAt = Instant.now();
    }

    public boolean isTerminal() {
        return state == EventState.COMPLETED || state == EventState.FAILED;
    }

    /**
     * Checks if processing should skip the remaining work stages.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED || isTerminal();
    }

    @Override
    public String toString() {
        return "InferenceRequestEvent{" +
                "sourceId=" + sourceId +
                ", state=" + state +
                ", batchSize=" + batchSize +
                ", seq=" + sequence +
                '}';
    }
}
