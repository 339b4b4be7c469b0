package fr.lapetina.seedrl.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.seedrl.disruptor.OutstandingRequests;
import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.model.ErrorType;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Final stage handler: answers the caller and recycles the event.
 *
 * Responsibilities:
 * - Releases the source's outstanding slot before the caller sees its answer
 * - Completes the caller's future with its own action, the shutdown flag and its source id
 * - Completes failed requests exceptionally
 * - Clears the event for reuse
 */
public final class CompletionHandler implements EventHandler<InferenceRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final OutstandingRequests outstandingRequests;
    private final BooleanSupplier shutdownSignal;

    public CompletionHandler(OutstandingRequests outstandingRequests, BooleanSupplier shutdownSignal) {
        this.outstandingRequests = outstandingRequests;
        this.shutdownSignal = shutdownSignal;
    }

    @Override
    public void onEvent(InferenceRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            complete(event);
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }

    private void complete(InferenceRequestEvent event) {
        CompletableFuture<SubmitResult> future = event.getResponseFuture();
        if (future == null) {
            return;
        }

        int sourceId = event.getSourceId();
        outstandingRequests.release(sourceId);

        if (event.getState() == EventState.STORED) {
            event.markCompleted();
            SubmitResult result = new SubmitResult(
                    event.getStep().action(),
                    shutdownSignal.getAsBoolean(),
                    sourceId
            );
            future.complete(result);

            log.debug("Request completed: sourceId={}, action={}, shutdown={}, batchSize={}, latencyMicros={}",
                    sourceId, result.action(), result.shutdown(), event.getBatchSize(), latencyMicros(event));
        } else {
            Throwable cause = failureCause(event);
            future.completeExceptionally(cause);

            log.warn("Request failed: sourceId={}, state={}, errorType={}, errorMessage={}",
                    sourceId, event.getState(), event.getErrorType(), cause.getMessage());
        }
    }

    private Throwable failureCause(InferenceRequestEvent event) {
        if (event.getError() != null) {
            return event.getError();
        }
        if (event.getErrorType() == ErrorType.VALIDATION_ERROR) {
            return new IllegalArgumentException(event.getErrorMessage());
        }
        return new IllegalStateException("Request ended in state " + event.getState()
                + (event.getErrorMessage() != null ? ": " + event.getErrorMessage() : ""));
    }

    private long latencyMicros(InferenceRequestEvent event) {
        if (event.getAcceptedAt() == null) {
            return 0;
        }
        return Duration.between(event.getAcceptedAt(), Instant.now()).toNanos() / 1_000;
    }
}
