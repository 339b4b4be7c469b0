package fr.lapetina.seedrl.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Fourth stage handler: records metrics and tracing information.
 *
 * Records:
 * - Request count by state
 * - Request and per-stage latency
 * - Errors by type
 * - Sets MDC context for structured logging
 */
public final class MetricsHandler implements EventHandler<InferenceRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(InferenceRequestEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(InferenceRequestEvent event) {
        MDC.put("sourceId", String.valueOf(event.getSourceId()));
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("sourceId");
        MDC.remove("eventState");
    }

    private void recordMetrics(InferenceRequestEvent event) {
        if (event.getState() != null) {
            metricsRegistry.incrementRequestCount(event.getState());
        }

        if (event.getAcceptedAt() != null) {
            metricsRegistry.recordRequestLatency(Duration.between(event.getAcceptedAt(), Instant.now()));
        }

        // Record stage-specific timings
        if (event.getValidatedAt() != null && event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("validation",
                    Duration.between(event.getAcceptedAt(), event.getValidatedAt()));
        }

        if (event.getInferredAt() != null && event.getValidatedAt() != null) {
            metricsRegistry.recordStageLatency("inference",
                    Duration.between(event.getValidatedAt(), event.getInferredAt()));
        }

        if (event.getStoredAt() != null && event.getInferredAt() != null) {
            metricsRegistry.recordStageLatency("store",
                    Duration.between(event.getInferredAt(), event.getStoredAt()));
        }

        if (event.getErrorType() != null) {
            metricsRegistry.incrementErrorCount(event.getErrorType());

            log.warn("Request error recorded: sourceId={}, errorType={}, message={}",
                    event.getSourceId(), event.getErrorType(), event.getErrorMessage());
        }
    }
}
