package fr.lapetina.seedrl.infrastructure.metrics;

import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry registry = new MetricsRegistry("test", false);

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("should expose live gauge values in the scrape")
    void shouldScrapeGauges() {
        AtomicInteger depth = new AtomicInteger(3);
        registry.registerGauge("training_queue_depth", "Training batches waiting", depth::get);

        assertThat(registry.scrape()).contains("test_training_queue_depth 3.0");

        depth.set(5);

        assertThat(registry.scrape()).contains("test_training_queue_depth 5.0");
    }

    @Test
    @DisplayName("should tag request and error counters")
    void shouldTagCounters() {
        registry.incrementRequestCount(EventState.COMPLETED);
        registry.incrementRequestCount(EventState.COMPLETED);
        registry.incrementErrorCount(ErrorType.MODEL_ERROR);

        String scrape = registry.scrape();

        assertThat(scrape).contains("test_requests_total{state=\"COMPLETED\",} 2.0");
        assertThat(scrape).contains("test_errors_total{type=\"MODEL_ERROR\",} 1.0");
    }

    @Test
    @DisplayName("should record inference batch sizes and durations")
    void shouldRecordInferenceBatches() {
        registry.recordInferenceBatch(4, Duration.ofMillis(2));
        registry.recordInferenceBatch(2, Duration.ofMillis(1));

        String scrape = registry.scrape();

        assertThat(scrape).contains("test_inference_batch_size_count 2.0");
        assertThat(scrape).contains("test_inference_batch_size_sum 6.0");
        assertThat(scrape).contains("test_inference_batch_duration_seconds_count 2.0");
    }
}
