package fr.lapetina.seedrl.infrastructure.metrics;

import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters by state and error counters by type
 * - Request, pipeline stage, inference and training timers
 * - Queue depth gauges and loss counters registered by the learner
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<EventState, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final Timer requestLatency;
    private final Timer inferenceTimer;
    private final Timer trainingTimer;
    private final DistributionSummary inferenceBatchSize;
    private final Counter episodesCompleted;

    public MetricsRegistry(String prefix, boolean bindSystemMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindSystemMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        this.requestLatency = Timer.builder(prefix + "_request_latency")
                .description("Time from submission to answer")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        this.inferenceTimer = Timer.builder(prefix + "_inference_batch_duration")
                .description("Model evaluation time per inference batch")
                .register(registry);

        this.trainingTimer = Timer.builder(prefix + "_training_step_duration")
                .description("Training step time, parameter copy included")
                .register(registry);

        this.inferenceBatchSize = DistributionSummary.builder(prefix + "_inference_batch_size")
                .description("Number of requests evaluated together")
                .register(registry);

        this.episodesCompleted = Counter.builder(prefix + "_episodes_total")
                .description("Episodes seen in trajectories handed to training")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Increments the request counter for a final state.
     */
    public void incrementRequestCount(EventState state) {
        requestCounters.computeIfAbsent(state, s ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of submitted requests")
                        .tag("state", s.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, t ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("type", t.name())
                        .register(registry)
        ).increment();
    }

    public void recordRequestLatency(Duration latency) {
        requestLatency.record(latency);
    }

    /**
     * Records stage-specific latency (validation, inference, store).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(latency);
    }

    public void recordInferenceBatch(int batchSize, Duration duration) {
        inferenceBatchSize.record(batchSize);
        inferenceTimer.record(duration);
    }

    public void recordTrainingStep(Duration duration) {
        trainingTimer.record(duration);
    }

    public void incrementEpisodes() {
        episodesCompleted.increment();
    }

    /**
     * Registers a gauge backed by a live value, e.g. a queue depth.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Registers a monotonically increasing counter owned by another component.
     */
    public void registerCounter(String name, String description, Supplier<Number> valueSupplier) {
        FunctionCounter.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    @Override
    public void close() {
        registry.close();
    }
}
