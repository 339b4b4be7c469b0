package fr.lapetina.seedrl.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.seedrl.disruptor.exception.BackpressureException;
import fr.lapetina.seedrl.disruptor.handlers.*;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.event.InferenceRequestEventFactory;
import fr.lapetina.seedrl.domain.exception.OutstandingRequestException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import fr.lapetina.seedrl.infrastructure.config.LearnerConfig;
import fr.lapetina.seedrl.infrastructure.metrics.LearnerStatistics;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.spi.PolicyModel;
import fr.lapetina.seedrl.store.BatchEntryTable;
import fr.lapetina.seedrl.store.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Disruptor pipeline batching concurrently submitted environment states for the shared
 * inference model.
 *
 * Handler chain: Validation -> Inference -> Trajectory -> Metrics -> Completion.
 *
 * PRODUCER TYPE: MULTI. Every actor thread (or HTTP handler thread for remote actors)
 * publishes concurrently.
 *
 * BATCHING: the inference stage evaluates everything that became available since its last
 * wake-up in one model call, using the Disruptor's end-of-batch signal. Under light load
 * a batch may hold a single request; under heavy load it grows up to the configured bound.
 *
 * ADMISSION: each source may have one request in flight. The completion stage releases a
 * source before its processor publishes the sequence, so a source may hold a finished slot
 * and a new one at the same time: the ring buffer must hold at least two slots per source.
 * A full buffer is reported as backpressure.
 *
 * WAIT STRATEGY: configurable (default BlockingWaitStrategy).
 */
public final class InferencePipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferencePipeline.class);

    private final Disruptor<InferenceRequestEvent> disruptor;
    private final RingBuffer<InferenceRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final OutstandingRequests outstandingRequests = new OutstandingRequests();
    private final long shutdownTimeoutMs;

    // Handlers (exposed for testing)
    private final ValidationHandler validationHandler;
    private final InferenceHandler inferenceHandler;
    private final TrajectoryHandler trajectoryHandler;
    private final MetricsHandler metricsHandler;
    private final CompletionHandler completionHandler;

    private InferencePipeline(Builder builder) {
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        ThreadFactory threadFactory = new DisruptorThreadFactory("inference-pipeline");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new InferenceRequestEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        this.validationHandler = new ValidationHandler(builder.numSources, builder.layout.observationSize());
        this.inferenceHandler = new InferenceHandler(
                builder.inferenceModel,
                builder.modelLock,
                builder.trainingSteps,
                builder.maxInferenceBatchSize,
                builder.layout.numActions(),
                builder.statistics,
                builder.metricsRegistry,
                builder.fatalErrorListener
        );
        this.trajectoryHandler = new TrajectoryHandler(
                builder.batchEntries,
                builder.trajectoryStore,
                builder.fatalErrorListener
        );
        this.metricsHandler = new MetricsHandler(builder.metricsRegistry);
        this.completionHandler = new CompletionHandler(outstandingRequests, builder.shutdownSignal);

        // Each handler sees an event only after the previous one has released it
        disruptor
                .handleEventsWith(validationHandler)
                .then(inferenceHandler)
                .then(trajectoryHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("InferencePipeline created: ringBufferSize={}, waitStrategy={}, maxInferenceBatchSize={}, sources={}",
                builder.ringBufferSize, builder.waitStrategy, builder.maxInferenceBatchSize, builder.numSources);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("InferencePipeline started");
        }
    }

    /**
     * Submits an environment state for inference.
     *
     * @return future completed with the action for {@code sourceId}; failed with
     *         {@link OutstandingRequestException} if the source already waits for an answer,
     *         or with {@link IllegalStateException} if the pipeline is not running
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<SubmitResult> submit(int sourceId, EnvironmentState state, Map<String, Object> metrics) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Inference pipeline not running"));
        }

        if (!outstandingRequests.tryAcquire(sourceId)) {
            log.warn("Rejected request: sourceId={}, reason=outstanding", sourceId);
            return CompletableFuture.failedFuture(new OutstandingRequestException(sourceId));
        }

        CompletableFuture<SubmitResult> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            outstandingRequests.release(sourceId);
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            InferenceRequestEvent event = ringBuffer.get(sequence);
            event.initialize(sourceId, state, metrics, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request submitted: sourceId={}, sequence={}", sourceId, sequence);

        return responseFuture;
    }

    /**
     * Number of submitted requests not yet answered.
     */
    public int getPendingRequests() {
        return outstandingRequests.size();
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains published requests, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down InferencePipeline...");
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                log.info("InferencePipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("InferencePipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     *
     * Marks the event failed and lets it continue down the chain, so that the completion
     * stage releases the source and answers the caller exceptionally.
     */
    private static class DisruptorExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<InferenceRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, InferenceRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getResponseFuture() != null && !event.isTerminal()) {
                event.markFailed(ErrorType.INTERNAL_ERROR, ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for InferencePipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxInferenceBatchSize = 64;
        private long shutdownTimeoutMs = 5_000;
        private int numSources;
        private TrajectoryLayout layout;
        private PolicyModel inferenceModel;
        private Lock modelLock;
        private LongSupplier trainingSteps;
        private BatchEntryTable batchEntries;
        private TrajectoryStore trajectoryStore;
        private LearnerStatistics statistics;
        private MetricsRegistry metricsRegistry;
        private BooleanSupplier shutdownSignal = () -> false;
        private Consumer<Throwable> fatalErrorListener = ex -> { };

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxInferenceBatchSize(int size) {
            this.maxInferenceBatchSize = size;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder numSources(int numSources) {
            this.numSources = numSources;
            return this;
        }

        public Builder layout(TrajectoryLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder inferenceModel(PolicyModel model) {
            this.inferenceModel = model;
            return this;
        }

        public Builder modelLock(Lock lock) {
            this.modelLock = lock;
            return this;
        }

        /**
         * Source of the training-step stamp; read under the model lock.
         */
        public Builder trainingSteps(LongSupplier trainingSteps) {
            this.trainingSteps = trainingSteps;
            return this;
        }

        public Builder batchEntries(BatchEntryTable batchEntries) {
            this.batchEntries = batchEntries;
            return this;
        }

        public Builder trajectoryStore(TrajectoryStore store) {
            this.trajectoryStore = store;
            return this;
        }

        public Builder statistics(LearnerStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder shutdownSignal(BooleanSupplier shutdownSignal) {
            this.shutdownSignal = shutdownSignal;
            return this;
        }

        public Builder fatalErrorListener(Consumer<Throwable> listener) {
            this.fatalErrorListener = listener;
            return this;
        }

        public Builder fromConfig(LearnerConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxInferenceBatchSize = config.getDisruptor().getMaxInferenceBatchSize();
            this.shutdownTimeoutMs = config.getShutdown().getJoinTimeoutMs();
            this.numSources = config.numSources();
            this.layout = new TrajectoryLayout(
                    config.getLayout().getObservationSize(),
                    config.getLayout().getNumActions()
            );
            return this;
        }

        public InferencePipeline build() {
            if (numSources <= 0) {
                throw new IllegalStateException("Number of sources is required");
            }
            if (ringBufferSize < 2 * numSources) {
                throw new IllegalStateException("Ring buffer of " + ringBufferSize
                        + " cannot hold two requests per source (" + numSources + " sources)");
            }
            if (layout == null) {
                throw new IllegalStateException("TrajectoryLayout is required");
            }
            if (inferenceModel == null) {
                throw new IllegalStateException("Inference PolicyModel is required");
            }
            if (modelLock == null) {
                throw new IllegalStateException("Model lock is required");
            }
            if (trainingSteps == null) {
                throw new IllegalStateException("Training step supplier is required");
            }
            if (batchEntries == null) {
                throw new IllegalStateException("BatchEntryTable is required");
            }
            if (trajectoryStore == null) {
                throw new IllegalStateException("TrajectoryStore is required");
            }
            if (statistics == null) {
                throw new IllegalStateException("LearnerStatistics is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new InferencePipeline(this);
        }
    }
}
