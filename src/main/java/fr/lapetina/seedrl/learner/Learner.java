package fr.lapetina.seedrl.learner;

import fr.lapetina.seedrl.actor.ActorPool;
import fr.lapetina.seedrl.actor.LearnerEndpoint;
import fr.lapetina.seedrl.disruptor.InferencePipeline;
import fr.lapetina.seedrl.domain.exception.ModelEvaluationException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.domain.model.TrainingBatch;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import fr.lapetina.seedrl.infrastructure.config.LearnerConfig;
import fr.lapetina.seedrl.infrastructure.metrics.LearnerStatistics;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.session.SessionRegistry;
import fr.lapetina.seedrl.spi.EnvironmentFactory;
import fr.lapetina.seedrl.spi.EpisodeRecorder;
import fr.lapetina.seedrl.spi.MetricLogger;
import fr.lapetina.seedrl.spi.PolicyModel;
import fr.lapetina.seedrl.store.BatchEntryTable;
import fr.lapetina.seedrl.store.DropOffQueue;
import fr.lapetina.seedrl.store.TrainingQueue;
import fr.lapetina.seedrl.store.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The callee: serves inference to its callers, keeps their trajectories and trains on
 * them.
 *
 * <p>Threads involved:
 * <ul>
 *   <li>caller threads (local actors or HTTP handlers) submitting requests,</li>
 *   <li>the inference pipeline's handler threads,</li>
 *   <li>one or more batch assembler threads,</li>
 *   <li>the thread calling {@link #run()}, which trains.</li>
 * </ul>
 * Inference and training share one model lock; evaluation, the training step and the
 * parameter copy into the inference model never overlap.
 *
 * <p>Shutdown is cooperative. Once requested, every answer carries the shutdown flag;
 * callers leave their loop and check out. {@link #run()} waits (bounded) for that, stops
 * the workers and always produces a {@link LearnerReport}.
 */
public final class Learner implements LearnerEndpoint, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Learner.class);

    private final String name;
    private final LearnerConfig config;
    private final PolicyModel trainingModel;
    private final PolicyModel inferenceModel;
    private final MetricLogger metricLogger;
    private final EnvironmentFactory environmentFactory;
    private final MetricsRegistry metricsRegistry;

    private final ReentrantLock modelLock = new ReentrantLock();
    private final ReentrantLock drainLock = new ReentrantLock();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicReference<LearnerState> state = new AtomicReference<>(LearnerState.IDLE);
    private final AtomicReference<Throwable> fatalError = new AtomicReference<>();
    private volatile ShutdownReason shutdownReason;
    private volatile LearnerReport report;

    private final LearnerStatistics statistics = new LearnerStatistics();
    private final SessionRegistry sessions = new SessionRegistry();
    private final DropOffQueue dropOffQueue;
    private final TrajectoryStore trajectoryStore;
    private final TrainingQueue trainingQueue;
    private final InferencePipeline pipeline;
    private final EpisodeTracker episodeTracker;
    private final LivenessWatchdog watchdog;
    private final List<Thread> assemblerThreads = new ArrayList<>();
    private ActorPool actorPool;

    private long startNanos;
    private int iterationsSinceSystemLog;

    private Learner(Builder builder) {
        this.config = builder.config;
        this.trainingModel = builder.trainingModel;
        this.inferenceModel = builder.inferenceModel;
        this.metricLogger = builder.metricLogger;
        this.environmentFactory = builder.environmentFactory;
        this.metricsRegistry = builder.metricsRegistry;
        this.name = "learner-" + config.getTopology().getLearnerRank();

        TrajectoryLayout layout = new TrajectoryLayout(
                config.getLayout().getObservationSize(),
                config.getLayout().getNumActions()
        );
        int numSources = config.numSources();

        this.dropOffQueue = new DropOffQueue(config.dropOffCapacity());
        this.trajectoryStore = new TrajectoryStore(numSources, config.getRollout().getLength(), layout, dropOffQueue);
        this.trainingQueue = new TrainingQueue(config.getQueues().getMaxQueuedBatches());
        this.episodeTracker = new EpisodeTracker(metricLogger, builder.episodeRecorder, metricsRegistry);

        this.pipeline = InferencePipeline.builder()
                .fromConfig(config)
                .inferenceModel(inferenceModel)
                .modelLock(modelLock)
                .trainingSteps(statistics::getTrainingSteps)
                .batchEntries(new BatchEntryTable(numSources))
                .trajectoryStore(trajectoryStore)
                .statistics(statistics)
                .metricsRegistry(metricsRegistry)
                .shutdownSignal(shutdownRequested::get)
                .fatalErrorListener(this::onFatalError)
                .build();

        this.watchdog = new LivenessWatchdog(
                config.getWatchdog().getStallThreshold(),
                trainingQueue::size,
                dropOffQueue::size,
                pipeline::getPendingRequests
        );

        registerMetrics();

        log.info("Learner created: name={}, sources={}, rollout={}, batchSizeTraining={}, dropOffCapacity={}",
                name, numSources, config.getRollout().getLength(),
                config.getRollout().getBatchSizeTraining(), dropOffQueue.capacity());
    }

    private void registerMetrics() {
        metricsRegistry.registerGauge("training_queue_depth", "Training batches waiting", trainingQueue::size);
        metricsRegistry.registerGauge("drop_off_queue_depth", "Trajectories waiting to be batched", dropOffQueue::size);
        metricsRegistry.registerGauge("pending_requests", "Submitted requests not yet answered",
                pipeline::getPendingRequests);
        metricsRegistry.registerGauge("sessions", "Callers checked in", sessions::size);
        metricsRegistry.registerCounter("trajectories_dropped_off_total", "Trajectories handed off by the store",
                trajectoryStore::getHandedOffCount);
        metricsRegistry.registerCounter("trajectories_evicted_total", "Trajectories evicted from the drop-off queue",
                dropOffQueue::getEvictedCount);
        metricsRegistry.registerCounter("batches_discarded_total", "Training batches discarded on a full queue",
                trainingQueue::getDiscardedCount);
    }

    /**
     * Starts the inference pipeline, the batch assemblers and, when configured, the local
     * actors.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startNanos = System.nanoTime();
        pipeline.start();

        for (int i = 0; i < config.getQueues().getNumPrefetchers(); i++) {
            BatchAssembler assembler = BatchAssembler.builder()
                    .dropOffQueue(dropOffQueue)
                    .trainingQueue(trainingQueue)
                    .drainLock(drainLock)
                    .batchSize(config.getRollout().getBatchSizeTraining())
                    .enqueueMaxTries(config.getQueues().getEnqueueMaxTries())
                    .enqueueBackoff(Duration.ofMillis(config.getQueues().getEnqueueBackoffMs()))
                    .idleSleep(Duration.ofMillis(config.getQueues().getPrefetchIdleMs()))
                    .shutdownSignal(shutdownRequested::get)
                    .trajectoryListener(episodeTracker)
                    .statistics(statistics)
                    .build();
            Thread thread = new Thread(assembler, "batch-assembler-" + i);
            thread.setDaemon(true);
            thread.start();
            assemblerThreads.add(thread);
        }

        if (environmentFactory != null && config.getTopology().isStartLocalActors()) {
            actorPool = new ActorPool(
                    this,
                    environmentFactory,
                    config.getTopology().getNumActors(),
                    config.getTopology().getEnvsPerActor(),
                    Duration.ofMillis(config.getServer().getRequestTimeoutMs()),
                    Duration.ofMillis(config.getShutdown().getJoinTimeoutMs())
            );
            actorPool.start();
        }

        log.info("Learner started: name={}, assemblers={}, localActors={}",
                name, assemblerThreads.size(), actorPool != null);
    }

    /**
     * Trains until a shutdown condition is met, then shuts down.
     *
     * @return the final report
     * @throws ModelEvaluationException if the run ended on a fatal model or store failure;
     *         the report has been produced and logged before
     */
    public LearnerReport run() {
        start();
        running.set(true);
        LearnerReport finalReport;
        try {
            while (!shutdownRequested.get()) {
                iterate();
            }
        } catch (RuntimeException e) {
            log.error("Training loop failed", e);
            onFatalError(e);
        } finally {
            finalReport = shutdown();
            running.set(false);
        }

        Throwable fatal = fatalError.get();
        if (fatal != null) {
            if (fatal instanceof ModelEvaluationException) {
                throw (ModelEvaluationException) fatal;
            }
            throw new ModelEvaluationException("Learner stopped after fatal failure: " + fatal.getMessage(), fatal);
        }
        return finalReport;
    }

    /**
     * One pass of the training loop: train on a queued batch if there is one, otherwise
     * sleep briefly; then periodic logging, the watchdog and the shutdown limits.
     */
    public void iterate() {
        if (!started.get()) {
            throw new IllegalStateException("Learner not started");
        }

        Optional<TrainingBatch> batch = trainingQueue.poll();
        if (batch.isPresent()) {
            state.compareAndSet(LearnerState.IDLE, LearnerState.TRAINING);
            try {
                train(batch.get());
            } finally {
                state.compareAndSet(LearnerState.TRAINING, LearnerState.IDLE);
            }
        } else {
            sleepIdle();
        }

        int systemLogInterval = config.getReporting().getSystemLogInterval();
        if (systemLogInterval > 0 && ++iterationsSinceSystemLog >= systemLogInterval) {
            iterationsSinceSystemLog = 0;
            logMetrics("system", systemMetrics());
        }

        if (watchdog.check()) {
            requestShutdown(ShutdownReason.STALLED);
        }

        checkLimits();
    }

    private void train(TrainingBatch batch) {
        long start = System.nanoTime();
        Map<String, Double> trainingMetrics;

        modelLock.lock();
        try {
            trainingMetrics = trainingModel.train(batch);
            if (inferenceModel != trainingModel) {
                inferenceModel.restore(trainingModel.snapshot());
            }
            statistics.recordTraining(batch.totalSteps(), System.nanoTime() - start);
        } finally {
            modelLock.unlock();
        }

        metricsRegistry.recordTrainingStep(Duration.ofNanos(System.nanoTime() - start));

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("runtime", runtimeSeconds());
        record.put("training_time", statistics.getTrainingNanos() / 1e9);
        record.put("training_epoch", statistics.getTrainingEpochs());
        record.put("training_steps", statistics.getTrainingSteps());
        if (trainingMetrics != null) {
            record.putAll(trainingMetrics);
        }
        logMetrics("training", record);

        int printInterval = config.getReporting().getPrintInterval();
        if (config.getReporting().isVerbose() && printInterval > 0
                && statistics.getTrainingEpochs() % printInterval == 0) {
            log.info("Training progress: {}", systemMetrics());
        }
    }

    private void sleepIdle() {
        try {
            Thread.sleep(config.getTraining().getIdleSleepMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestShutdown(ShutdownReason.INTERRUPTED);
        }
    }

    private void checkLimits() {
        long maxEpochs = config.getLimits().getMaxEpochs();
        long totalSteps = config.getLimits().getTotalSteps();
        long maxTimeSeconds = config.getLimits().getMaxTimeSeconds();

        if (maxEpochs > 0 && statistics.getTrainingEpochs() > maxEpochs) {
            requestShutdown(ShutdownReason.MAX_EPOCHS);
        } else if (totalSteps > 0 && statistics.getTrainingSteps() > totalSteps) {
            requestShutdown(ShutdownReason.TOTAL_STEPS);
        } else if (maxTimeSeconds > 0 && runtimeSeconds() > maxTimeSeconds) {
            requestShutdown(ShutdownReason.MAX_TIME);
        }
    }

    /**
     * Asks callers and workers to stop. The first reason wins.
     */
    public void requestShutdown(ShutdownReason reason) {
        if (shutdownRequested.compareAndSet(false, true)) {
            shutdownReason = reason;
            log.info("Shutdown requested: name={}, reason={}, trainingEpochs={}, trainingSteps={}",
                    name, reason, statistics.getTrainingEpochs(), statistics.getTrainingSteps());
        }
    }

    private void onFatalError(Throwable error) {
        if (fatalError.compareAndSet(null, error)) {
            log.error("Fatal failure, shutting down: name={}, reason={}", name, error.getMessage());
        }
        requestShutdown(ShutdownReason.FATAL_ERROR);
    }

    private LearnerReport shutdown() {
        if (!finished.compareAndSet(false, true)) {
            return report;
        }
        state.set(LearnerState.SHUTTING_DOWN);
        requestShutdown(ShutdownReason.CLOSED);
        Duration runtime = Duration.ofNanos(System.nanoTime() - startNanos);

        awaitCheckOut();
        joinAssemblers();
        if (actorPool != null) {
            closeQuietly("actor pool", actorPool);
        }
        closeQuietly("inference pipeline", pipeline);

        try {
            metricLogger.flush();
        } catch (RuntimeException e) {
            log.warn("Metric logger flush failed", e);
        }

        report = new LearnerReport(
                name,
                shutdownReason,
                runtime,
                statistics.getInferenceSteps(),
                statistics.getTrainingSteps(),
                statistics.getTrainingEpochs(),
                Duration.ofNanos(statistics.getInferenceNanos()),
                Duration.ofNanos(statistics.getTrainingNanos()),
                Duration.ofNanos(statistics.getFetchingNanos()),
                episodeTracker.getMeanLatency(),
                episodeTracker.getEpisodesSeen(),
                episodeTracker.getTrajectoriesSeen(),
                trainingQueue.getDiscardedCount(),
                dropOffQueue.getEvictedCount()
        );
        log.info("Learner report: {}", report);

        state.set(LearnerState.STOPPED);
        return report;
    }

    private void awaitCheckOut() {
        Duration timeout = Duration.ofMillis(config.getShutdown().getCheckOutTimeoutMs());
        try {
            if (!sessions.awaitEmpty(timeout)) {
                log.warn("Callers still checked in after {}: remaining={}", timeout, sessions.getSessions());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for callers to check out");
        }
    }

    private void joinAssemblers() {
        long joinTimeoutMs = config.getShutdown().getJoinTimeoutMs();
        for (Thread thread : assemblerThreads) {
            try {
                thread.join(joinTimeoutMs);
                if (thread.isAlive()) {
                    log.warn("Batch assembler did not stop in time: thread={}", thread.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while joining batch assembler: thread={}", thread.getName());
                return;
            }
        }
    }

    private static void closeQuietly(String what, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}", what, e);
        }
    }

    private double runtimeSeconds() {
        return started.get() ? (System.nanoTime() - startNanos) / 1e9 : 0.0;
    }

    /**
     * Snapshot of the learner's counters, as logged on the {@code system} channel.
     */
    public Map<String, Object> systemMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("runtime", runtimeSeconds());
        metrics.put("trajectories_seen", episodeTracker.getTrajectoriesSeen());
        metrics.put("episodes_seen", episodeTracker.getEpisodesSeen());
        metrics.put("mean_inference_latency", episodeTracker.getMeanLatency());
        metrics.put("fetching_time", statistics.getFetchingNanos() / 1e9);
        metrics.put("inference_time", statistics.getInferenceNanos() / 1e9);
        metrics.put("inference_steps", statistics.getInferenceSteps());
        metrics.put("training_time", statistics.getTrainingNanos() / 1e9);
        metrics.put("training_steps", statistics.getTrainingSteps());
        metrics.put("queue_batches", trainingQueue.size());
        metrics.put("queue_drop_off", dropOffQueue.size());
        metrics.put("queue_rpcs", pipeline.getPendingRequests());
        return metrics;
    }

    private void logMetrics(String channel, Map<String, Object> record) {
        try {
            metricLogger.log(channel, record);
        } catch (RuntimeException e) {
            log.warn("Metric logger failed on channel {}", channel, e);
        }
    }

    // LearnerEndpoint

    @Override
    public void checkIn(String callerId, int rank) {
        sessions.checkIn(callerId, rank);
    }

    @Override
    public void checkOut(String callerId) {
        sessions.checkOut(callerId);
    }

    @Override
    public CompletableFuture<SubmitResult> submit(int sourceId, EnvironmentState state, Map<String, Object> metrics) {
        return pipeline.submit(sourceId, state, metrics);
    }

    /**
     * Requests shutdown. If {@link #run()} is not driving the learner, also performs the
     * shutdown sequence.
     */
    @Override
    public void close() {
        requestShutdown(ShutdownReason.CLOSED);
        if (running.get()) {
            return;
        }
        if (started.get()) {
            shutdown();
        } else {
            closeQuietly("inference pipeline", pipeline);
            state.set(LearnerState.STOPPED);
        }
    }

    // Getters

    public String getName() { return name; }
    public LearnerState getState() { return state.get(); }
    public boolean isShutdownRequested() { return shutdownRequested.get(); }
    public ShutdownReason getShutdownReason() { return shutdownReason; }
    public Optional<LearnerReport> getReport() { return Optional.ofNullable(report); }
    public LearnerStatistics getStatistics() { return statistics; }
    public SessionRegistry getSessions() { return sessions; }
    public TrainingQueue getTrainingQueue() { return trainingQueue; }
    public DropOffQueue getDropOffQueue() { return dropOffQueue; }
    public TrajectoryStore getTrajectoryStore() { return trajectoryStore; }
    public EpisodeTracker getEpisodeTracker() { return episodeTracker; }
    public int getPendingRequests() { return pipeline.getPendingRequests(); }
    public Optional<ActorPool> getActorPool() { return Optional.ofNullable(actorPool); }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Learner.
     */
    public static final class Builder {
        private LearnerConfig config;
        private PolicyModel trainingModel;
        private PolicyModel inferenceModel;
        private MetricLogger metricLogger;
        private EpisodeRecorder episodeRecorder = EpisodeRecorder.NOOP;
        private EnvironmentFactory environmentFactory;
        private MetricsRegistry metricsRegistry;

        public Builder config(LearnerConfig config) {
            this.config = config;
            return this;
        }

        public Builder trainingModel(PolicyModel model) {
            this.trainingModel = model;
            return this;
        }

        /**
         * Model serving inference. Defaults to the training model, in which case no
         * parameter copy happens after training steps.
         */
        public Builder inferenceModel(PolicyModel model) {
            this.inferenceModel = model;
            return this;
        }

        public Builder metricLogger(MetricLogger metricLogger) {
            this.metricLogger = metricLogger;
            return this;
        }

        public Builder episodeRecorder(EpisodeRecorder episodeRecorder) {
            this.episodeRecorder = episodeRecorder;
            return this;
        }

        /**
         * Environments for local actors. Without one, the learner only serves remote callers.
         */
        public Builder environmentFactory(EnvironmentFactory environmentFactory) {
            this.environmentFactory = environmentFactory;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Learner build() {
            if (config == null) {
                throw new IllegalStateException("LearnerConfig is required");
            }
            if (trainingModel == null) {
                throw new IllegalStateException("Training PolicyModel is required");
            }
            if (inferenceModel == null) {
                inferenceModel = trainingModel;
            }
            if (metricLogger == null) {
                throw new IllegalStateException("MetricLogger is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (episodeRecorder == null) {
                episodeRecorder = EpisodeRecorder.NOOP;
            }
            config.validate();
            return new Learner(this);
        }
    }
}
