package fr.lapetina.seedrl.learner;

import fr.lapetina.seedrl.domain.model.TrainingBatch;
import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.infrastructure.metrics.LearnerStatistics;
import fr.lapetina.seedrl.store.DropOffQueue;
import fr.lapetina.seedrl.store.TrainingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Moves finished trajectories from the drop-off queue into training batches.
 *
 * <p>Several assemblers may run concurrently; they share one drain lock so that each
 * batch is taken from the queue atomically. Stacking and enqueueing happen outside the
 * lock.
 */
public final class BatchAssembler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchAssembler.class);

    private final DropOffQueue dropOffQueue;
    private final TrainingQueue trainingQueue;
    private final Lock drainLock;
    private final int batchSize;
    private final int enqueueMaxTries;
    private final Duration enqueueBackoff;
    private final Duration idleSleep;
    private final BooleanSupplier shutdownSignal;
    private final Consumer<Trajectory> trajectoryListener;
    private final LearnerStatistics statistics;

    private BatchAssembler(Builder builder) {
        this.dropOffQueue = builder.dropOffQueue;
        this.trainingQueue = builder.trainingQueue;
        this.drainLock = builder.drainLock;
        this.batchSize = builder.batchSize;
        this.enqueueMaxTries = builder.enqueueMaxTries;
        this.enqueueBackoff = builder.enqueueBackoff;
        this.idleSleep = builder.idleSleep;
        this.shutdownSignal = builder.shutdownSignal;
        this.trajectoryListener = builder.trajectoryListener;
        this.statistics = builder.statistics;
    }

    @Override
    public void run() {
        log.info("Batch assembler started: batchSize={}", batchSize);
        try {
            while (!shutdownSignal.getAsBoolean()) {
                if (!assembleOnce()) {
                    Thread.sleep(idleSleep.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Batch assembler interrupted");
        }
        log.info("Batch assembler stopped");
    }

    /**
     * Takes one batch worth of trajectories, if available, and enqueues it for training.
     *
     * @return false if fewer than {@code batchSize} trajectories were queued
     */
    public boolean assembleOnce() throws InterruptedException {
        long start = System.nanoTime();
        List<Trajectory> trajectories = drain();
        if (trajectories.isEmpty()) {
            return false;
        }

        TrainingBatch batch = TrainingBatch.stack(trajectories);
        boolean enqueued = trainingQueue.offer(batch, enqueueMaxTries, enqueueBackoff);
        statistics.recordFetching(System.nanoTime() - start);

        log.debug("Training batch assembled: size={}, steps={}, enqueued={}, queueDepth={}",
                batch.size(), batch.totalSteps(), enqueued, trainingQueue.size());
        return true;
    }

    private List<Trajectory> drain() {
        drainLock.lock();
        try {
            List<Trajectory> trajectories = dropOffQueue.drainExactly(batchSize);
            for (Trajectory trajectory : trajectories) {
                notifyListener(trajectory);
            }
            return trajectories;
        } finally {
            drainLock.unlock();
        }
    }

    private void notifyListener(Trajectory trajectory) {
        try {
            trajectoryListener.accept(trajectory);
        } catch (RuntimeException e) {
            log.warn("Trajectory listener failed: seq={}, sourceId={}",
                    trajectory.getSequenceNumber(), trajectory.getSourceId(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DropOffQueue dropOffQueue;
        private TrainingQueue trainingQueue;
        private Lock drainLock;
        private int batchSize = 4;
        private int enqueueMaxTries = 50;
        private Duration enqueueBackoff = Duration.ofMillis(100);
        private Duration idleSleep = Duration.ofMillis(100);
        private BooleanSupplier shutdownSignal = () -> false;
        private Consumer<Trajectory> trajectoryListener = trajectory -> { };
        private LearnerStatistics statistics = new LearnerStatistics();

        public Builder dropOffQueue(DropOffQueue dropOffQueue) {
            this.dropOffQueue = dropOffQueue;
            return this;
        }

        public Builder trainingQueue(TrainingQueue trainingQueue) {
            this.trainingQueue = trainingQueue;
            return this;
        }

        public Builder drainLock(Lock drainLock) {
            this.drainLock = drainLock;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder enqueueMaxTries(int enqueueMaxTries) {
            this.enqueueMaxTries = enqueueMaxTries;
            return this;
        }

        public Builder enqueueBackoff(Duration enqueueBackoff) {
            this.enqueueBackoff = enqueueBackoff;
            return this;
        }

        public Builder idleSleep(Duration idleSleep) {
            this.idleSleep = idleSleep;
            return this;
        }

        public Builder shutdownSignal(BooleanSupplier shutdownSignal) {
            this.shutdownSignal = shutdownSignal;
            return this;
        }

        public Builder trajectoryListener(Consumer<Trajectory> trajectoryListener) {
            this.trajectoryListener = trajectoryListener;
            return this;
        }

        public Builder statistics(LearnerStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public BatchAssembler build() {
            if (dropOffQueue == null) {
                throw new IllegalStateException("DropOffQueue is required");
            }
            if (trainingQueue == null) {
                throw new IllegalStateException("TrainingQueue is required");
            }
            if (drainLock == null) {
                throw new IllegalStateException("Drain lock is required");
            }
            if (batchSize <= 0) {
                throw new IllegalStateException("Batch size must be positive");
            }
            return new BatchAssembler(this);
        }
    }
}
