package fr.lapetina.seedrl.infrastructure.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one learner instance, shared by the inference pipeline, the batch
 * assemblers and the training loop.
 *
 * <p>Training counters are written under the model lock by the training loop and read
 * under the same lock to stamp inference outputs.
 */
public final class LearnerStatistics {

    private final AtomicLong inferenceEpochs = new AtomicLong();
    private final AtomicLong inferenceSteps = new AtomicLong();
    private final AtomicLong inferenceNanos = new AtomicLong();
    private final AtomicLong trainingEpochs = new AtomicLong();
    private final AtomicLong trainingSteps = new AtomicLong();
    private final AtomicLong trainingNanos = new AtomicLong();
    private final AtomicLong fetchingNanos = new AtomicLong();

    public void recordInference(int batchSize, long elapsedNanos) {
        inferenceEpochs.incrementAndGet();
        inferenceSteps.addAndGet(batchSize);
        inferenceNanos.addAndGet(elapsedNanos);
    }

    public void recordTraining(int steps, long elapsedNanos) {
        trainingEpochs.incrementAndGet();
        trainingSteps.addAndGet(steps);
        trainingNanos.addAndGet(elapsedNanos);
    }

    public void recordFetching(long elapsedNanos) {
        fetchingNanos.addAndGet(elapsedNanos);
    }

    public long getInferenceEpochs() { return inferenceEpochs.get(); }
    public long getInferenceSteps() { return inferenceSteps.get(); }
    public long getInferenceNanos() { return inferenceNanos.get(); }
    public long getTrainingEpochs() { return trainingEpochs.get(); }
    public long getTrainingSteps() { return trainingSteps.get(); }
    public long getTrainingNanos() { return trainingNanos.get(); }
    public long getFetchingNanos() { return fetchingNanos.get(); }
}
