package fr.lapetina.seedrl.support;

import fr.lapetina.seedrl.domain.model.InferenceBatch;
import fr.lapetina.seedrl.domain.model.InferenceOutput;
import fr.lapetina.seedrl.domain.model.TrainingBatch;
import fr.lapetina.seedrl.spi.ModelSnapshot;
import fr.lapetina.seedrl.spi.PolicyModel;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Policy model whose action for a source is {@code sourceId % numActions}.
 */
public final class StubPolicyModel implements PolicyModel {

    private final int numActions;
    private final List<Integer> evaluatedBatchSizes = new CopyOnWriteArrayList<>();
    private final List<TrainingBatch> trainedBatches = new CopyOnWriteArrayList<>();
    private final AtomicLong version = new AtomicLong();
    private volatile RuntimeException evaluationFailure;
    private volatile ModelSnapshot restored;

    public StubPolicyModel(int numActions) {
        this.numActions = numActions;
    }

    @Override
    public InferenceOutput evaluate(InferenceBatch batch) {
        if (evaluationFailure != null) {
            throw evaluationFailure;
        }
        int size = batch.size();
        evaluatedBatchSizes.add(size);
        int[] actions = new int[size];
        float[][] logits = new float[size][numActions];
        float[] baselines = new float[size];
        for (int i = 0; i < size; i++) {
            actions[i] = batch.getSourceIds()[i] % numActions;
            logits[i][actions[i]] = 1f;
            baselines[i] = batch.getRewards()[i];
        }
        return new InferenceOutput(actions, logits, baselines);
    }

    @Override
    public Map<String, Double> train(TrainingBatch batch) {
        trainedBatches.add(batch);
        version.incrementAndGet();
        return Map.of("total_loss", 1.0 / trainedBatches.size());
    }

    @Override
    public ModelSnapshot snapshot() {
        return new ModelSnapshot(version.get(), Map.of("weights", new float[]{version.get()}));
    }

    @Override
    public void restore(ModelSnapshot snapshot) {
        this.restored = snapshot;
        version.set(snapshot.version());
    }

    public void failEvaluationWith(RuntimeException failure) {
        this.evaluationFailure = failure;
    }

    public List<Integer> getEvaluatedBatchSizes() {
        return evaluatedBatchSizes;
    }

    public List<TrainingBatch> getTrainedBatches() {
        return trainedBatches;
    }

    public long getVersion() {
        return version.get();
    }

    public ModelSnapshot getRestored() {
        return restored;
    }
}
