package fr.lapetina.seedrl.spi;

import fr.lapetina.seedrl.domain.model.InferenceBatch;
import fr.lapetina.seedrl.domain.model.InferenceOutput;
import fr.lapetina.seedrl.domain.model.TrainingBatch;

import java.util.Map;

/**
 * A policy network as seen by the learner.
 *
 * <p>The learner keeps two instances: one that is trained and one that serves inference.
 * After every training step the trained parameters are copied into the inference instance
 * through {@link #snapshot()} and {@link #restore(ModelSnapshot)}. All calls on either
 * instance happen under the learner's model lock, so implementations need not be
 * thread-safe.
 */
public interface PolicyModel {

    /**
     * Evaluates a batch of environment states.
     *
     * @return one action, one policy-logits row and one baseline per row of {@code batch}
     */
    InferenceOutput evaluate(InferenceBatch batch);

    /**
     * Runs one optimisation step on a training batch.
     *
     * @return named training statistics (losses, gradient norms, ...), logged as-is
     */
    Map<String, Double> train(TrainingBatch batch);

    ModelSnapshot snapshot();

    void restore(ModelSnapshot snapshot);
}
