package fr.lapetina.seedrl.domain.model;

import java.util.Objects;

/**
 * A single evaluated time-step for one source: the environment state that was submitted
 * and the model outputs produced for it.
 *
 * @param state         the submitted environment state
 * @param action        action chosen by the inference model
 * @param policyLogits  policy distribution (one logit per action)
 * @param baseline      value estimate
 * @param trainingSteps training-step counter of the model version that produced the outputs
 */
public record StepRecord(
        EnvironmentState state,
        int action,
        float[] policyLogits,
        float baseline,
        long trainingSteps
) {
    public StepRecord {
        Objects.requireNonNull(state, "State is required");
        Objects.requireNonNull(policyLogits, "Policy logits are required");
    }

    /**
     * True when this step closes an episode. A {@code done} flag on step zero is the
     * artificial reset frame and does not count.
     */
    public boolean isTerminal() {
        return state.done() && state.episodeStep() > 0;
    }
}
