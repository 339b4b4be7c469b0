package fr.lapetina.seedrl.domain.model;

import java.util.Objects;

/**
 * Batched outputs of one model evaluation. Row {@code i} belongs to the
 * {@code i}-th source of the evaluated {@link InferenceBatch}.
 */
public record InferenceOutput(
        int[] actions,
        float[][] policyLogits,
        float[] baselines
) {
    public InferenceOutput {
        Objects.requireNonNull(actions, "Actions are required");
        Objects.requireNonNull(policyLogits, "Policy logits are required");
        Objects.requireNonNull(baselines, "Baselines are required");
        if (policyLogits.length != actions.length || baselines.length != actions.length) {
            throw new IllegalArgumentException("Output rows disagree: actions=" + actions.length
                    + ", policyLogits=" + policyLogits.length + ", baselines=" + baselines.length);
        }
    }

    public int size() {
        return actions.length;
    }
}
