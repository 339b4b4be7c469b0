package fr.lapetina.seedrl.domain.model;

/**
 * Fixed shapes shared by every trajectory buffer and every inference batch.
 *
 * @param observationSize width of one observation vector
 * @param numActions      width of one policy-logits vector
 */
public record TrajectoryLayout(int observationSize, int numActions) {
    public TrajectoryLayout {
        if (observationSize <= 0) {
            throw new IllegalArgumentException("Observation size must be positive: " + observationSize);
        }
        if (numActions <= 0) {
            throw new IllegalArgumentException("Number of actions must be positive: " + numActions);
        }
    }
}
