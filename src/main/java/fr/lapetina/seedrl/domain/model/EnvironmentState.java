package fr.lapetina.seedrl.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One environment time-step as seen by an actor: the observation vector plus the
 * episode bookkeeping the learner needs to cut trajectories.
 *
 * <p>{@code extras} carries arbitrary per-source fields. Numeric ones (numbers, primitive
 * arrays, lists of numbers) are concatenated by the inference batcher; everything else
 * passes through untouched.
 */
public record EnvironmentState(
        float[] observation,
        float reward,
        boolean done,
        long episodeId,
        int episodeStep,
        float episodeReturn,
        Map<String, Object> extras
) {
    public EnvironmentState {
        Objects.requireNonNull(observation, "Observation is required");
        if (episodeStep < 0) {
            throw new IllegalArgumentException("Episode step must not be negative: " + episodeStep);
        }
        // Map.copyOf rejects null values, which JSON payloads may legitimately carry
        extras = extras != null ? Collections.unmodifiableMap(new HashMap<>(extras)) : Map.of();
    }

    /**
     * Creates the first state of an episode.
     */
    public static EnvironmentState initial(float[] observation, long episodeId) {
        return new EnvironmentState(observation, 0f, false, episodeId, 0, 0f, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private float[] observation;
        private float reward;
        private boolean done;
        private long episodeId;
        private int episodeStep;
        private float episodeReturn;
        private Map<String, Object> extras;

        public Builder observation(float[] observation) {
            this.observation = observation;
            return this;
        }

        public Builder reward(float reward) {
            this.reward = reward;
            return this;
        }

        public Builder done(boolean done) {
            this.done = done;
            return this;
        }

        public Builder episodeId(long episodeId) {
            this.episodeId = episodeId;
            return this;
        }

        public Builder episodeStep(int episodeStep) {
            this.episodeStep = episodeStep;
            return this;
        }

        public Builder episodeReturn(float episodeReturn) {
            this.episodeReturn = episodeReturn;
            return this;
        }

        public Builder extras(Map<String, Object> extras) {
            this.extras = extras;
            return this;
        }

        public EnvironmentState build() {
            return new EnvironmentState(
                    observation, reward, done, episodeId, episodeStep, episodeReturn, extras
            );
        }
    }
}
