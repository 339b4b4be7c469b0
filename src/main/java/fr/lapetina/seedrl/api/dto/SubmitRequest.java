package fr.lapetina.seedrl.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.seedrl.domain.model.EnvironmentState;

import java.util.Map;

/**
 * Wire form of one submitted environment state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitRequest {

    @JsonProperty("source_id")
    private int sourceId;

    private float[] observation;
    private float reward;
    private boolean done;

    @JsonProperty("episode_id")
    private long episodeId;

    @JsonProperty("episode_step")
    private int episodeStep;

    @JsonProperty("episode_return")
    private float episodeReturn;

    private Map<String, Object> extras;
    private Map<String, Object> metrics;

    // Getters and setters
    public int getSourceId() { return sourceId; }
    public void setSourceId(int sourceId) { this.sourceId = sourceId; }

    public float[] getObservation() { return observation; }
    public void setObservation(float[] observation) { this.observation = observation; }

    public float getReward() { return reward; }
    public void setReward(float reward) { this.reward = reward; }

    public boolean isDone() { return done; }
    public void setDone(boolean done) { this.done = done; }

    public long getEpisodeId() { return episodeId; }
    public void setEpisodeId(long episodeId) { this.episodeId = episodeId; }

    public int getEpisodeStep() { return episodeStep; }
    public void setEpisodeStep(int episodeStep) { this.episodeStep = episodeStep; }

    public float getEpisodeReturn() { return episodeReturn; }
    public void setEpisodeReturn(float episodeReturn) { this.episodeReturn = episodeReturn; }

    public Map<String, Object> getExtras() { return extras; }
    public void setExtras(Map<String, Object> extras) { this.extras = extras; }

    public Map<String, Object> getMetrics() { return metrics; }
    public void setMetrics(Map<String, Object> metrics) { this.metrics = metrics; }

    /**
     * Converts to domain EnvironmentState.
     *
     * @throws IllegalArgumentException if the observation is missing
     */
    public EnvironmentState toEnvironmentState() {
        if (observation == null) {
            throw new IllegalArgumentException("Observation is required");
        }
        return new EnvironmentState(observation, reward, done, episodeId, episodeStep, episodeReturn, extras);
    }

    /**
     * Creates from a domain EnvironmentState.
     */
    public static SubmitRequest from(int sourceId, EnvironmentState state, Map<String, Object> metrics) {
        SubmitRequest request = new SubmitRequest();
        request.sourceId = sourceId;
        request.observation = state.observation();
        request.reward = state.reward();
        request.done = state.done();
        request.episodeId = state.episodeId();
        request.episodeStep = state.episodeStep();
        request.episodeReturn = state.episodeReturn();
        request.extras = state.extras().isEmpty() ? null : state.extras();
        request.metrics = metrics == null || metrics.isEmpty() ? null : metrics;
        return request;
    }
}
