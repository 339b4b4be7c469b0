package fr.lapetina.seedrl.domain.model;

import fr.lapetina.seedrl.domain.exception.TrajectoryOverflowException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-capacity, column-oriented buffer of consecutive time-steps from one source.
 *
 * <p>Columns are pre-allocated for {@code maxLength} steps. Rows at index
 * {@code >= currentLength} are zero and carry no meaning. Instances are not thread-safe;
 * the trajectory store guards each live buffer with its source lock and hands out deep
 * copies only.
 */
public final class Trajectory {

    private final int sourceId;
    private final int maxLength;
    private final TrajectoryLayout layout;

    private long sequenceNumber;
    private int currentLength;
    private boolean complete;

    private final float[][] observations;
    private final float[] rewards;
    private final boolean[] dones;
    private final long[] episodeIds;
    private final int[] episodeSteps;
    private final float[] episodeReturns;
    private final int[] actions;
    private final float[][] policyLogits;
    private final float[] baselines;
    private final long[] trainingSteps;
    private final List<Map<String, Object>> metrics;

    public Trajectory(int sourceId, int maxLength, TrajectoryLayout layout, long sequenceNumber) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Trajectory length must be positive: " + maxLength);
        }
        this.sourceId = sourceId;
        this.maxLength = maxLength;
        this.layout = layout;
        this.sequenceNumber = sequenceNumber;
        this.observations = new float[maxLength][layout.observationSize()];
        this.rewards = new float[maxLength];
        this.dones = new boolean[maxLength];
        this.episodeIds = new long[maxLength];
        this.episodeSteps = new int[maxLength];
        this.episodeReturns = new float[maxLength];
        this.actions = new int[maxLength];
        this.policyLogits = new float[maxLength][layout.numActions()];
        this.baselines = new float[maxLength];
        this.trainingSteps = new long[maxLength];
        this.metrics = new ArrayList<>(Collections.nCopies(maxLength, Map.of()));
    }

    private Trajectory(Trajectory other) {
        this.sourceId = other.sourceId;
        this.maxLength = other.maxLength;
        this.layout = other.layout;
        this.sequenceNumber = other.sequenceNumber;
        this.currentLength = other.currentLength;
        this.complete = other.complete;
        this.observations = deepCopy(other.observations);
        this.rewards = other.rewards.clone();
        this.dones = other.dones.clone();
        this.episodeIds = other.episodeIds.clone();
        this.episodeSteps = other.episodeSteps.clone();
        this.episodeReturns = other.episodeReturns.clone();
        this.actions = other.actions.clone();
        this.policyLogits = deepCopy(other.policyLogits);
        this.baselines = other.baselines.clone();
        this.trainingSteps = other.trainingSteps.clone();
        this.metrics = new ArrayList<>(other.metrics.size());
        for (Map<String, Object> row : other.metrics) {
            this.metrics.add(row.isEmpty() ? Map.of() : new HashMap<>(row));
        }
    }

    /**
     * Writes a step at {@code currentLength} and advances it.
     *
     * @throws TrajectoryOverflowException if the buffer is already full
     * @throws IllegalArgumentException    if the step's vectors do not match the layout
     */
    public void append(StepRecord step, Map<String, Object> stepMetrics) {
        if (isFull()) {
            throw new TrajectoryOverflowException(sourceId, maxLength);
        }
        EnvironmentState state = step.state();
        checkWidth("observation", state.observation().length, layout.observationSize());
        checkWidth("policy logits", step.policyLogits().length, layout.numActions());

        int i = currentLength;
        System.arraycopy(state.observation(), 0, observations[i], 0, layout.observationSize());
        rewards[i] = state.reward();
        dones[i] = state.done();
        episodeIds[i] = state.episodeId();
        episodeSteps[i] = state.episodeStep();
        episodeReturns[i] = state.episodeReturn();
        actions[i] = step.action();
        System.arraycopy(step.policyLogits(), 0, policyLogits[i], 0, layout.numActions());
        baselines[i] = step.baseline();
        trainingSteps[i] = step.trainingSteps();
        metrics.set(i, stepMetrics != null ? new HashMap<>(stepMetrics) : Map.of());
        currentLength++;
    }

    public void markComplete() {
        this.complete = true;
    }

    /**
     * Zero-fills every column and starts over under a new sequence number.
     */
    public void reset(long newSequenceNumber) {
        for (int i = 0; i < currentLength; i++) {
            Arrays.fill(observations[i], 0f);
            Arrays.fill(policyLogits[i], 0f);
            metrics.set(i, Map.of());
        }
        Arrays.fill(rewards, 0f);
        Arrays.fill(dones, false);
        Arrays.fill(episodeIds, 0L);
        Arrays.fill(episodeSteps, 0);
        Arrays.fill(episodeReturns, 0f);
        Arrays.fill(actions, 0);
        Arrays.fill(baselines, 0f);
        Arrays.fill(trainingSteps, 0L);
        this.currentLength = 0;
        this.complete = false;
        this.sequenceNumber = newSequenceNumber;
    }

    /**
     * Deep copy; the result shares no mutable state with this buffer.
     */
    public Trajectory copy() {
        return new Trajectory(this);
    }

    public boolean isFull() {
        return currentLength >= maxLength;
    }

    /**
     * True when the step at {@code index} ends an episode (done on a non-initial step).
     */
    public boolean isTerminalStep(int index) {
        return index < currentLength && dones[index] && episodeSteps[index] > 0;
    }

    private static void checkWidth(String what, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(
                    "Unexpected " + what + " width: expected " + expected + ", got " + actual);
        }
    }

    private static float[][] deepCopy(float[][] source) {
        float[][] copy = new float[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    // Getters

    public int getSourceId() { return sourceId; }
    public int getMaxLength() { return maxLength; }
    public TrajectoryLayout getLayout() { return layout; }
    public long getSequenceNumber() { return sequenceNumber; }
    public int getCurrentLength() { return currentLength; }
    public boolean isComplete() { return complete; }
    public float[][] getObservations() { return observations; }
    public float[] getRewards() { return rewards; }
    public boolean[] getDones() { return dones; }
    public long[] getEpisodeIds() { return episodeIds; }
    public int[] getEpisodeSteps() { return episodeSteps; }
    public float[] getEpisodeReturns() { return episodeReturns; }
    public int[] getActions() { return actions; }
    public float[][] getPolicyLogits() { return policyLogits; }
    public float[] getBaselines() { return baselines; }
    public long[] getTrainingSteps() { return trainingSteps; }

    public Map<String, Object> getMetrics(int index) {
        return metrics.get(index);
    }

    @Override
    public String toString() {
        return "Trajectory{" +
                "sourceId=" + sourceId +
                ", sequenceNumber=" + sequenceNumber +
                ", currentLength=" + currentLength +
                ", maxLength=" + maxLength +
                ", complete=" + complete +
                '}';
    }
}
