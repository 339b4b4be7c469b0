package fr.lapetina.seedrl.domain.model;

import java.util.List;

/**
 * A fixed number of trajectories stacked along a batch dimension.
 *
 * <p>Every column is laid out {@code [B][T]} (or {@code [B][T][width]} for vectors):
 * row {@code b} is the {@code b}-th trajectory's column, which stays padded with zeros
 * past {@code currentLength[b]}. The rows reference the trajectory copies handed out by
 * the drop-off queue, so no further copying happens here.
 */
public final class TrainingBatch {

    private final List<Trajectory> trajectories;
    private final int[] sourceIds;
    private final long[] sequenceNumbers;
    private final int[] currentLength;
    private final float[][][] observations;
    private final float[][] rewards;
    private final boolean[][] dones;
    private final long[][] episodeIds;
    private final int[][] episodeSteps;
    private final float[][] episodeReturns;
    private final int[][] actions;
    private final float[][][] policyLogits;
    private final float[][] baselines;
    private final long[][] trainingSteps;

    private TrainingBatch(List<Trajectory> trajectories) {
        int size = trajectories.size();
        this.trajectories = List.copyOf(trajectories);
        this.sourceIds = new int[size];
        this.sequenceNumbers = new long[size];
        this.currentLength = new int[size];
        this.observations = new float[size][][];
        this.rewards = new float[size][];
        this.dones = new boolean[size][];
        this.episodeIds = new long[size][];
        this.episodeSteps = new int[size][];
        this.episodeReturns = new float[size][];
        this.actions = new int[size][];
        this.policyLogits = new float[size][][];
        this.baselines = new float[size][];
        this.trainingSteps = new long[size][];
    }

    /**
     * Stacks the given trajectories. All of them must share the same maximum length.
     */
    public static TrainingBatch stack(List<Trajectory> trajectories) {
        if (trajectories.isEmpty()) {
            throw new IllegalArgumentException("Cannot stack an empty list of trajectories");
        }
        int maxLength = trajectories.get(0).getMaxLength();
        TrainingBatch batch = new TrainingBatch(trajectories);
        for (int b = 0; b < trajectories.size(); b++) {
            Trajectory t = trajectories.get(b);
            if (t.getMaxLength() != maxLength) {
                throw new IllegalArgumentException("Trajectory " + t.getSequenceNumber()
                        + " has length " + t.getMaxLength() + ", expected " + maxLength);
            }
            batch.sourceIds[b] = t.getSourceId();
            batch.sequenceNumbers[b] = t.getSequenceNumber();
            batch.currentLength[b] = t.getCurrentLength();
            batch.observations[b] = t.getObservations();
            batch.rewards[b] = t.getRewards();
            batch.dones[b] = t.getDones();
            batch.episodeIds[b] = t.getEpisodeIds();
            batch.episodeSteps[b] = t.getEpisodeSteps();
            batch.episodeReturns[b] = t.getEpisodeReturns();
            batch.actions[b] = t.getActions();
            batch.policyLogits[b] = t.getPolicyLogits();
            batch.baselines[b] = t.getBaselines();
            batch.trainingSteps[b] = t.getTrainingSteps();
        }
        return batch;
    }

    public int size() {
        return trajectories.size();
    }

    /**
     * Number of meaningful time-steps across all rows.
     */
    public int totalSteps() {
        int total = 0;
        for (int length : currentLength) {
            total += length;
        }
        return total;
    }

    public List<Trajectory> getTrajectories() { return trajectories; }
    public int[] getSourceIds() { return sourceIds; }
    public long[] getSequenceNumbers() { return sequenceNumbers; }
    public int[] getCurrentLength() { return currentLength; }
    public float[][][] getObservations() { return observations; }
    public float[][] getRewards() { return rewards; }
    public boolean[][] getDones() { return dones; }
    public long[][] getEpisodeIds() { return episodeIds; }
    public int[][] getEpisodeSteps() { return episodeSteps; }
    public float[][] getEpisodeReturns() { return episodeReturns; }
    public int[][] getActions() { return actions; }
    public float[][][] getPolicyLogits() { return policyLogits; }
    public float[][] getBaselines() { return baselines; }
    public long[][] getTrainingSteps() { return trainingSteps; }
}
