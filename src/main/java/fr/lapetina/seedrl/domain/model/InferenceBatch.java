package fr.lapetina.seedrl.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stacked environment states of every request collected in one inference cycle.
 *
 * <p>Row {@code i} of every array belongs to {@code sourceIds[i]}; rows keep arrival
 * order. Extra fields whose values are numeric with a common width across all rows are
 * stacked into {@code [B][width]} matrices. Any other extra field is passed through as a
 * list of raw values without concatenation.
 */
public final class InferenceBatch {

    private static final Logger log = LoggerFactory.getLogger(InferenceBatch.class);

    private final int[] sourceIds;
    private final float[][] observations;
    private final float[] rewards;
    private final boolean[] dones;
    private final long[] episodeIds;
    private final int[] episodeSteps;
    private final float[] episodeReturns;
    private final Map<String, float[][]> numericExtras;
    private final Map<String, List<Object>> passthroughExtras;

    private InferenceBatch(int size) {
        this.sourceIds = new int[size];
        this.observations = new float[size][];
        this.rewards = new float[size];
        this.dones = new boolean[size];
        this.episodeIds = new long[size];
        this.episodeSteps = new int[size];
        this.episodeReturns = new float[size];
        this.numericExtras = new LinkedHashMap<>();
        this.passthroughExtras = new LinkedHashMap<>();
    }

    /**
     * Stacks {@code states} in the given order.
     *
     * @param sourceIds source id of each state, same length as {@code states}
     * @param states    submitted environment states
     */
    public static InferenceBatch of(int[] sourceIds, List<EnvironmentState> states) {
        if (sourceIds.length != states.size()) {
            throw new IllegalArgumentException("Source ids and states disagree: "
                    + sourceIds.length + " vs " + states.size());
        }
        int size = states.size();
        InferenceBatch batch = new InferenceBatch(size);
        Set<String> extraKeys = new TreeSet<>();
        for (int i = 0; i < size; i++) {
            EnvironmentState state = states.get(i);
            batch.sourceIds[i] = sourceIds[i];
            batch.observations[i] = state.observation();
            batch.rewards[i] = state.reward();
            batch.dones[i] = state.done();
            batch.episodeIds[i] = state.episodeId();
            batch.episodeSteps[i] = state.episodeStep();
            batch.episodeReturns[i] = state.episodeReturn();
            extraKeys.addAll(state.extras().keySet());
        }
        for (String key : extraKeys) {
            stackExtra(batch, key, states);
        }
        return batch;
    }

    private static void stackExtra(InferenceBatch batch, String key, List<EnvironmentState> states) {
        float[][] rows = new float[states.size()][];
        int width = -1;
        boolean numeric = true;
        for (int i = 0; i < states.size() && numeric; i++) {
            float[] row = toFloatRow(states.get(i).extras().get(key));
            if (row == null || (width >= 0 && row.length != width)) {
                numeric = false;
            } else {
                width = row.length;
                rows[i] = row;
            }
        }
        if (numeric) {
            batch.numericExtras.put(key, rows);
            return;
        }
        log.debug("Skipping concatenation of extra field '{}'", key);
        List<Object> values = new ArrayList<>(states.size());
        for (EnvironmentState state : states) {
            values.add(state.extras().get(key));
        }
        batch.passthroughExtras.put(key, Collections.unmodifiableList(values));
    }

    /**
     * Converts a numeric value to a float row, or returns {@code null} if it is not numeric.
     */
    static float[] toFloatRow(Object value) {
        if (value instanceof Number) {
            return new float[]{((Number) value).floatValue()};
        }
        if (value instanceof float[]) {
            return ((float[]) value).clone();
        }
        if (value instanceof double[]) {
            double[] doubles = (double[]) value;
            float[] row = new float[doubles.length];
            for (int i = 0; i < doubles.length; i++) {
                row[i] = (float) doubles[i];
            }
            return row;
        }
        if (value instanceof int[]) {
            int[] ints = (int[]) value;
            float[] row = new float[ints.length];
            for (int i = 0; i < ints.length; i++) {
                row[i] = ints[i];
            }
            return row;
        }
        if (value instanceof long[]) {
            long[] longs = (long[]) value;
            float[] row = new float[longs.length];
            for (int i = 0; i < longs.length; i++) {
                row[i] = longs[i];
            }
            return row;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            float[] row = new float[list.size()];
            for (int i = 0; i < list.size(); i++) {
                Object element = list.get(i);
                if (!(element instanceof Number)) {
                    return null;
                }
                row[i] = ((Number) element).floatValue();
            }
            return row;
        }
        return null;
    }

    public int size() {
        return sourceIds.length;
    }

    public int[] getSourceIds() { return sourceIds; }
    public float[][] getObservations() { return observations; }
    public float[] getRewards() { return rewards; }
    public boolean[] getDones() { return dones; }
    public long[] getEpisodeIds() { return episodeIds; }
    public int[] getEpisodeSteps() { return episodeSteps; }
    public float[] getEpisodeReturns() { return episodeReturns; }

    public Map<String, float[][]> getNumericExtras() {
        return Collections.unmodifiableMap(numericExtras);
    }

    public Map<String, List<Object>> getPassthroughExtras() {
        return Collections.unmodifiableMap(passthroughExtras);
    }
}
