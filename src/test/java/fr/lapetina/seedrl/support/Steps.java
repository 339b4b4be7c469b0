package fr.lapetina.seedrl.support;

import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.StepRecord;
import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;

/**
 * Builders for hand-made steps and trajectories.
 */
public final class Steps {

    private Steps() {
    }

    public static EnvironmentState state(int observationSize, long episodeId, int episodeStep, boolean done) {
        float[] observation = new float[observationSize];
        observation[0] = episodeStep;
        return EnvironmentState.builder()
                .observation(observation)
                .reward(episodeStep > 0 ? 1f : 0f)
                .done(done)
                .episodeId(episodeId)
                .episodeStep(episodeStep)
                .episodeReturn(episodeStep)
                .build();
    }

    public static StepRecord step(TrajectoryLayout layout, int episodeStep, boolean done) {
        return new StepRecord(
                state(layout.observationSize(), 1L, episodeStep, done),
                0,
                new float[layout.numActions()],
                0f,
                0L
        );
    }

    /**
     * A trajectory of {@code length} non-terminal steps.
     */
    public static Trajectory trajectory(int sourceId, int maxLength, TrajectoryLayout layout, int length, long seq) {
        Trajectory trajectory = new Trajectory(sourceId, maxLength, layout, seq);
        for (int i = 0; i < length; i++) {
            trajectory.append(step(layout, i, false), null);
        }
        return trajectory;
    }
}
