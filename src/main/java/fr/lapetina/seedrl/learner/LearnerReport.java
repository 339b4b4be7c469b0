package fr.lapetina.seedrl.learner;

import java.time.Duration;

/**
 * Final figures of a learner run, produced on every shutdown.
 */
public record LearnerReport(
        String learnerName,
        ShutdownReason shutdownReason,
        Duration runtime,
        long inferenceSteps,
        long trainingSteps,
        long trainingEpochs,
        Duration inferenceTime,
        Duration trainingTime,
        Duration fetchingTime,
        double meanLatencySeconds,
        long episodesSeen,
        long trajectoriesSeen,
        long discardedBatches,
        long evictedTrajectories
) {

    public double inferenceFps() {
        return perSecond(inferenceSteps);
    }

    public double trainingFps() {
        return perSecond(trainingSteps);
    }

    private double perSecond(long steps) {
        double seconds = runtime.toNanos() / 1e9;
        return seconds > 0 ? steps / seconds : 0.0;
    }

    @Override
    public String toString() {
        return "LearnerReport{" +
                "learner=" + learnerName +
                ", reason=" + shutdownReason +
                ", runtime=" + runtime +
                ", inferenceSteps=" + inferenceSteps +
                ", inferenceFps=" + String.format("%.1f", inferenceFps()) +
                ", trainingSteps=" + trainingSteps +
                ", trainingFps=" + String.format("%.1f", trainingFps()) +
                ", trainingEpochs=" + trainingEpochs +
                ", inferenceTime=" + inferenceTime +
                ", trainingTime=" + trainingTime +
                ", fetchingTime=" + fetchingTime +
                ", meanLatencySeconds=" + meanLatencySeconds +
                ", episodes=" + episodesSeen +
                ", trajectories=" + trajectoriesSeen +
                ", discardedBatches=" + discardedBatches +
                ", evictedTrajectories=" + evictedTrajectories +
                '}';
    }
}
