package fr.lapetina.seedrl;

import fr.lapetina.seedrl.spi.EnvironmentFactory;
import fr.lapetina.seedrl.spi.EpisodeRecorder;
import fr.lapetina.seedrl.spi.MetricLogger;
import fr.lapetina.seedrl.spi.PolicyModel;

/**
 * External pieces a learner needs but does not implement.
 *
 * @param trainingModel      model updated by training steps, required
 * @param inferenceModel     model serving inference; null to share the training model
 * @param metricLogger       record sink; null for the logging default
 * @param episodeRecorder    episode sink; null for no recording
 * @param environmentFactory environments for local actors; null for remote callers only
 */
public record LearnerCollaborators(
        PolicyModel trainingModel,
        PolicyModel inferenceModel,
        MetricLogger metricLogger,
        EpisodeRecorder episodeRecorder,
        EnvironmentFactory environmentFactory
) {

    public LearnerCollaborators {
        if (trainingModel == null) {
            throw new IllegalArgumentException("trainingModel is required");
        }
    }

    public static LearnerCollaborators of(PolicyModel model) {
        return new LearnerCollaborators(model, null, null, null, null);
    }

    public LearnerCollaborators withInferenceModel(PolicyModel model) {
        return new LearnerCollaborators(trainingModel, model, metricLogger, episodeRecorder, environmentFactory);
    }

    public LearnerCollaborators withMetricLogger(MetricLogger logger) {
        return new LearnerCollaborators(trainingModel, inferenceModel, logger, episodeRecorder, environmentFactory);
    }

    public LearnerCollaborators withEpisodeRecorder(EpisodeRecorder recorder) {
        return new LearnerCollaborators(trainingModel, inferenceModel, metricLogger, recorder, environmentFactory);
    }

    public LearnerCollaborators withEnvironmentFactory(EnvironmentFactory factory) {
        return new LearnerCollaborators(trainingModel, inferenceModel, metricLogger, episodeRecorder, factory);
    }
}
