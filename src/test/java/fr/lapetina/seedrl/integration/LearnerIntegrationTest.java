package fr.lapetina.seedrl.integration;

import fr.lapetina.seedrl.LearnerCollaborators;
import fr.lapetina.seedrl.domain.exception.ModelEvaluationException;
import fr.lapetina.seedrl.learner.Learner;
import fr.lapetina.seedrl.learner.LearnerReport;
import fr.lapetina.seedrl.learner.LearnerState;
import fr.lapetina.seedrl.learner.ShutdownReason;
import fr.lapetina.seedrl.support.ExclusiveAccessModel;
import fr.lapetina.seedrl.support.RecordingMetricLogger;
import fr.lapetina.seedrl.support.ScriptedEnvironment;
import fr.lapetina.seedrl.support.StubPolicyModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of a learner driving local actors over scripted environments.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class LearnerIntegrationTest {

    private TestLearnerFactory factory;

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should train until the epoch limit and shut down cleanly")
    void shouldStopAfterMaxEpochs() {
        factory = TestLearnerFactory.create();
        Learner learner = factory.getLearner();

        LearnerReport report = learner.run();

        // maxEpochs 3: the learner stops once a fourth epoch has run
        assertThat(report.shutdownReason()).isEqualTo(ShutdownReason.MAX_EPOCHS);
        assertThat(report.trainingEpochs()).isEqualTo(4);
        assertThat(report.trainingSteps()).isPositive();
        assertThat(report.inferenceSteps()).isGreaterThanOrEqualTo(report.trainingSteps());
        assertThat(learner.getState()).isEqualTo(LearnerState.STOPPED);
        assertThat(learner.getReport()).contains(report);
        assertThat(learner.getSessions().size()).isZero();
        assertThat(factory.getModel().getTrainedBatches()).hasSize(4);
    }

    @Test
    @DisplayName("should feed training batches of the configured size")
    void shouldTrainOnConfiguredBatchSize() {
        factory = TestLearnerFactory.create();

        factory.getLearner().run();

        assertThat(factory.getModel().getTrainedBatches())
                .allSatisfy(batch -> assertThat(batch.size()).isEqualTo(2));
    }

    @Test
    @DisplayName("should log training, system and episode records and flush on shutdown")
    void shouldLogMetricChannels() {
        factory = TestLearnerFactory.create();

        factory.getLearner().run();

        RecordingMetricLogger logger = factory.getRecordingMetricLogger();
        assertThat(logger.records("training")).hasSize(4);
        assertThat(logger.records("training").get(3))
                .containsEntry("training_epoch", 4L)
                .containsKeys("runtime", "training_steps", "total_loss");
        assertThat(logger.records("system")).isNotEmpty();
        assertThat(logger.records("system").get(0))
                .containsKeys("trajectories_seen", "episodes_seen", "queue_batches", "queue_drop_off", "queue_rpcs");
        assertThat(logger.records("episodes")).isNotEmpty();
        Map<String, Object> episode = logger.records("episodes").get(0);
        assertThat(episode).containsKeys("episode_id", "source_id", "return", "length");
        assertThat(logger.getFlushes()).isEqualTo(1);
    }

    @Test
    @DisplayName("should stop and close every local environment on shutdown")
    void shouldCloseEnvironments() {
        factory = TestLearnerFactory.create();

        factory.getLearner().run();

        assertThat(factory.getEnvironments()).hasSize(4);
        assertThat(factory.getEnvironments()).allMatch(ScriptedEnvironment::isClosed);
        assertThat(factory.getEnvironments()).allSatisfy(env ->
                assertThat(env.getReceivedActions()).isNotEmpty());
    }

    @Test
    @DisplayName("should send each environment the action chosen for its own source")
    void shouldRouteActionsBySource() {
        factory = TestLearnerFactory.create();

        factory.getLearner().run();

        for (ScriptedEnvironment environment : factory.getEnvironments()) {
            assertThat(environment.getReceivedActions()).containsOnly(environment.getSourceId() % 2);
        }
    }

    @Test
    @DisplayName("should report a stall when nothing moves through the pipeline")
    void shouldStopOnStall() {
        factory = TestLearnerFactory.create(config -> {
            config.getWatchdog().setStallThreshold(10);
            config.getShutdown().setCheckOutTimeoutMs(100);
        }, false);
        Learner learner = factory.getLearner();

        LearnerReport report = learner.run();

        assertThat(report.shutdownReason()).isEqualTo(ShutdownReason.STALLED);
        assertThat(report.trainingEpochs()).isZero();
        assertThat(learner.getState()).isEqualTo(LearnerState.STOPPED);
    }

    @Test
    @DisplayName("should rethrow a model failure after producing the report")
    void shouldFailOnModelError() {
        factory = TestLearnerFactory.create();
        factory.getModel().failEvaluationWith(new IllegalStateException("nan in logits"));
        Learner learner = factory.getLearner();

        assertThatThrownBy(learner::run).isInstanceOf(ModelEvaluationException.class);

        assertThat(learner.getShutdownReason()).isEqualTo(ShutdownReason.FATAL_ERROR);
        assertThat(learner.getReport()).isPresent();
        assertThat(learner.getState()).isEqualTo(LearnerState.STOPPED);
    }

    @Test
    @DisplayName("should stop a running learner when closed from another thread")
    void shouldStopWhenClosed() throws Exception {
        factory = TestLearnerFactory.create(config -> config.getLimits().setMaxEpochs(-1), true);
        Learner learner = factory.getLearner();

        CompletableFuture<LearnerReport> run = CompletableFuture.supplyAsync(learner::run);
        while (learner.getStatistics().getTrainingEpochs() == 0) {
            Thread.sleep(5);
        }
        learner.close();

        LearnerReport report = run.get(10, TimeUnit.SECONDS);
        assertThat(report.shutdownReason()).isEqualTo(ShutdownReason.CLOSED);
        assertThat(learner.getSessions().size()).isZero();
    }

    @Test
    @DisplayName("should copy trained parameters into a separate inference model after every epoch")
    void shouldSyncSeparateInferenceModel() {
        StubPolicyModel inferenceModel = new StubPolicyModel(2);
        factory = TestLearnerFactory.create(config -> { }, true,
                collaborators -> collaborators.withInferenceModel(inferenceModel));

        LearnerReport report = factory.getLearner().run();

        assertThat(report.trainingEpochs()).isEqualTo(4);
        assertThat(inferenceModel.getTrainedBatches()).isEmpty();
        assertThat(inferenceModel.getEvaluatedBatchSizes()).isNotEmpty();
        assertThat(factory.getModel().getEvaluatedBatchSizes()).isEmpty();
        assertThat(inferenceModel.getRestored()).isNotNull();
        assertThat(inferenceModel.getRestored().version()).isEqualTo(report.trainingEpochs());
        assertThat(inferenceModel.getVersion()).isEqualTo(factory.getModel().getVersion());
    }

    @Test
    @DisplayName("should never evaluate while a training step is running")
    void shouldSerializeEvaluationAndTraining() {
        ExclusiveAccessModel.Tracker tracker = new ExclusiveAccessModel.Tracker();
        ExclusiveAccessModel inferenceModel = new ExclusiveAccessModel(new StubPolicyModel(2), tracker);
        factory = TestLearnerFactory.create(config -> config.getLimits().setMaxEpochs(10), true,
                collaborators -> new LearnerCollaborators(
                        new ExclusiveAccessModel(collaborators.trainingModel(), tracker),
                        inferenceModel,
                        collaborators.metricLogger(),
                        collaborators.episodeRecorder(),
                        collaborators.environmentFactory()));

        LearnerReport report = factory.getLearner().run();

        assertThat(report.shutdownReason()).isEqualTo(ShutdownReason.MAX_EPOCHS);
        assertThat(tracker.getTrainings()).isEqualTo(11);
        assertThat(tracker.getEvaluations()).isPositive();
        assertThat(tracker.hasOverlapped()).isFalse();
    }
}
