package fr.lapetina.seedrl.learner;

import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.StepRecord;
import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.support.RecordingMetricLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.lapetina.seedrl.support.Steps.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EpisodeTrackerTest {

    private static final TrajectoryLayout LAYOUT = new TrajectoryLayout(2, 2);

    private RecordingMetricLogger metricLogger;
    private MetricsRegistry metricsRegistry;

    @BeforeEach
    void setUp() {
        metricLogger = new RecordingMetricLogger();
        metricsRegistry = new MetricsRegistry("test", false);
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private static StepRecord step(long episodeId, int episodeStep, boolean done, long trainingSteps) {
        EnvironmentState state = state(LAYOUT.observationSize(), episodeId, episodeStep, done);
        return new StepRecord(state, 1, new float[LAYOUT.numActions()], 0f, trainingSteps);
    }

    @Test
    @DisplayName("should log one episode record per terminal step")
    void shouldLogTerminalSteps() {
        EpisodeTracker tracker = new EpisodeTracker(metricLogger, t -> { }, metricsRegistry);
        Trajectory trajectory = new Trajectory(5, 6, LAYOUT, 0);
        trajectory.append(step(7, 1, false, 10), Map.of("latency", 0.2));
        trajectory.append(step(7, 2, true, 10), Map.of("latency", 0.4));
        trajectory.append(step(8, 0, true, 12), Map.of());
        trajectory.append(step(8, 1, true, 12), null);

        tracker.accept(trajectory);

        assertThat(tracker.getTrajectoriesSeen()).isEqualTo(1);
        assertThat(tracker.getEpisodesSeen()).isEqualTo(2);
        assertThat(tracker.getMeanLatency()).isCloseTo(0.3, within(1e-9));

        List<Map<String, Object>> episodes = metricLogger.records("episodes");
        assertThat(episodes).hasSize(2);
        assertThat(episodes.get(0))
                .containsEntry("episode_id", 7L)
                .containsEntry("source_id", 5)
                .containsEntry("length", 2)
                .containsEntry("return", 2f)
                .containsEntry("training_steps", 10L);
        assertThat(episodes.get(1)).containsEntry("episode_id", 8L);
    }

    @Test
    @DisplayName("should forward every trajectory to the recorder and survive its failures")
    void shouldForwardToRecorder() {
        List<Trajectory> recorded = new CopyOnWriteArrayList<>();
        EpisodeTracker tracker = new EpisodeTracker(metricLogger, t -> {
            recorded.add(t);
            throw new IllegalStateException("disk full");
        }, metricsRegistry);
        Trajectory trajectory = new Trajectory(0, 2, LAYOUT, 0);
        trajectory.append(step(1, 0, false, 0), null);

        tracker.accept(trajectory);
        tracker.accept(trajectory);

        assertThat(recorded).hasSize(2);
        assertThat(tracker.getTrajectoriesSeen()).isEqualTo(2);
        assertThat(tracker.getEpisodesSeen()).isZero();
        assertThat(tracker.getMeanLatency()).isZero();
    }
}
