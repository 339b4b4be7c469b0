package fr.lapetina.seedrl.integration;

import fr.lapetina.seedrl.disruptor.InferencePipeline;
import fr.lapetina.seedrl.domain.exception.OutstandingRequestException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.InferenceBatch;
import fr.lapetina.seedrl.domain.model.InferenceOutput;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.domain.model.TrainingBatch;
import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import fr.lapetina.seedrl.infrastructure.metrics.LearnerStatistics;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.spi.ModelSnapshot;
import fr.lapetina.seedrl.spi.PolicyModel;
import fr.lapetina.seedrl.store.BatchEntryTable;
import fr.lapetina.seedrl.store.DropOffQueue;
import fr.lapetina.seedrl.store.TrajectoryStore;
import fr.lapetina.seedrl.support.StubPolicyModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the inference pipeline, wired without a learner.
 */
class InferencePipelineIntegrationTest {

    private static final int NUM_SOURCES = 8;
    private static final TrajectoryLayout LAYOUT = new TrajectoryLayout(2, 3);

    private final DropOffQueue dropOffQueue = new DropOffQueue(64);
    private final TrajectoryStore store = new TrajectoryStore(NUM_SOURCES, 4, LAYOUT, dropOffQueue);
    private final MetricsRegistry metricsRegistry = new MetricsRegistry("test", false);
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private InferencePipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metricsRegistry.close();
    }

    private InferencePipeline start(PolicyModel model) {
        pipeline = builder(model, NUM_SOURCES, 16, store).build();
        pipeline.start();
        return pipeline;
    }

    private InferencePipeline.Builder builder(PolicyModel model, int numSources, int ringBufferSize,
                                              TrajectoryStore trajectoryStore) {
        return InferencePipeline.builder()
                .ringBufferSize(ringBufferSize)
                .maxInferenceBatchSize(numSources)
                .shutdownTimeoutMs(1000)
                .numSources(numSources)
                .layout(LAYOUT)
                .inferenceModel(model)
                .modelLock(new ReentrantLock())
                .trainingSteps(() -> 0L)
                .batchEntries(new BatchEntryTable(numSources))
                .trajectoryStore(trajectoryStore)
                .statistics(new LearnerStatistics())
                .metricsRegistry(metricsRegistry)
                .shutdownSignal(shutdown::get)
                .fatalErrorListener(e -> { });
    }

    private static EnvironmentState state(int sourceId, int episodeStep, boolean done) {
        return EnvironmentState.builder()
                .observation(new float[]{sourceId, episodeStep})
                .done(done)
                .episodeId(sourceId)
                .episodeStep(episodeStep)
                .build();
    }

    @Test
    @DisplayName("should answer a single submit with its own source id")
    void shouldEchoSourceId() throws Exception {
        start(new StubPolicyModel(3));

        SubmitResult result = pipeline.submit(5, state(5, 0, false), Map.of()).get(5, TimeUnit.SECONDS);

        assertThat(result.sourceId()).isEqualTo(5);
        assertThat(result.action()).isEqualTo(2);
        assertThat(result.shutdown()).isFalse();
        assertThat(store.snapshot(5).getCurrentLength()).isEqualTo(1);
        assertThat(pipeline.getPendingRequests()).isZero();
    }

    @Test
    @DisplayName("should answer concurrent submits each with its own source id")
    void shouldEchoSourceIdsConcurrently() throws Exception {
        start(new StubPolicyModel(3));
        ExecutorService callers = Executors.newFixedThreadPool(NUM_SOURCES);
        try {
            List<Future<List<SubmitResult>>> perSource = new ArrayList<>();
            for (int sourceId = 0; sourceId < NUM_SOURCES; sourceId++) {
                int id = sourceId;
                perSource.add(callers.submit(() -> {
                    List<SubmitResult> results = new ArrayList<>();
                    for (int step = 0; step < 10; step++) {
                        results.add(pipeline.submit(id, state(id, step, false), Map.of())
                                .get(5, TimeUnit.SECONDS));
                    }
                    return results;
                }));
            }

            for (int sourceId = 0; sourceId < NUM_SOURCES; sourceId++) {
                List<SubmitResult> results = perSource.get(sourceId).get(10, TimeUnit.SECONDS);
                assertThat(results).hasSize(10);
                assertThat(results).extracting(SubmitResult::sourceId).containsOnly(sourceId);
                assertThat(results).extracting(SubmitResult::action).containsOnly(sourceId % 3);
            }
        } finally {
            callers.shutdownNow();
        }

        // 10 steps per source with rollout 4: two full trajectories each
        assertThat(dropOffQueue.size()).isEqualTo(NUM_SOURCES * 2);
        assertThat(pipeline.getPendingRequests()).isZero();
    }

    @Test
    @DisplayName("should refuse a ring buffer with fewer than two slots per source")
    void shouldRejectRingWithOneSlotPerSource() {
        TrajectoryStore wideStore = new TrajectoryStore(16, 4, LAYOUT, new DropOffQueue(64));

        assertThatThrownBy(() -> builder(new StubPolicyModel(3), 16, 16, wideStore).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("two requests per source");
    }

    @Test
    @DisplayName("should admit every resubmission of busy sources on a ring of two slots per source")
    void shouldNeverBackpressureBusySources() throws Exception {
        int sources = 16;
        int rounds = 200;
        TrajectoryStore wideStore = new TrajectoryStore(sources, 4, LAYOUT, new DropOffQueue(sources * rounds));
        pipeline = builder(new StubPolicyModel(3), sources, 2 * sources, wideStore).build();
        pipeline.start();

        ExecutorService callers = Executors.newFixedThreadPool(sources);
        try {
            List<Future<Integer>> answered = new ArrayList<>();
            for (int sourceId = 0; sourceId < sources; sourceId++) {
                int id = sourceId;
                answered.add(callers.submit(() -> {
                    int count = 0;
                    for (int step = 0; step < rounds; step++) {
                        SubmitResult result = pipeline.submit(id, state(id, step, false), Map.of())
                                .get(5, TimeUnit.SECONDS);
                        assertThat(result.sourceId()).isEqualTo(id);
                        count++;
                    }
                    return count;
                }));
            }

            for (Future<Integer> future : answered) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isEqualTo(rounds);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(pipeline.getPendingRequests()).isZero();
    }

    @Test
    @DisplayName("should reject a second submit while the first is outstanding")
    void shouldRejectDuplicateOutstandingSubmit() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StubPolicyModel delegate = new StubPolicyModel(3);
        start(new BlockingModel(delegate, entered, release));

        CompletableFuture<SubmitResult> first = pipeline.submit(1, state(1, 0, false), Map.of());
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<SubmitResult> second = pipeline.submit(1, state(1, 1, false), Map.of());

        assertThatThrownBy(() -> second.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(OutstandingRequestException.class);
        assertThat(pipeline.getPendingRequests()).isEqualTo(1);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).sourceId()).isEqualTo(1);
        assertThat(store.snapshot(1).getCurrentLength()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail a submit for an unknown source with a validation error")
    void shouldFailUnknownSource() {
        start(new StubPolicyModel(3));

        CompletableFuture<SubmitResult> future = pipeline.submit(NUM_SOURCES, state(0, 0, false), Map.of());

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should carry the shutdown flag in answers once shutdown is requested")
    void shouldPropagateShutdownFlag() throws Exception {
        start(new StubPolicyModel(3));
        shutdown.set(true);

        SubmitResult result = pipeline.submit(0, state(0, 0, false), Map.of()).get(5, TimeUnit.SECONDS);

        assertThat(result.shutdown()).isTrue();
    }

    @Test
    @DisplayName("should fail submits once the pipeline is closed")
    void shouldRejectAfterClose() {
        start(new StubPolicyModel(3));
        pipeline.close();

        CompletableFuture<SubmitResult> future = pipeline.submit(0, state(0, 0, false), Map.of());

        assertThat(future).isCompletedExceptionally();
    }

    @Test
    @DisplayName("should hand off the trajectory when a submitted step ends the episode")
    void shouldHandOffOnEpisodeEnd() throws Exception {
        start(new StubPolicyModel(3));

        pipeline.submit(2, state(2, 0, false), Map.of()).get(5, TimeUnit.SECONDS);
        pipeline.submit(2, state(2, 1, true), Map.of("latency", 0.01)).get(5, TimeUnit.SECONDS);

        Trajectory trajectory = dropOffQueue.drainExactly(1).get(0);
        assertThat(trajectory.getCurrentLength()).isEqualTo(2);
        assertThat(trajectory.isComplete()).isTrue();
        assertThat(trajectory.getActions()[1]).isEqualTo(2);
        assertThat(trajectory.getMetrics(1)).containsKeys("latency", "timestamp");
    }

    /**
     * Holds every evaluation until released.
     */
    private static final class BlockingModel implements PolicyModel {
        private final PolicyModel delegate;
        private final CountDownLatch entered;
        private final CountDownLatch release;

        BlockingModel(PolicyModel delegate, CountDownLatch entered, CountDownLatch release) {
            this.delegate = delegate;
            this.entered = entered;
            this.release = release;
        }

        @Override
        public InferenceOutput evaluate(InferenceBatch batch) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.evaluate(batch);
        }

        @Override
        public Map<String, Double> train(TrainingBatch batch) {
            return delegate.train(batch);
        }

        @Override
        public ModelSnapshot snapshot() {
            return delegate.snapshot();
        }

        @Override
        public void restore(ModelSnapshot snapshot) {
            delegate.restore(snapshot);
        }
    }
}
