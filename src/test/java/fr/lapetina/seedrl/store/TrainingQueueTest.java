package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.TrainingBatch;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.seedrl.support.Steps.trajectory;
import static org.assertj.core.api.Assertions.assertThat;

class TrainingQueueTest {

    private static final TrajectoryLayout LAYOUT = new TrajectoryLayout(2, 2);

    private static TrainingBatch batch(long seq) {
        return TrainingBatch.stack(List.of(trajectory(0, 4, LAYOUT, 2, seq)));
    }

    @Test
    @DisplayName("should discard the second batch when capacity is one and nothing consumes")
    void shouldDiscardWhenFull() throws Exception {
        TrainingQueue queue = new TrainingQueue(1);

        boolean first = queue.offer(batch(0), 2, Duration.ofMillis(1));
        boolean second = queue.offer(batch(1), 2, Duration.ofMillis(1));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.getDiscardedCount()).isEqualTo(1);
        assertThat(queue.getEnqueuedCount()).isEqualTo(1);
        assertThat(queue.poll().orElseThrow().getSequenceNumbers()).containsExactly(0L);
    }

    @Test
    @DisplayName("should enqueue after backing off once a consumer frees a slot")
    void shouldRetryUntilSpaceFrees() throws Exception {
        TrainingQueue queue = new TrainingQueue(1);
        queue.offer(batch(0), 0, Duration.ZERO);

        CompletableFuture<Boolean> producer = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.offer(batch(1), 500, Duration.ofMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        Thread.sleep(30);
        assertThat(queue.poll()).isPresent();

        assertThat(producer.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.getDiscardedCount()).isZero();
    }

    @Test
    @DisplayName("should return empty when polling an empty queue")
    void shouldPollEmpty() {
        TrainingQueue queue = new TrainingQueue(4);

        Optional<TrainingBatch> polled = queue.poll();

        assertThat(polled).isEmpty();
    }
}
