package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.lapetina.seedrl.support.Steps.trajectory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DropOffQueueTest {

    private static final TrajectoryLayout LAYOUT = new TrajectoryLayout(2, 2);

    @Test
    @DisplayName("should evict the oldest trajectory when full")
    void shouldEvictOldest() {
        DropOffQueue queue = new DropOffQueue(3);

        for (int seq = 0; seq < 5; seq++) {
            boolean evicted = queue.offer(trajectory(0, 4, LAYOUT, 1, seq));
            assertThat(evicted).isEqualTo(seq >= 3);
            assertThat(queue.size()).isLessThanOrEqualTo(3);
        }

        assertThat(queue.getEvictedCount()).isEqualTo(2);
        assertThat(queue.getOfferedCount()).isEqualTo(5);
        assertThat(queue.drainExactly(3))
                .extracting(Trajectory::getSequenceNumber)
                .containsExactly(2L, 3L, 4L);
    }

    @Test
    @DisplayName("should drain nothing when fewer entries than requested are queued")
    void shouldDrainAllOrNothing() {
        DropOffQueue queue = new DropOffQueue(4);
        queue.offer(trajectory(0, 4, LAYOUT, 1, 0));
        queue.offer(trajectory(1, 4, LAYOUT, 1, 1));

        assertThat(queue.drainExactly(3)).isEmpty();
        assertThat(queue.size()).isEqualTo(2);

        List<Trajectory> drained = queue.drainExactly(2);
        assertThat(drained).extracting(Trajectory::getSourceId).containsExactly(0, 1);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("should reject non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new DropOffQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
