package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.TrainingBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of training batches between the batch assemblers and the training loop.
 *
 * <p>Unlike the drop-off queue, a full training queue never evicts: producers retry with
 * a fixed backoff and discard their batch once the attempts are exhausted. Consumers
 * never block.
 */
public final class TrainingQueue {

    private static final Logger log = LoggerFactory.getLogger(TrainingQueue.class);

    private final int capacity;
    private final BlockingQueue<TrainingBatch> queue;
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public TrainingQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Training queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueues a batch, retrying up to {@code maxRetries} times with {@code backoff}
     * between attempts while the queue is full.
     *
     * @return true if the batch was enqueued, false if it was discarded
     * @throws InterruptedException if interrupted while backing off
     */
    public boolean offer(TrainingBatch batch, int maxRetries, Duration backoff) throws InterruptedException {
        for (int attempt = 0; ; attempt++) {
            if (queue.offer(batch)) {
                enqueued.incrementAndGet();
                return true;
            }
            if (attempt >= maxRetries) {
                long total = discarded.incrementAndGet();
                log.warn("Training queue full, discarding batch: attempts={}, capacity={}, discardedTotal={}",
                        attempt + 1, capacity, total);
                return false;
            }
            Thread.sleep(backoff.toMillis());
        }
    }

    /**
     * Takes the oldest batch if one is queued.
     */
    public Optional<TrainingBatch> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long getEnqueuedCount() {
        return enqueued.get();
    }

    public long getDiscardedCount() {
        return discarded.get();
    }
}
