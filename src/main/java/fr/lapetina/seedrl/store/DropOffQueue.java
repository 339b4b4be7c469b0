package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.Trajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of finished trajectories waiting to be batched.
 *
 * <p>Offering to a full queue evicts the oldest entry. Evictions are counted; they mean
 * the batch assemblers fall behind the actors.
 */
public final class DropOffQueue {

    private static final Logger log = LoggerFactory.getLogger(DropOffQueue.class);

    private final int capacity;
    private final ArrayDeque<Trajectory> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong offered = new AtomicLong();

    public DropOffQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Drop-off capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a trajectory, evicting the oldest one if the queue is full.
     *
     * @return true if an older trajectory was evicted
     */
    public boolean offer(Trajectory trajectory) {
        lock.lock();
        try {
            offered.incrementAndGet();
            boolean evictedOldest = false;
            if (entries.size() >= capacity) {
                Trajectory oldest = entries.pollFirst();
                evicted.incrementAndGet();
                evictedOldest = true;
                log.debug("Drop-off queue full, evicted trajectory: seq={}, sourceId={}",
                        oldest.getSequenceNumber(), oldest.getSourceId());
            }
            entries.addLast(trajectory);
            return evictedOldest;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes exactly {@code count} trajectories in FIFO order, or none at all if fewer
     * are queued.
     */
    public List<Trajectory> drainExactly(int count) {
        lock.lock();
        try {
            if (entries.size() < count) {
                return List.of();
            }
            List<Trajectory> drained = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                drained.add(entries.pollFirst());
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long getEvictedCount() {
        return evicted.get();
    }

    public long getOfferedCount() {
        return offered.get();
    }
}
