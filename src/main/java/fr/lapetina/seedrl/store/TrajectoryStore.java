package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.StepRecord;
import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.domain.model.TrajectoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live trajectory buffer per source, filled step by step.
 *
 * <p>When a buffer becomes complete (episode ended) or full it is copied into the
 * {@link DropOffQueue} and reset in place under a fresh sequence number. Every source has
 * its own lock, so appends for different sources never contend.
 */
public final class TrajectoryStore {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryStore.class);

    private final Trajectory[] slots;
    private final ReentrantLock[] locks;
    private final DropOffQueue dropOffQueue;
    private final AtomicLong sequenceCounter = new AtomicLong();
    private final AtomicLong handedOff = new AtomicLong();

    public TrajectoryStore(int numSources, int maxLength, TrajectoryLayout layout, DropOffQueue dropOffQueue) {
        if (numSources <= 0) {
            throw new IllegalArgumentException("Number of sources must be positive: " + numSources);
        }
        this.slots = new Trajectory[numSources];
        this.locks = new ReentrantLock[numSources];
        this.dropOffQueue = dropOffQueue;
        for (int sourceId = 0; sourceId < numSources; sourceId++) {
            slots[sourceId] = new Trajectory(sourceId, maxLength, layout, sequenceCounter.getAndIncrement());
            locks[sourceId] = new ReentrantLock();
        }
        log.info("Trajectory store created: sources={}, maxLength={}, observationSize={}, numActions={}",
                numSources, maxLength, layout.observationSize(), layout.numActions());
    }

    /**
     * Appends a step to the source's trajectory and hands the trajectory off if it is now
     * complete or full.
     *
     * @throws fr.lapetina.seedrl.domain.exception.TrajectoryOverflowException if the live
     *         buffer was already full
     */
    public void addToEntry(int sourceId, StepRecord step, Map<String, Object> metrics) {
        ReentrantLock lock = lockFor(sourceId);
        lock.lock();
        try {
            Trajectory trajectory = slots[sourceId];
            trajectory.append(step, metrics);
            if (step.isTerminal()) {
                trajectory.markComplete();
            }
            if (trajectory.isComplete() || trajectory.isFull()) {
                handOff(trajectory);
            }
        } finally {
            lock.unlock();
        }
    }

    private void handOff(Trajectory trajectory) {
        Trajectory copy = trajectory.copy();
        dropOffQueue.offer(copy);
        handedOff.incrementAndGet();
        trajectory.reset(sequenceCounter.getAndIncrement());
        log.trace("Trajectory handed off: seq={}, sourceId={}, length={}, complete={}",
                copy.getSequenceNumber(), copy.getSourceId(), copy.getCurrentLength(), copy.isComplete());
    }

    /**
     * Returns a deep copy of the source's live trajectory.
     */
    public Trajectory snapshot(int sourceId) {
        ReentrantLock lock = lockFor(sourceId);
        lock.lock();
        try {
            return slots[sourceId].copy();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(int sourceId) {
        if (sourceId < 0 || sourceId >= slots.length) {
            throw new IllegalArgumentException("Unknown source id: " + sourceId);
        }
        return locks[sourceId];
    }

    public int getNumSources() {
        return slots.length;
    }

    public DropOffQueue getDropOffQueue() {
        return dropOffQueue;
    }

    public long getHandedOffCount() {
        return handedOff.get();
    }
}
