package fr.lapetina.seedrl.learner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntSupplier;

/**
 * Detects a pipeline that stopped moving.
 *
 * <p>Each {@link #check()} compares the training queue depth, the drop-off queue depth and
 * the number of pending requests with the previous snapshot. If none changed, the stall
 * counter grows; any change resets it and takes a new snapshot. With threshold {@code T}
 * the watchdog reports a stall on the {@code T+1}-th unchanged check in a row.
 */
public final class LivenessWatchdog {

    private static final Logger log = LoggerFactory.getLogger(LivenessWatchdog.class);

    private final int stallThreshold;
    private final IntSupplier trainingQueueDepth;
    private final IntSupplier dropOffDepth;
    private final IntSupplier pendingRequests;

    private int lastTrainingQueueDepth;
    private int lastDropOffDepth;
    private int lastPendingRequests;
    private int stallCount;
    private boolean stalled;

    public LivenessWatchdog(
            int stallThreshold,
            IntSupplier trainingQueueDepth,
            IntSupplier dropOffDepth,
            IntSupplier pendingRequests
    ) {
        this.stallThreshold = stallThreshold;
        this.trainingQueueDepth = trainingQueueDepth;
        this.dropOffDepth = dropOffDepth;
        this.pendingRequests = pendingRequests;
        snapshot();
    }

    /**
     * Takes one observation.
     *
     * @return true once the pipeline has been unchanged for more than the threshold
     */
    public boolean check() {
        int trainingDepth = trainingQueueDepth.getAsInt();
        int dropOff = dropOffDepth.getAsInt();
        int pending = pendingRequests.getAsInt();

        if (trainingDepth == lastTrainingQueueDepth && dropOff == lastDropOffDepth && pending == lastPendingRequests) {
            stallCount++;
        } else {
            stallCount = 0;
            lastTrainingQueueDepth = trainingDepth;
            lastDropOffDepth = dropOff;
            lastPendingRequests = pending;
        }

        if (stallCount > stallThreshold && !stalled) {
            stalled = true;
            log.warn("Pipeline stalled: checks={}, trainingQueue={}, dropOff={}, pendingRequests={}",
                    stallCount, trainingDepth, dropOff, pending);
        }
        return stallCount > stallThreshold;
    }

    private void snapshot() {
        this.lastTrainingQueueDepth = trainingQueueDepth.getAsInt();
        this.lastDropOffDepth = dropOffDepth.getAsInt();
        this.lastPendingRequests = pendingRequests.getAsInt();
    }

    public int getStallCount() {
        return stallCount;
    }

    public int getStallThreshold() {
        return stallThreshold;
    }
}
