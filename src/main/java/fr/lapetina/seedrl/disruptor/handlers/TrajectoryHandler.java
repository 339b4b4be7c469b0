package fr.lapetina.seedrl.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.exception.TrajectoryOverflowException;
import fr.lapetina.seedrl.domain.model.ErrorType;
import fr.lapetina.seedrl.store.BatchEntryTable;
import fr.lapetina.seedrl.store.BatchEntryTable.BatchEntry;
import fr.lapetina.seedrl.store.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Third stage handler: records each evaluated step.
 *
 * The step is written to the source's batch entry, read back and appended to the
 * source's trajectory together with the caller's metrics and a wall-clock
 * {@code timestamp} in seconds.
 */
public final class TrajectoryHandler implements EventHandler<InferenceRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryHandler.class);

    private final BatchEntryTable batchEntries;
    private final TrajectoryStore trajectoryStore;
    private final Consumer<Throwable> fatalErrorListener;

    public TrajectoryHandler(
            BatchEntryTable batchEntries,
            TrajectoryStore trajectoryStore,
            Consumer<Throwable> fatalErrorListener
    ) {
        this.batchEntries = batchEntries;
        this.trajectoryStore = trajectoryStore;
        this.fatalErrorListener = fatalErrorListener;
    }

    @Override
    public void onEvent(InferenceRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.getState() != EventState.INFERRED) {
            return;
        }

        int sourceId = event.getSourceId();
        batchEntries.write(sourceId, new BatchEntry(event.getStep(), event.getMetrics()));
        BatchEntry entry = batchEntries.read(sourceId);

        Map<String, Object> metrics = new HashMap<>(entry.metrics());
        metrics.put("timestamp", System.currentTimeMillis() / 1000.0);

        try {
            trajectoryStore.addToEntry(sourceId, entry.step(), metrics);
            event.markStored();
        } catch (TrajectoryOverflowException e) {
            event.markFailed(ErrorType.STORE_ERROR, e);
            log.error("Trajectory store rejected step: sourceId={}, sequence={}", sourceId, sequence, e);
            fatalErrorListener.accept(e);
        }
    }
}
