package fr.lapetina.seedrl.store;

import fr.lapetina.seedrl.domain.model.StepRecord;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Latest evaluated step of every source, indexed by source id.
 *
 * <p>The inference stage writes a source's entry after the model has run; the entry is
 * then read back and appended to the source's trajectory. Each slot has its own lock.
 */
public final class BatchEntryTable {

    /**
     * Evaluated step plus the per-step metrics the caller sent with it.
     */
    public record BatchEntry(StepRecord step, Map<String, Object> metrics) {
    }

    private final BatchEntry[] entries;
    private final ReentrantLock[] locks;

    public BatchEntryTable(int numSources) {
        this.entries = new BatchEntry[numSources];
        this.locks = new ReentrantLock[numSources];
        for (int i = 0; i < numSources; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public void write(int sourceId, BatchEntry entry) {
        ReentrantLock lock = locks[sourceId];
        lock.lock();
        try {
            entries[sourceId] = entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the latest entry of the source, or {@code null} if none was written yet
     */
    public BatchEntry read(int sourceId) {
        ReentrantLock lock = locks[sourceId];
        lock.lock();
        try {
            return entries[sourceId];
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return entries.length;
    }
}
