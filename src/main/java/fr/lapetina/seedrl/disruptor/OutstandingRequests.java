package fr.lapetina.seedrl.disruptor;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Source ids that currently have a request in the pipeline.
 *
 * <p>A slot is acquired on submission and released by the completion stage right before
 * the caller's future completes, so the caller can submit again as soon as it has its
 * answer.
 */
public final class OutstandingRequests {

    private final Set<Integer> sources = ConcurrentHashMap.newKeySet();

    /**
     * @return false if the source already has a request outstanding
     */
    public boolean tryAcquire(int sourceId) {
        return sources.add(sourceId);
    }

    public void release(int sourceId) {
        sources.remove(sourceId);
    }

    public boolean isOutstanding(int sourceId) {
        return sources.contains(sourceId);
    }

    public int size() {
        return sources.size();
    }
}
