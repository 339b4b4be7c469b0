package fr.lapetina.seedrl.session;

import fr.lapetina.seedrl.domain.exception.DuplicateSessionException;
import fr.lapetina.seedrl.domain.exception.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe registry of the callers currently checked in.
 *
 * <p>Shutdown waits on {@link #awaitEmpty(Duration)} until every caller has checked out,
 * so that no caller is left blocked on an answer that will never come.
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Object emptyMonitor = new Object();

    /**
     * @throws DuplicateSessionException if {@code callerId} is already checked in
     */
    public Session checkIn(String callerId, int rank) {
        Session session = new Session(callerId, rank, Instant.now());
        Session existing = sessions.putIfAbsent(callerId, session);
        if (existing != null) {
            log.warn("Rejected duplicate check-in: callerId={}, rank={}", callerId, rank);
            throw new DuplicateSessionException(callerId);
        }
        log.info("Caller checked in: callerId={}, rank={}, active={}", callerId, rank, sessions.size());
        return session;
    }

    /**
     * @throws UnknownSessionException if {@code callerId} is not checked in
     */
    public Session checkOut(String callerId) {
        Session removed = sessions.remove(callerId);
        if (removed == null) {
            log.warn("Rejected check-out of unknown caller: callerId={}", callerId);
            throw new UnknownSessionException(callerId);
        }
        removed.markCheckedOut();
        synchronized (emptyMonitor) {
            emptyMonitor.notifyAll();
        }
        log.info("Caller checked out: callerId={}, active={}", callerId, sessions.size());
        return removed;
    }

    /**
     * Waits until no caller is checked in.
     *
     * @return true if the registry emptied, false if the timeout elapsed first
     */
    public boolean awaitEmpty(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (emptyMonitor) {
            while (!sessions.isEmpty()) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(emptyMonitor, remainingNanos);
            }
        }
        return true;
    }

    public boolean isCheckedIn(String callerId) {
        return sessions.containsKey(callerId);
    }

    public int size() {
        return sessions.size();
    }

    public Collection<Session> getSessions() {
        return List.copyOf(sessions.values());
    }
}
