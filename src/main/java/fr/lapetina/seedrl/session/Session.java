package fr.lapetina.seedrl.session;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A checked-in caller.
 */
public final class Session {

    private final String callerId;
    private final int rank;
    private final Instant checkedInAt;
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public Session(String callerId, int rank, Instant checkedInAt) {
        this.callerId = callerId;
        this.rank = rank;
        this.checkedInAt = checkedInAt;
    }

    public String getCallerId() {
        return callerId;
    }

    public int getRank() {
        return rank;
    }

    public Instant getCheckedInAt() {
        return checkedInAt;
    }

    public boolean isAlive() {
        return alive.get();
    }

    void markCheckedOut() {
        alive.set(false);
    }

    @Override
    public String toString() {
        return "Session{callerId='" + callerId + "', rank=" + rank + ", alive=" + alive.get() + '}';
    }
}
