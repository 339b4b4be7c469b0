package fr.lapetina.seedrl.domain.exception;

/**
 * Append attempted on a trajectory that is already full. A full trajectory is always
 * handed off and reset before the next append, so this signals a broken invariant.
 */
public final class TrajectoryOverflowException extends RuntimeException {

    private final int sourceId;

    public TrajectoryOverflowException(int sourceId, int maxLength) {
        super("Trajectory of source " + sourceId + " is full (length " + maxLength + ")");
        this.sourceId = sourceId;
    }

    public int getSourceId() {
        return sourceId;
    }
}
