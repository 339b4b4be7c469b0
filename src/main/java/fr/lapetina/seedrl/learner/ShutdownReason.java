package fr.lapetina.seedrl.learner;

/**
 * Why a learner stopped.
 */
public enum ShutdownReason {
    MAX_EPOCHS,
    TOTAL_STEPS,
    MAX_TIME,
    /** The liveness watchdog saw no progress */
    STALLED,
    /** Model evaluation or trajectory storage failed */
    FATAL_ERROR,
    INTERRUPTED,
    /** Closed by its owner */
    CLOSED
}
