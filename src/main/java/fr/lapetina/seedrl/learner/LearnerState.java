package fr.lapetina.seedrl.learner;

/**
 * Lifecycle of a learner.
 */
public enum LearnerState {
    /** Waiting for the next training batch */
    IDLE,

    /** Running a training step */
    TRAINING,

    /** Shutdown requested; waiting for callers and workers to finish */
    SHUTTING_DOWN,

    /** Final report produced */
    STOPPED
}
