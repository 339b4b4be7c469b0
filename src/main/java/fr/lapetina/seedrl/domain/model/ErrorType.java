package fr.lapetina.seedrl.domain.model;

/**
 * Error taxonomy for submitted requests.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Malformed request (unknown source id, wrong observation width) */
    VALIDATION_ERROR,

    /** Caller broke the session protocol */
    PROTOCOL_VIOLATION,

    /** Model evaluation failed; fatal to the batch cycle */
    MODEL_ERROR,

    /** Trajectory store invariant violated */
    STORE_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
