package fr.lapetina.seedrl.domain.event;

/**
 * Lifecycle state of a submitted request in the inference pipeline.
 */
public enum EventState {
    /** Event just published, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** Model outputs assigned */
    INFERRED,

    /** Step appended to the source's trajectory */
    STORED,

    /** Answer delivered to the caller */
    COMPLETED,

    /** Request failed */
    FAILED
}
