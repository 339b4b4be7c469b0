package fr.lapetina.seedrl.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: validates submitted environment states.
 *
 * Validates:
 * - Source id is within the configured range
 * - State is present
 * - Observation width matches the trajectory layout
 */
public final class ValidationHandler implements EventHandler<InferenceRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final int numSources;
    private final int observationSize;

    public ValidationHandler(int numSources, int observationSize) {
        this.numSources = numSources;
        this.observationSize = observationSize;
    }

    @Override
    public void onEvent(InferenceRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);

        try {
            validate(event);
            event.markValidated();

            log.debug("Request validated: sourceId={}, sequence={}", event.getSourceId(), sequence);

        } catch (ValidationException e) {
            event.setState(EventState.VALIDATION_FAILED);
            event.setError(ErrorType.VALIDATION_ERROR, e.getMessage());

            log.warn("Validation failed: sourceId={}, reason={}, sequence={}",
                    event.getSourceId(), e.getMessage(), sequence);
        }
    }

    private void validate(InferenceRequestEvent event) throws ValidationException {
        int sourceId = event.getSourceId();
        if (sourceId < 0 || sourceId >= numSources) {
            throw new ValidationException("Source id out of range [0, " + numSources + "): " + sourceId);
        }

        EnvironmentState state = event.getEnvironmentState();
        if (state == null) {
            throw new ValidationException("Environment state is required");
        }

        if (state.observation().length != observationSize) {
            throw new ValidationException("Observation width " + state.observation().length
                    + " does not match layout width " + observationSize);
        }
    }

    private static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
