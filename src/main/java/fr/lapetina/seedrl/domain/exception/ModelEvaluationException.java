package fr.lapetina.seedrl.domain.exception;

/**
 * The inference model failed to evaluate a batch, or produced outputs of the wrong
 * shape. Fatal to the learner.
 */
public final class ModelEvaluationException extends RuntimeException {

    public ModelEvaluationException(String message) {
        super(message);
    }

    public ModelEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
