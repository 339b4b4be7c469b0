package fr.lapetina.seedrl.domain.exception;

/**
 * Thrown when a caller breaks the session protocol: checks in twice, checks out
 * without a session, or submits for a source that still has a request outstanding.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
