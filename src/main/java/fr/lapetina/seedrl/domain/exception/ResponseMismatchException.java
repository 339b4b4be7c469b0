package fr.lapetina.seedrl.domain.exception;

/**
 * Raised on the caller side when an answer echoes a different source id than the one
 * the request was submitted for.
 */
public final class ResponseMismatchException extends ProtocolViolationException {

    private final int expectedSourceId;
    private final int actualSourceId;

    public ResponseMismatchException(int expectedSourceId, int actualSourceId) {
        super("Answer for source " + actualSourceId + " received for request of source " + expectedSourceId);
        this.expectedSourceId = expectedSourceId;
        this.actualSourceId = actualSourceId;
    }

    public int getExpectedSourceId() {
        return expectedSourceId;
    }

    public int getActualSourceId() {
        return actualSourceId;
    }
}
