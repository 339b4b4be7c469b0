package fr.lapetina.seedrl.domain.exception;

/**
 * A second request was submitted for a source whose previous request is still pending.
 */
public final class OutstandingRequestException extends ProtocolViolationException {

    private final int sourceId;

    public OutstandingRequestException(int sourceId) {
        super("Source already has an outstanding request: " + sourceId);
        this.sourceId = sourceId;
    }

    public int getSourceId() {
        return sourceId;
    }
}
