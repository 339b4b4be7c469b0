package fr.lapetina.seedrl.domain.exception;

public final class DuplicateSessionException extends ProtocolViolationException {

    private final String callerId;

    public DuplicateSessionException(String callerId) {
        super("Caller already checked in: " + callerId);
        this.callerId = callerId;
    }

    public String getCallerId() {
        return callerId;
    }
}
