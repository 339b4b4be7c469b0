package fr.lapetina.seedrl.domain.exception;

public final class UnknownSessionException extends ProtocolViolationException {

    private final String callerId;

    public UnknownSessionException(String callerId) {
        super("Caller is not checked in: " + callerId);
        this.callerId = callerId;
    }

    public String getCallerId() {
        return callerId;
    }
}
