package fr.lapetina.seedrl.disruptor.exception;

/**
 * Exception thrown when the inference pipeline cannot admit a request.
 *
 * This occurs when the ring buffer is full. With one outstanding request per source and
 * a ring buffer sized for every source, it means the buffer is misconfigured or callers
 * bypass the session protocol.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
