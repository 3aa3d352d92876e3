package fr.lapetina.admission.ingress.exception;

/**
 * Exception thrown when the ingress queue cannot take a submission.
 *
 * This occurs when the ring buffer has fewer free slots than the batch being submitted.
 * Nothing from the rejected batch is queued and no request id is consumed, so the caller
 * may retry the same batch later.
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
        RING_BUFFER_FULL("Ingress ring buffer is full"),
        BATCH_TOO_LARGE("Batch is larger than the ingress ring buffer");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
