package fr.lapetina.admission.validation;

/**
 * Thrown when a request does not have a shape the engine can serve.
 */
public final class RequestValidationException extends RuntimeException {

    private final long requestId;

    public RequestValidationException(String message) {
        this(-1L, message);
    }

    public RequestValidationException(long requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    /**
     * Id of the offending item, or -1 when the request was rejected before an id was issued.
     */
    public long getRequestId() {
        return requestId;
    }
}
