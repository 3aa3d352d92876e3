package fr.lapetina.admission.conversion;

/**
 * Thrown when an admitted request cannot be turned into an executable request.
 */
public final class RequestConversionException extends RuntimeException {

    private final long requestId;

    public RequestConversionException(long requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public RequestConversionException(long requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public long getRequestId() {
        return requestId;
    }
}
