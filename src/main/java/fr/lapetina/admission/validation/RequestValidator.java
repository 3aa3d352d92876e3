package fr.lapetina.admission.validation;

import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.RequestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a request has a shape the engine was configured for.
 *
 * Validates:
 * - Request is not null
 * - Beam width is between 1 and the configured maximum
 * - Request type matches the serving mode (aggregated or disaggregated)
 * - Generation-only requests carry context phase parameters
 * - Prompt is present unless the request resumes from a context server
 */
public final class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    private final int maxBeamWidth;
    private final boolean disaggregated;

    public RequestValidator(int maxBeamWidth, boolean disaggregated) {
        if (maxBeamWidth < 1) {
            throw new IllegalArgumentException("maxBeamWidth must be at least 1");
        }
        this.maxBeamWidth = maxBeamWidth;
        this.disaggregated = disaggregated;
    }

    /**
     * Creates a validator for aggregated serving with greedy decoding.
     */
    public static RequestValidator withDefaults() {
        return new RequestValidator(1, false);
    }

    /**
     * Validates a request that has not been issued an id yet.
     *
     * @throws RequestValidationException if the request is rejected
     */
    public void validate(GenerationRequest request) {
        validate(-1L, request);
    }

    /**
     * Validates a request, reporting {@code requestId} on failure.
     *
     * @throws RequestValidationException if the request is rejected
     */
    public void validate(long requestId, GenerationRequest request) {
        String reason = rejectionReason(request);
        if (reason != null) {
            log.warn("Request rejected: requestId={}, reason={}", requestId, reason);
            throw new RequestValidationException(requestId, reason);
        }
    }

    private String rejectionReason(GenerationRequest request) {
        if (request == null) {
            return "Request is null";
        }

        if (request.beamWidth() < 1 || request.beamWidth() > maxBeamWidth) {
            return "Request beam width " + request.beamWidth()
                    + " is outside the supported range [1, " + maxBeamWidth + "]";
        }

        RequestType type = request.requestType();
        if (!disaggregated && type != RequestType.CONTEXT_AND_GENERATION) {
            return "Request type " + type + " requires disaggregated serving";
        }

        if (type == RequestType.GENERATION_ONLY) {
            if (request.contextPhaseParams() == null || request.contextPhaseParams().isBlank()) {
                return "Generation-only request requires context phase parameters";
            }
        } else if (request.inputTokenIds().isEmpty()) {
            return "Input token ids are required";
        }

        return null;
    }

    public int getMaxBeamWidth() {
        return maxBeamWidth;
    }

    public boolean isDisaggregated() {
        return disaggregated;
    }
}
