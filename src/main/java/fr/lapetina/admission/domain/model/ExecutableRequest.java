package fr.lapetina.admission.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Request in the form the execution engine consumes, produced once per admitted item.
 */
public record ExecutableRequest(
        long requestId,
        int rank,
        List<Integer> inputTokenIds,
        int maxNewTokens,
        int beamWidth,
        RequestType requestType,
        String contextPhaseParams,
        String correlationId,
        Instant admittedAt
) {
    public ExecutableRequest {
        inputTokenIds = List.copyOf(inputTokenIds);
        Objects.requireNonNull(requestType, "requestType is required");
        Objects.requireNonNull(admittedAt, "admittedAt is required");
    }

    public boolean isGenerationOnly() {
        return requestType == RequestType.GENERATION_ONLY;
    }
}
