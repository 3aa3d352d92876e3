package fr.lapetina.admission.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A generation request submitted by a caller, before it has been admitted.
 * Immutable and thread-safe.
 *
 * <p>The admission layer only looks at the beam width, request type and context phase
 * parameters (validation), the scheduling hint (placement) and the prompt length
 * (fallback balancing). Everything else is carried through to the execution engine.
 */
public record GenerationRequest(
        List<Integer> inputTokenIds,
        int maxNewTokens,
        int beamWidth,
        RequestType requestType,
        String contextPhaseParams,
        SchedulingHint schedulingHint,
        String correlationId,
        Instant createdAt
) {
    public GenerationRequest {
        inputTokenIds = inputTokenIds != null ? List.copyOf(inputTokenIds) : List.of();
        if (maxNewTokens < 0) {
            throw new IllegalArgumentException("maxNewTokens must not be negative");
        }
        if (requestType == null) {
            requestType = RequestType.CONTEXT_AND_GENERATION;
        }
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a plain context-and-generation request with beam width 1 and no rank preference.
     */
    public static GenerationRequest ofTokens(List<Integer> inputTokenIds, int maxNewTokens) {
        return new GenerationRequest(
                inputTokenIds, maxNewTokens, 1, RequestType.CONTEXT_AND_GENERATION,
                null, null, null, null
        );
    }

    /**
     * Number of prompt tokens, used to balance context work across ranks.
     */
    public int promptLength() {
        return inputTokenIds.size();
    }

    public Optional<SchedulingHint> hint() {
        return Optional.ofNullable(schedulingHint);
    }

    /**
     * Returns a copy of this request carrying the given scheduling hint.
     */
    public GenerationRequest withSchedulingHint(SchedulingHint hint) {
        return new GenerationRequest(
                inputTokenIds, maxNewTokens, beamWidth, requestType,
                contextPhaseParams, hint, correlationId, createdAt
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Integer> inputTokenIds;
        private int maxNewTokens = 16;
        private int beamWidth = 1;
        private RequestType requestType = RequestType.CONTEXT_AND_GENERATION;
        private String contextPhaseParams;
        private SchedulingHint schedulingHint;
        private String correlationId;
        private Instant createdAt;

        public Builder inputTokenIds(List<Integer> inputTokenIds) {
            this.inputTokenIds = inputTokenIds;
            return this;
        }

        public Builder maxNewTokens(int maxNewTokens) {
            this.maxNewTokens = maxNewTokens;
            return this;
        }

        public Builder beamWidth(int beamWidth) {
            this.beamWidth = beamWidth;
            return this;
        }

        public Builder requestType(RequestType requestType) {
            this.requestType = requestType;
            return this;
        }

        public Builder contextPhaseParams(String contextPhaseParams) {
            this.contextPhaseParams = contextPhaseParams;
            return this;
        }

        public Builder schedulingHint(SchedulingHint schedulingHint) {
            this.schedulingHint = schedulingHint;
            return this;
        }

        /**
         * Pins the request to a rank ({@code relaxed=false}) or states a preference for it.
         */
        public Builder targetRank(int rank, boolean relaxed) {
            this.schedulingHint = new SchedulingHint(rank, relaxed);
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(
                    inputTokenIds, maxNewTokens, beamWidth, requestType,
                    contextPhaseParams, schedulingHint, correlationId, createdAt
            );
        }
    }
}
