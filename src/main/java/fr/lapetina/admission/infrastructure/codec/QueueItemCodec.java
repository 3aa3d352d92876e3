package fr.lapetina.admission.infrastructure.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.domain.model.RequestType;
import fr.lapetina.admission.domain.model.SchedulingHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the batch drained on the owner rank, so it can be sent to the other ranks.
 *
 * Every rank must decode the same items in the same order to reach the same placement, so the
 * codec carries every field that validation and scheduling look at.
 */
public final class QueueItemCodec {

    private static final Logger log = LoggerFactory.getLogger(QueueItemCodec.class);

    private static final TypeReference<List<WireItem>> WIRE_BATCH = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public QueueItemCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Encodes a batch, keeping its order.
     *
     * @throws CodecException if the batch cannot be serialized
     */
    public byte[] encode(List<QueueItem> items) {
        List<WireItem> wire = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            wire.add(WireItem.from(item));
        }
        try {
            return objectMapper.writeValueAsBytes(wire);
        } catch (IOException e) {
            throw new CodecException("Failed to encode batch of " + items.size() + " items", e);
        }
    }

    /**
     * Decodes a batch produced by {@link #encode(List)}.
     *
     * @throws CodecException if the bytes are not a valid batch
     */
    public List<QueueItem> decode(byte[] bytes) {
        List<WireItem> wire;
        try {
            wire = objectMapper.readValue(bytes, WIRE_BATCH);
        } catch (IOException e) {
            throw new CodecException("Failed to decode batch of " + bytes.length + " bytes", e);
        }
        if (wire == null) {
            throw new CodecException("Batch is null");
        }
        List<QueueItem> items = new ArrayList<>(wire.size());
        for (WireItem item : wire) {
            try {
                items.add(item.toQueueItem());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new CodecException("Malformed item in batch: kind=" + item.getKind() + ", id=" + item.getId(), e);
            }
        }
        log.debug("Decoded batch: items={}, bytes={}", items.size(), bytes.length);
        return items;
    }

    /**
     * Exception for malformed batches.
     */
    public static class CodecException extends RuntimeException {
        public CodecException(String message) {
            super(message);
        }

        public CodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WireItem {
        private QueueItem.Kind kind;
        private long id;
        private WireRequest request;

        public QueueItem.Kind getKind() { return kind; }
        public void setKind(QueueItem.Kind kind) { this.kind = kind; }

        public long getId() { return id; }
        public void setId(long id) { this.id = id; }

        public WireRequest getRequest() { return request; }
        public void setRequest(WireRequest request) { this.request = request; }

        static WireItem from(QueueItem item) {
            WireItem wire = new WireItem();
            wire.kind = item.kind();
            wire.id = item.id();
            if (item.isNormal()) {
                wire.request = WireRequest.from(item.request());
            }
            return wire;
        }

        QueueItem toQueueItem() {
            if (kind == null) {
                throw new IllegalArgumentException("kind is required");
            }
            return switch (kind) {
                case NORMAL -> {
                    if (request == null) {
                        throw new IllegalArgumentException("request is required for NORMAL items");
                    }
                    yield QueueItem.normal(id, request.toGenerationRequest());
                }
                case CANCEL -> QueueItem.cancel(id);
                case SHUTDOWN -> QueueItem.shutdown();
            };
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WireRequest {
        private List<Integer> inputTokenIds;
        private int maxNewTokens;
        private int beamWidth;
        private RequestType requestType;
        private String contextPhaseParams;
        private Integer targetRank;
        private Boolean relaxed;
        private String correlationId;
        private Instant createdAt;

        public List<Integer> getInputTokenIds() { return inputTokenIds; }
        public void setInputTokenIds(List<Integer> inputTokenIds) { this.inputTokenIds = inputTokenIds; }

        public int getMaxNewTokens() { return maxNewTokens; }
        public void setMaxNewTokens(int maxNewTokens) { this.maxNewTokens = maxNewTokens; }

        public int getBeamWidth() { return beamWidth; }
        public void setBeamWidth(int beamWidth) { this.beamWidth = beamWidth; }

        public RequestType getRequestType() { return requestType; }
        public void setRequestType(RequestType requestType) { this.requestType = requestType; }

        public String getContextPhaseParams() { return contextPhaseParams; }
        public void setContextPhaseParams(String contextPhaseParams) { this.contextPhaseParams = contextPhaseParams; }

        public Integer getTargetRank() { return targetRank; }
        public void setTargetRank(Integer targetRank) { this.targetRank = targetRank; }

        public Boolean getRelaxed() { return relaxed; }
        public void setRelaxed(Boolean relaxed) { this.relaxed = relaxed; }

        public String getCorrelationId() { return correlationId; }
        public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

        public Instant getCreatedAt() { return createdAt; }
        public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

        static WireRequest from(GenerationRequest request) {
            WireRequest wire = new WireRequest();
            wire.inputTokenIds = request.inputTokenIds();
            wire.maxNewTokens = request.maxNewTokens();
            wire.beamWidth = request.beamWidth();
            wire.requestType = request.requestType();
            wire.contextPhaseParams = request.contextPhaseParams();
            request.hint().ifPresent(hint -> {
                wire.targetRank = hint.targetRank();
                wire.relaxed = hint.relaxed();
            });
            wire.correlationId = request.correlationId();
            wire.createdAt = request.createdAt();
            return wire;
        }

        GenerationRequest toGenerationRequest() {
            SchedulingHint hint = targetRank == null
                    ? null
                    : new SchedulingHint(targetRank, Boolean.TRUE.equals(relaxed));
            return new GenerationRequest(
                    inputTokenIds,
                    maxNewTokens,
                    beamWidth,
                    requestType,
                    contextPhaseParams,
                    hint,
                    correlationId,
                    createdAt
            );
        }
    }
}
