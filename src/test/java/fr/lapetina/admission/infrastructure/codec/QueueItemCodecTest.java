package fr.lapetina.admission.infrastructure.codec;

import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.domain.model.RequestType;
import fr.lapetina.admission.domain.model.SchedulingHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueItemCodecTest {

    private final QueueItemCodec codec = new QueueItemCodec();

    @Test
    @DisplayName("should carry a drained batch to another rank unchanged")
    void shouldPreserveBatch() {
        GenerationRequest hinted = GenerationRequest.builder()
                .inputTokenIds(List.of(1, 2, 3))
                .maxNewTokens(12)
                .targetRank(3, true)
                .correlationId("c-1")
                .createdAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build();
        GenerationRequest generationOnly = GenerationRequest.builder()
                .requestType(RequestType.GENERATION_ONLY)
                .contextPhaseParams("kv-handle")
                .correlationId("c-2")
                .createdAt(Instant.parse("2024-05-01T10:15:31Z"))
                .build();
        List<QueueItem> batch = List.of(
                QueueItem.normal(8, hinted),
                QueueItem.cancel(5),
                QueueItem.normal(9, generationOnly),
                QueueItem.shutdown()
        );

        List<QueueItem> decoded = codec.decode(codec.encode(batch));

        assertThat(decoded).isEqualTo(batch);
        assertThat(decoded.get(0).schedulingHint()).contains(SchedulingHint.preferred(3));
        assertThat(decoded.get(2).schedulingHint()).isEmpty();
    }

    @Test
    @DisplayName("should write timestamps as ISO strings and omit absent fields")
    void shouldWriteReadableJson() {
        byte[] bytes = codec.encode(List.of(QueueItem.normal(8, GenerationRequest.builder()
                .inputTokenIds(List.of(1))
                .createdAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build())));
        String json = new String(bytes, StandardCharsets.UTF_8);

        assertThat(json).contains("\"createdAt\":\"2024-05-01T10:15:30Z\"");
        assertThat(json).doesNotContain("targetRank").doesNotContain("contextPhaseParams");
    }

    @Test
    @DisplayName("should ignore unknown properties")
    void shouldIgnoreUnknownProperties() {
        String json = "[{\"kind\":\"CANCEL\",\"id\":4,\"origin\":\"rank-0\"}]";

        assertThat(codec.decode(json.getBytes(StandardCharsets.UTF_8))).containsExactly(QueueItem.cancel(4));
    }

    @Test
    @DisplayName("should reject malformed input")
    void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueueItemCodec.CodecException.class);
        assertThatThrownBy(() -> codec.decode("null".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueueItemCodec.CodecException.class);
        assertThatThrownBy(() -> codec.decode("[{\"kind\":\"NORMAL\",\"id\":3}]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueueItemCodec.CodecException.class)
                .hasMessageContaining("id=3");
        assertThatThrownBy(() -> codec.decode("[{\"id\":3}]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueueItemCodec.CodecException.class);
    }
}
