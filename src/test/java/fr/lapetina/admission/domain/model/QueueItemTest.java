package fr.lapetina.admission.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueItemTest {

    private final GenerationRequest request = GenerationRequest.builder()
            .inputTokenIds(List.of(4, 5, 6, 7))
            .targetRank(2, true)
            .build();

    @Test
    @DisplayName("should expose the request of a normal item")
    void shouldExposeRequest() {
        QueueItem item = QueueItem.normal(12, request);

        assertThat(item.isNormal()).isTrue();
        assertThat(item.request()).isSameAs(request);
        assertThat(item.promptLength()).isEqualTo(4);
        assertThat(item.schedulingHint()).contains(SchedulingHint.preferred(2));
    }

    @Test
    @DisplayName("should carry no request on control items")
    void shouldCarryNoRequestOnControlItems() {
        QueueItem cancel = QueueItem.cancel(12);
        QueueItem shutdown = QueueItem.shutdown();

        assertThat(cancel.isCancellation()).isTrue();
        assertThat(shutdown.id()).isEqualTo(QueueItem.SHUTDOWN_REQUEST_ID);
        assertThat(cancel.schedulingHint()).isEmpty();
        assertThat(shutdown.promptLength()).isZero();
        assertThatThrownBy(cancel::request).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should reject inconsistent items")
    void shouldRejectInconsistentItems() {
        assertThatThrownBy(() -> new QueueItem(QueueItem.Kind.NORMAL, 1, null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> QueueItem.normal(-1, request))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueItem(QueueItem.Kind.CANCEL, 1, request))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueueItem(QueueItem.Kind.SHUTDOWN, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should fill request defaults")
    void shouldFillRequestDefaults() {
        GenerationRequest plain = new GenerationRequest(null, 4, 1, null, null, null, null, null);

        assertThat(plain.inputTokenIds()).isEmpty();
        assertThat(plain.requestType()).isEqualTo(RequestType.CONTEXT_AND_GENERATION);
        assertThat(plain.correlationId()).isNotBlank();
        assertThat(plain.createdAt()).isNotNull();
        assertThat(plain.hint()).isEmpty();
        assertThat(plain.withSchedulingHint(SchedulingHint.pinned(1)).hint()).contains(SchedulingHint.pinned(1));
        assertThatThrownBy(() -> SchedulingHint.pinned(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
