package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.validation.RequestValidationException;
import fr.lapetina.admission.validation.RequestValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdmissionFilterTest {

    private AdmissionFilter filter;

    @BeforeEach
    void setUp() {
        filter = new AdmissionFilter(RequestValidator.withDefaults());
    }

    private static QueueItem item(long id) {
        return QueueItem.normal(id, GenerationRequest.ofTokens(List.of(1, 2, 3), 4));
    }

    @Test
    @DisplayName("should keep requests and record cancellations")
    void shouldSeparateControlItems() {
        List<QueueItem> requests = filter.validate(List.of(
                item(1), QueueItem.cancel(1), item(2), QueueItem.cancel(3)));

        assertThat(requests).extracting(QueueItem::id).containsExactly(1L, 2L);
        assertThat(filter.getCanceledIds()).containsExactly(1L, 3L);
        assertThat(filter.getCanceledIdsSize()).isEqualTo(2);
        assertThat(filter.isShutdownRequested()).isFalse();
    }

    @Test
    @DisplayName("should keep processing items after a shutdown sentinel")
    void shouldContinuePastShutdown() {
        List<QueueItem> requests = filter.validate(List.of(
                item(1), QueueItem.shutdown(), item(2), QueueItem.cancel(1)));

        assertThat(filter.isShutdownRequested()).isTrue();
        assertThat(requests).extracting(QueueItem::id).containsExactly(1L, 2L);
        assertThat(filter.getCanceledIds()).containsExactly(1L);
    }

    @Test
    @DisplayName("should fail on a malformed request")
    void shouldRejectMalformedRequest() {
        QueueItem wide = QueueItem.normal(7, GenerationRequest.builder()
                .inputTokenIds(List.of(1))
                .beamWidth(2)
                .build());

        assertThatThrownBy(() -> filter.validate(List.of(item(1), wide)))
                .isInstanceOf(RequestValidationException.class)
                .satisfies(e -> assertThat(((RequestValidationException) e).getRequestId()).isEqualTo(7L));
    }

    @Test
    @DisplayName("should purge canceled requests and keep the ids")
    void shouldPurgeCanceled() {
        PendingBacklog backlog = new PendingBacklog();
        backlog.appendAll(filter.validate(List.of(item(1), item(2), item(3))));
        filter.validate(List.of(QueueItem.cancel(2), QueueItem.cancel(9)));

        int purged = filter.purgeCanceled(backlog);

        assertThat(purged).isEqualTo(1);
        assertThat(backlog.snapshot()).extracting(QueueItem::id).containsExactly(1L, 3L);
        assertThat(filter.getCanceledIds()).containsExactly(2L, 9L);
    }

    @Test
    @DisplayName("should purge a request canceled before it arrived")
    void shouldPurgeLateArrival() {
        PendingBacklog backlog = new PendingBacklog();
        filter.validate(List.of(QueueItem.cancel(5)));
        backlog.appendAll(filter.validate(List.of(item(5), item(6))));

        assertThat(filter.purgeCanceledItems(backlog)).extracting(QueueItem::id).containsExactly(5L);
        assertThat(backlog.snapshot()).extracting(QueueItem::id).containsExactly(6L);
    }

    @Test
    @DisplayName("should forget ids once cleared")
    void shouldClearCanceledIds() {
        filter.validate(List.of(QueueItem.cancel(1)));

        filter.clearCanceledIds();

        assertThat(filter.getCanceledIds()).isEmpty();
        assertThat(filter.getCanceledIdsSize()).isZero();
    }
}
