package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingBacklogTest {

    private PendingBacklog backlog;

    @BeforeEach
    void setUp() {
        backlog = new PendingBacklog();
        backlog.appendAll(List.of(item(1), item(2), item(3), item(4)));
    }

    private static QueueItem item(long id) {
        return QueueItem.normal(id, GenerationRequest.ofTokens(List.of(1, 2), 4));
    }

    private List<Long> ids() {
        return backlog.snapshot().stream().map(QueueItem::id).toList();
    }

    @Test
    @DisplayName("should keep arrival order")
    void shouldKeepArrivalOrder() {
        backlog.append(item(5));

        assertThat(ids()).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(backlog.sizeSnapshot()).isEqualTo(5);
    }

    @Test
    @DisplayName("should reject control items")
    void shouldRejectControlItems() {
        assertThatThrownBy(() -> backlog.append(QueueItem.cancel(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backlog.appendAll(List.of(QueueItem.shutdown())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should put deferred items back in front in their order")
    void shouldReturnToFront() {
        List<QueueItem> taken = backlog.pollFront(2);

        backlog.returnToFront(taken);

        assertThat(ids()).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    @DisplayName("should leave rejected items in place when polling selectively")
    void shouldPollMatching() {
        List<QueueItem> taken = backlog.pollMatching(2, item -> item.id() % 2 == 0);

        assertThat(taken).extracting(QueueItem::id).containsExactly(2L, 4L);
        assertThat(ids()).containsExactly(1L, 3L);
    }

    @Test
    @DisplayName("should stop polling once enough items were taken")
    void shouldStopAtLimit() {
        List<Long> tested = new ArrayList<>();

        backlog.pollMatching(1, item -> {
            tested.add(item.id());
            return true;
        });

        assertThat(tested).containsExactly(1L);
    }

    @Test
    @DisplayName("should remove matching items keeping survivors in order")
    void shouldRemoveIf() {
        List<QueueItem> removed = backlog.removeIf(item -> item.id() == 2 || item.id() == 3);

        assertThat(removed).extracting(QueueItem::id).containsExactly(2L, 3L);
        assertThat(ids()).containsExactly(1L, 4L);
        assertThat(backlog.sizeSnapshot()).isEqualTo(2);
    }

    @Test
    @DisplayName("should iterate over a snapshot")
    void shouldIterateOverSnapshot() {
        for (QueueItem item : backlog) {
            backlog.removeIf(pending -> pending.id() == item.id());
        }

        assertThat(backlog.isEmpty()).isTrue();
    }
}
