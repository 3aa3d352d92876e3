package fr.lapetina.admission.domain.event;

import fr.lapetina.admission.domain.model.QueueItem;

import java.time.Instant;

/**
 * Slot of the ingress ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. Producers fill it while
 * holding the enqueue lock; the scheduling thread takes the item out and clears the slot.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the ingress queue.
 */
public final class IngressEvent {

    private QueueItem item;
    private Instant publishedAt;

    public void clear() {
        this.item = null;
        this.publishedAt = null;
    }

    public void initialize(QueueItem item, Instant publishedAt) {
        this.item = item;
        this.publishedAt = publishedAt;
    }

    /**
     * Returns the held item and clears the slot so the ring does not retain it.
     */
    public QueueItem take() {
        QueueItem taken = item;
        clear();
        return taken;
    }

    public QueueItem getItem() {
        return item;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    @Override
    public String toString() {
        return "IngressEvent{item=" + item + ", publishedAt=" + publishedAt + '}';
    }
}
