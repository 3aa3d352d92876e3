package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.QueueItem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.function.Predicate;

/**
 * Validated requests waiting for admission, in arrival order.
 *
 * Not thread-safe: owned and mutated by the scheduling thread only. The size is mirrored in a
 * volatile field so metrics can read it from other threads.
 */
public final class PendingBacklog implements Iterable<QueueItem> {

    private final ArrayDeque<QueueItem> items = new ArrayDeque<>();
    private volatile int sizeSnapshot;

    public void appendAll(Collection<QueueItem> newItems) {
        for (QueueItem item : newItems) {
            requireNormal(item);
            items.addLast(item);
        }
        sizeSnapshot = items.size();
    }

    public void append(QueueItem item) {
        requireNormal(item);
        items.addLast(item);
        sizeSnapshot = items.size();
    }

    /**
     * Puts items back at the front, keeping their relative order ahead of everything already
     * pending.
     */
    public void returnToFront(List<QueueItem> deferred) {
        ListIterator<QueueItem> it = deferred.listIterator(deferred.size());
        while (it.hasPrevious()) {
            items.addFirst(it.previous());
        }
        sizeSnapshot = items.size();
    }

    /**
     * Removes up to {@code n} items from the front.
     */
    public List<QueueItem> pollFront(int n) {
        int count = Math.min(Math.max(n, 0), items.size());
        List<QueueItem> taken = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            taken.add(items.pollFirst());
        }
        sizeSnapshot = items.size();
        return taken;
    }

    /**
     * Scans from the front and removes items accepted by {@code eligible} until {@code n}
     * items were taken. Rejected items stay where they are.
     */
    public List<QueueItem> pollMatching(int n, Predicate<QueueItem> eligible) {
        List<QueueItem> taken = new ArrayList<>();
        if (n <= 0) {
            return taken;
        }
        Iterator<QueueItem> it = items.iterator();
        while (it.hasNext() && taken.size() < n) {
            QueueItem item = it.next();
            if (eligible.test(item)) {
                it.remove();
                taken.add(item);
            }
        }
        sizeSnapshot = items.size();
        return taken;
    }

    /**
     * Removes every item matching {@code predicate}; survivors keep their order.
     */
    public List<QueueItem> removeIf(Predicate<QueueItem> predicate) {
        List<QueueItem> removed = new ArrayList<>();
        Iterator<QueueItem> it = items.iterator();
        while (it.hasNext()) {
            QueueItem item = it.next();
            if (predicate.test(item)) {
                it.remove();
                removed.add(item);
            }
        }
        sizeSnapshot = items.size();
        return removed;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Size as last published by the scheduling thread; safe to read from any thread.
     */
    public int sizeSnapshot() {
        return sizeSnapshot;
    }

    public List<QueueItem> snapshot() {
        return List.copyOf(items);
    }

    @Override
    public Iterator<QueueItem> iterator() {
        return snapshot().iterator();
    }

    private static void requireNormal(QueueItem item) {
        if (!item.isNormal()) {
            throw new IllegalArgumentException("Only normal items can be pending: " + item);
        }
    }
}
