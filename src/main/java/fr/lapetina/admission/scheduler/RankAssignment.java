package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.QueueItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of placing one tick's items onto ranks: the items admitted per rank, in placement
 * order, and the items that found no room and stay pending.
 *
 * Every rank of the cluster has an entry, possibly empty.
 */
public final class RankAssignment {

    private final List<List<QueueItem>> perRank;
    private final List<QueueItem> deferred = new ArrayList<>();

    public RankAssignment(int numRanks) {
        this.perRank = new ArrayList<>(numRanks);
        for (int rank = 0; rank < numRanks; rank++) {
            perRank.add(new ArrayList<>());
        }
    }

    public void assign(int rank, QueueItem item) {
        perRank.get(rank).add(item);
    }

    public void defer(QueueItem item) {
        deferred.add(item);
    }

    /**
     * Puts the deferred items back in the order they appear in {@code arrivalOrder}.
     */
    void orderDeferred(List<QueueItem> arrivalOrder) {
        if (deferred.size() < 2) {
            return;
        }
        Set<QueueItem> given = Collections.newSetFromMap(new IdentityHashMap<>());
        given.addAll(deferred);
        deferred.clear();
        for (QueueItem item : arrivalOrder) {
            if (given.contains(item)) {
                deferred.add(item);
            }
        }
    }

    public int numRanks() {
        return perRank.size();
    }

    public List<QueueItem> forRank(int rank) {
        return Collections.unmodifiableList(perRank.get(rank));
    }

    /**
     * Rank to admitted items, in ascending rank order.
     */
    public Map<Integer, List<QueueItem>> asMap() {
        Map<Integer, List<QueueItem>> map = new LinkedHashMap<>();
        for (int rank = 0; rank < perRank.size(); rank++) {
            map.put(rank, List.copyOf(perRank.get(rank)));
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Rank to admitted ids, in ascending rank order.
     */
    public Map<Integer, List<Long>> idsByRank() {
        Map<Integer, List<Long>> map = new LinkedHashMap<>();
        for (int rank = 0; rank < perRank.size(); rank++) {
            map.put(rank, perRank.get(rank).stream().map(QueueItem::id).toList());
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Items left without a rank. After {@link AdmissionScheduler#scheduleAcrossRanks} they are
     * in arrival order.
     */
    public List<QueueItem> getDeferred() {
        return Collections.unmodifiableList(deferred);
    }

    public int admittedCount() {
        int count = 0;
        for (List<QueueItem> items : perRank) {
            count += items.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "RankAssignment{" + idsByRank() + ", deferred="
                + deferred.stream().map(QueueItem::id).toList() + '}';
    }
}
