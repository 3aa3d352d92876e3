package fr.lapetina.admission.domain.strategy;

import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.scheduler.CapacityTracker;
import fr.lapetina.admission.scheduler.RankAssignment;

import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Base for strategies that hand each item to the least loaded rank with spare capacity.
 *
 * Load is compared as (prompt tokens placed on the rank during this call, active requests,
 * rank index), smallest first. A rank leaves the queue once it is full. With equal prompt
 * lengths this is a round-robin over ranks ordered by current load, which keeps context
 * work even across ranks within a tick.
 *
 * Subclasses only decide the order in which the pool is placed.
 */
public abstract class HeapPlacementStrategy implements PlacementStrategy {

    private static final Comparator<RankLoad> LEAST_LOADED_FIRST = Comparator
            .comparingLong(RankLoad::placedTokens)
            .thenComparingInt(RankLoad::activeRequests)
            .thenComparingInt(RankLoad::rank);

    @Override
    public final void place(List<QueueItem> pool, CapacityTracker tracker, RankAssignment assignment) {
        if (pool.isEmpty()) {
            return;
        }

        PriorityQueue<RankLoad> ranks = new PriorityQueue<>(LEAST_LOADED_FIRST);
        for (int rank = 0; rank < tracker.numRanks(); rank++) {
            if (tracker.hasCapacity(rank)) {
                ranks.add(new RankLoad(rank, 0L, tracker.get(rank)));
            }
        }

        for (QueueItem item : order(pool)) {
            RankLoad least = ranks.poll();
            if (least == null) {
                assignment.defer(item);
                continue;
            }

            tracker.tryReserve(least.rank());
            assignment.assign(least.rank(), item);

            if (tracker.hasCapacity(least.rank())) {
                ranks.add(new RankLoad(
                        least.rank(),
                        least.placedTokens() + item.promptLength(),
                        tracker.get(least.rank())
                ));
            }
        }
    }

    /**
     * Returns the pool in the order it should be placed. Must not modify {@code pool}.
     */
    protected abstract List<QueueItem> order(List<QueueItem> pool);

    private record RankLoad(int rank, long placedTokens, int activeRequests) {
    }
}
