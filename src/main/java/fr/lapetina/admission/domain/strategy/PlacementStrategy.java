package fr.lapetina.admission.domain.strategy;

import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.scheduler.CapacityTracker;
import fr.lapetina.admission.scheduler.RankAssignment;

import java.util.List;

/**
 * Strategy for placing requests that have no usable target rank: unhinted requests and
 * preferred-rank requests whose preferred rank was full.
 *
 * Implementations are called from the scheduling thread only, but must be stateless across
 * calls so the same strategy yields the same placement on every rank of the cluster.
 */
public interface PlacementStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Places {@code pool} onto ranks with spare capacity.
     *
     * <p>Every placed item must reserve one slot on its rank through {@code tracker}, and no
     * rank may be filled beyond its capacity. Items that fit nowhere go to
     * {@link RankAssignment#defer(QueueItem)}.
     *
     * @param pool       items to place, in arrival order
     * @param tracker    current per-rank counters, updated in place
     * @param assignment receives placed and deferred items
     */
    void place(List<QueueItem> pool, CapacityTracker tracker, RankAssignment assignment);
}
