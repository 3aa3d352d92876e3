package fr.lapetina.admission.domain.strategy;

import fr.lapetina.admission.domain.model.QueueItem;

import java.util.List;

/**
 * Least-loaded placement in arrival order.
 *
 * The default strategy: earlier requests get the emptier ranks.
 */
public final class LeastLoadedPlacementStrategy extends HeapPlacementStrategy {

    public static final String NAME = "least-loaded";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<QueueItem> order(List<QueueItem> pool) {
        return pool;
    }
}
