package fr.lapetina.admission.domain.strategy;

import fr.lapetina.admission.domain.model.QueueItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Least-loaded placement, longest prompts first.
 *
 * Placing long prompts first spreads prefill cost more evenly than arrival order when prompt
 * lengths vary a lot. Requests of equal length keep their arrival order (the sort is stable).
 */
public final class LongestPromptFirstPlacementStrategy extends HeapPlacementStrategy {

    public static final String NAME = "longest-prompt-first";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected List<QueueItem> order(List<QueueItem> pool) {
        List<QueueItem> sorted = new ArrayList<>(pool);
        sorted.sort(Comparator.comparingInt(QueueItem::promptLength).reversed());
        return sorted;
    }
}
