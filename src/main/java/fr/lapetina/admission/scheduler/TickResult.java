package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.ExecutableRequest;
import fr.lapetina.admission.domain.model.QueueItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scheduling tick.
 *
 * @param tick                   tick number, starting at 1
 * @param drained                raw batch taken from the ingress queue, for broadcast to the
 *                               other ranks; empty when the batch was supplied by the caller
 * @param admitted               every request admitted this tick, across all ranks
 * @param assignment             rank to admitted requests in rank-aware mode, every rank
 *                               present; empty in single-rank mode
 * @param localRequests          converted requests this rank must execute
 * @param conversionFailures     id to failure for admitted requests that could not be converted
 * @param canceledIds            ids canceled so far and not yet cleared; requests among them that
 *                               are already executing must be stopped by the engine
 * @param deferredCount          pulled requests returned to the backlog for lack of room
 * @param purgedCount            pending requests removed by cancellation
 * @param expectedActiveRequests advisory active request count per rank
 * @param queueLatencyMs         summed submission-to-admission time of the admitted requests
 */
public record TickResult(
        long tick,
        List<QueueItem> drained,
        List<QueueItem> admitted,
        Map<Integer, List<QueueItem>> assignment,
        List<ExecutableRequest> localRequests,
        Map<Long, RuntimeException> conversionFailures,
        List<Long> canceledIds,
        int deferredCount,
        int purgedCount,
        int expectedActiveRequests,
        long queueLatencyMs
) {
    public TickResult {
        drained = List.copyOf(drained);
        admitted = List.copyOf(admitted);
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        localRequests = List.copyOf(localRequests);
        conversionFailures = Collections.unmodifiableMap(new LinkedHashMap<>(conversionFailures));
        canceledIds = List.copyOf(canceledIds);
    }

    public boolean isEmpty() {
        return admitted.isEmpty();
    }

    public List<Long> admittedIds() {
        return admitted.stream().map(QueueItem::id).toList();
    }
}
