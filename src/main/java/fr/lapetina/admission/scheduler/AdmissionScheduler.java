package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.domain.model.SchedulingHint;
import fr.lapetina.admission.domain.strategy.PlacementStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which pending requests become active and on which rank.
 *
 * Single-rank mode simply takes requests from the front of the backlog. Rank-aware mode
 * honors scheduling hints:
 * - pinned requests only ever run on their target rank and wait while it is full
 * - relaxed requests prefer their target rank and fall back to any rank with room
 * - unhinted requests go wherever the {@link PlacementStrategy} puts them
 *
 * No call ever pushes a rank beyond the tracker's per-rank capacity. A hint whose target is
 * not a rank of the cluster is ignored and the request is treated as unhinted.
 *
 * Not thread-safe: owned by the scheduling thread. {@link #getExpectedActiveRequests()} may be
 * read from any thread.
 */
public final class AdmissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    private final PlacementStrategy placementStrategy;
    private volatile int expectedActiveRequests;

    public AdmissionScheduler(PlacementStrategy placementStrategy) {
        this.placementStrategy = Objects.requireNonNull(placementStrategy, "placementStrategy");
    }

    /**
     * Removes up to {@code n} requests from the front of the backlog, in order.
     * Returns an empty list without touching the backlog when {@code n <= 0}.
     */
    public List<QueueItem> takeFromBacklog(PendingBacklog backlog, int n) {
        return backlog.pollFront(n);
    }

    /**
     * Tells whether {@code item} can be pulled this tick.
     *
     * Unhinted and relaxed requests are always eligible. A pinned request is eligible only
     * when its target rank has room, and that room is reserved on {@code tracker} right away
     * so later pinned requests in the same scan see it taken.
     */
    public boolean isEligible(QueueItem item, CapacityTracker tracker) {
        Optional<SchedulingHint> hint = usableHint(item, tracker);
        if (hint.isEmpty() || hint.get().relaxed()) {
            return true;
        }
        return tracker.tryReserve(hint.get().targetRank());
    }

    /**
     * Scans the backlog from the front and removes up to {@code n} eligible requests.
     * Ineligible requests keep their place in the backlog.
     */
    public List<QueueItem> takeFromBacklogRankAware(PendingBacklog backlog, int n, CapacityTracker tracker) {
        List<QueueItem> taken = backlog.pollMatching(n, item -> isEligible(item, tracker));
        if (log.isDebugEnabled() && !taken.isEmpty()) {
            log.debug("Pulled from backlog: requested={}, taken={}, remaining={}",
                    n, taken.size(), backlog.size());
        }
        return taken;
    }

    /**
     * Places {@code items} onto ranks, reserving one slot on {@code tracker} for every
     * placed request.
     *
     * Pinned requests are placed first, then relaxed requests on their preferred rank, then
     * the remaining relaxed and unhinted requests (in arrival order) through the placement
     * strategy. Requests that fit nowhere are returned as deferred, in arrival order.
     */
    public RankAssignment scheduleAcrossRanks(List<QueueItem> items, CapacityTracker tracker) {
        int numRanks = tracker.numRanks();
        expectedActiveRequests = Math.max(
                ceilDiv(tracker.sum() + items.size(), numRanks),
                tracker.max()
        );

        RankAssignment assignment = new RankAssignment(numRanks);
        if (items.isEmpty()) {
            return assignment;
        }

        List<QueueItem> pinned = new ArrayList<>();
        List<QueueItem> relaxed = new ArrayList<>();
        Set<QueueItem> fallback = Collections.newSetFromMap(new IdentityHashMap<>());
        for (QueueItem item : items) {
            Optional<SchedulingHint> hint = usableHint(item, tracker);
            if (hint.isEmpty()) {
                fallback.add(item);
            } else if (hint.get().isPinned()) {
                pinned.add(item);
            } else {
                relaxed.add(item);
            }
        }

        for (QueueItem item : pinned) {
            int target = targetRank(item);
            if (tracker.tryReserve(target)) {
                assignment.assign(target, item);
            } else {
                log.debug("Pinned request deferred, target rank full: id={}, rank={}", item.id(), target);
                assignment.defer(item);
            }
        }

        for (QueueItem item : relaxed) {
            int target = targetRank(item);
            if (tracker.tryReserve(target)) {
                assignment.assign(target, item);
            } else {
                fallback.add(item);
            }
        }

        // Fallback pool keeps the combined arrival order of the batch.
        List<QueueItem> pool = new ArrayList<>(fallback.size());
        for (QueueItem item : items) {
            if (fallback.contains(item)) {
                pool.add(item);
            }
        }
        placementStrategy.place(pool, tracker, assignment);
        assignment.orderDeferred(items);

        log.debug("Scheduled across ranks: strategy={}, items={}, assignment={}, expectedActive={}",
                placementStrategy.getName(), items.size(), assignment, expectedActiveRequests);
        return assignment;
    }

    /**
     * Advisory target for the number of active requests per rank, as computed by the last
     * {@link #scheduleAcrossRanks} call (or set by the single-rank admission path).
     */
    public int getExpectedActiveRequests() {
        return expectedActiveRequests;
    }

    void setExpectedActiveRequests(int expectedActiveRequests) {
        this.expectedActiveRequests = expectedActiveRequests;
    }

    public PlacementStrategy getPlacementStrategy() {
        return placementStrategy;
    }

    private static Optional<SchedulingHint> usableHint(QueueItem item, CapacityTracker tracker) {
        Optional<SchedulingHint> hint = item.schedulingHint();
        if (hint.isPresent() && !tracker.isValidRank(hint.get().targetRank())) {
            log.warn("Ignoring scheduling hint with unknown target rank: id={}, targetRank={}, numRanks={}",
                    item.id(), hint.get().targetRank(), tracker.numRanks());
            return Optional.empty();
        }
        return hint;
    }

    private static int targetRank(QueueItem item) {
        return item.request().schedulingHint().targetRank();
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
