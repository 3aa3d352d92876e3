package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.conversion.DefaultRequestConverter;
import fr.lapetina.admission.conversion.RequestConverter;
import fr.lapetina.admission.domain.model.ExecutableRequest;
import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.domain.strategy.LeastLoadedPlacementStrategy;
import fr.lapetina.admission.domain.strategy.PlacementStrategy;
import fr.lapetina.admission.infrastructure.config.AdmissionConfig;
import fr.lapetina.admission.infrastructure.metrics.AdmissionMetrics;
import fr.lapetina.admission.ingress.IngressQueue;
import fr.lapetina.admission.ingress.exception.BackpressureException;
import fr.lapetina.admission.validation.RequestValidationException;
import fr.lapetina.admission.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the admission side of one rank, one tick at a time.
 *
 * A tick takes the newly ingressed items, records cancellations and shutdown, appends the
 * requests to the backlog, purges canceled requests and then admits as many pending requests
 * as the cluster has room for:
 *
 * SINGLE-RANK MODE: every rank executes the same batch, so requests are taken from the front
 * of the backlog up to the free slots of rank 0 and reserved there.
 *
 * RANK-AWARE MODE: requests are pulled up to the total free slots of the cluster and placed on
 * individual ranks by the {@link AdmissionScheduler}. Pinned requests are checked against a
 * scratch copy of the tracker while pulling, so only the placement step changes the caller's
 * counters. Requests that found no room go back to the front of the backlog.
 *
 * The owner rank (rank 0) also holds the {@link IngressQueue} and drains it; the other ranks
 * receive the drained batch through the transport and pass it to {@link #admit}.
 *
 * Not thread-safe except for the submission methods, which producers may call concurrently,
 * and the telemetry getters documented as safe. Everything else belongs to the scheduling
 * thread.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final IngressQueue ingressQueue;
    private final PendingBacklog backlog = new PendingBacklog();
    private final AdmissionFilter filter;
    private final AdmissionScheduler scheduler;
    private final RequestConverter converter;
    private final AdmissionMetrics metrics;
    private final Clock clock;

    private final int rank;
    private final int numRanks;
    private final int maxActiveRequestsPerRank;
    private final boolean rankAwareBalancing;
    private final Duration idleDrainTimeout;

    private final AtomicLong tickCounter = new AtomicLong(0);
    private volatile long lastQueueLatencyMs;
    private boolean lastTickStalled;

    private AdmissionController(Builder builder) {
        this.ingressQueue = builder.ingressQueue;
        this.filter = new AdmissionFilter(builder.validator);
        this.scheduler = new AdmissionScheduler(builder.placementStrategy);
        this.converter = builder.converter;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.rank = builder.rank;
        this.numRanks = builder.numRanks;
        this.maxActiveRequestsPerRank = builder.maxActiveRequestsPerRank;
        this.rankAwareBalancing = builder.rankAwareBalancing;
        this.idleDrainTimeout = Duration.ofMillis(builder.idleDrainTimeoutMs);

        log.info("AdmissionController created: rank={}, numRanks={}, maxActiveRequestsPerRank={}, "
                        + "rankAwareBalancing={}, placementStrategy={}, owner={}",
                rank, numRanks, maxActiveRequestsPerRank, rankAwareBalancing,
                builder.placementStrategy.getName(), isOwner());
    }

    // Producer side

    /**
     * Submits a request on the owner rank.
     *
     * @return the id issued to the request
     * @see IngressQueue#submit(List)
     */
    public long submit(GenerationRequest request) {
        return submit(List.of(request)).get(0);
    }

    /**
     * Submits a batch of requests on the owner rank.
     *
     * @return the ids issued, in the order of {@code requests}
     * @throws IllegalStateException       if this is not the owner rank or after shutdown
     * @throws RequestValidationException  if any request is malformed
     * @throws BackpressureException       if the ingress queue cannot hold the batch
     */
    public List<Long> submit(List<GenerationRequest> requests) {
        IngressQueue ingress = requireIngress("submit");
        try {
            List<Long> ids = ingress.submit(requests);
            if (metrics != null) {
                metrics.incrementSubmitted(ids.size());
            }
            return ids;
        } catch (RequestValidationException e) {
            recordRejection("VALIDATION");
            throw e;
        } catch (BackpressureException e) {
            recordRejection(e.getReason().name());
            throw e;
        } catch (IllegalStateException e) {
            recordRejection("SHUTDOWN");
            throw e;
        }
    }

    /**
     * Cancels a previously submitted request. Canceling an id that is no longer pending has no
     * effect.
     */
    public void cancel(long requestId) {
        requireIngress("cancel").cancel(requestId);
        if (metrics != null) {
            metrics.incrementCanceled();
        }
    }

    /**
     * Stops accepting submissions. Already ingressed requests are still admitted.
     */
    public void shutdown() {
        requireIngress("shutdown").shutdown();
    }

    /**
     * True only on the owner rank while submissions are accepted.
     */
    public boolean canEnqueue() {
        return ingressQueue != null && ingressQueue.canEnqueue();
    }

    // Scheduling thread

    /**
     * Drains the ingress queue on the owner rank.
     *
     * Waits up to the idle drain timeout when nothing is active and nothing is pending, or when
     * the previous tick neither received nor admitted anything, so a loop calling this does not
     * spin while the cluster is idle or full. Otherwise takes what is there without waiting.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if this is not the owner rank
     */
    public List<QueueItem> drainIngress(CapacityTracker tracker) throws InterruptedException {
        IngressQueue ingress = requireIngress("drain");
        int active = rankAwareBalancing ? tracker.sum() : tracker.get(0);
        boolean idle = active == 0 && backlog.isEmpty();
        return ingress.drain(idle || lastTickStalled ? idleDrainTimeout : null);
    }

    /**
     * Drains the ingress queue and runs one tick with the drained items.
     *
     * @see #drainIngress(CapacityTracker)
     * @see #admit(List, CapacityTracker)
     */
    public TickResult fetchNewRequests(CapacityTracker tracker) throws InterruptedException {
        List<QueueItem> drained = drainIngress(tracker);
        return runTick(drained, drained, tracker);
    }

    /**
     * Runs one tick with {@code items}, typically a batch drained on the owner rank and
     * received through the transport.
     *
     * <p>{@code tracker} must hold the current active count of every rank (only rank 0 is read
     * in single-rank mode). It is updated in place with the admitted requests.
     *
     * @throws RequestValidationException if a request in {@code items} is malformed
     */
    public TickResult admit(List<QueueItem> items, CapacityTracker tracker) {
        return runTick(items, List.of(), tracker);
    }

    private TickResult runTick(List<QueueItem> items, List<QueueItem> drained, CapacityTracker tracker) {
        Objects.requireNonNull(items, "items");
        requireTracker(tracker);
        long tick = tickCounter.incrementAndGet();

        List<QueueItem> requests = filter.validate(items);
        backlog.appendAll(requests);

        List<QueueItem> purged = filter.purgeCanceledItems(backlog);
        for (QueueItem item : purged) {
            forgetSubmission(item.id());
        }

        List<QueueItem> admitted;
        List<QueueItem> local;
        Map<Integer, List<QueueItem>> assignmentByRank;
        int deferredCount;
        int expectedActive;

        if (rankAwareBalancing) {
            int n = tracker.totalHeadroom();
            List<QueueItem> pulled = scheduler.takeFromBacklogRankAware(backlog, n, tracker.copy());
            RankAssignment assignment = scheduler.scheduleAcrossRanks(pulled, tracker);

            List<QueueItem> deferred = assignment.getDeferred();
            backlog.returnToFront(deferred);
            deferredCount = deferred.size();

            admitted = new ArrayList<>(assignment.admittedCount());
            for (int r = 0; r < assignment.numRanks(); r++) {
                admitted.addAll(assignment.forRank(r));
                if (metrics != null) {
                    metrics.incrementAdmitted(r, assignment.forRank(r).size());
                }
            }
            local = assignment.forRank(rank);
            assignmentByRank = assignment.asMap();
            expectedActive = scheduler.getExpectedActiveRequests();
        } else {
            int activeBefore = tracker.get(0);
            admitted = scheduler.takeFromBacklog(backlog, tracker.getPerRankCapacity() - activeBefore);
            for (int i = 0; i < admitted.size(); i++) {
                tracker.tryReserve(0);
            }
            if (metrics != null) {
                metrics.incrementAdmitted(rank, admitted.size());
            }
            local = admitted;
            assignmentByRank = Map.of();
            deferredCount = 0;
            expectedActive = activeBefore + admitted.size();
            scheduler.setExpectedActiveRequests(expectedActive);
        }

        long queueLatencyMs = recordQueueLatency(admitted);
        Map<Long, RuntimeException> failures = new LinkedHashMap<>();
        List<ExecutableRequest> executable = convert(local, failures);

        publishTickState(purged.size(), deferredCount, expectedActive, tracker);
        lastTickStalled = items.isEmpty() && admitted.isEmpty();

        TickResult result = new TickResult(
                tick,
                drained,
                admitted,
                assignmentByRank,
                executable,
                failures,
                filter.getCanceledIds(),
                deferredCount,
                purged.size(),
                expectedActive,
                queueLatencyMs
        );

        if (!items.isEmpty() || !admitted.isEmpty()) {
            log.debug("Tick completed: tick={}, received={}, admitted={}, local={}, deferred={}, purged={}, "
                            + "pending={}, expectedActive={}, active={}",
                    tick, items.size(), admitted.size(), executable.size(), deferredCount, purged.size(),
                    backlog.size(), expectedActive, tracker);
        }
        return result;
    }

    private List<ExecutableRequest> convert(List<QueueItem> local, Map<Long, RuntimeException> failures) {
        List<ExecutableRequest> executable = new ArrayList<>(local.size());
        for (QueueItem item : local) {
            try {
                executable.add(converter.convert(item, rank));
            } catch (RuntimeException e) {
                log.error("Request conversion failed, dropping request: requestId={}, rank={}", item.id(), rank, e);
                failures.put(item.id(), e);
                if (metrics != null) {
                    metrics.incrementConversionFailures();
                }
            }
        }
        return executable;
    }

    private long recordQueueLatency(List<QueueItem> admitted) {
        if (ingressQueue == null || admitted.isEmpty()) {
            lastQueueLatencyMs = 0;
            return 0;
        }
        Instant now = clock.instant();
        long totalMs = 0;
        for (QueueItem item : admitted) {
            Optional<Instant> submittedAt = ingressQueue.removeSubmissionTime(item.id());
            if (submittedAt.isPresent()) {
                Duration latency = Duration.between(submittedAt.get(), now);
                totalMs += latency.toMillis();
                if (metrics != null) {
                    metrics.recordQueueLatency(latency);
                }
            }
        }
        lastQueueLatencyMs = totalMs;
        return totalMs;
    }

    private void publishTickState(int purgedCount, int deferredCount,
                                  int expectedActive, CapacityTracker tracker) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPurged(purgedCount);
        metrics.incrementDeferred(deferredCount);
        metrics.updateTickState(
                getIngressSize(),
                backlog.size(),
                filter.getCanceledIdsSize(),
                expectedActive,
                tracker.toArray()
        );
    }

    private void forgetSubmission(long requestId) {
        if (ingressQueue != null) {
            ingressQueue.removeSubmissionTime(requestId);
        }
    }

    private void recordRejection(String reason) {
        if (metrics != null) {
            metrics.incrementRejected(reason);
        }
    }

    private IngressQueue requireIngress(String operation) {
        if (ingressQueue == null) {
            throw new IllegalStateException("Cannot " + operation + " on rank " + rank
                    + ": only rank " + IngressQueue.OWNER_RANK + " owns the ingress queue");
        }
        return ingressQueue;
    }

    private void requireTracker(CapacityTracker tracker) {
        Objects.requireNonNull(tracker, "tracker");
        if (rankAwareBalancing && tracker.numRanks() != numRanks) {
            throw new IllegalArgumentException("Tracker covers " + tracker.numRanks()
                    + " ranks, cluster has " + numRanks);
        }
        if (tracker.getPerRankCapacity() != maxActiveRequestsPerRank) {
            throw new IllegalArgumentException("Tracker allows " + tracker.getPerRankCapacity()
                    + " active requests per rank, controller is configured for " + maxActiveRequestsPerRank);
        }
    }

    /**
     * Creates a tracker over {@code activeRequests} with the configured per-rank capacity.
     */
    public CapacityTracker newTracker(int... activeRequests) {
        return new CapacityTracker(activeRequests, maxActiveRequestsPerRank);
    }

    // Telemetry

    public boolean isOwner() {
        return ingressQueue != null;
    }

    /**
     * Safe from any thread.
     */
    public boolean isShutdownRequested() {
        return filter.isShutdownRequested();
    }

    /**
     * True once shutdown was received and nothing is left to admit. Safe from any thread.
     */
    public boolean isDrained() {
        return filter.isShutdownRequested() && getIngressSize() == 0 && backlog.sizeSnapshot() == 0;
    }

    /**
     * Items waiting in the ingress queue; zero on non-owner ranks. Safe from any thread.
     */
    public int getIngressSize() {
        return ingressQueue == null ? 0 : ingressQueue.size();
    }

    /**
     * Safe from any thread.
     */
    public int getBacklogSize() {
        return backlog.sizeSnapshot();
    }

    /**
     * Scheduling thread only.
     */
    public List<QueueItem> getPendingRequests() {
        return backlog.snapshot();
    }

    /**
     * Scheduling thread only.
     */
    public List<Long> getCanceledIds() {
        return filter.getCanceledIds();
    }

    /**
     * Safe from any thread.
     */
    public int getCanceledIdsSize() {
        return filter.getCanceledIdsSize();
    }

    /**
     * Forgets the canceled ids recorded so far. Scheduling thread only.
     */
    public void clearCanceledIds() {
        filter.clearCanceledIds();
    }

    public int getExpectedActiveRequests() {
        return scheduler.getExpectedActiveRequests();
    }

    /**
     * Summed queue latency of the requests admitted by the last tick, in milliseconds.
     */
    public long getLastQueueLatencyMs() {
        return lastQueueLatencyMs;
    }

    /**
     * Time since submission of a request that has not been admitted or purged yet.
     */
    public Optional<Duration> getLatencySinceSubmission(long requestId) {
        return ingressQueue == null ? Optional.empty() : ingressQueue.getLatencySinceSubmission(requestId);
    }

    public long getTickCount() {
        return tickCounter.get();
    }

    public int getRank() {
        return rank;
    }

    public int getNumRanks() {
        return numRanks;
    }

    public int getMaxActiveRequestsPerRank() {
        return maxActiveRequestsPerRank;
    }

    public boolean isRankAwareBalancing() {
        return rankAwareBalancing;
    }

    public Optional<IngressQueue> getIngressQueue() {
        return Optional.ofNullable(ingressQueue);
    }

    public AdmissionScheduler getScheduler() {
        return scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for AdmissionController.
     */
    public static final class Builder {
        private IngressQueue ingressQueue;
        private RequestValidator validator = RequestValidator.withDefaults();
        private PlacementStrategy placementStrategy = new LeastLoadedPlacementStrategy();
        private RequestConverter converter;
        private AdmissionMetrics metrics;
        private Clock clock = Clock.systemUTC();
        private int rank = 0;
        private int numRanks = 1;
        private int maxActiveRequestsPerRank = 16;
        private boolean rankAwareBalancing = false;
        private long idleDrainTimeoutMs = 100;

        /**
         * Ingress queue of the owner rank; leave unset on the other ranks.
         */
        public Builder ingressQueue(IngressQueue ingressQueue) {
            this.ingressQueue = ingressQueue;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator");
            return this;
        }

        public Builder placementStrategy(PlacementStrategy strategy) {
            this.placementStrategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder converter(RequestConverter converter) {
            this.converter = converter;
            return this;
        }

        public Builder metrics(AdmissionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder numRanks(int numRanks) {
            this.numRanks = numRanks;
            return this;
        }

        public Builder maxActiveRequestsPerRank(int max) {
            this.maxActiveRequestsPerRank = max;
            return this;
        }

        public Builder rankAwareBalancing(boolean enabled) {
            this.rankAwareBalancing = enabled;
            return this;
        }

        public Builder idleDrainTimeoutMs(long timeoutMs) {
            this.idleDrainTimeoutMs = timeoutMs;
            return this;
        }

        public Builder fromConfig(AdmissionConfig config) {
            this.rank = config.getCluster().getRank();
            this.numRanks = config.getCluster().getNumRanks();
            this.maxActiveRequestsPerRank = config.getScheduler().getMaxActiveRequestsPerRank();
            this.rankAwareBalancing = config.getScheduler().isRankAwareBalancing();
            this.idleDrainTimeoutMs = config.getScheduler().getIdleDrainTimeoutMs();
            return this;
        }

        public AdmissionController build() {
            if (numRanks < 1) {
                throw new IllegalStateException("numRanks must be at least 1");
            }
            if (rank < 0 || rank >= numRanks) {
                throw new IllegalStateException("rank " + rank + " is outside [0, " + numRanks + ")");
            }
            if (maxActiveRequestsPerRank < 1) {
                throw new IllegalStateException("maxActiveRequestsPerRank must be at least 1");
            }
            if (idleDrainTimeoutMs < 0) {
                throw new IllegalStateException("idleDrainTimeoutMs must not be negative");
            }
            if (ingressQueue != null && ingressQueue.getRank() != rank) {
                throw new IllegalStateException("IngressQueue belongs to rank " + ingressQueue.getRank()
                        + ", controller to rank " + rank);
            }
            if (ingressQueue != null && rank != IngressQueue.OWNER_RANK) {
                throw new IllegalStateException("Only rank " + IngressQueue.OWNER_RANK + " owns an IngressQueue");
            }
            if (converter == null) {
                converter = new DefaultRequestConverter(clock);
            }
            return new AdmissionController(this);
        }
    }
}
