package fr.lapetina.admission.ingress;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventPoller;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import fr.lapetina.admission.domain.event.IngressEvent;
import fr.lapetina.admission.domain.event.IngressEventFactory;
import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.ingress.exception.BackpressureException;
import fr.lapetina.admission.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-producer, single-consumer ingress queue for submissions, cancellations and the
 * shutdown sentinel.
 *
 * WHY A RING BUFFER:
 *
 * Slots are pre-allocated {@link IngressEvent} holders, so accepting a request allocates
 * nothing beyond the item itself, and a full ring is an immediate, explicit backpressure
 * signal instead of an unbounded queue.
 *
 * PRODUCER SIDE:
 *
 * Id assignment and publishing happen under one {@link ReentrantLock}, so ids are issued
 * without gaps or duplicates and the ids of one batch are contiguous and occupy contiguous
 * slots. Because the lock already serializes publishers, the ring uses a single-producer
 * sequencer.
 *
 * CONSUMER SIDE:
 *
 * One scheduling thread drains through an {@link EventPoller}. Waiting for the first item
 * uses a {@link Condition} of the enqueue lock, which producers signal after publishing.
 */
public final class IngressQueue {

    private static final Logger log = LoggerFactory.getLogger(IngressQueue.class);

    /** Only this endpoint issues request ids. */
    public static final int OWNER_RANK = 0;

    private final RingBuffer<IngressEvent> ringBuffer;
    private final EventPoller<IngressEvent> poller;
    private final ReentrantLock enqueueLock = new ReentrantLock();
    private final Condition itemsAvailable = enqueueLock.newCondition();
    private final Map<Long, Instant> submissionTimes = new ConcurrentHashMap<>();
    private final RequestValidator validator;
    private final Clock clock;
    private final int rank;
    private final long firstRequestId;

    private volatile boolean active = true;

    // Guarded by enqueueLock
    private long nextRequestId;

    private IngressQueue(Builder builder) {
        this.validator = builder.validator;
        this.clock = builder.clock;
        this.rank = builder.rank;
        this.firstRequestId = builder.maxBatchSize;
        this.nextRequestId = builder.maxBatchSize;

        this.ringBuffer = RingBuffer.createSingleProducer(
                new IngressEventFactory(),
                builder.ringBufferSize,
                new BlockingWaitStrategy()
        );
        this.poller = ringBuffer.newPoller();
        ringBuffer.addGatingSequences(poller.getSequence());

        log.info("IngressQueue created: rank={}, ringBufferSize={}, firstRequestId={}",
                rank, builder.ringBufferSize, firstRequestId);
    }

    /**
     * Submits a single request.
     *
     * @return the id issued to the request
     * @see #submit(List)
     */
    public long submit(GenerationRequest request) {
        return submit(List.of(request)).get(0);
    }

    /**
     * Submits a batch of requests, issuing them consecutive ids in list order.
     *
     * <p>The batch is accepted or rejected as a whole. A rejected batch consumes no ids.
     *
     * @return the ids issued, in the order of {@code requests}
     * @throws IllegalStateException      if {@link #shutdown()} has been called
     * @throws fr.lapetina.admission.validation.RequestValidationException if any request is malformed
     * @throws BackpressureException      if the ring buffer cannot hold the whole batch
     */
    public List<Long> submit(List<GenerationRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        if (!active) {
            throw new IllegalStateException("Cannot submit requests after shutdown");
        }
        for (GenerationRequest request : requests) {
            validator.validate(request);
        }
        int count = requests.size();
        if (count > ringBuffer.getBufferSize()) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.BATCH_TOO_LARGE,
                    "batch=" + count + ", ringBufferSize=" + ringBuffer.getBufferSize()
            );
        }

        enqueueLock.lock();
        try {
            // Re-checked under the lock: a concurrent shutdown may have published its sentinel
            if (!active) {
                throw new IllegalStateException("Cannot submit requests after shutdown");
            }
            if (count == 0) {
                return List.of();
            }

            long hi;
            try {
                hi = ringBuffer.tryNext(count);
            } catch (InsufficientCapacityException e) {
                log.warn("Submission rejected: batch={}, remainingCapacity={}",
                        count, ringBuffer.remainingCapacity());
                throw new BackpressureException(
                        BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                        "batch=" + count + ", remaining capacity: " + ringBuffer.remainingCapacity()
                );
            }
            long lo = hi - count + 1;

            Instant now = clock.instant();
            List<Long> ids = new ArrayList<>(count);
            try {
                for (int i = 0; i < count; i++) {
                    long id = nextRequestId++;
                    submissionTimes.put(id, now);
                    ringBuffer.get(lo + i).initialize(QueueItem.normal(id, requests.get(i)), now);
                    ids.add(id);
                }
            } finally {
                ringBuffer.publish(lo, hi);
            }
            itemsAvailable.signalAll();

            log.debug("Requests enqueued: ids={}..{}, sequences={}..{}",
                    ids.get(0), ids.get(count - 1), lo, hi);
            return ids;
        } finally {
            enqueueLock.unlock();
        }
    }

    /**
     * Enqueues a cancellation for a previously issued id. No id is allocated.
     *
     * <p>Waits for a free slot when the ring is full, so cancellations are never dropped.
     */
    public void cancel(long requestId) {
        enqueueLock.lock();
        try {
            publish(QueueItem.cancel(requestId));
            log.debug("Cancellation enqueued: requestId={}", requestId);
        } finally {
            enqueueLock.unlock();
        }
    }

    /**
     * Stops accepting submissions and enqueues the shutdown sentinel. Later calls are no-ops.
     */
    public void shutdown() {
        enqueueLock.lock();
        try {
            if (!active) {
                log.debug("Shutdown already requested");
                return;
            }
            active = false;
            publish(QueueItem.shutdown());
            log.info("Shutdown requested: nextRequestId={}", nextRequestId);
        } finally {
            enqueueLock.unlock();
        }
    }

    // Caller holds enqueueLock
    private void publish(QueueItem item) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initialize(item, clock.instant());
        } finally {
            ringBuffer.publish(sequence);
        }
        itemsAvailable.signalAll();
    }

    /**
     * Waits up to {@code timeout} for at least one item, then takes every item currently
     * available without waiting further.
     *
     * @param timeout how long to wait for the first item; {@code null} never waits
     * @return drained items in publication order, empty if the wait timed out
     * @throws InterruptedException if the scheduling thread is interrupted while waiting
     */
    public List<QueueItem> drain(Duration timeout) throws InterruptedException {
        if (timeout != null && !hasPendingItems()) {
            awaitItems(timeout);
        }

        List<QueueItem> drained = new ArrayList<>();
        try {
            poller.poll((event, sequence, endOfBatch) -> {
                drained.add(event.take());
                return true;
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to drain ingress ring buffer", e);
        }

        if (!drained.isEmpty()) {
            log.debug("Drained {} items from ingress", drained.size());
        }
        return drained;
    }

    private void awaitItems(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        enqueueLock.lockInterruptibly();
        try {
            while (!hasPendingItems() && remainingNanos > 0) {
                remainingNanos = itemsAvailable.awaitNanos(remainingNanos);
            }
        } finally {
            enqueueLock.unlock();
        }
    }

    private boolean hasPendingItems() {
        return ringBuffer.getCursor() > poller.getSequence().get();
    }

    /**
     * True only on the owner endpoint while submissions are accepted. Other ranks route
     * submissions to the owner through the transport.
     */
    public boolean canEnqueue() {
        return rank == OWNER_RANK && active;
    }

    public boolean isActive() {
        return active;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Returns the id the next accepted submission will receive.
     */
    public long getNextRequestId() {
        enqueueLock.lock();
        try {
            return nextRequestId;
        } finally {
            enqueueLock.unlock();
        }
    }

    /**
     * First id handed to callers; lower ids are reserved for warm-up.
     */
    public long getFirstRequestId() {
        return firstRequestId;
    }

    /**
     * Number of items published but not yet drained.
     */
    public int size() {
        return (int) (ringBuffer.getCursor() - poller.getSequence().get());
    }

    public long getRemainingCapacity() {
        return ringBuffer.getBufferSize() - size();
    }

    public Optional<Instant> getSubmissionTime(long requestId) {
        return Optional.ofNullable(submissionTimes.get(requestId));
    }

    /**
     * Time elapsed since the request was submitted, while its timestamp is still tracked.
     */
    public Optional<Duration> getLatencySinceSubmission(long requestId) {
        return getSubmissionTime(requestId).map(start -> Duration.between(start, clock.instant()));
    }

    /**
     * Stops tracking a request, returning its submission time if it was tracked.
     */
    public Optional<Instant> removeSubmissionTime(long requestId) {
        return Optional.ofNullable(submissionTimes.remove(requestId));
    }

    public int getTrackedSubmissionCount() {
        return submissionTimes.size();
    }

    public Clock getClock() {
        return clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for IngressQueue.
     */
    public static final class Builder {
        private int ringBufferSize = 8192;
        private int maxBatchSize = 8;
        private int rank = OWNER_RANK;
        private RequestValidator validator = RequestValidator.withDefaults();
        private Clock clock = Clock.systemUTC();

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        /**
         * Number of ids reserved for warm-up; the first submission receives this id.
         */
        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize < 0) {
                throw new IllegalArgumentException("maxBatchSize must not be negative");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public IngressQueue build() {
            return new IngressQueue(this);
        }
    }
}
