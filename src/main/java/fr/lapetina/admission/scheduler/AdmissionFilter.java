package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * First stage of every tick: separates control items from requests.
 *
 * Handles:
 * - Shutdown sentinel: latches the shutdown flag
 * - Cancellations: remembers the id until the caller clears it
 * - Requests: re-validated, since drained batches may come from another rank
 *
 * Items after a shutdown sentinel in the same batch are still processed, so nothing that was
 * ingressed before shutdown is lost.
 *
 * Not thread-safe: owned by the scheduling thread. The shutdown flag and canceled-id count
 * may be read from any thread.
 */
public final class AdmissionFilter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);

    private final RequestValidator validator;
    private final Set<Long> canceledIds = new LinkedHashSet<>();
    private volatile boolean shutdownRequested;
    private volatile int canceledIdsSize;

    public AdmissionFilter(RequestValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Returns the requests of {@code items}, in order, after recording every cancellation and
     * shutdown sentinel they contain.
     *
     * @throws fr.lapetina.admission.validation.RequestValidationException if a request is malformed
     */
    public List<QueueItem> validate(List<QueueItem> items) {
        List<QueueItem> requests = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            switch (item.kind()) {
                case SHUTDOWN -> {
                    if (!shutdownRequested) {
                        log.info("Shutdown sentinel received");
                    }
                    shutdownRequested = true;
                }
                case CANCEL -> {
                    canceledIds.add(item.id());
                    log.debug("Cancellation recorded: requestId={}", item.id());
                }
                case NORMAL -> {
                    validator.validate(item.id(), item.request());
                    requests.add(item);
                }
            }
        }
        canceledIdsSize = canceledIds.size();
        return requests;
    }

    /**
     * Removes every pending request whose id was canceled; survivors keep their order.
     * Canceled ids are kept until {@link #clearCanceledIds()}.
     *
     * @return the number of requests removed
     */
    public int purgeCanceled(PendingBacklog backlog) {
        return purgeCanceledItems(backlog).size();
    }

    /**
     * Same as {@link #purgeCanceled(PendingBacklog)}, returning the removed requests.
     */
    public List<QueueItem> purgeCanceledItems(PendingBacklog backlog) {
        if (canceledIds.isEmpty() || backlog.isEmpty()) {
            return List.of();
        }
        List<QueueItem> purged = backlog.removeIf(item -> canceledIds.contains(item.id()));
        if (!purged.isEmpty()) {
            log.debug("Purged canceled requests: count={}, remaining={}", purged.size(), backlog.size());
        }
        return purged;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Canceled ids in the order they were first seen.
     */
    public List<Long> getCanceledIds() {
        return new ArrayList<>(canceledIds);
    }

    public int getCanceledIdsSize() {
        return canceledIdsSize;
    }

    public void clearCanceledIds() {
        canceledIds.clear();
        canceledIdsSize = 0;
    }
}
