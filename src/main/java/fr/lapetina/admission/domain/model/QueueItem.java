package fr.lapetina.admission.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Unit of work flowing through the ingress queue and the pending backlog.
 *
 * <p>Each item is exactly one of three kinds, and the kind decides which fields are meaningful:
 * <ul>
 *   <li>{@link Kind#NORMAL} carries a submitted request under a freshly issued id</li>
 *   <li>{@link Kind#CANCEL} carries the id of a previously submitted request and no payload</li>
 *   <li>{@link Kind#SHUTDOWN} carries {@link #SHUTDOWN_REQUEST_ID} and no payload</li>
 * </ul>
 */
public record QueueItem(Kind kind, long id, GenerationRequest payload) {

    /** Reserved id of the shutdown sentinel. Never issued to a submission. */
    public static final long SHUTDOWN_REQUEST_ID = -1L;

    public enum Kind {
        NORMAL,
        CANCEL,
        SHUTDOWN
    }

    public QueueItem {
        Objects.requireNonNull(kind, "kind is required");
        switch (kind) {
            case NORMAL -> {
                Objects.requireNonNull(payload, "A normal item requires a request");
                if (id < 0) {
                    throw new IllegalArgumentException("Request id must not be negative: " + id);
                }
            }
            case CANCEL -> {
                if (payload != null) {
                    throw new IllegalArgumentException("A cancellation carries no request");
                }
                if (id < 0) {
                    throw new IllegalArgumentException("Canceled id must not be negative: " + id);
                }
            }
            case SHUTDOWN -> {
                if (payload != null || id != SHUTDOWN_REQUEST_ID) {
                    throw new IllegalArgumentException("Malformed shutdown sentinel");
                }
            }
        }
    }

    public static QueueItem normal(long id, GenerationRequest request) {
        return new QueueItem(Kind.NORMAL, id, request);
    }

    public static QueueItem cancel(long id) {
        return new QueueItem(Kind.CANCEL, id, null);
    }

    public static QueueItem shutdown() {
        return new QueueItem(Kind.SHUTDOWN, SHUTDOWN_REQUEST_ID, null);
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    public boolean isCancellation() {
        return kind == Kind.CANCEL;
    }

    public boolean isShutdown() {
        return kind == Kind.SHUTDOWN;
    }

    /**
     * Returns the submitted request.
     *
     * @throws IllegalStateException if this is a cancellation or the shutdown sentinel
     */
    public GenerationRequest request() {
        if (kind != Kind.NORMAL) {
            throw new IllegalStateException(kind + " item " + id + " carries no request");
        }
        return payload;
    }

    /**
     * Scheduling hint of the request; empty for items without a rank preference.
     */
    public Optional<SchedulingHint> schedulingHint() {
        return kind == Kind.NORMAL ? payload.hint() : Optional.empty();
    }

    /**
     * Prompt length used for balancing; zero for control items.
     */
    public int promptLength() {
        return kind == Kind.NORMAL ? payload.promptLength() : 0;
    }

    @Override
    public String toString() {
        return "QueueItem{" + kind + ", id=" + id + schedulingHint().map(h -> ", hint=" + h).orElse("") + '}';
    }
}
