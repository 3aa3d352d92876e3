package fr.lapetina.admission.scheduler;

/**
 * The model execution side of a rank, as seen by {@link AdmissionWorker}.
 */
public interface ExecutionEngine {

    /**
     * Returns a tracker filled with the current active request count of every rank.
     * Called once at the start of every tick.
     */
    CapacityTracker currentCapacity();

    /**
     * Accepts the outcome of a tick. The tracker returned by the preceding
     * {@link #currentCapacity()} call already counts the admitted requests.
     *
     * <p>{@link TickResult#canceledIds()} lists the cancellations seen since the previous call;
     * the worker forgets them once this method returns, so running requests among them must be
     * stopped here.
     */
    void enqueue(TickResult result);
}
