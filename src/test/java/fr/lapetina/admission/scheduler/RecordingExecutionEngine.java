package fr.lapetina.admission.scheduler;

import fr.lapetina.admission.domain.model.ExecutableRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Test engine that exposes a shared tracker and records every tick result.
 */
public final class RecordingExecutionEngine implements ExecutionEngine {

    private final Supplier<CapacityTracker> capacity;
    private final BlockingQueue<TickResult> results = new LinkedBlockingQueue<>();
    private final Queue<Long> canceledIds = new ConcurrentLinkedQueue<>();

    public RecordingExecutionEngine(Supplier<CapacityTracker> capacity) {
        this.capacity = capacity;
    }

    /**
     * Engine whose tracker is the same instance on every tick, so admissions accumulate.
     */
    public static RecordingExecutionEngine accumulating(CapacityTracker tracker) {
        return new RecordingExecutionEngine(() -> tracker);
    }

    @Override
    public CapacityTracker currentCapacity() {
        return capacity.get();
    }

    @Override
    public void enqueue(TickResult result) {
        canceledIds.addAll(result.canceledIds());
        if (!result.isEmpty()) {
            results.add(result);
        }
    }

    /**
     * Waits until at least {@code count} requests were handed to this rank.
     *
     * @return the requests received, in order
     */
    public List<ExecutableRequest> awaitLocalRequests(int count, Duration timeout) throws InterruptedException {
        List<ExecutableRequest> received = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (received.size() < count) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            TickResult result = results.poll(remaining, TimeUnit.NANOSECONDS);
            if (result != null) {
                received.addAll(result.localRequests());
            }
        }
        return received;
    }

    /**
     * Every canceled id reported by the ticks handed over so far, in report order.
     */
    public List<Long> getCanceledIds() {
        return new ArrayList<>(canceledIds);
    }
}
