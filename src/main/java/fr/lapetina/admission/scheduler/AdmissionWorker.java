package fr.lapetina.admission.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dedicated scheduling thread of the owner rank.
 *
 * Each iteration asks the {@link ExecutionEngine} for the current capacity, runs one tick
 * through {@link AdmissionController#fetchNewRequests} and hands the result back to the engine,
 * after which the canceled ids it carried are cleared.
 * The loop ends once shutdown was received and nothing is left to admit, or when the worker
 * is closed. An exception thrown by a tick stops the worker and is kept for
 * {@link #getFailure()}.
 *
 * The tick number is put in the SLF4J MDC under {@value #MDC_TICK} while a tick runs.
 */
public final class AdmissionWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionWorker.class);

    public static final String MDC_TICK = "tick";

    private final AdmissionController controller;
    private final ExecutionEngine engine;
    private final Thread thread;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile RuntimeException failure;

    public AdmissionWorker(AdmissionController controller, ExecutionEngine engine) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.engine = Objects.requireNonNull(engine, "engine");
        if (!controller.isOwner()) {
            throw new IllegalArgumentException("AdmissionWorker drains the ingress queue and must run on rank 0");
        }
        ThreadFactory threadFactory = new AdmissionThreadFactory("admission-worker-rank" + controller.getRank());
        this.thread = threadFactory.newThread(this::runLoop);
    }

    /**
     * Starts the scheduling thread.
     */
    public AdmissionWorker start() {
        if (running.compareAndSet(false, true)) {
            thread.start();
            log.info("AdmissionWorker started: thread={}", thread.getName());
        }
        return this;
    }

    private void runLoop() {
        try {
            while (running.get()) {
                CapacityTracker tracker = engine.currentCapacity();
                MDC.put(MDC_TICK, String.valueOf(controller.getTickCount() + 1));
                try {
                    TickResult result = controller.fetchNewRequests(tracker);
                    engine.enqueue(result);
                    if (!result.canceledIds().isEmpty()) {
                        controller.clearCanceledIds();
                    }
                } finally {
                    MDC.remove(MDC_TICK);
                }
                if (controller.isDrained()) {
                    log.info("Shutdown received and backlog drained after {} ticks", controller.getTickCount());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("AdmissionWorker interrupted after {} ticks", controller.getTickCount());
        } catch (RuntimeException e) {
            failure = e;
            log.error("AdmissionWorker stopped by a failed tick", e);
        } finally {
            running.set(false);
            terminated.countDown();
            log.info("AdmissionWorker stopped");
        }
    }

    /**
     * Waits for the scheduling thread to finish.
     *
     * @return true if it finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Stops the scheduling thread without waiting for the backlog to drain.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AdmissionWorker...");
            thread.interrupt();
        }
        if (thread.isAlive()) {
            try {
                if (!awaitTermination(Duration.ofSeconds(5))) {
                    log.warn("AdmissionWorker did not stop within 5 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for AdmissionWorker to stop");
            }
        }
    }

    /**
     * Thread factory for the scheduling thread.
     */
    private static class AdmissionThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        AdmissionThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
