package fr.lapetina.admission.infrastructure.metrics;

import fr.lapetina.admission.ingress.exception.BackpressureException.BackpressureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admission metrics using Micrometer.
 *
 * Provides:
 * - Queue depth gauges for ingress and backlog
 * - Per-rank active request gauges and admission counters
 * - Rejection counters by reason
 * - Queue latency histogram of admitted requests
 * - JVM and system metrics
 * - Prometheus exposition
 *
 * Gauges read values published by the scheduling thread at the end of every tick.
 */
public final class AdmissionMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter submitted;
    private final Counter canceled;
    private final Counter purged;
    private final Counter deferred;
    private final Counter conversionFailures;
    private final Timer queueLatency;
    private final List<Counter> admittedPerRank;
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();

    private final AtomicInteger ingressDepth = new AtomicInteger(0);
    private final AtomicInteger backlogDepth = new AtomicInteger(0);
    private final AtomicInteger canceledIds = new AtomicInteger(0);
    private final AtomicInteger expectedActive = new AtomicInteger(0);
    private final List<AtomicInteger> activePerRank;

    public AdmissionMetrics(String prefix, int numRanks) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_ingress_depth", ingressDepth, AtomicInteger::get)
                .description("Items published to the ingress queue and not yet drained")
                .register(registry);

        Gauge.builder(prefix + "_backlog_depth", backlogDepth, AtomicInteger::get)
                .description("Validated requests waiting for admission")
                .register(registry);

        Gauge.builder(prefix + "_canceled_ids", canceledIds, AtomicInteger::get)
                .description("Canceled request ids remembered by the admission filter")
                .register(registry);

        Gauge.builder(prefix + "_expected_active_requests", expectedActive, AtomicInteger::get)
                .description("Advisory number of active requests per rank after the last tick")
                .register(registry);

        this.activePerRank = new ArrayList<>(numRanks);
        this.admittedPerRank = new ArrayList<>(numRanks);
        for (int rank = 0; rank < numRanks; rank++) {
            AtomicInteger active = new AtomicInteger(0);
            activePerRank.add(active);
            Gauge.builder(prefix + "_active_requests", active, AtomicInteger::get)
                    .description("Active requests per rank after the last tick")
                    .tag("rank", String.valueOf(rank))
                    .register(registry);
            admittedPerRank.add(Counter.builder(prefix + "_admitted_total")
                    .description("Requests admitted per rank")
                    .tag("rank", String.valueOf(rank))
                    .register(registry));
        }

        this.submitted = Counter.builder(prefix + "_submitted_total")
                .description("Requests accepted by the ingress queue")
                .register(registry);
        this.canceled = Counter.builder(prefix + "_cancellations_total")
                .description("Cancellations received")
                .register(registry);
        this.purged = Counter.builder(prefix + "_purged_total")
                .description("Pending requests removed by cancellation")
                .register(registry);
        this.deferred = Counter.builder(prefix + "_deferred_total")
                .description("Pulled requests returned to the backlog for lack of room")
                .register(registry);
        this.conversionFailures = Counter.builder(prefix + "_conversion_failures_total")
                .description("Admitted requests that could not be converted")
                .register(registry);
        this.queueLatency = Timer.builder(prefix + "_queue_latency")
                .description("Time from submission to admission")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        log.info("AdmissionMetrics initialized with prefix: {}, ranks: {}", prefix, numRanks);
    }

    public AdmissionMetrics(int numRanks) {
        this("admission", numRanks);
    }

    public void incrementSubmitted(int count) {
        submitted.increment(count);
    }

    public void incrementCanceled() {
        canceled.increment();
    }

    public void incrementPurged(int count) {
        purged.increment(count);
    }

    public void incrementDeferred(int count) {
        deferred.increment(count);
    }

    public void incrementConversionFailures() {
        conversionFailures.increment();
    }

    public void incrementAdmitted(int rank, int count) {
        admittedPerRank.get(rank).increment(count);
    }

    /**
     * Increments the rejection counter for a reason (validation, backpressure reason, shutdown).
     */
    public void incrementRejected(String reason) {
        rejectionCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_rejected_total")
                        .description("Submissions rejected at ingress")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    public void incrementRejected(BackpressureReason reason) {
        incrementRejected(reason.name());
    }

    public void recordQueueLatency(Duration latency) {
        queueLatency.record(latency);
    }

    /**
     * Publishes the state observed at the end of a tick.
     */
    public void updateTickState(int ingress, int backlog, int canceledIdCount, int expectedActiveRequests,
                                int[] activeRequests) {
        ingressDepth.set(ingress);
        backlogDepth.set(backlog);
        canceledIds.set(canceledIdCount);
        expectedActive.set(expectedActiveRequests);
        for (int rank = 0; rank < activePerRank.size() && rank < activeRequests.length; rank++) {
            activePerRank.get(rank).set(activeRequests[rank]);
        }
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
