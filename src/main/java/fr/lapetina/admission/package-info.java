/**
 * Inference Admission - admission control for multi-rank inference serving.
 *
 * <p>Producers submit generation requests to an ingress queue backed by an LMAX Disruptor ring
 * buffer. On every scheduling tick the owner rank drains the queue, and each rank filters,
 * buffers and admits requests up to a per-rank capacity, optionally placing them on individual
 * ranks.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.admission.AdmissionControllerFactory} - Main entry point for creating
 *       a fully-configured controller from YAML configuration</li>
 *   <li>{@link fr.lapetina.admission.scheduler.AdmissionController} - Per-rank tick orchestration</li>
 *   <li>{@link fr.lapetina.admission.scheduler.AdmissionWorker} - Dedicated scheduling thread</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (AdmissionControllerFactory factory = AdmissionControllerFactory.create("admission.yaml")) {
 *     AdmissionController controller = factory.getController();
 *
 *     long id = controller.submit(GenerationRequest.ofTokens(List.of(1, 2, 3), 16));
 *
 *     CapacityTracker tracker = controller.newTracker(0);
 *     TickResult tick = controller.fetchNewRequests(tracker);
 *     tick.localRequests().forEach(engine::execute);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Gap-free request ids issued by a single owner rank</li>
 *   <li>Id-based cancellation and a terminal shutdown signal</li>
 *   <li>Pinned and preferred target ranks with least-loaded fallback</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Backpressure handling via ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.admission.AdmissionControllerFactory
 * @see fr.lapetina.admission.scheduler.AdmissionController
 */
package fr.lapetina.admission;
