package fr.lapetina.admission;

import fr.lapetina.admission.domain.strategy.PlacementStrategy;
import fr.lapetina.admission.domain.strategy.PlacementStrategyRegistry;
import fr.lapetina.admission.infrastructure.codec.QueueItemCodec;
import fr.lapetina.admission.infrastructure.config.AdmissionConfig;
import fr.lapetina.admission.infrastructure.config.ConfigLoader;
import fr.lapetina.admission.infrastructure.metrics.AdmissionMetrics;
import fr.lapetina.admission.ingress.IngressQueue;
import fr.lapetina.admission.scheduler.AdmissionController;
import fr.lapetina.admission.scheduler.AdmissionWorker;
import fr.lapetina.admission.scheduler.ExecutionEngine;
import fr.lapetina.admission.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Factory for creating a fully-wired admission controller from configuration.
 * This is the primary entry point for obtaining a configured AdmissionController.
 *
 * <p>Usage:
 * <pre>{@code
 * try (AdmissionControllerFactory factory = AdmissionControllerFactory.create("admission.yaml")) {
 *     AdmissionController controller = factory.getController();
 *     // use controller...
 * }
 * }</pre>
 */
public class AdmissionControllerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionControllerFactory.class);

    private final AdmissionConfig config;
    private final PlacementStrategyRegistry strategyRegistry;
    private final AdmissionMetrics metrics;
    private final IngressQueue ingressQueue;
    private final AdmissionController controller;
    private final QueueItemCodec codec = new QueueItemCodec();

    private AdmissionWorker worker;

    protected AdmissionControllerFactory(AdmissionConfig config, PlacementStrategyRegistry strategyRegistry) {
        config.validate();
        this.config = config;
        this.strategyRegistry = strategyRegistry;

        RequestValidator validator = new RequestValidator(
                config.getValidation().getMaxBeamWidth(),
                config.getValidation().isDisaggregated()
        );

        // Create strategy
        PlacementStrategy strategy = strategyRegistry.get(config.getScheduler().getPlacementStrategy());
        log.info("Using placement strategy: {}", strategy.getName());

        // Initialize metrics
        this.metrics = config.getMetrics().isEnabled()
                ? new AdmissionMetrics(config.getMetrics().getPrefix(), config.getCluster().getNumRanks())
                : null;

        // Only the owner rank accepts submissions
        int rank = config.getCluster().getRank();
        this.ingressQueue = rank == IngressQueue.OWNER_RANK
                ? IngressQueue.builder()
                        .ringBufferSize(config.getIngress().getRingBufferSize())
                        .maxBatchSize(config.getScheduler().getMaxBatchSize())
                        .rank(rank)
                        .validator(validator)
                        .build()
                : null;

        this.controller = AdmissionController.builder()
                .fromConfig(config)
                .ingressQueue(ingressQueue)
                .validator(validator)
                .placementStrategy(strategy)
                .metrics(metrics)
                .build();

        log.info("AdmissionControllerFactory initialized: rank={}/{}, owner={}",
                rank, config.getCluster().getNumRanks(), ingressQueue != null);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static AdmissionControllerFactory create(String configPath) {
        log.info("Initializing AdmissionControllerFactory from config: {}", configPath);
        return create(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from the default configuration (admission.yaml).
     */
    public static AdmissionControllerFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG_PATH);
    }

    /**
     * Creates a factory from an already loaded configuration with the built-in strategies.
     */
    public static AdmissionControllerFactory create(AdmissionConfig config) {
        return new AdmissionControllerFactory(config, PlacementStrategyRegistry.withDefaults());
    }

    /**
     * Creates a factory resolving the placement strategy from {@code strategyRegistry}.
     */
    public static AdmissionControllerFactory create(AdmissionConfig config, PlacementStrategyRegistry strategyRegistry) {
        return new AdmissionControllerFactory(config, strategyRegistry);
    }

    /**
     * Starts a scheduling thread feeding {@code engine}. Owner rank only; at most one worker.
     */
    public synchronized AdmissionWorker startWorker(ExecutionEngine engine) {
        if (worker != null) {
            throw new IllegalStateException("AdmissionWorker already started");
        }
        worker = new AdmissionWorker(controller, engine).start();
        return worker;
    }

    public AdmissionController getController() {
        return controller;
    }

    public Optional<IngressQueue> getIngressQueue() {
        return Optional.ofNullable(ingressQueue);
    }

    public Optional<AdmissionMetrics> getMetrics() {
        return Optional.ofNullable(metrics);
    }

    public PlacementStrategyRegistry getStrategyRegistry() {
        return strategyRegistry;
    }

    public QueueItemCodec getCodec() {
        return codec;
    }

    public AdmissionConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Shutting down AdmissionControllerFactory...");

        AdmissionWorker current;
        synchronized (this) {
            current = worker;
        }
        if (current != null) {
            try {
                current.close();
            } catch (Exception e) {
                log.warn("Error closing admission worker", e);
            }
        }

        if (ingressQueue != null && ingressQueue.isActive()) {
            try {
                ingressQueue.shutdown();
            } catch (Exception e) {
                log.warn("Error shutting down ingress queue", e);
            }
        }

        if (metrics != null) {
            try {
                metrics.close();
            } catch (Exception e) {
                log.warn("Error closing metrics", e);
            }
        }

        log.info("AdmissionControllerFactory shut down");
    }
}
