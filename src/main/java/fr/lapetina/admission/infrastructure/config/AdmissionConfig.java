package fr.lapetina.admission.infrastructure.config;

/**
 * Root configuration object for admission control.
 * Designed to be populated from YAML.
 */
public class AdmissionConfig {

    private ClusterConfig cluster = new ClusterConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private ValidationConfig validation = new ValidationConfig();
    private IngressConfig ingress = new IngressConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ClusterConfig getCluster() { return cluster; }
    public void setCluster(ClusterConfig cluster) { this.cluster = cluster; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public IngressConfig getIngress() { return ingress; }
    public void setIngress(IngressConfig ingress) { this.ingress = ingress; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks cross-field constraints that the YAML binding cannot express.
     *
     * @throws IllegalArgumentException describing the first invalid value
     */
    public void validate() {
        if (cluster.numRanks < 1) {
            throw new IllegalArgumentException("cluster.numRanks must be at least 1, got " + cluster.numRanks);
        }
        if (cluster.rank < 0 || cluster.rank >= cluster.numRanks) {
            throw new IllegalArgumentException("cluster.rank must be in [0, " + cluster.numRanks
                    + "), got " + cluster.rank);
        }
        if (scheduler.maxBatchSize < 0) {
            throw new IllegalArgumentException("scheduler.maxBatchSize must not be negative");
        }
        if (scheduler.maxActiveRequestsPerRank < 1) {
            throw new IllegalArgumentException("scheduler.maxActiveRequestsPerRank must be at least 1");
        }
        if (scheduler.placementStrategy == null || scheduler.placementStrategy.isBlank()) {
            throw new IllegalArgumentException("scheduler.placementStrategy is required");
        }
        if (scheduler.idleDrainTimeoutMs < 0) {
            throw new IllegalArgumentException("scheduler.idleDrainTimeoutMs must not be negative");
        }
        if (validation.maxBeamWidth < 1) {
            throw new IllegalArgumentException("validation.maxBeamWidth must be at least 1");
        }
        if (Integer.bitCount(ingress.ringBufferSize) != 1) {
            throw new IllegalArgumentException("ingress.ringBufferSize must be a power of 2, got "
                    + ingress.ringBufferSize);
        }
    }

    /**
     * Position of this process in the cluster.
     */
    public static class ClusterConfig {
        private int rank = 0;
        private int numRanks = 1;

        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }

        public int getNumRanks() { return numRanks; }
        public void setNumRanks(int numRanks) { this.numRanks = numRanks; }
    }

    /**
     * Admission scheduling configuration.
     */
    public static class SchedulerConfig {
        private int maxBatchSize = 8;
        private int maxActiveRequestsPerRank = 16;
        private boolean rankAwareBalancing = false;
        private String placementStrategy = "least-loaded";
        private long idleDrainTimeoutMs = 100;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public int getMaxActiveRequestsPerRank() { return maxActiveRequestsPerRank; }
        public void setMaxActiveRequestsPerRank(int maxActiveRequestsPerRank) { this.maxActiveRequestsPerRank = maxActiveRequestsPerRank; }

        public boolean isRankAwareBalancing() { return rankAwareBalancing; }
        public void setRankAwareBalancing(boolean rankAwareBalancing) { this.rankAwareBalancing = rankAwareBalancing; }

        public String getPlacementStrategy() { return placementStrategy; }
        public void setPlacementStrategy(String placementStrategy) { this.placementStrategy = placementStrategy; }

        public long getIdleDrainTimeoutMs() { return idleDrainTimeoutMs; }
        public void setIdleDrainTimeoutMs(long idleDrainTimeoutMs) { this.idleDrainTimeoutMs = idleDrainTimeoutMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxBeamWidth = 1;
        private boolean disaggregated = false;

        public int getMaxBeamWidth() { return maxBeamWidth; }
        public void setMaxBeamWidth(int maxBeamWidth) { this.maxBeamWidth = maxBeamWidth; }

        public boolean isDisaggregated() { return disaggregated; }
        public void setDisaggregated(boolean disaggregated) { this.disaggregated = disaggregated; }
    }

    /**
     * Ingress ring buffer configuration.
     */
    public static class IngressConfig {
        private int ringBufferSize = 8192;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "admission";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
