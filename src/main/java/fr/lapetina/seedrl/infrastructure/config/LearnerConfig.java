package fr.lapetina.seedrl.infrastructure.config;

/**
 * Root configuration object for the learner.
 * Designed to be populated from YAML.
 */
public class LearnerConfig {

    private ServerConfig server = new ServerConfig();
    private TopologyConfig topology = new TopologyConfig();
    private LayoutConfig layout = new LayoutConfig();
    private RolloutConfig rollout = new RolloutConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private QueuesConfig queues = new QueuesConfig();
    private WatchdogConfig watchdog = new WatchdogConfig();
    private LimitsConfig limits = new LimitsConfig();
    private TrainingConfig training = new TrainingConfig();
    private ShutdownConfig shutdown = new ShutdownConfig();
    private ReportingConfig reporting = new ReportingConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public TopologyConfig getTopology() { return topology; }
    public void setTopology(TopologyConfig topology) { this.topology = topology; }

    public LayoutConfig getLayout() { return layout; }
    public void setLayout(LayoutConfig layout) { this.layout = layout; }

    public RolloutConfig getRollout() { return rollout; }
    public void setRollout(RolloutConfig rollout) { this.rollout = rollout; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public QueuesConfig getQueues() { return queues; }
    public void setQueues(QueuesConfig queues) { this.queues = queues; }

    public WatchdogConfig getWatchdog() { return watchdog; }
    public void setWatchdog(WatchdogConfig watchdog) { this.watchdog = watchdog; }

    public LimitsConfig getLimits() { return limits; }
    public void setLimits(LimitsConfig limits) { this.limits = limits; }

    public TrainingConfig getTraining() { return training; }
    public void setTraining(TrainingConfig training) { this.training = training; }

    public ShutdownConfig getShutdown() { return shutdown; }
    public void setShutdown(ShutdownConfig shutdown) { this.shutdown = shutdown; }

    public ReportingConfig getReporting() { return reporting; }
    public void setReporting(ReportingConfig reporting) { this.reporting = reporting; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Total number of sources (environments) across all actors.
     */
    public int numSources() {
        return topology.getNumActors() * topology.getEnvsPerActor();
    }

    /**
     * Effective drop-off queue capacity; a non-positive setting means one slot per source.
     */
    public int dropOffCapacity() {
        int configured = queues.getMaxQueuedDrops();
        return configured > 0 ? configured : numSources();
    }

    /**
     * Checks the settings the learner cannot run without.
     *
     * @throws ConfigLoader.ConfigurationException on the first invalid setting
     */
    public void validate() {
        require(topology.getNumActors() > 0, "topology.numActors must be positive");
        require(topology.getEnvsPerActor() > 0, "topology.envsPerActor must be positive");
        require(layout.getObservationSize() > 0, "layout.observationSize must be positive");
        require(layout.getNumActions() > 0, "layout.numActions must be positive");
        require(rollout.getLength() > 0, "rollout.length must be positive");
        require(rollout.getBatchSizeTraining() > 0, "rollout.batchSizeTraining must be positive");
        int ringBufferSize = disruptor.getRingBufferSize();
        require(ringBufferSize > 0 && Integer.bitCount(ringBufferSize) == 1,
                "disruptor.ringBufferSize must be a power of two");
        require(ringBufferSize >= 2 * numSources(),
                "disruptor.ringBufferSize must hold two requests per source (" + 2 * numSources() + ")");
        require(disruptor.getMaxInferenceBatchSize() > 0, "disruptor.maxInferenceBatchSize must be positive");
        require(queues.getMaxQueuedBatches() > 0, "queues.maxQueuedBatches must be positive");
        require(queues.getNumPrefetchers() > 0, "queues.numPrefetchers must be positive");
        require(rollout.getBatchSizeTraining() <= dropOffCapacity(),
                "rollout.batchSizeTraining must not exceed the drop-off capacity (" + dropOffCapacity() + ")");
        require(queues.getEnqueueMaxTries() >= 0, "queues.enqueueMaxTries must not be negative");
        require(watchdog.getStallThreshold() >= 0, "watchdog.stallThreshold must not be negative");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigLoader.ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private long requestTimeoutMs = 120000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Callers and callees. Source ids run from 0 to {@code numActors * envsPerActor - 1}.
     */
    public static class TopologyConfig {
        private int numActors = 4;
        private int envsPerActor = 1;
        private int numLearners = 1;
        private int learnerRank = 0;
        private boolean startLocalActors = true;

        public int getNumActors() { return numActors; }
        public void setNumActors(int numActors) { this.numActors = numActors; }

        public int getEnvsPerActor() { return envsPerActor; }
        public void setEnvsPerActor(int envsPerActor) { this.envsPerActor = envsPerActor; }

        public int getNumLearners() { return numLearners; }
        public void setNumLearners(int numLearners) { this.numLearners = numLearners; }

        public int getLearnerRank() { return learnerRank; }
        public void setLearnerRank(int learnerRank) { this.learnerRank = learnerRank; }

        public boolean isStartLocalActors() { return startLocalActors; }
        public void setStartLocalActors(boolean startLocalActors) { this.startLocalActors = startLocalActors; }
    }

    /**
     * Shapes of observation and policy vectors.
     */
    public static class LayoutConfig {
        private int observationSize = 4;
        private int numActions = 2;

        public int getObservationSize() { return observationSize; }
        public void setObservationSize(int observationSize) { this.observationSize = observationSize; }

        public int getNumActions() { return numActions; }
        public void setNumActions(int numActions) { this.numActions = numActions; }
    }

    public static class RolloutConfig {
        private int length = 80;
        private int batchSizeTraining = 4;

        public int getLength() { return length; }
        public void setLength(int length) { this.length = length; }

        public int getBatchSizeTraining() { return batchSizeTraining; }
        public void setBatchSizeTraining(int batchSizeTraining) { this.batchSizeTraining = batchSizeTraining; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxInferenceBatchSize = 64;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxInferenceBatchSize() { return maxInferenceBatchSize; }
        public void setMaxInferenceBatchSize(int maxInferenceBatchSize) { this.maxInferenceBatchSize = maxInferenceBatchSize; }
    }

    /**
     * Drop-off and training queue bounds, and the batch assemblers feeding them.
     */
    public static class QueuesConfig {
        private int maxQueuedBatches = 128;
        private int maxQueuedDrops = 0;
        private int enqueueMaxTries = 50;
        private long enqueueBackoffMs = 100;
        private long prefetchIdleMs = 100;
        private int numPrefetchers = 1;

        public int getMaxQueuedBatches() { return maxQueuedBatches; }
        public void setMaxQueuedBatches(int maxQueuedBatches) { this.maxQueuedBatches = maxQueuedBatches; }

        public int getMaxQueuedDrops() { return maxQueuedDrops; }
        public void setMaxQueuedDrops(int maxQueuedDrops) { this.maxQueuedDrops = maxQueuedDrops; }

        public int getEnqueueMaxTries() { return enqueueMaxTries; }
        public void setEnqueueMaxTries(int enqueueMaxTries) { this.enqueueMaxTries = enqueueMaxTries; }

        public long getEnqueueBackoffMs() { return enqueueBackoffMs; }
        public void setEnqueueBackoffMs(long enqueueBackoffMs) { this.enqueueBackoffMs = enqueueBackoffMs; }

        public long getPrefetchIdleMs() { return prefetchIdleMs; }
        public void setPrefetchIdleMs(long prefetchIdleMs) { this.prefetchIdleMs = prefetchIdleMs; }

        public int getNumPrefetchers() { return numPrefetchers; }
        public void setNumPrefetchers(int numPrefetchers) { this.numPrefetchers = numPrefetchers; }
    }

    public static class WatchdogConfig {
        private int stallThreshold = 100;

        public int getStallThreshold() { return stallThreshold; }
        public void setStallThreshold(int stallThreshold) { this.stallThreshold = stallThreshold; }
    }

    /**
     * Shutdown limits. A non-positive value disables the limit.
     */
    public static class LimitsConfig {
        private long maxEpochs = -1;
        private long totalSteps = -1;
        private long maxTimeSeconds = -1;

        public long getMaxEpochs() { return maxEpochs; }
        public void setMaxEpochs(long maxEpochs) { this.maxEpochs = maxEpochs; }

        public long getTotalSteps() { return totalSteps; }
        public void setTotalSteps(long totalSteps) { this.totalSteps = totalSteps; }

        public long getMaxTimeSeconds() { return maxTimeSeconds; }
        public void setMaxTimeSeconds(long maxTimeSeconds) { this.maxTimeSeconds = maxTimeSeconds; }
    }

    public static class TrainingConfig {
        private long idleSleepMs = 10;

        public long getIdleSleepMs() { return idleSleepMs; }
        public void setIdleSleepMs(long idleSleepMs) { this.idleSleepMs = idleSleepMs; }
    }

    /**
     * Bounded waits of the shutdown sequence. Exceeding them is logged, not fatal.
     */
    public static class ShutdownConfig {
        private long checkOutTimeoutMs = 5000;
        private long joinTimeoutMs = 5000;

        public long getCheckOutTimeoutMs() { return checkOutTimeoutMs; }
        public void setCheckOutTimeoutMs(long checkOutTimeoutMs) { this.checkOutTimeoutMs = checkOutTimeoutMs; }

        public long getJoinTimeoutMs() { return joinTimeoutMs; }
        public void setJoinTimeoutMs(long joinTimeoutMs) { this.joinTimeoutMs = joinTimeoutMs; }
    }

    public static class ReportingConfig {
        private boolean verbose = false;
        private int printInterval = 10;
        private int systemLogInterval = 1;

        public boolean isVerbose() { return verbose; }
        public void setVerbose(boolean verbose) { this.verbose = verbose; }

        public int getPrintInterval() { return printInterval; }
        public void setPrintInterval(int printInterval) { this.printInterval = printInterval; }

        public int getSystemLogInterval() { return systemLogInterval; }
        public void setSystemLogInterval(int systemLogInterval) { this.systemLogInterval = systemLogInterval; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "seedrl";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
