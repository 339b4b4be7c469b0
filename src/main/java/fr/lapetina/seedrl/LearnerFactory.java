package fr.lapetina.seedrl;

import fr.lapetina.seedrl.infrastructure.config.ConfigLoader;
import fr.lapetina.seedrl.infrastructure.config.LearnerConfig;
import fr.lapetina.seedrl.infrastructure.logging.LoggingMetricLogger;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.learner.Learner;
import fr.lapetina.seedrl.spi.MetricLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating fully-wired learners from configuration.
 * This is the primary entry point for obtaining a configured {@link Learner}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LearnerFactory factory = LearnerFactory.create("config.yaml", LearnerCollaborators.of(model))) {
 *     LearnerReport report = factory.start().getLearner().run();
 * }
 * }</pre>
 */
public class LearnerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LearnerFactory.class);

    private final LearnerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final MetricLogger metricLogger;
    private final Learner learner;

    protected LearnerFactory(LearnerConfig config, LearnerCollaborators collaborators) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isEnabled());

        this.metricLogger = collaborators.metricLogger() != null
                ? collaborators.metricLogger()
                : new LoggingMetricLogger();

        this.learner = Learner.builder()
                .config(config)
                .trainingModel(collaborators.trainingModel())
                .inferenceModel(collaborators.inferenceModel())
                .metricLogger(metricLogger)
                .episodeRecorder(collaborators.episodeRecorder())
                .environmentFactory(collaborators.environmentFactory())
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("LearnerFactory initialized: learner={}, sources={}", learner.getName(), config.numSources());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static LearnerFactory create(String configPath, LearnerCollaborators collaborators) {
        log.info("Initializing LearnerFactory from config: {}", configPath);
        return new LearnerFactory(new ConfigLoader(configPath).load(), collaborators);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static LearnerFactory create(LearnerConfig config, LearnerCollaborators collaborators) {
        config.validate();
        return new LearnerFactory(config, collaborators);
    }

    /**
     * Starts the inference pipeline, the batch assemblers and the local actors.
     */
    public LearnerFactory start() {
        learner.start();
        log.info("Learner started: {}", learner.getName());
        return this;
    }

    public Learner getLearner() {
        return learner;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public MetricLogger getMetricLogger() {
        return metricLogger;
    }

    public LearnerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Shutting down LearnerFactory...");

        try {
            learner.close();
        } catch (Exception e) {
            log.warn("Error closing learner", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("LearnerFactory shut down");
    }
}
