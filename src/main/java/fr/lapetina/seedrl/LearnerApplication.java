package fr.lapetina.seedrl;

import fr.lapetina.seedrl.api.LearnerHttpServer;
import fr.lapetina.seedrl.infrastructure.config.LearnerConfig;
import fr.lapetina.seedrl.learner.LearnerReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A learner served over HTTP: remote actors reach it through
 * {@link fr.lapetina.seedrl.infrastructure.http.LearnerHttpClient}.
 */
public class LearnerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LearnerApplication.class);

    private final LearnerFactory factory;
    private final LearnerHttpServer httpServer;

    public LearnerApplication(String configPath, LearnerCollaborators collaborators) throws Exception {
        this(LearnerFactory.create(configPath, collaborators));
    }

    public LearnerApplication(LearnerFactory factory) throws Exception {
        log.info("Starting learner application...");
        this.factory = factory;

        LearnerConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new LearnerHttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                factory.getLearner(),
                factory.getMetricsRegistry(),
                server.getRequestTimeoutMs(),
                factory.getConfig().getMetrics().isEnabled()
        );

        log.info("Learner application initialized");
    }

    /**
     * Opens the HTTP surface and starts the learner's background work.
     */
    public LearnerApplication start() {
        httpServer.start();
        factory.start();
        log.info("Learner application started on port {}", httpServer.getPort());
        return this;
    }

    /**
     * Runs the learner's training loop on the calling thread until it shuts down.
     */
    public LearnerReport run() {
        return factory.getLearner().run();
    }

    public void requestShutdown() {
        factory.getLearner().close();
    }

    public LearnerFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down learner application...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        log.info("Learner application shut down");
    }
}
