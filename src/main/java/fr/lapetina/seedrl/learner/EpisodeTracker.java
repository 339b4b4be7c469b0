package fr.lapetina.seedrl.learner;

import fr.lapetina.seedrl.domain.model.Trajectory;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.spi.EpisodeRecorder;
import fr.lapetina.seedrl.spi.MetricLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Inspects every trajectory handed to training: counts trajectories and finished
 * episodes, averages the callers' round-trip latency and logs one {@code episodes}
 * record per finished episode.
 */
public final class EpisodeTracker implements Consumer<Trajectory> {

    private static final Logger log = LoggerFactory.getLogger(EpisodeTracker.class);

    static final String LATENCY_METRIC = "latency";

    private final MetricLogger metricLogger;
    private final EpisodeRecorder episodeRecorder;
    private final MetricsRegistry metricsRegistry;

    private long trajectoriesSeen;
    private long episodesSeen;
    private long latencySamples;
    private double meanLatency;

    public EpisodeTracker(MetricLogger metricLogger, EpisodeRecorder episodeRecorder, MetricsRegistry metricsRegistry) {
        this.metricLogger = metricLogger;
        this.episodeRecorder = episodeRecorder;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void accept(Trajectory trajectory) {
        synchronized (this) {
            trajectoriesSeen++;
            for (int i = 0; i < trajectory.getCurrentLength(); i++) {
                recordLatency(trajectory.getMetrics(i).get(LATENCY_METRIC));
                if (trajectory.isTerminalStep(i)) {
                    episodesSeen++;
                    metricsRegistry.incrementEpisodes();
                    logEpisode(trajectory, i);
                }
            }
        }

        try {
            episodeRecorder.record(trajectory);
        } catch (RuntimeException e) {
            log.warn("Episode recorder failed: seq={}, sourceId={}",
                    trajectory.getSequenceNumber(), trajectory.getSourceId(), e);
        }
    }

    private void recordLatency(Object value) {
        if (!(value instanceof Number)) {
            return;
        }
        double latency = ((Number) value).doubleValue();
        latencySamples++;
        meanLatency += (latency - meanLatency) / latencySamples;
    }

    private void logEpisode(Trajectory trajectory, int index) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("episode_id", trajectory.getEpisodeIds()[index]);
        record.put("source_id", trajectory.getSourceId());
        record.put("return", trajectory.getEpisodeReturns()[index]);
        record.put("length", trajectory.getEpisodeSteps()[index]);
        record.put("training_steps", trajectory.getTrainingSteps()[index]);

        log.debug("Episode finished: episodeId={}, sourceId={}, return={}, length={}",
                record.get("episode_id"), record.get("source_id"), record.get("return"), record.get("length"));

        try {
            metricLogger.log("episodes", record);
        } catch (RuntimeException e) {
            log.warn("Metric logger failed on channel episodes", e);
        }
    }

    public synchronized long getTrajectoriesSeen() {
        return trajectoriesSeen;
    }

    public synchronized long getEpisodesSeen() {
        return episodesSeen;
    }

    /**
     * Mean of the {@code latency} metric over all steps seen, or 0 if none carried one.
     */
    public synchronized double getMeanLatency() {
        return meanLatency;
    }
}
