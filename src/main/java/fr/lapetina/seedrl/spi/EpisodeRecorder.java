package fr.lapetina.seedrl.spi;

import fr.lapetina.seedrl.domain.model.Trajectory;

/**
 * Receives every trajectory handed to training, e.g. to render or archive episodes.
 */
@FunctionalInterface
public interface EpisodeRecorder {

    EpisodeRecorder NOOP = trajectory -> {
    };

    void record(Trajectory trajectory);
}
