package fr.lapetina.seedrl.spi;

import java.util.Map;

/**
 * Sink for the learner's structured records. Channels used are {@code training},
 * {@code system} and {@code episodes}.
 */
public interface MetricLogger {

    void log(String channel, Map<String, Object> record);

    /**
     * Writes out anything buffered. Called once on learner shutdown.
     */
    default void flush() {
    }
}
