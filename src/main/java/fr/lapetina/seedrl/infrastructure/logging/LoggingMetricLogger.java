package fr.lapetina.seedrl.infrastructure.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.seedrl.spi.MetricLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link MetricLogger}: each record is rendered as one JSON line on the
 * {@code seedrl.metrics.<channel>} logger at INFO, so channels can be routed or muted in
 * logback.xml.
 */
public final class LoggingMetricLogger implements MetricLogger {

    private static final Logger log = LoggerFactory.getLogger(LoggingMetricLogger.class);
    private static final String LOGGER_PREFIX = "seedrl.metrics.";

    private final ObjectMapper objectMapper;
    private final Map<String, Logger> channelLoggers = new ConcurrentHashMap<>();

    public LoggingMetricLogger() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());
    }

    @Override
    public void log(String channel, Map<String, Object> record) {
        Logger channelLogger = channelLoggers.computeIfAbsent(
                channel, c -> LoggerFactory.getLogger(LOGGER_PREFIX + c));
        if (!channelLogger.isInfoEnabled()) {
            return;
        }
        try {
            channelLogger.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize metric record: channel={}, keys={}", channel, record.keySet(), e);
        }
    }

    @Override
    public void flush() {
        log.debug("Metric logger flushed: channels={}", channelLoggers.keySet());
    }
}
