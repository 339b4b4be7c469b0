package fr.lapetina.seedrl.support;

import fr.lapetina.seedrl.spi.MetricLogger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps every logged record in memory.
 */
public final class RecordingMetricLogger implements MetricLogger {

    public record Entry(String channel, Map<String, Object> record) {
    }

    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    private volatile int flushes;

    @Override
    public void log(String channel, Map<String, Object> record) {
        entries.add(new Entry(channel, Map.copyOf(record)));
    }

    @Override
    public void flush() {
        flushes++;
    }

    public List<Map<String, Object>> records(String channel) {
        return entries.stream()
                .filter(entry -> entry.channel().equals(channel))
                .map(Entry::record)
                .collect(Collectors.toList());
    }

    public int getFlushes() {
        return flushes;
    }
}
