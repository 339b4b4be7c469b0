package fr.lapetina.seedrl.spi;

import java.util.Map;

/**
 * Opaque copy of a model's parameters.
 *
 * @param version    monotonically increasing version chosen by the model
 * @param parameters named parameter tensors, flattened
 */
public record ModelSnapshot(long version, Map<String, float[]> parameters) {
    public ModelSnapshot {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
