package fr.lapetina.seedrl.spi;

import fr.lapetina.seedrl.domain.model.EnvironmentState;

/**
 * An environment driven by an actor. Implementations track episode ids, steps and
 * returns themselves and reset automatically after a terminal step.
 */
public interface Environment extends AutoCloseable {

    EnvironmentState initial();

    EnvironmentState step(int action);

    @Override
    default void close() {
    }
}
