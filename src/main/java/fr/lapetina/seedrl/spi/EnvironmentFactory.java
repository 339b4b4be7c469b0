package fr.lapetina.seedrl.spi;

/**
 * Creates the environment for a given source id.
 */
@FunctionalInterface
public interface EnvironmentFactory {

    Environment create(int sourceId);
}
