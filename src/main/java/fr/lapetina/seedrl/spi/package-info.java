/**
 * Extension points supplied by the embedding application: the policy model, the
 * environments driven by actors and the sinks for metrics and finished episodes.
 */
package fr.lapetina.seedrl.spi;
