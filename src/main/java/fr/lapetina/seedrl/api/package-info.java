/**
 * HTTP surface of a learner. Wire bodies live in {@code api.dto}.
 */
package fr.lapetina.seedrl.api;
