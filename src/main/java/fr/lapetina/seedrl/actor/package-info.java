/**
 * Caller side of the session protocol.
 */
package fr.lapetina.seedrl.actor;
