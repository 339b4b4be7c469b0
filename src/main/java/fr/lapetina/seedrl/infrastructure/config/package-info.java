/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a plain object tree with
 * documented defaults. The configuration is validated once, when it is loaded.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.seedrl.infrastructure.config.LearnerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.seedrl.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, request timeout)</li>
 *   <li>{@code topology} - Number of actors, environments per actor, local actor startup</li>
 *   <li>{@code layout} - Observation and action vector widths</li>
 *   <li>{@code rollout} - Trajectory length and training batch size</li>
 *   <li>{@code disruptor} - Ring buffer, wait strategy and inference batch bound</li>
 *   <li>{@code queues} - Drop-off and training queue bounds, batch assembler settings</li>
 *   <li>{@code watchdog} - Stall detection threshold</li>
 *   <li>{@code limits} - Epoch, step and wall-clock limits</li>
 *   <li>{@code shutdown} - Bounded waits during shutdown</li>
 *   <li>{@code reporting} - Periodic logging intervals</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.seedrl.infrastructure.config;
