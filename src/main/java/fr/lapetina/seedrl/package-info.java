/**
 * SEED-style learner: many actors stream environment states to one learner, which batches
 * them for a shared policy model, answers each with an action, keeps per-source
 * trajectories and trains on fixed-size batches of completed ones.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.seedrl.LearnerFactory} - Main entry point for creating a fully-wired
 *       learner from YAML configuration</li>
 *   <li>{@link fr.lapetina.seedrl.LearnerApplication} - The same learner behind an HTTP surface
 *       for remote actors</li>
 *   <li>{@link fr.lapetina.seedrl.spi} - Contracts for the model, environments and record sinks</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * LearnerCollaborators collaborators = LearnerCollaborators.of(model)
 *         .withEnvironmentFactory(sourceId -> new MyEnvironment(sourceId));
 *
 * try (LearnerFactory factory = LearnerFactory.create("config.yaml", collaborators).start()) {
 *     LearnerReport report = factory.getLearner().run();
 *     System.out.println(report);
 * }
 * }</pre>
 *
 * @see fr.lapetina.seedrl.learner.Learner
 * @see fr.lapetina.seedrl.disruptor.InferencePipeline
 */
package fr.lapetina.seedrl;
