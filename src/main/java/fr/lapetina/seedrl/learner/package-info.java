/**
 * The learner's training side.
 *
 * <p>{@link fr.lapetina.seedrl.learner.BatchAssembler} threads move completed trajectories
 * from the drop-off queue into training batches; {@link fr.lapetina.seedrl.learner.Learner}
 * consumes them, checks its stop conditions after every iteration and, on shutdown, waits
 * for callers to leave before writing its {@link fr.lapetina.seedrl.learner.LearnerReport}.
 * The {@link fr.lapetina.seedrl.learner.LivenessWatchdog} turns a pipeline with no movement
 * into a normal shutdown.
 */
package fr.lapetina.seedrl.learner;
