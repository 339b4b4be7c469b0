/**
 * Trajectory storage between inference and training.
 *
 * <p>Data flows {@link fr.lapetina.seedrl.store.BatchEntryTable} ->
 * {@link fr.lapetina.seedrl.store.TrajectoryStore} ->
 * {@link fr.lapetina.seedrl.store.DropOffQueue} ->
 * {@link fr.lapetina.seedrl.store.TrainingQueue}. The two queues are bounded with
 * different overflow policies: the drop-off queue evicts its oldest trajectory, the
 * training queue makes producers retry and eventually discard.
 */
package fr.lapetina.seedrl.store;
