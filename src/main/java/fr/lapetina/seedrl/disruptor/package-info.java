/**
 * LMAX Disruptor-based pipeline batching inference requests.
 *
 * <p>Actors submit one environment state per source and wait for the answer. Requests
 * arriving concurrently land in a pre-allocated ring buffer; the inference stage drains
 * whatever is available at once and evaluates the shared model a single time for all of
 * it.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Validation → Inference (batched) → Trajectory → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.seedrl.disruptor.InferencePipeline} - Pipeline orchestrator and admission</li>
 *   <li>{@link fr.lapetina.seedrl.disruptor.OutstandingRequests} - One in-flight request per source</li>
 *   <li>{@link fr.lapetina.seedrl.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.seedrl.disruptor;
