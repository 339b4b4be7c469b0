package fr.lapetina.seedrl.actor;

import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.SubmitResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The learner's session protocol as seen by a caller: check in once, submit one request
 * per source and wait for it, check out once.
 *
 * <p>Implemented by the learner itself for in-process actors and by an HTTP client for
 * remote ones.
 */
public interface LearnerEndpoint {

    /**
     * @throws fr.lapetina.seedrl.domain.exception.DuplicateSessionException if already checked in
     */
    void checkIn(String callerId, int rank);

    /**
     * @throws fr.lapetina.seedrl.domain.exception.UnknownSessionException if not checked in
     */
    void checkOut(String callerId);

    /**
     * Submits one environment state for inference.
     *
     * @param sourceId global source id of the environment
     * @param state    the environment's current state
     * @param metrics  per-step metrics recorded alongside the step (e.g. {@code latency})
     * @return future completed with the action for {@code sourceId}
     */
    CompletableFuture<SubmitResult> submit(int sourceId, EnvironmentState state, Map<String, Object> metrics);
}
