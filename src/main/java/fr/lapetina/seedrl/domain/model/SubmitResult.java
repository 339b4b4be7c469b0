package fr.lapetina.seedrl.domain.model;

/**
 * Answer to one submitted request.
 *
 * @param action   the action for the caller's source
 * @param shutdown true once the learner asks its callers to stop
 * @param sourceId echo of the submitted source id; callers check it against their own
 */
public record SubmitResult(int action, boolean shutdown, int sourceId) {
}
