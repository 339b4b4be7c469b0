package fr.lapetina.seedrl.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.seedrl.domain.model.SubmitResult;

/**
 * Wire form of the answer to a submitted state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitResponse {

    private int action;
    private boolean shutdown;

    @JsonProperty("source_id")
    private int sourceId;

    public int getAction() { return action; }
    public void setAction(int action) { this.action = action; }

    public boolean isShutdown() { return shutdown; }
    public void setShutdown(boolean shutdown) { this.shutdown = shutdown; }

    public int getSourceId() { return sourceId; }
    public void setSourceId(int sourceId) { this.sourceId = sourceId; }

    public static SubmitResponse fromSubmitResult(SubmitResult result) {
        SubmitResponse response = new SubmitResponse();
        response.action = result.action();
        response.shutdown = result.shutdown();
        response.sourceId = result.sourceId();
        return response;
    }

    public SubmitResult toSubmitResult() {
        return new SubmitResult(action, shutdown, sourceId);
    }
}
