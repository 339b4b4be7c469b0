package fr.lapetina.seedrl.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a check-in or check-out call. The rank is ignored on check-out.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionRequest {

    @JsonProperty("caller_id")
    private String callerId;

    private int rank;

    public SessionRequest() {
    }

    public SessionRequest(String callerId, int rank) {
        this.callerId = callerId;
        this.rank = rank;
    }

    public String getCallerId() { return callerId; }
    public void setCallerId(String callerId) { this.callerId = callerId; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }
}
