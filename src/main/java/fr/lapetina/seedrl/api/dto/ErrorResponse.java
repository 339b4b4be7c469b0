package fr.lapetina.seedrl.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body; {@code type} names the failure so clients can rethrow the matching exception.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorResponse {

    private String error;
    private String type;

    public ErrorResponse() {
    }

    public ErrorResponse(String error, String type) {
        this.error = error;
        this.type = type;
    }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
}
