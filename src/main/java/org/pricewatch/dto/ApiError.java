package org.pricewatch.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

// Error payload: {"error": "..."}
public class ApiError {
    private final String error;

    @JsonCreator
    public ApiError(@JsonProperty("error") String error) {
        this.error = error;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }
}
