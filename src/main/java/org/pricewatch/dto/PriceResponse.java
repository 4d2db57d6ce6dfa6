package org.pricewatch.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

// Success payload: {"data": [...]}
public class PriceResponse {
    private final List<PriceRow> data;

    @JsonCreator
    public PriceResponse(@JsonProperty("data") List<PriceRow> data) {
        this.data = (data == null) ? List.of() : List.copyOf(data);
    }

    @JsonProperty("data")
    public List<PriceRow> getData() {
        return data;
    }
}
