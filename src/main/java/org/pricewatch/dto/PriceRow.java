package org.pricewatch.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

// One day of aggregated price data
@JsonPropertyOrder({"date", "price_usd", "volume_usd"})
public final class PriceRow {
    private final String date;
    private final double priceUsd;
    private final double volumeUsd;

    @JsonCreator
    public PriceRow(@JsonProperty("date") String date,
                    @JsonProperty("price_usd") double priceUsd,
                    @JsonProperty("volume_usd") double volumeUsd) {
        this.date = (date == null) ? "" : date;
        this.priceUsd = priceUsd;
        this.volumeUsd = volumeUsd;
    }

    @JsonProperty("date")
    public String getDate() {
        return date;
    }

    @JsonProperty("price_usd")
    public double getPriceUsd() {
        return priceUsd;
    }

    @JsonProperty("volume_usd")
    public double getVolumeUsd() {
        return volumeUsd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceRow)) return false;
        PriceRow other = (PriceRow) o;
        return Double.compare(priceUsd, other.priceUsd) == 0
                && Double.compare(volumeUsd, other.volumeUsd) == 0
                && date.equals(other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, priceUsd, volumeUsd);
    }

    @Override
    public String toString() {
        return "PriceRow{date=" + date + ", price_usd=" + priceUsd + ", volume_usd=" + volumeUsd + "}";
    }
}
