package ch.xavier.retirementsim.tax;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FilingStatus {
    @JsonProperty("single") SINGLE,
    @JsonProperty("married") MARRIED
}
