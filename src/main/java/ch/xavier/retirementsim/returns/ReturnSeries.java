package ch.xavier.retirementsim.returns;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ReturnSeries {
    @JsonProperty("nominal") NOMINAL,
    @JsonProperty("real") REAL
}
