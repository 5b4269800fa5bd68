package ch.xavier.retirementsim.returns;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ReturnMode {
    @JsonProperty("fixed") FIXED,
    @JsonProperty("bootstrap") BOOTSTRAP,
    @JsonProperty("historical") HISTORICAL
}
