package ch.xavier.retirementsim.tax;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EmploymentType {
    @JsonProperty("w2") W2,
    @JsonProperty("self-employed") SELF_EMPLOYED,
    // Half wages, half self-employment income
    @JsonProperty("both") BOTH,
    @JsonProperty("retired") RETIRED,
    @JsonProperty("other") OTHER
}
