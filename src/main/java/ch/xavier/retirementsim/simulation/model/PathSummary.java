package ch.xavier.retirementsim.simulation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * What survives of a path once the batch is aggregated. Hosts send these back for the guardrails estimate.
 */
@Builder
@Getter
@ToString
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathSummary {
    private final double terminalRealWealth;
    private final double firstYearAfterTaxRealWithdrawal;
    private final boolean ruined;
    private final int survivalYears;
}
