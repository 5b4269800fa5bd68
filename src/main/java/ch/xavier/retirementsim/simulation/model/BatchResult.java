package ch.xavier.retirementsim.simulation.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Aggregate of a completed batch. Built once from all path results, never mutated afterwards.
 */
@Builder
@Getter
public class BatchResult {
    private final int pathCount;
    private final int[] ages;
    private final PercentileBands realBalances;
    private final PercentileBands nominalBalances;
    private final OutcomeDistribution terminalRealWealth;
    private final OutcomeDistribution firstYearAfterTaxRealWithdrawal;

    // Untrimmed share of ruined paths
    private final double probabilityOfRuin;

    private final List<PathSummary> allRuns;
}
