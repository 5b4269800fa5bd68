package ch.xavier.retirementsim.simulation.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Builder
@Getter
public class PathResult {
    private final List<YearlyState> trajectory;
    private final double terminalRealWealth;
    private final double firstYearAfterTaxRealWithdrawal;
    private final boolean ruined;
    private final int survivalYears;
    private final double totalRothConversions;
    private final double conversionTaxesPaid;

    public double[] realBalances() {
        return trajectory.stream().mapToDouble(YearlyState::getRealBalance).toArray();
    }

    public double[] nominalBalances() {
        return trajectory.stream().mapToDouble(YearlyState::getNominalBalance).toArray();
    }

    public PathSummary summary() {
        return PathSummary.builder()
                .terminalRealWealth(terminalRealWealth)
                .firstYearAfterTaxRealWithdrawal(firstYearAfterTaxRealWithdrawal)
                .ruined(ruined)
                .survivalYears(survivalYears)
                .build();
    }
}
