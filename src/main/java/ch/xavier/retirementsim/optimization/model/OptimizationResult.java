package ch.xavier.retirementsim.optimization.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class OptimizationResult {
    // Contributions the household could stop making and still clear the success threshold
    private final double surplusAnnual;
    private final double surplusMonthly;

    // Largest one-time expense out of the taxable account that keeps the plan successful
    private final double maxSplurge;

    private final int earliestRetirementAge;
    private final int yearsEarlier;
}
