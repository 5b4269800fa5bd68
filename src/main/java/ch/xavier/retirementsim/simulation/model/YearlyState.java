package ch.xavier.retirementsim.simulation.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * End-of-year snapshot of one path.
 */
@Builder
@Getter
@ToString
public class YearlyState {
    private final int age; // Primary earner
    private final boolean retired;

    private final double nominalBalance;
    private final double realBalance;
    private final double cumulativeInflation;

    private final double taxableBalance;
    private final double pretaxBalance;
    private final double rothBalance;
    private final double emergencyBalance;

    private final double requiredDistribution;
    private final double socialSecurity;
}
