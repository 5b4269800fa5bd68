package ch.xavier.retirementsim.simulation.model;

import ch.xavier.retirementsim.returns.BondGlidePath;
import ch.xavier.retirementsim.returns.ReturnMode;
import ch.xavier.retirementsim.returns.ReturnSeries;
import ch.xavier.retirementsim.tax.EmploymentType;
import ch.xavier.retirementsim.tax.FilingStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable household and market assumptions for one request.
 * <p>
 * Rates ending in {@code Pct} are percentages ({@code 6.0} for 6%). {@code targetConversionBracket} is the
 * only decimal rate ({@code 0.24}), matching the bracket tables. Currency amounts are nominal dollars of the
 * current year. {@code age2}, {@code spouse}, {@code ssIncome2} and {@code ssClaimAge2} are ignored for single
 * filers.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationParams {

    // Household
    @Builder.Default
    private final FilingStatus filingStatus = FilingStatus.SINGLE;
    private final int age1;
    private final int age2;
    private final int retirementAge;

    // Starting balances
    private final double taxableBalance;
    private final double pretaxBalance;
    private final double rothBalance;
    private final double emergencyFund;

    // Contributions while working
    @Builder.Default
    private final Contributions primary = Contributions.NONE;
    @Builder.Default
    private final Contributions spouse = Contributions.NONE;
    private final boolean increaseContributions;
    private final double incomeGrowthPct;

    // Earned income while working, for employment taxes
    private final double annualIncome1;
    private final double annualIncome2;
    @Builder.Default
    private final EmploymentType employmentType1 = EmploymentType.W2;
    @Builder.Default
    private final EmploymentType employmentType2 = EmploymentType.W2;

    // Market assumptions
    @Builder.Default
    private final double returnRatePct = 9.8;
    @Builder.Default
    private final double inflationRatePct = 2.6;
    @Builder.Default
    private final ReturnMode returnMode = ReturnMode.BOOTSTRAP;
    @Builder.Default
    private final ReturnSeries returnSeries = ReturnSeries.NOMINAL;
    private final Integer historicalYear;
    private final Double inflationShockRatePct;
    @Builder.Default
    private final int inflationShockYears = 5;
    @Builder.Default
    private final double dividendYieldPct = 2.0;
    private final BondGlidePath bondGlidePath; // All equity when absent

    // Spending and taxes
    private final double stateTaxRatePct;
    @Builder.Default
    private final double withdrawalRatePct = 4.0;

    // Social Security
    private final boolean includeSocialSecurity;
    private final double ssIncome1;
    @Builder.Default
    private final int ssClaimAge1 = 67;
    private final double ssIncome2;
    @Builder.Default
    private final int ssClaimAge2 = 67;

    // Roth conversions during drawdown
    private final boolean rothConversionsEnabled;
    @Builder.Default
    private final double targetConversionBracket = 0.24;

    // Healthcare
    private final boolean includeMedicare;
    @Builder.Default
    private final double medicarePremiumMonthly = 400;
    @Builder.Default
    private final double medicalInflationPct = 5.0;
    private final boolean includeLongTermCare;
    @Builder.Default
    private final double ltcAnnualCost = 80_000;
    @Builder.Default
    private final double ltcProbabilityPct = 50;
    @Builder.Default
    private final double ltcDurationYears = 2.5;
    @Builder.Default
    private final int ltcOnsetAge = 82;
    private final boolean includePreMedicareHealthcare;

    // Children
    @Builder.Default
    private final List<Integer> childrenAges = List.of();
    private final int numChildren;
    private final int additionalChildrenExpected;

    @JsonIgnore
    public boolean isMarried() {
        return filingStatus == FilingStatus.MARRIED;
    }

    public int youngerAge() {
        return isMarried() ? Math.min(age1, age2) : age1;
    }

    public int olderAge() {
        return isMarried() ? Math.max(age1, age2) : age1;
    }

    public double totalContributions() {
        return primary.total() + (isMarried() ? spouse.total() : 0);
    }
}
