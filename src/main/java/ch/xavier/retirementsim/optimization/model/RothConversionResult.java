package ch.xavier.retirementsim.optimization.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Baseline versus bracket-filling conversion plan. When there is nothing to recommend only
 * {@code hasRecommendation} and {@code reason} are set.
 */
@Getter
@ToString
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RothConversionResult {
    private final boolean hasRecommendation;
    private final String reason;

    private final List<ConversionYear> conversions;
    private final ConversionWindow conversionWindow;
    private final Double totalConverted;
    private final Double avgAnnualConversion;

    private final Double lifetimeTaxSavings;
    private final Double baselineLifetimeTax;
    private final Double optimizedLifetimeTax;

    private final Double rmdReduction;
    private final Double rmdReductionPercent;
    private final Double effectiveRateImprovement; // Percentage points

    // First ten RMD years of each scenario
    private final List<RmdYear> baselineRmds;
    private final List<RmdYear> optimizedRmds;

    private final Double targetBracket;
    private final Double targetBracketLimit;

    public static RothConversionResult noRecommendation(String reason) {
        return RothConversionResult.builder().hasRecommendation(false).reason(reason).build();
    }
}
