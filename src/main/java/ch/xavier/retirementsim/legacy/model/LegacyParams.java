package ch.xavier.retirementsim.legacy.model;

import ch.xavier.retirementsim.tax.FilingStatus;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyParams {
    // Estate at the end of life, nominal dollars, and how many years after 2025 that is
    private final double eolNominal;
    private final int yearsFrom2025;

    // Percent
    private final double nominalRet;
    private final double inflPct;

    // Real payout per eligible beneficiary per year
    private final double perBenReal;
    private final int startBens;

    private final double totalFertilityRate;
    @Builder.Default
    private final int generationLength = 30;
    @Builder.Default
    private final int deathAge = 90;
    @Builder.Default
    private final int minDistAge = 21;
    @Builder.Default
    private final int capYears = 10_000;
    @Builder.Default
    private final List<Integer> initialBenAges = List.of(0);
    @Builder.Default
    private final int fertilityWindowStart = 25;
    @Builder.Default
    private final int fertilityWindowEnd = 35;

    @JsonAlias("marital")
    @Builder.Default
    private final FilingStatus filingStatus = FilingStatus.SINGLE;
}
