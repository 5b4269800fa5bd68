package ch.xavier.retirementsim.tax;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable jurisdiction tables consumed by the tax and benefit calculators.
 * The values are a point-in-time approximation of US federal rules, not a derivation of them.
 */
@Getter
public class TaxTables {

    private static final double INF = Double.POSITIVE_INFINITY;

    private final Map<FilingStatus, Double> standardDeductions;
    private final Map<FilingStatus, List<TaxBracket>> ordinaryBrackets;
    private final Map<FilingStatus, List<TaxBracket>> capitalGainsBrackets;
    private final Map<FilingStatus, Double> niitThresholds;
    private final double niitRate;
    private final Map<FilingStatus, List<IrmaaTier>> irmaaTiers;
    private final int rmdStartAge;
    private final NavigableMap<Integer, Double> rmdDivisors;
    private final double rmdFallbackDivisor;
    private final SocialSecurityRules socialSecurity;
    private final EstateTaxRules estateTax;
    private final EmploymentTaxRules employmentTax;

    @Builder
    private TaxTables(@Singular Map<FilingStatus, Double> standardDeductions,
                      @Singular Map<FilingStatus, List<TaxBracket>> ordinaryBrackets,
                      @Singular Map<FilingStatus, List<TaxBracket>> capitalGainsBrackets,
                      @Singular Map<FilingStatus, Double> niitThresholds,
                      double niitRate,
                      @Singular Map<FilingStatus, List<IrmaaTier>> irmaaTiers,
                      int rmdStartAge,
                      @Singular Map<Integer, Double> rmdDivisors,
                      double rmdFallbackDivisor,
                      SocialSecurityRules socialSecurity,
                      EstateTaxRules estateTax,
                      EmploymentTaxRules employmentTax) {
        for (FilingStatus status : FilingStatus.values()) {
            requireStatus(standardDeductions, status, "standard deduction");
            requireSchedule(requireStatus(ordinaryBrackets, status, "ordinary brackets"), status, "ordinary");
            requireSchedule(requireStatus(capitalGainsBrackets, status, "capital gains brackets"), status, "capital gains");
            requireStatus(niitThresholds, status, "NIIT threshold");
            requireStatus(irmaaTiers, status, "IRMAA tiers");
        }
        if (rmdDivisors.isEmpty()) {
            throw new IllegalArgumentException("RMD divisor table must not be empty");
        }
        if (socialSecurity == null) {
            throw new IllegalArgumentException("Social Security rules are required");
        }
        if (employmentTax == null) {
            throw new IllegalArgumentException("Employment tax rules are required");
        }

        this.standardDeductions = Collections.unmodifiableMap(new EnumMap<>(standardDeductions));
        this.ordinaryBrackets = immutableSchedules(ordinaryBrackets);
        this.capitalGainsBrackets = immutableSchedules(capitalGainsBrackets);
        this.niitThresholds = Collections.unmodifiableMap(new EnumMap<>(niitThresholds));
        this.niitRate = niitRate;
        EnumMap<FilingStatus, List<IrmaaTier>> tiers = new EnumMap<>(FilingStatus.class);
        irmaaTiers.forEach((status, list) -> tiers.put(status, List.copyOf(list)));
        this.irmaaTiers = Collections.unmodifiableMap(tiers);
        this.rmdStartAge = rmdStartAge;
        this.rmdDivisors = Collections.unmodifiableNavigableMap(new TreeMap<>(rmdDivisors));
        this.rmdFallbackDivisor = rmdFallbackDivisor;
        this.socialSecurity = socialSecurity;
        this.estateTax = estateTax;
        this.employmentTax = employmentTax;
    }

    public double standardDeduction(FilingStatus status) {
        return standardDeductions.get(status);
    }

    public List<TaxBracket> ordinaryBrackets(FilingStatus status) {
        return ordinaryBrackets.get(status);
    }

    public List<TaxBracket> capitalGainsBrackets(FilingStatus status) {
        return capitalGainsBrackets.get(status);
    }

    public double niitThreshold(FilingStatus status) {
        return niitThresholds.get(status);
    }

    public List<IrmaaTier> irmaaTiers(FilingStatus status) {
        return irmaaTiers.get(status);
    }

    /**
     * 2026 federal brackets and deductions (TCJA rates), 2026 IRMAA tiers, SECURE 2.0 RMD start age and the
     * IRS Uniform Lifetime Table.
     */
    public static TaxTables federal2026() {
        return TaxTables.builder()
                .standardDeduction(FilingStatus.SINGLE, 16_100.0)
                .standardDeduction(FilingStatus.MARRIED, 32_200.0)
                .ordinaryBracket(FilingStatus.SINGLE, List.of(
                        new TaxBracket(12_400, 0.10),
                        new TaxBracket(50_400, 0.12),
                        new TaxBracket(105_700, 0.22),
                        new TaxBracket(201_775, 0.24),
                        new TaxBracket(256_225, 0.32),
                        new TaxBracket(640_600, 0.35),
                        new TaxBracket(INF, 0.37)))
                .ordinaryBracket(FilingStatus.MARRIED, List.of(
                        new TaxBracket(24_800, 0.10),
                        new TaxBracket(100_800, 0.12),
                        new TaxBracket(211_400, 0.22),
                        new TaxBracket(403_550, 0.24),
                        new TaxBracket(512_450, 0.32),
                        new TaxBracket(768_700, 0.35),
                        new TaxBracket(INF, 0.37)))
                .capitalGainsBracket(FilingStatus.SINGLE, List.of(
                        new TaxBracket(49_450, 0.0),
                        new TaxBracket(545_500, 0.15),
                        new TaxBracket(INF, 0.20)))
                .capitalGainsBracket(FilingStatus.MARRIED, List.of(
                        new TaxBracket(98_900, 0.0),
                        new TaxBracket(613_700, 0.15),
                        new TaxBracket(INF, 0.20)))
                .niitThreshold(FilingStatus.SINGLE, 200_000.0)
                .niitThreshold(FilingStatus.MARRIED, 250_000.0)
                .niitRate(0.038)
                .irmaaTier(FilingStatus.SINGLE, List.of(
                        new IrmaaTier(109_000, 0),
                        new IrmaaTier(137_000, 81.20),
                        new IrmaaTier(171_000, 202.90),
                        new IrmaaTier(205_000, 324.60),
                        new IrmaaTier(500_000, 446.30),
                        new IrmaaTier(INF, 487.00)))
                .irmaaTier(FilingStatus.MARRIED, List.of(
                        new IrmaaTier(218_000, 0),
                        new IrmaaTier(274_000, 81.20),
                        new IrmaaTier(342_000, 202.90),
                        new IrmaaTier(410_000, 324.60),
                        new IrmaaTier(750_000, 446.30),
                        new IrmaaTier(INF, 487.00)))
                .rmdStartAge(73)
                .rmdDivisors(uniformLifetimeTable())
                .rmdFallbackDivisor(2.0)
                .socialSecurity(SocialSecurityRules.builder()
                        .firstBendPoint(1286)
                        .secondBendPoint(7749)
                        .firstReplacementRate(0.90)
                        .secondReplacementRate(0.32)
                        .thirdReplacementRate(0.15)
                        .fullRetirementAge(67)
                        .earlyReductionFirst36Months(5.0 / 9.0)
                        .earlyReductionBeyond36Months(5.0 / 12.0)
                        .delayedCreditPerMonth(2.0 / 3.0)
                        .spousalShareOfPia(0.5)
                        .spousalEarlyReductionFirst36Months(25.0 / 36.0)
                        .build())
                .estateTax(EstateTaxRules.builder()
                        .baseYear(2026)
                        .singleExemption(13_610_000)
                        .marriedExemption(27_220_000)
                        .exemptionGrowthRate(0.026)
                        .rate(0.40)
                        .build())
                .employmentTax(EmploymentTaxRules.builder()
                        .socialSecurityWageBase(184_500)
                        .socialSecurityEmployeeRate(0.062)
                        .socialSecuritySelfEmployedRate(0.124)
                        .medicareEmployeeRate(0.0145)
                        .medicareSelfEmployedRate(0.029)
                        .additionalMedicareThreshold(200_000)
                        .additionalMedicareRate(0.009)
                        .selfEmploymentFactor(0.9235)
                        .build())
                .build();
    }

    private static Map<Integer, Double> uniformLifetimeTable() {
        double[] divisors = {
                26.5, 25.5, 24.6, 23.7, 22.9, 22.0, 21.1, 20.2, 19.4, 18.5, 17.7, 16.8, 16.0, 15.2, 14.4, 13.7,
                12.9, 12.2, 11.5, 10.8, 10.1, 9.5, 8.9, 8.4, 7.8, 7.3, 6.8, 6.4, 6.0, 5.6, 5.2, 4.9,
                4.6, 4.3, 4.1, 3.9, 3.7, 3.5, 3.4, 3.3, 3.1, 3.0, 2.9, 2.8, 2.7, 2.5, 2.3, 2.0
        };
        Map<Integer, Double> table = new TreeMap<>();
        for (int i = 0; i < divisors.length; i++) {
            table.put(73 + i, divisors[i]);
        }
        return table;
    }

    private static <T> T requireStatus(Map<FilingStatus, T> map, FilingStatus status, String what) {
        T value = map.get(status);
        if (value == null) {
            throw new IllegalArgumentException("Missing " + what + " for " + status);
        }
        return value;
    }

    private static void requireSchedule(List<TaxBracket> brackets, FilingStatus status, String what) {
        if (brackets.isEmpty()) {
            throw new IllegalArgumentException("Empty " + what + " schedule for " + status);
        }
        double previous = 0;
        for (TaxBracket bracket : brackets) {
            if (bracket.getLimit() <= previous) {
                throw new IllegalArgumentException(what + " brackets for " + status + " must be ascending");
            }
            previous = bracket.getLimit();
        }
    }

    private static Map<FilingStatus, List<TaxBracket>> immutableSchedules(Map<FilingStatus, List<TaxBracket>> source) {
        EnumMap<FilingStatus, List<TaxBracket>> copy = new EnumMap<>(FilingStatus.class);
        source.forEach((status, brackets) -> copy.put(status, List.copyOf(brackets)));
        return Collections.unmodifiableMap(copy);
    }
}
