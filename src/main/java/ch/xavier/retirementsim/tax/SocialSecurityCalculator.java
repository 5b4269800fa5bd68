package ch.xavier.retirementsim.tax;

import org.springframework.stereotype.Component;

/**
 * Social Security retirement benefits: primary insurance amount from bend points, claiming-age adjustment
 * and the spousal top-up. Monthly amounts unless the method name says otherwise.
 */
@Component
public class SocialSecurityCalculator {

    private final SocialSecurityRules rules;

    public SocialSecurityCalculator(TaxTables tables) {
        this.rules = tables.getSocialSecurity();
    }

    /**
     * @param averageAnnualIncome average indexed earnings expressed per year
     * @return monthly PIA
     */
    public double primaryInsuranceAmount(double averageAnnualIncome) {
        if (averageAnnualIncome <= 0) {
            return 0;
        }

        double aime = averageAnnualIncome / 12;
        double first = rules.getFirstBendPoint();
        double second = rules.getSecondBendPoint();

        if (aime <= first) {
            return aime * rules.getFirstReplacementRate();
        }
        if (aime <= second) {
            return first * rules.getFirstReplacementRate()
                    + (aime - first) * rules.getSecondReplacementRate();
        }
        return first * rules.getFirstReplacementRate()
                + (second - first) * rules.getSecondReplacementRate()
                + (aime - second) * rules.getThirdReplacementRate();
    }

    /**
     * Multiplier applied to the PIA for claiming at {@code claimAge}: below 1 before full retirement age,
     * above 1 after it.
     */
    public double adjustmentFactor(double claimAge) {
        double monthsFromFra = (claimAge - rules.getFullRetirementAge()) * 12;

        if (monthsFromFra < 0) {
            double earlyMonths = -monthsFromFra;
            if (earlyMonths <= 36) {
                return 1 - earlyMonths * rules.getEarlyReductionFirst36Months() / 100;
            }
            return 1 - 36 * rules.getEarlyReductionFirst36Months() / 100
                    - (earlyMonths - 36) * rules.getEarlyReductionBeyond36Months() / 100;
        }
        if (monthsFromFra > 0) {
            return 1 + monthsFromFra * rules.getDelayedCreditPerMonth() / 100;
        }
        return 1.0;
    }

    public double adjustedMonthlyBenefit(double monthlyPia, double claimAge) {
        if (monthlyPia <= 0) {
            return 0;
        }
        return monthlyPia * adjustmentFactor(claimAge);
    }

    public double annualBenefit(double averageAnnualIncome, double claimAge) {
        if (averageAnnualIncome <= 0) {
            return 0;
        }
        return adjustedMonthlyBenefit(primaryInsuranceAmount(averageAnnualIncome), claimAge) * 12;
    }

    /**
     * Higher of the worker's own adjusted benefit and the spousal benefit. The spousal benefit is a share of the
     * other spouse's unadjusted PIA, reduced for early claiming and never increased by delay.
     */
    public double effectiveMonthlyBenefit(double ownPia, double spousePia, double ownClaimAge) {
        double ownBenefit = adjustedMonthlyBenefit(ownPia, ownClaimAge);
        double spousalBenefit = spousePia * rules.getSpousalShareOfPia();

        double fra = rules.getFullRetirementAge();
        if (ownClaimAge < fra) {
            double monthsEarly = (fra - ownClaimAge) * 12;
            if (monthsEarly <= 36) {
                spousalBenefit *= 1 - monthsEarly * rules.getSpousalEarlyReductionFirst36Months() / 100;
            } else {
                spousalBenefit *= 1 - 36 * rules.getSpousalEarlyReductionFirst36Months() / 100
                        - (monthsEarly - 36) * rules.getEarlyReductionBeyond36Months() / 100;
            }
        }

        return Math.max(ownBenefit, spousalBenefit);
    }
}
