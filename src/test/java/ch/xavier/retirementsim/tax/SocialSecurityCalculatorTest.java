package ch.xavier.retirementsim.tax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SocialSecurityCalculatorTest {

    private final SocialSecurityCalculator calculator = new SocialSecurityCalculator(TaxTables.federal2026());

    @Test
    @DisplayName("PIA applies 90% and 32% across the first two bend points")
    void primaryInsuranceAmount_betweenBendPoints() {
        // AIME 5,000: 1,286 * 0.90 + 3,714 * 0.32
        assertEquals(2_345.88, calculator.primaryInsuranceAmount(60_000), 1e-6);
    }

    @Test
    @DisplayName("No earnings, no benefit")
    void primaryInsuranceAmount_noIncome_isZero() {
        assertEquals(0, calculator.primaryInsuranceAmount(0));
        assertEquals(0, calculator.annualBenefit(0, 67));
    }

    @Test
    @DisplayName("Claiming at 62 costs 30%, at 70 earns 24%")
    void adjustmentFactor_earlyAndDelayed() {
        assertEquals(0.70, calculator.adjustmentFactor(62), 1e-9);
        assertEquals(1.00, calculator.adjustmentFactor(67), 1e-9);
        assertEquals(1.24, calculator.adjustmentFactor(70), 1e-9);
    }

    @Test
    @DisplayName("Adjustment factor increases with claim age and is continuous at the 36-month boundary")
    void adjustmentFactor_monotonicAndContinuous() {
        double previous = 0;
        for (double age = 62; age <= 70; age += 1.0 / 12) {
            double factor = calculator.adjustmentFactor(age);
            assertThat(factor).isGreaterThan(previous);
            previous = factor;
        }

        double justBefore = calculator.adjustmentFactor(64 - 1e-9);
        double justAfter = calculator.adjustmentFactor(64 + 1e-9);
        assertThat(Math.abs(justAfter - justBefore)).isLessThan(1e-6);
    }

    @Test
    @DisplayName("A low earner gets half of the spouse's PIA when that is larger")
    void effectiveMonthlyBenefit_spousalTopUp() {
        assertEquals(1_500, calculator.effectiveMonthlyBenefit(500, 3_000, 67), 1e-9);
        assertEquals(3_000, calculator.effectiveMonthlyBenefit(3_000, 500, 67), 1e-9);
    }

    @Test
    @DisplayName("The spousal benefit is reduced for early claiming but never raised for delay")
    void effectiveMonthlyBenefit_spousalClaimAge() {
        double early = calculator.effectiveMonthlyBenefit(0, 3_000, 64);
        double delayed = calculator.effectiveMonthlyBenefit(0, 3_000, 70);

        assertEquals(1_500 * 0.75, early, 1e-9);
        assertEquals(1_500, delayed, 1e-9);
    }
}
