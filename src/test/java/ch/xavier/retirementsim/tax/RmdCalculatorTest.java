package ch.xavier.retirementsim.tax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RmdCalculatorTest {

    private final RmdCalculator calculator = new RmdCalculator(TaxTables.federal2026());

    @Test
    @DisplayName("No distribution is required before the start age")
    void requiredDistribution_beforeStartAge_isZero() {
        assertEquals(73, calculator.startAge());
        assertEquals(0, calculator.requiredDistribution(500_000, 72));
    }

    @Test
    @DisplayName("First RMD divides the balance by the age-73 divisor")
    void requiredDistribution_atStartAge_usesTableDivisor() {
        assertEquals(500_000 / 26.5, calculator.requiredDistribution(500_000, 73), 1e-9);
    }

    @Test
    @DisplayName("Empty account requires nothing")
    void requiredDistribution_emptyAccount_isZero() {
        assertEquals(0, calculator.requiredDistribution(0, 80));
    }

    @Test
    @DisplayName("Divisors never increase with age and fall back past the table")
    void divisor_isNonIncreasing() {
        double previous = Double.MAX_VALUE;
        for (int age = 73; age <= 130; age++) {
            double divisor = calculator.divisor(age);
            assertThat(divisor).isPositive().isLessThanOrEqualTo(previous);
            previous = divisor;
        }
        assertEquals(2.0, calculator.divisor(140));
    }
}
