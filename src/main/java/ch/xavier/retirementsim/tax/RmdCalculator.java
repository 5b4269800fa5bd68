package ch.xavier.retirementsim.tax;

import org.springframework.stereotype.Component;

@Component
public class RmdCalculator {

    private final TaxTables tables;

    public RmdCalculator(TaxTables tables) {
        this.tables = tables;
    }

    public int startAge() {
        return tables.getRmdStartAge();
    }

    /**
     * Uniform Lifetime divisor for the age, the fallback divisor past the end of the table.
     */
    public double divisor(int age) {
        Double divisor = tables.getRmdDivisors().get(age);
        return divisor != null ? divisor : tables.getRmdFallbackDivisor();
    }

    public double requiredDistribution(double pretaxBalance, int age) {
        if (age < tables.getRmdStartAge() || pretaxBalance <= 0) {
            return 0;
        }
        return pretaxBalance / divisor(age);
    }
}
