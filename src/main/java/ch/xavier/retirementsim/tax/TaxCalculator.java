package ch.xavier.retirementsim.tax;

import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Federal income tax math over a {@link TaxTables} snapshot. Stateless: safe to share between parallel paths.
 */
@Component
public class TaxCalculator {

    @Getter
    private final TaxTables tables;

    public TaxCalculator(TaxTables tables) {
        this.tables = tables;
    }

    /**
     * Progressive ordinary income tax after the standard deduction.
     *
     * @param income gross ordinary income, negative or non-finite values count as zero
     */
    public double ordinaryTax(double income, FilingStatus status) {
        double safeIncome = sanitize(income);
        if (safeIncome <= 0) {
            return 0;
        }

        double remaining = Math.max(0, safeIncome - tables.standardDeduction(status));
        double tax = 0;
        double previousLimit = 0;

        for (TaxBracket bracket : tables.ordinaryBrackets(status)) {
            double amount = Math.min(remaining, bracket.getLimit() - previousLimit);
            tax += amount * bracket.getRate();
            remaining -= amount;
            previousLimit = bracket.getLimit();
            if (remaining <= 0) {
                break;
            }
        }

        return tax;
    }

    /**
     * Long-term capital gains tax with the gains stacked on top of {@code ordinaryIncome}: ordinary income
     * consumes the 0% and 15% thresholds first, gains only get the room left over.
     */
    public double capitalGainsTax(double gains, FilingStatus status, double ordinaryIncome) {
        double remainingGain = sanitize(gains);
        if (remainingGain <= 0) {
            return 0;
        }

        List<TaxBracket> brackets = tables.capitalGainsBrackets(status);
        double cumulativeIncome = sanitize(ordinaryIncome);
        double tax = 0;

        for (TaxBracket bracket : brackets) {
            double room = Math.max(0, bracket.getLimit() - cumulativeIncome);
            double taxedHere = Math.min(remainingGain, room);

            if (taxedHere > 0) {
                tax += taxedHere * bracket.getRate();
                remainingGain -= taxedHere;
                cumulativeIncome += taxedHere;
            }

            if (remainingGain <= 0) {
                break;
            }
        }

        if (remainingGain > 0) {
            tax += remainingGain * brackets.get(brackets.size() - 1).getRate();
        }

        return tax;
    }

    public double netInvestmentIncomeTax(double investmentIncome, FilingStatus status, double modifiedAgi) {
        double income = sanitize(investmentIncome);
        if (income <= 0) {
            return 0;
        }

        double excess = Math.max(0, sanitize(modifiedAgi) - tables.niitThreshold(status));
        return Math.min(income, excess) * tables.getNiitRate();
    }

    /**
     * Monthly Medicare IRMAA surcharge for the tier the MAGI falls into (inclusive upper bounds).
     */
    public double irmaaMonthlySurcharge(double modifiedAgi, FilingStatus status) {
        List<IrmaaTier> tiers = tables.irmaaTiers(status);
        for (IrmaaTier tier : tiers) {
            if (modifiedAgi <= tier.getMagiThreshold()) {
                return tier.getMonthlySurcharge();
            }
        }
        return tiers.get(tiers.size() - 1).getMonthlySurcharge();
    }

    /**
     * Upper limit of the ordinary bracket taxed at {@code rate}, or {@code NaN} when the schedule has no such rate.
     */
    public double bracketLimitForRate(double rate, FilingStatus status) {
        return tables.ordinaryBrackets(status).stream()
                .filter(bracket -> Math.abs(bracket.getRate() - rate) < 1e-9)
                .mapToDouble(TaxBracket::getLimit)
                .findFirst()
                .orElse(Double.NaN);
    }

    /**
     * Employee share of FICA on wages, or full SECA on self-employment income. {@code BOTH} splits the income
     * evenly between the two.
     */
    public double employmentTax(double income, EmploymentType type) {
        double safeIncome = sanitize(income);
        if (safeIncome <= 0 || type == null || type == EmploymentType.RETIRED || type == EmploymentType.OTHER) {
            return 0;
        }
        return switch (type) {
            case W2 -> payrollTax(safeIncome);
            case SELF_EMPLOYED -> selfEmploymentTax(safeIncome);
            default -> payrollTax(safeIncome / 2) + selfEmploymentTax(safeIncome / 2);
        };
    }

    public double payrollTax(double wages) {
        if (wages <= 0) {
            return 0;
        }
        EmploymentTaxRules rules = tables.getEmploymentTax();
        double socialSecurity = Math.min(wages, rules.getSocialSecurityWageBase()) * rules.getSocialSecurityEmployeeRate();
        return socialSecurity + medicareTax(wages, rules.getMedicareEmployeeRate(), rules);
    }

    public double selfEmploymentTax(double netEarnings) {
        if (netEarnings <= 0) {
            return 0;
        }
        EmploymentTaxRules rules = tables.getEmploymentTax();
        double earnings = netEarnings * rules.getSelfEmploymentFactor();
        double socialSecurity = Math.min(earnings, rules.getSocialSecurityWageBase()) * rules.getSocialSecuritySelfEmployedRate();
        return socialSecurity + medicareTax(earnings, rules.getMedicareSelfEmployedRate(), rules);
    }

    private static double medicareTax(double earnings, double rate, EmploymentTaxRules rules) {
        double tax = earnings * rate;
        if (earnings > rules.getAdditionalMedicareThreshold()) {
            tax += (earnings - rules.getAdditionalMedicareThreshold()) * rules.getAdditionalMedicareRate();
        }
        return tax;
    }

    private static double sanitize(double value) {
        return Double.isFinite(value) ? Math.max(0, value) : 0;
    }
}
