package ch.xavier.retirementsim.optimization;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.optimization.model.ConversionWindow;
import ch.xavier.retirementsim.optimization.model.ConversionYear;
import ch.xavier.retirementsim.optimization.model.RmdYear;
import ch.xavier.retirementsim.optimization.model.RothConversionResult;
import ch.xavier.retirementsim.optimization.model.RothOptimizerParams;
import ch.xavier.retirementsim.tax.FilingStatus;
import ch.xavier.retirementsim.tax.RmdCalculator;
import ch.xavier.retirementsim.tax.TaxCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic comparison of a do-nothing plan against converting pre-tax money to Roth up to a target bracket
 * every year between retirement and the first RMD. Both plans grow at the same fixed rate.
 */
@Service
@Slf4j
public class RothConversionOptimizer {

    static final double MIN_CONVERSION = 5_000;
    private static final int REPORTED_RMD_YEARS = 10;

    private final TaxCalculator taxCalculator;
    private final RmdCalculator rmdCalculator;
    private final int lifeExpectancy;

    public RothConversionOptimizer(TaxCalculator taxCalculator, RmdCalculator rmdCalculator,
                                   EngineProperties properties) {
        this.taxCalculator = taxCalculator;
        this.rmdCalculator = rmdCalculator;
        this.lifeExpectancy = properties.getLifeExpectancy();
    }

    public RothConversionResult optimize(RothOptimizerParams params) {
        if (params.getPretaxBalance() <= 0) {
            return RothConversionResult.noRecommendation("No pre-tax balance to convert");
        }

        int rmdStartAge = rmdCalculator.startAge();
        int conversionYears = Math.max(0, rmdStartAge - params.getRetirementAge());
        if (conversionYears == 0) {
            return RothConversionResult.noRecommendation("Already at or past RMD age");
        }

        FilingStatus status = params.getFilingStatus();
        double bracketLimit = taxCalculator.bracketLimitForRate(params.getTargetBracket(), status);
        if (Double.isNaN(bracketLimit)) {
            log.error("No {} bracket at rate {}", status, params.getTargetBracket());
            throw new InvalidSimulationParametersException("Unknown target bracket: " + params.getTargetBracket());
        }

        // Untouched, the pre-tax balance compounds through the window
        double baselinePretax = params.getPretaxBalance() * Math.pow(1 + params.getGrowthRate(), conversionYears);
        List<RmdYear> baselineRmds = new ArrayList<>();
        double baselineTax = rmdPhase(baselinePretax, params, baselineRmds);

        List<ConversionYear> conversions = new ArrayList<>();
        double optimizedPretax = params.getPretaxBalance();
        Double taxable = params.getTaxableBalance();
        double conversionTax = 0;
        double baseIncome = params.getSsIncome() + params.getAnnualWithdrawal();
        double taxableBeforeConversion = Math.max(0, baseIncome - taxCalculator.getTables().standardDeduction(status));
        double room = Math.max(0, bracketLimit - taxableBeforeConversion);

        for (int age = params.getRetirementAge(); age < rmdStartAge; age++) {
            double amount = Math.min(room, optimizedPretax);
            if (taxable != null) {
                // Marginal rate never exceeds the target rate inside the bracket
                amount = Math.min(amount, Math.max(0, taxable) / params.getTargetBracket());
            }

            if (amount > MIN_CONVERSION) {
                double tax = taxCalculator.ordinaryTax(baseIncome + amount, status)
                        - taxCalculator.ordinaryTax(baseIncome, status);
                conversions.add(new ConversionYear(age, amount, tax, optimizedPretax));
                conversionTax += tax;
                optimizedPretax -= amount;
                if (taxable != null) {
                    taxable -= tax;
                }
            }

            optimizedPretax *= 1 + params.getGrowthRate();
            if (taxable != null) {
                taxable *= 1 + params.getGrowthRate();
            }
        }

        List<RmdYear> optimizedRmds = new ArrayList<>();
        double optimizedTax = conversionTax + rmdPhase(optimizedPretax, params, optimizedRmds);

        double totalConverted = conversions.stream().mapToDouble(ConversionYear::getConversionAmount).sum();
        double baselineTotalRmds = baselineRmds.stream().mapToDouble(RmdYear::getRmd).sum();
        double optimizedTotalRmds = optimizedRmds.stream().mapToDouble(RmdYear::getRmd).sum();
        double rmdReduction = baselineTotalRmds - optimizedTotalRmds;
        double savings = baselineTax - optimizedTax;

        double baselineAvgRate = baselineTotalRmds > 0 ? baselineTax / baselineTotalRmds : 0;
        double optimizedBase = optimizedTotalRmds + totalConverted;
        double optimizedAvgRate = optimizedBase > 0 ? optimizedTax / optimizedBase : 0;

        RothConversionResult result = RothConversionResult.builder()
                .hasRecommendation(!conversions.isEmpty() && savings > 0)
                .conversions(conversions)
                .conversionWindow(new ConversionWindow(params.getRetirementAge(), rmdStartAge - 1, conversionYears))
                .totalConverted(totalConverted)
                .avgAnnualConversion(conversions.isEmpty() ? 0 : totalConverted / conversions.size())
                .lifetimeTaxSavings(savings)
                .baselineLifetimeTax(baselineTax)
                .optimizedLifetimeTax(optimizedTax)
                .rmdReduction(rmdReduction)
                .rmdReductionPercent(baselineTotalRmds > 0 ? rmdReduction / baselineTotalRmds * 100 : 0)
                .effectiveRateImprovement((baselineAvgRate - optimizedAvgRate) * 100)
                .baselineRmds(firstRows(baselineRmds))
                .optimizedRmds(firstRows(optimizedRmds))
                .targetBracket(params.getTargetBracket())
                .targetBracketLimit(bracketLimit)
                .build();

        log.info("Roth plan: {} conversions totalling {}, lifetime tax savings {}",
                conversions.size(), totalConverted, savings);
        return result;
    }

    /**
     * Draws RMDs from {@code rmdStartAge} to life expectancy, taxing each together with Social Security.
     *
     * @return lifetime tax over the phase
     */
    private double rmdPhase(double pretax, RothOptimizerParams params, List<RmdYear> rows) {
        double balance = pretax;
        double lifetimeTax = 0;

        for (int age = rmdCalculator.startAge(); age <= lifeExpectancy; age++) {
            double rmd = rmdCalculator.requiredDistribution(balance, age);
            double tax = taxCalculator.ordinaryTax(rmd + params.getSsIncome(), params.getFilingStatus());
            rows.add(new RmdYear(age, rmd, tax));
            lifetimeTax += tax;
            balance = (balance - rmd) * (1 + params.getGrowthRate());
        }

        return lifetimeTax;
    }

    private static List<RmdYear> firstRows(List<RmdYear> rows) {
        return List.copyOf(rows.subList(0, Math.min(REPORTED_RMD_YEARS, rows.size())));
    }
}
