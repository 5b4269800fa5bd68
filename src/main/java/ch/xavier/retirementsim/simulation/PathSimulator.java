package ch.xavier.retirementsim.simulation;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.returns.ReturnGeneratorFactory;
import ch.xavier.retirementsim.simulation.model.Contributions;
import ch.xavier.retirementsim.simulation.model.PathResult;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import ch.xavier.retirementsim.simulation.model.YearlyState;
import ch.xavier.retirementsim.tax.EmploymentType;
import ch.xavier.retirementsim.tax.FilingStatus;
import ch.xavier.retirementsim.tax.RmdCalculator;
import ch.xavier.retirementsim.tax.SocialSecurityCalculator;
import ch.xavier.retirementsim.tax.TaxCalculator;
import ch.xavier.retirementsim.tax.WithdrawalTaxCalculator;
import ch.xavier.retirementsim.tax.WithdrawalTaxes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Advances one household through accumulation and drawdown for a single market path.
 * <p>
 * Accumulation runs from the current year (index 0, no growth applied) to the retirement year of the younger
 * spouse. Drawdown runs one year at a time until the older spouse reaches life expectancy. Balances are clamped
 * at zero and the trajectory always covers the full horizon, ruined or not.
 */
@Component
@Slf4j
public class PathSimulator {

    private final TaxCalculator taxCalculator;
    private final RmdCalculator rmdCalculator;
    private final SocialSecurityCalculator socialSecurityCalculator;
    private final WithdrawalTaxCalculator withdrawalTaxCalculator;
    private final ReturnGeneratorFactory returnGeneratorFactory;
    private final int lifeExpectancy;

    public PathSimulator(TaxCalculator taxCalculator,
                         RmdCalculator rmdCalculator,
                         SocialSecurityCalculator socialSecurityCalculator,
                         WithdrawalTaxCalculator withdrawalTaxCalculator,
                         ReturnGeneratorFactory returnGeneratorFactory,
                         EngineProperties properties) {
        this.taxCalculator = taxCalculator;
        this.rmdCalculator = rmdCalculator;
        this.socialSecurityCalculator = socialSecurityCalculator;
        this.withdrawalTaxCalculator = withdrawalTaxCalculator;
        this.returnGeneratorFactory = returnGeneratorFactory;
        this.lifeExpectancy = properties.getLifeExpectancy();
    }

    /**
     * Rejects parameters no path could be simulated with.
     */
    public void validate(SimulationParams params) {
        if (params == null) {
            throw new InvalidSimulationParametersException("Simulation parameters are required");
        }
        if (params.getFilingStatus() == null || params.getPrimary() == null || params.getSpouse() == null
                || params.getChildrenAges() == null) {
            throw new InvalidSimulationParametersException(
                    "filingStatus, primary, spouse and childrenAges must not be null when present");
        }
        if (params.getAge1() <= 0) {
            throw new InvalidSimulationParametersException("age1 must be positive, got " + params.getAge1());
        }
        if (params.isMarried() && params.getAge2() <= 0) {
            throw new InvalidSimulationParametersException(
                    "age2 must be positive for married households, got " + params.getAge2());
        }
        if (params.getRetirementAge() <= params.youngerAge()) {
            throw new InvalidSimulationParametersException(String.format(
                    "Retirement age (%d) must be greater than current age (%d)",
                    params.getRetirementAge(), params.youngerAge()));
        }
        if (params.getTaxableBalance() < 0 || params.getPretaxBalance() < 0 || params.getRothBalance() < 0
                || params.getEmergencyFund() < 0) {
            throw new InvalidSimulationParametersException("Starting balances must not be negative");
        }
        if (params.isRothConversionsEnabled()
                && Double.isNaN(taxCalculator.bracketLimitForRate(params.getTargetConversionBracket(), params.getFilingStatus()))) {
            throw new InvalidSimulationParametersException(
                    "Unknown Roth conversion target bracket: " + params.getTargetConversionBracket());
        }
        Integer historicalYear = params.getHistoricalYear();
        int firstYear = returnGeneratorFactory.getHistory().getStartYear();
        int lastYear = returnGeneratorFactory.getHistory().getEndYear();
        if (historicalYear != null && (historicalYear < firstYear || historicalYear > lastYear)) {
            throw new InvalidSimulationParametersException(String.format(
                    "Historical start year %d outside of %d-%d", historicalYear, firstYear, lastYear));
        }
    }

    public PathResult simulate(SimulationParams params, int seed) {
        validate(params);

        FilingStatus status = params.getFilingStatus();
        boolean married = params.isMarried();
        int retirementAge = params.getRetirementAge();

        int yearsToRetirement = retirementAge - params.youngerAge();
        int yearsToSimulate = Math.max(0, lifeExpectancy - (params.olderAge() + yearsToRetirement));

        double inflation = params.getInflationRatePct() / 100;
        double inflationFactor = 1 + inflation;
        double medicalInflationFactor = 1 + params.getMedicalInflationPct() / 100;

        // Whole return sequences are drawn before the ledger runs
        double[] accumulationReturns = returnGeneratorFactory.create(params.getReturnMode(),
                params.getReturnSeries(), yearsToRetirement + 1, params.getReturnRatePct(),
                params.getInflationRatePct(), seed, params.getHistoricalYear(),
                params.getBondGlidePath(), params.youngerAge()).drain();
        double[] drawdownReturns = returnGeneratorFactory.create(params.getReturnMode(),
                params.getReturnSeries(), yearsToSimulate, params.getReturnRatePct(),
                params.getInflationRatePct(), seed + 1,
                params.getHistoricalYear() == null ? null : params.getHistoricalYear() + yearsToRetirement,
                params.getBondGlidePath(), params.olderAge() + yearsToRetirement).drain();

        double taxable = params.getTaxableBalance();
        double pretax = params.getPretaxBalance();
        double roth = params.getRothBalance();
        double basis = params.getTaxableBalance();
        double emergency = params.getEmergencyFund();

        List<Integer> childrenAges = effectiveChildrenAges(params, yearsToRetirement);

        List<YearlyState> trajectory = new ArrayList<>(yearsToRetirement + yearsToSimulate + 1);
        double cumulativeInflation = 1.0;
        Contributions primary = params.getPrimary();
        Contributions spouse = params.getSpouse();

        // Accumulation
        for (int y = 0; y <= yearsToRetirement; y++) {
            double growth = accumulationReturns[y];
            int age1 = params.getAge1() + y;
            int age2 = params.getAge2() + y;

            if (y > 0) {
                taxable *= growth;
                pretax *= growth;
                roth *= growth;
                taxable -= yieldDrag(taxable, params);
            }

            if (y > 0 && params.isIncreaseContributions()) {
                double raise = 1 + params.getIncomeGrowthPct() / 100;
                primary = primary.scaled(raise);
                spouse = spouse.scaled(raise);
            }

            double midYear = 1 + (growth - 1) * 0.5;
            if (age1 < retirementAge) {
                taxable += primary.getTaxable() * midYear;
                pretax += (primary.getPretax() + primary.getEmployerMatch()) * midYear;
                roth += primary.getRoth() * midYear;
                basis += primary.getTaxable();
            }
            if (married && age2 < retirementAge) {
                taxable += spouse.getTaxable() * midYear;
                pretax += (spouse.getPretax() + spouse.getEmployerMatch()) * midYear;
                roth += spouse.getRoth() * midYear;
                basis += spouse.getTaxable();
            }

            if (age1 < retirementAge) {
                double childExpenses = HouseholdExpenses.childExpenses(childrenAges, y, Math.pow(inflationFactor, y));
                if (childExpenses > 0) {
                    taxable = Math.max(0, taxable - childExpenses);
                }
            }

            double incomeGrowth = Math.pow(1 + params.getIncomeGrowthPct() / 100, y);
            double employmentTax = 0;
            if (age1 < retirementAge) {
                employmentTax += employerShareOfSelfEmploymentTax(
                        params.getAnnualIncome1() * incomeGrowth, params.getEmploymentType1());
            }
            if (married && age2 < retirementAge) {
                employmentTax += employerShareOfSelfEmploymentTax(
                        params.getAnnualIncome2() * incomeGrowth, params.getEmploymentType2());
            }
            if (employmentTax > 0) {
                taxable = Math.max(0, taxable - employmentTax);
            }

            if (age1 < retirementAge && params.isIncludePreMedicareHealthcare()) {
                double premiums = HouseholdExpenses.preMedicareHealthcare(age1, married ? age2 : null,
                        dependentChildren(params, childrenAges, y), Math.pow(medicalInflationFactor, y));
                taxable = Math.max(0, taxable - premiums);
            }

            if (y > 0) {
                emergency *= inflationFactor;
            }

            cumulativeInflation *= 1 + effectiveInflationPct(params, y, yearsToRetirement) / 100;
            trajectory.add(snapshot(age1, false, taxable, pretax, roth, emergency, cumulativeInflation, 0, 0));
        }

        // First retirement year withdrawal, as a share of the final nominal balance
        double finalNominal = taxable + pretax + roth + emergency;
        double firstYearGross = finalNominal * params.getWithdrawalRatePct() / 100;
        WithdrawalTaxes firstYearTaxes = withdrawalTaxCalculator.compute(firstYearGross, status,
                taxable, pretax, roth, basis, params.getStateTaxRatePct(), 0, 0);
        double firstYearRealWithdrawal = (firstYearGross - firstYearTaxes.getTotalTax())
                / Math.pow(inflationFactor, yearsToRetirement);

        double currentGrossWithdrawal = firstYearGross;
        int survivalYears = 0;
        boolean ruined = false;
        double totalRothConversions = 0;
        double conversionTaxesPaid = 0;

        double conversionBracketLimit = params.isRothConversionsEnabled()
                ? taxCalculator.bracketLimitForRate(params.getTargetConversionBracket(), status)
                : Double.NaN;

        // Drawdown
        for (int y = 1; y <= yearsToSimulate; y++) {
            double growth = drawdownReturns[y - 1];

            taxable *= growth;
            pretax *= growth;
            roth *= growth;
            emergency *= inflationFactor;
            taxable -= yieldDrag(taxable, params);

            int age1 = params.getAge1() + yearsToRetirement + y;
            int age2 = married ? params.getAge2() + yearsToRetirement + y : 0;
            double rmd = rmdCalculator.requiredDistribution(pretax, age1);
            double socialSecurity = socialSecurityIncome(params, age1, age2);

            if (params.isRothConversionsEnabled() && age1 < rmdCalculator.startAge() && pretax > 0 && taxable > 0) {
                double headroom = Math.max(0,
                        conversionBracketLimit + taxCalculator.getTables().standardDeduction(status) - socialSecurity);

                if (headroom > 0) {
                    double maxConversion = Math.min(headroom, pretax);
                    double maxConversionTax = marginalTax(socialSecurity, maxConversion, status);
                    double affordable = maxConversionTax > 0
                            ? Math.min(maxConversion, taxable / maxConversionTax * maxConversion)
                            : maxConversion;

                    if (affordable > 0) {
                        double conversion = Math.min(affordable, pretax);
                        double conversionTax = marginalTax(socialSecurity, conversion, status);

                        pretax -= conversion;
                        roth += conversion;
                        taxable -= conversionTax;

                        totalRothConversions += conversion;
                        conversionTaxesPaid += conversionTax;
                    }
                }
            }

            double healthcare = 0;
            double medicalInflation = Math.pow(medicalInflationFactor, y);
            if (params.isIncludeMedicare() && age1 >= HouseholdExpenses.MEDICARE_AGE) {
                healthcare += params.getMedicarePremiumMonthly() * 12 * medicalInflation;
                double estimatedMagi = currentGrossWithdrawal + socialSecurity + rmd;
                healthcare += taxCalculator.irmaaMonthlySurcharge(estimatedMagi, status) * 12 * medicalInflation;
            }
            if (params.isIncludeLongTermCare() && age1 >= params.getLtcOnsetAge()
                    && age1 - params.getLtcOnsetAge() < params.getLtcDurationYears()) {
                healthcare += params.getLtcAnnualCost() * (params.getLtcProbabilityPct() / 100) * medicalInflation;
            }

            double childExpenses = HouseholdExpenses.childExpenses(childrenAges, yearsToRetirement + y,
                    Math.pow(inflationFactor, yearsToRetirement + y));

            double netNeed = Math.max(0, currentGrossWithdrawal + healthcare + childExpenses - socialSecurity);
            double withdrawal = netNeed;
            double rmdExcess = 0;
            if (rmd > netNeed) {
                withdrawal = rmd;
                rmdExcess = rmd - netNeed;
            }

            WithdrawalTaxes taxes = withdrawalTaxCalculator.compute(withdrawal, status, taxable, pretax, roth,
                    basis, params.getStateTaxRatePct(), rmd, socialSecurity);
            taxable -= taxes.getTaxableDraw();
            pretax -= taxes.getPretaxDraw();
            roth -= taxes.getRothDraw();
            basis = taxes.getNewBasis();

            if (rmdExcess > 0) {
                double excessAfterTax = rmdExcess - taxCalculator.ordinaryTax(rmdExcess, status);
                taxable += excessAfterTax;
                basis += excessAfterTax;
            }

            taxable = Math.max(0, taxable);
            pretax = Math.max(0, pretax);
            roth = Math.max(0, roth);

            cumulativeInflation *= 1 + effectiveInflationPct(params, yearsToRetirement + y, yearsToRetirement) / 100;
            trajectory.add(snapshot(age1, true, taxable, pretax, roth, emergency, cumulativeInflation,
                    rmd, socialSecurity));

            double portfolio = taxable + pretax + roth;
            if (portfolio <= 0 && emergency <= 0) {
                if (!ruined) {
                    survivalYears = y - 1;
                    ruined = true;
                }
                taxable = pretax = roth = emergency = 0;
            } else if (portfolio <= 0) {
                emergency -= Math.min(currentGrossWithdrawal, emergency);
                taxable = pretax = roth = 0;
                survivalYears = y;
            } else {
                survivalYears = y;
            }

            currentGrossWithdrawal *= inflationFactor;
        }

        double terminalWealth = Math.max(0, taxable + pretax + roth + emergency);
        log.debug("Path seed {} finished: ruined={}, survivalYears={}, terminal nominal={}",
                seed, ruined, survivalYears, terminalWealth);

        return PathResult.builder()
                .trajectory(trajectory)
                .terminalRealWealth(terminalWealth / cumulativeInflation)
                .firstYearAfterTaxRealWithdrawal(firstYearRealWithdrawal)
                .ruined(ruined)
                .survivalYears(survivalYears)
                .totalRothConversions(totalRothConversions)
                .conversionTaxesPaid(conversionTaxesPaid)
                .build();
    }

    /**
     * Capital gains tax owed on the dividends the taxable account throws off, whether or not anything is sold.
     */
    private double yieldDrag(double taxable, SimulationParams params) {
        if (taxable <= 0 || params.getDividendYieldPct() <= 0) {
            return 0;
        }
        double dividends = taxable * params.getDividendYieldPct() / 100;
        return taxCalculator.capitalGainsTax(dividends, params.getFilingStatus(), 0);
    }

    private double marginalTax(double baseIncome, double additionalIncome, FilingStatus status) {
        return taxCalculator.ordinaryTax(baseIncome + additionalIncome, status)
                - taxCalculator.ordinaryTax(baseIncome, status);
    }

    private double socialSecurityIncome(SimulationParams params, int age1, int age2) {
        if (!params.isIncludeSocialSecurity()) {
            return 0;
        }
        if (!params.isMarried()) {
            return age1 >= params.getSsClaimAge1()
                    ? socialSecurityCalculator.annualBenefit(params.getSsIncome1(), params.getSsClaimAge1())
                    : 0;
        }

        boolean firstClaimed = age1 >= params.getSsClaimAge1();
        boolean secondClaimed = age2 >= params.getSsClaimAge2();

        if (firstClaimed && secondClaimed) {
            double pia1 = socialSecurityCalculator.primaryInsuranceAmount(params.getSsIncome1());
            double pia2 = socialSecurityCalculator.primaryInsuranceAmount(params.getSsIncome2());
            return (socialSecurityCalculator.effectiveMonthlyBenefit(pia1, pia2, params.getSsClaimAge1())
                    + socialSecurityCalculator.effectiveMonthlyBenefit(pia2, pia1, params.getSsClaimAge2())) * 12;
        }
        if (firstClaimed) {
            return socialSecurityCalculator.annualBenefit(params.getSsIncome1(), params.getSsClaimAge1());
        }
        if (secondClaimed) {
            return socialSecurityCalculator.annualBenefit(params.getSsIncome2(), params.getSsClaimAge2());
        }
        return 0;
    }

    /**
     * Inflation for a simulation year, the shock rate during the shock window that opens at retirement.
     */
    private static double effectiveInflationPct(SimulationParams params, int year, int yearsToRetirement) {
        Double shock = params.getInflationShockRatePct();
        if (shock != null && year >= yearsToRetirement && year < yearsToRetirement + params.getInflationShockYears()) {
            return shock;
        }
        return params.getInflationRatePct();
    }

    /**
     * Children as start ages at year 0. Without explicit ages, {@code numChildren} are spaced three years apart
     * from age 5; expected children are born every other year from year 2 while the household still works.
     */
    /**
     * The half of SECA a W-2 employer would have paid. Contributions are assumed net of the employee half, so
     * only this extra share leaves the taxable account.
     */
    private double employerShareOfSelfEmploymentTax(double income, EmploymentType type) {
        if (type == EmploymentType.SELF_EMPLOYED) {
            return taxCalculator.selfEmploymentTax(income) * 0.5;
        }
        if (type == EmploymentType.BOTH) {
            return taxCalculator.selfEmploymentTax(income / 2) * 0.5;
        }
        return 0;
    }

    private static List<Integer> effectiveChildrenAges(SimulationParams params, int yearsToRetirement) {
        List<Integer> ages = new ArrayList<>(params.getChildrenAges());
        if (ages.isEmpty()) {
            for (int i = 0; i < params.getNumChildren(); i++) {
                ages.add(5 + i * 3);
            }
        }
        for (int k = 1; k <= params.getAdditionalChildrenExpected() && 2 * k <= yearsToRetirement; k++) {
            ages.add(-2 * k);
        }
        return ages;
    }

    private static int dependentChildren(SimulationParams params, List<Integer> childrenAges, int year) {
        if (childrenAges.isEmpty()) {
            return params.getNumChildren();
        }
        return (int) childrenAges.stream()
                .mapToInt(startAge -> startAge + year)
                .filter(age -> age >= 0 && age < HouseholdExpenses.HEALTHCARE_DEPENDENT_END_AGE)
                .count();
    }

    private static YearlyState snapshot(int age, boolean retired, double taxable, double pretax, double roth,
                                        double emergency, double cumulativeInflation, double rmd,
                                        double socialSecurity) {
        double total = taxable + pretax + roth + emergency;
        return YearlyState.builder()
                .age(age)
                .retired(retired)
                .nominalBalance(total)
                .realBalance(total / cumulativeInflation)
                .cumulativeInflation(cumulativeInflation)
                .taxableBalance(taxable)
                .pretaxBalance(pretax)
                .rothBalance(roth)
                .emergencyBalance(emergency)
                .requiredDistribution(rmd)
                .socialSecurity(socialSecurity)
                .build();
    }
}
