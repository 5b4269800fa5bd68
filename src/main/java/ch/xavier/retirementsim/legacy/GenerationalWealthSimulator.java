package ch.xavier.retirementsim.legacy;

import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.legacy.model.GenerationDataPoint;
import ch.xavier.retirementsim.legacy.model.LegacyParams;
import ch.xavier.retirementsim.legacy.model.LegacyResult;
import ch.xavier.retirementsim.tax.EstateTaxRules;
import ch.xavier.retirementsim.tax.TaxTables;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dynasty-fund model: the estate left at the end of life becomes a real-valued fund paying every adult
 * beneficiary each year while the family grows and dies off. Deterministic.
 */
@Service
@Slf4j
public class GenerationalWealthSimulator {

    static final int CHUNK_YEARS = 10;
    static final int PERPETUAL_HORIZON = 10_000;
    static final int EARLY_TERMINATION_YEAR = 1_000;
    static final int GROWTH_REFERENCE_YEAR = 100;
    static final double EARLY_TERMINATION_GROWTH = 0.03;
    static final double PERPETUAL_SAFETY_MARGIN = 0.95;
    static final int MAX_CHECKPOINTS = 10;

    private final EstateTaxRules estateTaxRules;

    public GenerationalWealthSimulator(TaxTables tables) {
        this.estateTaxRules = tables.getEstateTax();
    }

    public LegacyResult simulate(LegacyParams params) {
        validate(params);

        double inflation = 1 + params.getInflPct() / 100;
        double fundReal = params.getEolNominal() / Math.pow(inflation, params.getYearsFrom2025());
        double realReturn = (1 + params.getNominalRet() / 100) / inflation - 1;

        int windowYears = params.getFertilityWindowEnd() - params.getFertilityWindowStart();
        double birthsPerYear = windowYears > 0 ? params.getTotalFertilityRate() / windowYears : 0;

        if (params.getCapYears() >= PERPETUAL_HORIZON && isPerpetual(params, realReturn, fundReal)) {
            log.info("Distribution rate safely below real return net of population growth, fund is perpetual");
            return LegacyResult.builder()
                    .years(Double.POSITIVE_INFINITY)
                    .fundLeftReal(fundReal)
                    .lastLivingCount(params.getStartBens())
                    .generationData(List.of())
                    .build();
        }

        List<Cohort> cohorts = initialCohorts(params);
        List<GenerationDataPoint> generationData = new ArrayList<>();
        int nextCheckpoint = params.getGenerationLength();
        int years = 0;
        double fundAtReferenceYear = 0;
        double fundAtEarlyTerminationYear = 0;

        for (int t = 0; t < params.getCapYears(); t += CHUNK_YEARS) {
            int chunkYears = Math.min(CHUNK_YEARS, params.getCapYears() - t);
            ChunkOutcome chunk = simulateChunk(cohorts, fundReal, realReturn, birthsPerYear, chunkYears, params);

            cohorts = chunk.cohorts;
            fundReal = chunk.fundReal;
            years += chunk.years;

            if (chunk.depleted) {
                log.info("Fund depleted after {} years", years);
                return LegacyResult.builder()
                        .years(years)
                        .fundLeftReal(0)
                        .lastLivingCount(living(cohorts))
                        .generationData(generationData)
                        .build();
            }

            if (t >= nextCheckpoint && generationData.size() < MAX_CHECKPOINTS) {
                generationData.add(checkpoint(generationData.size() + 1, t, fundReal, cohorts, params));
                nextCheckpoint += params.getGenerationLength();
            }

            if (t == GROWTH_REFERENCE_YEAR && fundAtReferenceYear == 0) {
                fundAtReferenceYear = fundReal;
            }
            if (t == EARLY_TERMINATION_YEAR && fundAtEarlyTerminationYear == 0) {
                fundAtEarlyTerminationYear = fundReal;
            }

            if (t > EARLY_TERMINATION_YEAR && params.getCapYears() >= PERPETUAL_HORIZON
                    && fundAtReferenceYear > 0 && fundReal > fundAtEarlyTerminationYear) {
                double growth = Math.pow(fundReal / fundAtEarlyTerminationYear, 1.0 / (t - EARLY_TERMINATION_YEAR)) - 1;
                if (growth > EARLY_TERMINATION_GROWTH) {
                    log.info("Fund still compounding at {}% after year {}, treating as perpetual", growth * 100, t);
                    return LegacyResult.builder()
                            .years(Double.POSITIVE_INFINITY)
                            .fundLeftReal(fundReal)
                            .lastLivingCount(living(cohorts))
                            .generationData(generationData)
                            .build();
                }
            }
        }

        log.info("Fund survived the {} year horizon with {} real left", params.getCapYears(), fundReal);
        return LegacyResult.builder()
                .years(years)
                .fundLeftReal(fundReal)
                .lastLivingCount(living(cohorts))
                .generationData(generationData)
                .build();
    }

    private static void validate(LegacyParams params) {
        if (params.getEolNominal() < 0) {
            throw new InvalidSimulationParametersException("Estate value must not be negative");
        }
        if (params.getInflPct() <= -100 || params.getNominalRet() <= -100) {
            throw new InvalidSimulationParametersException("Rates must be above -100%");
        }
        if (params.getGenerationLength() <= 0 || params.getCapYears() < 0) {
            throw new InvalidSimulationParametersException("Generation length must be positive and the horizon non-negative");
        }
    }

    /**
     * The fund lasts forever when the payout rate stays below the real return net of population growth,
     * with a safety margin.
     */
    static boolean isPerpetual(LegacyParams params, double realReturn, double fundReal) {
        double populationGrowth = (params.getTotalFertilityRate() - 2.0) / params.getGenerationLength();
        double distributionRate = params.getPerBenReal() * params.getStartBens() / fundReal;
        return distributionRate < (realReturn - populationGrowth) * PERPETUAL_SAFETY_MARGIN;
    }

    private static List<Cohort> initialCohorts(LegacyParams params) {
        List<Cohort> cohorts = new ArrayList<>();
        List<Integer> ages = params.getInitialBenAges();

        if (ages != null && !ages.isEmpty()) {
            for (int age : ages) {
                cohorts.add(new Cohort(1, age, age <= params.getFertilityWindowEnd(), 0));
            }
        } else if (params.getStartBens() > 0) {
            cohorts.add(Cohort.newborns(params.getStartBens()));
        }
        return cohorts;
    }

    private static ChunkOutcome simulateChunk(List<Cohort> cohorts, double fundReal, double realReturn,
                                              double birthsPerYear, int chunkYears, LegacyParams params) {
        List<Cohort> current = cohorts;
        double fund = fundReal;
        int yearsSimulated = 0;

        for (int i = 0; i < chunkYears; i++) {
            current = current.stream()
                    .filter(cohort -> cohort.getAge() < params.getDeathAge())
                    .collect(Collectors.toCollection(ArrayList::new));

            if (living(current) == 0) {
                return new ChunkOutcome(current, fund, yearsSimulated, true);
            }

            fund *= 1 + realReturn;

            double eligible = current.stream()
                    .filter(cohort -> cohort.getAge() >= params.getMinDistAge())
                    .mapToDouble(Cohort::getSize)
                    .sum();
            fund -= params.getPerBenReal() * eligible;

            if (fund < 0) {
                return new ChunkOutcome(current, 0, yearsSimulated, true);
            }
            yearsSimulated++;

            current.forEach(cohort -> cohort.setAge(cohort.getAge() + 1));
            addBirths(current, birthsPerYear, params);
        }

        return new ChunkOutcome(current, fund, yearsSimulated, false);
    }

    /**
     * Everyone born in the same year shares one cohort, which keeps the cohort count bounded by the death age.
     */
    private static void addBirths(List<Cohort> cohorts, double birthsPerYear, LegacyParams params) {
        double births = 0;

        for (Cohort cohort : cohorts) {
            boolean fertile = cohort.isCanReproduce()
                    && cohort.getAge() >= params.getFertilityWindowStart()
                    && cohort.getAge() <= params.getFertilityWindowEnd()
                    && cohort.getCumulativeBirths() < params.getTotalFertilityRate();
            if (!fertile) {
                continue;
            }

            double birthsThisYear = Math.min(birthsPerYear, params.getTotalFertilityRate() - cohort.getCumulativeBirths());
            births += cohort.getSize() * birthsThisYear;
            cohort.setCumulativeBirths(cohort.getCumulativeBirths() + birthsThisYear);
        }

        if (births > 0) {
            cohorts.add(Cohort.newborns(births));
        }
    }

    private GenerationDataPoint checkpoint(int generation, int year, double fundReal, List<Cohort> cohorts,
                                           LegacyParams params) {
        int yearsAfterBase = params.getYearsFrom2025() + year;
        double estateValue = fundReal * Math.pow(1 + params.getInflPct() / 100, yearsAfterBase);
        double taxableEstate = Math.max(0, estateValue - estateTaxRules.exemption(params.getFilingStatus(), yearsAfterBase));
        double estateTax = taxableEstate * estateTaxRules.getRate();

        return GenerationDataPoint.builder()
                .generation(generation)
                .year(year)
                .estateValue(estateValue)
                .estateTax(estateTax)
                .netToHeirs(estateValue - estateTax)
                .fundRealValue(fundReal)
                .livingBeneficiaries(living(cohorts))
                .build();
    }

    private static double living(List<Cohort> cohorts) {
        return cohorts.stream().mapToDouble(Cohort::getSize).sum();
    }

    @AllArgsConstructor
    private static class ChunkOutcome {
        private final List<Cohort> cohorts;
        private final double fundReal;
        private final int years;
        private final boolean depleted;
    }
}
