package ch.xavier.retirementsim.optimization;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.SimulationCancelledException;
import ch.xavier.retirementsim.optimization.model.OptimizationResult;
import ch.xavier.retirementsim.simulation.CancellationToken;
import ch.xavier.retirementsim.simulation.MonteCarloService;
import ch.xavier.retirementsim.simulation.ProgressListener;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Binary searches over reduced Monte Carlo batches. The oracle says whether a configuration keeps the
 * probability of ruin under {@code 1 - successThreshold}; every search keeps the best passing candidate and
 * returns it when the iteration cap is hit.
 */
@Service
@Slf4j
public class GoalSeekOptimizer {

    // 1 - successThreshold carries rounding error; a ruin rate exactly at the limit must fail
    private static final double RUIN_TOLERANCE = 1e-9;

    private final MonteCarloService monteCarloService;
    private final EngineProperties.Optimizer properties;

    public GoalSeekOptimizer(MonteCarloService monteCarloService, EngineProperties engineProperties) {
        this.monteCarloService = monteCarloService;
        this.properties = engineProperties.getOptimizer();
    }

    public Mono<OptimizationResult> optimize(SimulationParams params, int baseSeed, CancellationToken cancellationToken) {
        // The searches block on their oracle batches, so they must stay off the parallel scheduler
        return Mono.fromCallable(() -> optimizeBlocking(params, baseSeed, cancellationToken))
                .subscribeOn(Schedulers.boundedElastic());
    }

    OptimizationResult optimizeBlocking(SimulationParams params, int baseSeed, CancellationToken cancellationToken) {
        monteCarloService.validate(params);
        log.info("Optimizing plan with {} test runs per oracle call", properties.getTestRuns());

        double surplusAnnual = Math.max(0, findSurplusContribution(params, baseSeed, cancellationToken));
        double maxSplurge = Math.max(0, findMaxSplurge(params, baseSeed, cancellationToken));
        int earliestRetirementAge = findEarliestRetirementAge(params, baseSeed, cancellationToken);

        OptimizationResult result = OptimizationResult.builder()
                .surplusAnnual(surplusAnnual)
                .surplusMonthly(surplusAnnual / 12)
                .maxSplurge(maxSplurge)
                .earliestRetirementAge(earliestRetirementAge)
                .yearsEarlier(Math.max(0, params.getRetirementAge() - earliestRetirementAge))
                .build();
        log.info("Optimization done: {}", result);
        return result;
    }

    /**
     * Current contributions minus the smallest total that still passes, all line items scaled together.
     */
    double findSurplusContribution(SimulationParams params, int baseSeed, CancellationToken cancellationToken) {
        double currentTotal = params.totalContributions();
        if (currentTotal <= 0) {
            return 0;
        }

        double low = 0;
        double high = currentTotal;
        double minContribution = currentTotal;
        int iterations = 0;

        while (low < high && iterations < properties.getMaxIterations()) {
            iterations++;
            double mid = low + (high - low) / 2;
            double scale = mid / currentTotal;

            SimulationParams candidate = params.toBuilder()
                    .primary(params.getPrimary().scaled(scale))
                    .spouse(params.getSpouse().scaled(scale))
                    .build();

            if (passes(candidate, baseSeed, cancellationToken)) {
                minContribution = mid;
                high = mid;
            } else {
                low = mid;
            }
            log.debug("Contribution search iteration {}: [{}, {}]", iterations, low, high);

            if (Math.abs(high - low) < properties.getContributionTolerance()) {
                break;
            }
        }
        warnIfCapped("contribution", iterations);

        return currentTotal - minContribution;
    }

    double findMaxSplurge(SimulationParams params, int baseSeed, CancellationToken cancellationToken) {
        double liquid = params.getTaxableBalance();
        if (liquid <= 0) {
            return 0;
        }

        double low = 0;
        double high = Math.min(properties.getExpenditureCeiling(), liquid * properties.getExpenditureLiquidShare());
        double maxSplurge = 0;
        int iterations = 0;

        while (low < high && iterations < properties.getMaxIterations()) {
            iterations++;
            double mid = low + (high - low) / 2;

            SimulationParams candidate = params.toBuilder()
                    .taxableBalance(Math.max(0, liquid - mid))
                    .build();

            if (passes(candidate, baseSeed, cancellationToken)) {
                maxSplurge = mid;
                low = mid;
            } else {
                high = mid;
            }
            log.debug("Expenditure search iteration {}: [{}, {}]", iterations, low, high);

            if (high - low < properties.getExpenditureTolerance()) {
                break;
            }
        }
        warnIfCapped("expenditure", iterations);

        return maxSplurge;
    }

    /**
     * Smallest age in {@code [currentAge + 1, retirementAge]} that passes, the configured retirement age when
     * none does.
     */
    int findEarliestRetirementAge(SimulationParams params, int baseSeed, CancellationToken cancellationToken) {
        int minAge = params.youngerAge() + 1;
        int maxAge = params.getRetirementAge();
        int bestAge = params.getRetirementAge();
        int iterations = 0;

        while (minAge <= maxAge && iterations < properties.getMaxIterations()) {
            iterations++;
            int midAge = (minAge + maxAge) / 2;

            SimulationParams candidate = params.toBuilder().retirementAge(midAge).build();

            if (passes(candidate, baseSeed, cancellationToken)) {
                bestAge = midAge;
                maxAge = midAge - 1;
            } else {
                minAge = midAge + 1;
            }
        }
        warnIfCapped("retirement age", iterations);

        return bestAge;
    }

    private boolean passes(SimulationParams candidate, int baseSeed, CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            throw new SimulationCancelledException("Optimization cancelled");
        }

        BatchResult batch = monteCarloService.runBatch(candidate, baseSeed, properties.getTestRuns(),
                ProgressListener.NONE, cancellationToken).block();

        return batch != null && meetsSuccessThreshold(batch.getProbabilityOfRuin());
    }

    boolean meetsSuccessThreshold(double probabilityOfRuin) {
        return probabilityOfRuin < 1 - properties.getSuccessThreshold() - RUIN_TOLERANCE;
    }

    private void warnIfCapped(String search, int iterations) {
        if (iterations >= properties.getMaxIterations()) {
            log.warn("The {} search hit the {} iteration cap, returning the best candidate so far",
                    search, properties.getMaxIterations());
        }
    }
}
