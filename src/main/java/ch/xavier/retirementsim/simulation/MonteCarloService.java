package ch.xavier.retirementsim.simulation;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.exception.SimulationCancelledException;
import ch.xavier.retirementsim.returns.SeededRandom;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.OutcomeDistribution;
import ch.xavier.retirementsim.simulation.model.PathResult;
import ch.xavier.retirementsim.simulation.model.PercentileBands;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import ch.xavier.retirementsim.simulation.model.YearlyState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

/**
 * Runs batches of independent paths in parallel and reduces them to percentile bands and a ruin probability.
 */
@Service
@Slf4j
public class MonteCarloService {

    private final PathSimulator pathSimulator;
    private final EngineProperties properties;

    public MonteCarloService(PathSimulator pathSimulator, EngineProperties properties) {
        this.pathSimulator = pathSimulator;
        this.properties = properties;
    }

    public void validate(SimulationParams params) {
        pathSimulator.validate(params);
    }

    public Mono<BatchResult> runBatch(SimulationParams params, int baseSeed, int pathCount) {
        return runBatch(params, baseSeed, pathCount, ProgressListener.NONE, CancellationToken.none());
    }

    /**
     * Simulates {@code pathCount} paths seeded from {@code baseSeed}. The whole batch is reproducible from the
     * two integers, whatever order the paths complete in.
     *
     * @return the aggregate, or an error: {@link InvalidSimulationParametersException} for bad input,
     * {@link SimulationCancelledException} once the token is cancelled
     */
    public Mono<BatchResult> runBatch(SimulationParams params, int baseSeed, int pathCount,
                                      ProgressListener progressListener, CancellationToken cancellationToken) {
        return Mono.fromCallable(() -> {
                    pathSimulator.validate(params);
                    if (pathCount <= 0) {
                        throw new InvalidSimulationParametersException("Path count must be positive, got " + pathCount);
                    }
                    return childSeeds(baseSeed, pathCount);
                })
                .flatMap(seeds -> {
                    log.debug("Starting batch of {} paths with base seed {}", pathCount, baseSeed);
                    AtomicInteger completed = new AtomicInteger(0);

                    return Flux.range(0, pathCount)
                            .flatMap(index -> simulatePath(params, seeds[index], index, cancellationToken))
                            .doOnNext(ignored -> notifyProgress(progressListener, completed.incrementAndGet(), pathCount))
                            .collect(() -> new PathResult[pathCount], (results, path) -> results[path.getT1()] = path.getT2())
                            .map(results -> aggregate(Arrays.asList(results)));
                })
                .doOnNext(result -> log.debug("Batch of {} paths done, probability of ruin {}",
                        pathCount, result.getProbabilityOfRuin()));
    }

    private Mono<Tuple2<Integer, PathResult>> simulatePath(SimulationParams params, int seed, int index,
                                                           CancellationToken cancellationToken) {
        return Mono.fromCallable(() -> {
                    if (cancellationToken.isCancelled()) {
                        throw new SimulationCancelledException("Batch cancelled before path " + index);
                    }
                    return Tuples.of(index, pathSimulator.simulate(params, seed));
                })
                .subscribeOn(Schedulers.parallel());
    }

    private void notifyProgress(ProgressListener listener, int completed, int total) {
        if (completed % properties.getProgressInterval() != 0 && completed != total) {
            return;
        }
        try {
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}, continuing", completed, total, e);
        }
    }

    /**
     * Second layer of the seeded generator: one child seed per path.
     */
    static int[] childSeeds(int baseSeed, int pathCount) {
        SeededRandom random = new SeededRandom(baseSeed);
        int[] seeds = new int[pathCount];
        for (int i = 0; i < pathCount; i++) {
            seeds[i] = (int) (random.nextDouble() * 1_000_000);
        }
        return seeds;
    }

    BatchResult aggregate(List<PathResult> results) {
        int pathCount = results.size();
        int trimCount = PercentileStatistics.trimCount(pathCount, properties.getTrimFraction());
        List<YearlyState> firstTrajectory = results.get(0).getTrajectory();

        long ruinedPaths = results.stream().filter(PathResult::isRuined).count();

        return BatchResult.builder()
                .pathCount(pathCount)
                .ages(firstTrajectory.stream().mapToInt(YearlyState::getAge).toArray())
                .realBalances(bands(results, firstTrajectory.size(), trimCount, YearlyState::getRealBalance))
                .nominalBalances(bands(results, firstTrajectory.size(), trimCount, YearlyState::getNominalBalance))
                .terminalRealWealth(outcome(results.stream()
                        .mapToDouble(PathResult::getTerminalRealWealth).toArray(), trimCount))
                .firstYearAfterTaxRealWithdrawal(outcome(results.stream()
                        .mapToDouble(PathResult::getFirstYearAfterTaxRealWithdrawal).toArray(), trimCount))
                .probabilityOfRuin((double) ruinedPaths / pathCount)
                .allRuns(results.stream().map(PathResult::summary).toList())
                .build();
    }

    private static PercentileBands bands(List<PathResult> results, int years, int trimCount,
                                         ToDoubleFunction<YearlyState> value) {
        double[] p10 = new double[years];
        double[] p25 = new double[years];
        double[] p50 = new double[years];
        double[] p75 = new double[years];
        double[] p90 = new double[years];
        double[] column = new double[results.size()];

        for (int t = 0; t < years; t++) {
            for (int i = 0; i < results.size(); i++) {
                column[i] = value.applyAsDouble(results.get(i).getTrajectory().get(t));
            }
            double[] trimmed = PercentileStatistics.trimExtremeValues(column, trimCount);
            p10[t] = PercentileStatistics.percentile(trimmed, 10);
            p25[t] = PercentileStatistics.percentile(trimmed, 25);
            p50[t] = PercentileStatistics.percentile(trimmed, 50);
            p75[t] = PercentileStatistics.percentile(trimmed, 75);
            p90[t] = PercentileStatistics.percentile(trimmed, 90);
        }

        return PercentileBands.builder().p10(p10).p25(p25).p50(p50).p75(p75).p90(p90).build();
    }

    private static OutcomeDistribution outcome(double[] values, int trimCount) {
        double[] trimmed = PercentileStatistics.trimExtremeValues(values, trimCount);
        return new OutcomeDistribution(
                PercentileStatistics.percentile(trimmed, 25),
                PercentileStatistics.percentile(trimmed, 50),
                PercentileStatistics.percentile(trimmed, 75));
    }
}
