package ch.xavier.retirementsim.simulation;

import ch.xavier.retirementsim.TestFixtures;
import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.exception.SimulationCancelledException;
import ch.xavier.retirementsim.returns.ReturnMode;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.PercentileBands;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MonteCarloServiceTest {

    private static SimulationParams bootstrapSaver(double withdrawalRatePct) {
        return SimulationParams.builder()
                .age1(55)
                .retirementAge(60)
                .taxableBalance(400_000)
                .pretaxBalance(600_000)
                .rothBalance(100_000)
                .returnMode(ReturnMode.BOOTSTRAP)
                .withdrawalRatePct(withdrawalRatePct)
                .build();
    }

    private final EngineProperties properties = new EngineProperties();
    private final MonteCarloService service = TestFixtures.monteCarloService(properties);

    @Test
    @DisplayName("Child seeds come from the base seed's generator, scaled to six digits")
    void childSeeds_referenceValues() {
        assertArrayEquals(new int[]{601103, 448290, 852465}, MonteCarloService.childSeeds(42, 3));
    }

    @Test
    @DisplayName("A batch aggregates every path into ordered percentile bands")
    void runBatch_bandsAreOrdered() {
        BatchResult result = service.runBatch(bootstrapSaver(4), 2024, 100).block();

        assertEquals(100, result.getPathCount());
        assertEquals(100, result.getAllRuns().size());
        assertEquals(55, result.getAges()[0]);
        assertEquals(95, result.getAges()[result.getAges().length - 1]);
        assertThat(result.getProbabilityOfRuin()).isBetween(0.0, 1.0);

        PercentileBands bands = result.getRealBalances();
        for (int t = 0; t < result.getAges().length; t++) {
            assertThat(bands.getP10()[t]).isLessThanOrEqualTo(bands.getP25()[t]);
            assertThat(bands.getP25()[t]).isLessThanOrEqualTo(bands.getP50()[t]);
            assertThat(bands.getP50()[t]).isLessThanOrEqualTo(bands.getP75()[t]);
            assertThat(bands.getP75()[t]).isLessThanOrEqualTo(bands.getP90()[t]);
        }
        assertThat(result.getTerminalRealWealth().getP25())
                .isLessThanOrEqualTo(result.getTerminalRealWealth().getP50());
    }

    @Test
    @DisplayName("The same base seed reproduces the batch whatever order the paths finish in")
    void runBatch_isReproducible() {
        BatchResult first = service.runBatch(bootstrapSaver(4), 7, 60).block();
        BatchResult second = service.runBatch(bootstrapSaver(4), 7, 60).block();

        assertArrayEquals(first.getRealBalances().getP50(), second.getRealBalances().getP50());
        assertArrayEquals(first.getNominalBalances().getP90(), second.getNominalBalances().getP90());
        assertEquals(first.getProbabilityOfRuin(), second.getProbabilityOfRuin());
    }

    @Test
    @DisplayName("Spending more never makes ruin less likely")
    void runBatch_ruinGrowsWithWithdrawalRate() {
        double modest = service.runBatch(bootstrapSaver(2), 11, 150).block().getProbabilityOfRuin();
        double aggressive = service.runBatch(bootstrapSaver(8), 11, 150).block().getProbabilityOfRuin();
        double reckless = service.runBatch(bootstrapSaver(15), 11, 150).block().getProbabilityOfRuin();

        assertThat(modest).isLessThanOrEqualTo(aggressive);
        assertThat(aggressive).isLessThanOrEqualTo(reckless);
        assertThat(reckless).isPositive();
    }

    @Test
    @DisplayName("Progress is reported every interval and once at the end")
    void runBatch_reportsProgress() {
        properties.setProgressInterval(10);
        List<Integer> reported = new CopyOnWriteArrayList<>();

        service.runBatch(bootstrapSaver(4), 5, 25, (completed, total) -> reported.add(completed),
                CancellationToken.none()).block();

        assertThat(reported).containsExactly(10, 20, 25);
    }

    @Test
    @DisplayName("A failing progress listener does not break the batch")
    void runBatch_listenerFailureIsIgnored() {
        StepVerifier.create(service.runBatch(bootstrapSaver(4), 5, 10, (completed, total) -> {
                    throw new IllegalStateException("host went away");
                }, CancellationToken.none()))
                .assertNext(result -> assertEquals(10, result.getPathCount()))
                .verifyComplete();
    }

    @Test
    @DisplayName("A cancelled batch ends with a cancellation error and no result")
    void runBatch_cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        StepVerifier.create(service.runBatch(bootstrapSaver(4), 5, 50, ProgressListener.NONE, token))
                .expectError(SimulationCancelledException.class)
                .verify();
    }

    @Test
    @DisplayName("Invalid parameters and path counts fail the batch")
    void runBatch_invalidInput() {
        StepVerifier.create(service.runBatch(bootstrapSaver(4), 5, 0))
                .expectError(InvalidSimulationParametersException.class)
                .verify();
        StepVerifier.create(service.runBatch(bootstrapSaver(4).toBuilder().retirementAge(50).build(), 5, 10))
                .expectError(InvalidSimulationParametersException.class)
                .verify();
    }
}
