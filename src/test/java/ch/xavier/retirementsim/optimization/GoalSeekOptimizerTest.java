package ch.xavier.retirementsim.optimization;

import ch.xavier.retirementsim.TestFixtures;
import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.exception.SimulationCancelledException;
import ch.xavier.retirementsim.optimization.model.OptimizationResult;
import ch.xavier.retirementsim.returns.ReturnMode;
import ch.xavier.retirementsim.simulation.CancellationToken;
import ch.xavier.retirementsim.simulation.model.Contributions;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoalSeekOptimizerTest {

    private GoalSeekOptimizer optimizer;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getOptimizer().setTestRuns(10);
        optimizer = new GoalSeekOptimizer(TestFixtures.monteCarloService(properties), properties);
    }

    // Fixed returns make every path identical, so each oracle call is a clean pass or fail
    private static SimulationParams.SimulationParamsBuilder saver() {
        return SimulationParams.builder()
                .age1(45)
                .retirementAge(60)
                .taxableBalance(300_000)
                .pretaxBalance(500_000)
                .rothBalance(50_000)
                .primary(Contributions.builder().pretax(20_000).roth(6_000).employerMatch(4_000).build())
                .returnMode(ReturnMode.FIXED)
                .returnRatePct(6)
                .inflationRatePct(2.5)
                .withdrawalRatePct(4);
    }

    @Test
    @DisplayName("A comfortable plan can drop contributions, afford a splurge and retire no later than planned")
    void optimize_comfortablePlan() {
        OptimizationResult result = optimizer.optimizeBlocking(saver().build(), 12345, CancellationToken.none());

        assertThat(result.getSurplusAnnual()).isBetween(0.0, 30_000.0);
        assertEquals(result.getSurplusAnnual() / 12, result.getSurplusMonthly(), 1e-9);
        assertThat(result.getMaxSplurge()).isBetween(0.0, 300_000 * 0.95);
        assertThat(result.getEarliestRetirementAge()).isBetween(46, 60);
        assertEquals(60 - result.getEarliestRetirementAge(), result.getYearsEarlier());
    }

    @Test
    @DisplayName("A ruin rate exactly at the limit does not clear a 95% success threshold")
    void meetsSuccessThreshold_boundaryFails() {
        assertFalse(optimizer.meetsSuccessThreshold(0.05));
        assertTrue(optimizer.meetsSuccessThreshold(0.0499));
        assertTrue(optimizer.meetsSuccessThreshold(0));
    }

    @Test
    @DisplayName("Without contributions there is no surplus to find")
    void findSurplusContribution_noContributions_zero() {
        SimulationParams params = saver().primary(Contributions.NONE).build();

        assertEquals(0, optimizer.findSurplusContribution(params, 1, CancellationToken.none()));
    }

    @Test
    @DisplayName("Without a taxable balance there is nothing to splurge")
    void findMaxSplurge_noTaxableBalance_zero() {
        SimulationParams params = saver().taxableBalance(0).build();

        assertEquals(0, optimizer.findMaxSplurge(params, 1, CancellationToken.none()));
    }

    @Test
    @DisplayName("A plan that cannot cover Medicare at any age keeps the configured retirement age")
    void findEarliestRetirementAge_hopelessPlan_keepsConfiguredAge() {
        SimulationParams params = saver()
                .taxableBalance(1_000)
                .pretaxBalance(0)
                .rothBalance(0)
                .primary(Contributions.NONE)
                .includeMedicare(true)
                .build();

        assertEquals(60, optimizer.findEarliestRetirementAge(params, 1, CancellationToken.none()));
    }

    @Test
    @DisplayName("Spouse contributions count only for married households")
    void totalContributions_spouseOnlyWhenMarried() {
        SimulationParams params = saver()
                .spouse(Contributions.builder().pretax(10_000).build())
                .build();

        assertEquals(30_000, params.totalContributions());
    }

    @Test
    @DisplayName("A cancelled token stops the search at the next oracle call")
    void optimize_cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(SimulationCancelledException.class,
                () -> optimizer.optimizeBlocking(saver().build(), 1, token));
    }

    @Test
    @DisplayName("Invalid parameters fail before any search")
    void optimize_invalidParams() {
        StepVerifier.create(optimizer.optimize(saver().retirementAge(40).build(), 1, CancellationToken.none()))
                .expectError(InvalidSimulationParametersException.class)
                .verify();
    }
}
