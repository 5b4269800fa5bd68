package ch.xavier.retirementsim;

import ch.xavier.retirementsim.engine.SimulationEngine;
import ch.xavier.retirementsim.engine.message.EngineMessage;
import ch.xavier.retirementsim.engine.message.ErrorMessage;
import ch.xavier.retirementsim.engine.message.ResultMessage;
import ch.xavier.retirementsim.engine.request.GuardrailsRequest;
import ch.xavier.retirementsim.engine.request.OptimizeRequest;
import ch.xavier.retirementsim.engine.request.RunRequest;
import ch.xavier.retirementsim.optimization.model.GuardrailsResult;
import ch.xavier.retirementsim.optimization.model.OptimizationResult;
import ch.xavier.retirementsim.returns.ReturnMode;
import ch.xavier.retirementsim.simulation.PathSimulator;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.Contributions;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import ch.xavier.retirementsim.tax.FilingStatus;
import ch.xavier.retirementsim.visualization.XChartVisualizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.nio.file.Path;

/**
 * Runs a sample household through a batch, the guardrails estimate and the goal-seeking optimizer, then
 * charts the real balance bands.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "retirement.runner", name = "enabled", havingValue = "true")
public class MainSimulator implements CommandLineRunner {

    private final SimulationEngine engine;
    private final XChartVisualizer visualizer;
    private final int baseSeed;
    private final Path chartDirectory;

    public MainSimulator(SimulationEngine engine,
                         XChartVisualizer visualizer,
                         @Value("${retirement.runner.base-seed:12345}") int baseSeed,
                         @Value("${retirement.runner.chart-directory:./visualizations}") String chartDirectory) {
        this.engine = engine;
        this.visualizer = visualizer;
        this.baseSeed = baseSeed;
        this.chartDirectory = Path.of(chartDirectory);
    }

    @Override
    public void run(String... args) {
        SimulationParams params = SimulationParams.builder()
                .filingStatus(FilingStatus.MARRIED)
                .age1(45)
                .age2(43)
                .retirementAge(62)
                .taxableBalance(250_000)
                .pretaxBalance(450_000)
                .rothBalance(120_000)
                .emergencyFund(30_000)
                .primary(Contributions.builder().pretax(23_000).roth(7_000).employerMatch(6_000).build())
                .spouse(Contributions.builder().pretax(12_000).taxable(6_000).build())
                .returnMode(ReturnMode.BOOTSTRAP)
                .stateTaxRatePct(4.5)
                .includeSocialSecurity(true)
                .ssIncome1(140_000)
                .ssIncome2(70_000)
                .includeMedicare(true)
                .build();

        disablePathLogs();
        log.info("Starting sample retirement simulation");

        BatchResult batch = awaitResult(engine.submit(RunRequest.builder()
                .params(params)
                .baseSeed(baseSeed)
                .build()), BatchResult.class);
        if (batch == null) {
            return;
        }
        log.info("Probability of ruin: {}%, median terminal real wealth: {}",
                String.format("%.1f", batch.getProbabilityOfRuin() * 100),
                String.format("%,.0f", batch.getTerminalRealWealth().getP50()));

        GuardrailsResult guardrails = awaitResult(engine.submit(GuardrailsRequest.builder()
                .allRuns(batch.getAllRuns())
                .build()), GuardrailsResult.class);
        if (guardrails != null) {
            log.info("Guardrails would prevent {} of {} failures, success rate {}% -> {}%",
                    guardrails.getPreventableFailures(), guardrails.getTotalFailures(),
                    String.format("%.1f", guardrails.getBaselineSuccessRate() * 100),
                    String.format("%.1f", guardrails.getNewSuccessRate() * 100));
        }

        OptimizationResult optimization = awaitResult(engine.submit(OptimizeRequest.builder()
                .params(params)
                .baseSeed(baseSeed)
                .build()), OptimizationResult.class);
        if (optimization != null) {
            log.info("Surplus savings {}/month, one-time budget {}, earliest retirement at {} ({} years earlier)",
                    String.format("%,.0f", optimization.getSurplusMonthly()),
                    String.format("%,.0f", optimization.getMaxSplurge()),
                    optimization.getEarliestRetirementAge(), optimization.getYearsEarlier());
        }

        visualizer.save(visualizer.createBalanceBandChart(batch, "Real balance by age"),
                chartDirectory, "real_balance_bands");
    }

    private <T> T awaitResult(Flux<EngineMessage> messages, Class<T> resultType) {
        EngineMessage last = messages.last().block();

        if (last instanceof ErrorMessage error) {
            log.error("Sample request failed: {}", error.getMessage());
            return null;
        }
        if (last instanceof ResultMessage<?> result && resultType.isInstance(result.getResult())) {
            return resultType.cast(result.getResult());
        }
        log.error("Unexpected answer {} while waiting for a {}", last, resultType.getSimpleName());
        return null;
    }

    private void disablePathLogs() {
        ((ch.qos.logback.classic.Logger) org.slf4j.LoggerFactory.getLogger(PathSimulator.class))
                .setLevel(ch.qos.logback.classic.Level.WARN);
    }
}
