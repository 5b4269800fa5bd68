package ch.xavier.retirementsim.optimization;

import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.optimization.model.GuardrailsResult;
import ch.xavier.retirementsim.simulation.model.PathSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Post-hoc estimate of how many failed paths a spending-cut policy would have rescued. Paths that fail early
 * leave more room to adapt, so they are weighted higher. Nothing is re-simulated.
 */
@Service
@Slf4j
public class GuardrailsEstimator {

    public static final double DEFAULT_SPENDING_REDUCTION = 0.10;

    // Reduction at which the prevention rates apply in full
    private static final double REFERENCE_REDUCTION = 0.10;

    public GuardrailsResult estimate(List<PathSummary> allRuns, Double spendingReduction) {
        if (allRuns == null || allRuns.isEmpty()) {
            throw new InvalidSimulationParametersException("Guardrails estimate needs at least one path summary");
        }

        double reduction = spendingReduction != null ? spendingReduction : DEFAULT_SPENDING_REDUCTION;
        List<PathSummary> failedPaths = allRuns.stream().filter(PathSummary::isRuined).toList();

        if (failedPaths.isEmpty()) {
            log.info("No failed paths among {}, guardrails change nothing", allRuns.size());
            return GuardrailsResult.builder().newSuccessRate(1.0).baselineSuccessRate(1.0).build();
        }

        double effectivenessScale = Math.min(1.0, reduction / REFERENCE_REDUCTION);
        double preventable = failedPaths.stream()
                .mapToDouble(path -> preventionRate(path.getSurvivalYears()) * effectivenessScale)
                .sum();

        int totalPaths = allRuns.size();
        double baselineSuccessRate = (double) (totalPaths - failedPaths.size()) / totalPaths;
        double newSuccessRate = (totalPaths - failedPaths.size() + preventable) / totalPaths;

        GuardrailsResult result = GuardrailsResult.builder()
                .totalFailures(failedPaths.size())
                .preventableFailures((int) Math.round(preventable))
                .baselineSuccessRate(baselineSuccessRate)
                .newSuccessRate(newSuccessRate)
                .improvement(newSuccessRate - baselineSuccessRate)
                .build();
        log.info("Guardrails at {}% reduction: {}", reduction * 100, result);
        return result;
    }

    static double preventionRate(int survivalYears) {
        if (survivalYears <= 5) {
            return 0.75;
        } else if (survivalYears <= 10) {
            return 0.65;
        } else if (survivalYears <= 15) {
            return 0.45;
        } else if (survivalYears <= 20) {
            return 0.30;
        } else if (survivalYears <= 25) {
            return 0.15;
        }
        return 0.05;
    }
}
