package ch.xavier.retirementsim.engine.message;

import ch.xavier.retirementsim.legacy.model.LegacyResult;
import ch.xavier.retirementsim.optimization.model.GuardrailsResult;
import ch.xavier.retirementsim.optimization.model.OptimizationResult;
import ch.xavier.retirementsim.optimization.model.RothConversionResult;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import lombok.Getter;

/**
 * The single successful answer to a request, typed by what produced it.
 */
@Getter
public class ResultMessage<T> extends EngineMessage {
    private final T result;

    private ResultMessage(String type, T result) {
        super(type);
        this.result = result;
    }

    public static ResultMessage<BatchResult> complete(BatchResult result) {
        return new ResultMessage<>("complete", result);
    }

    public static ResultMessage<LegacyResult> legacyComplete(LegacyResult result) {
        return new ResultMessage<>("legacy-complete", result);
    }

    public static ResultMessage<GuardrailsResult> guardrailsComplete(GuardrailsResult result) {
        return new ResultMessage<>("guardrails-complete", result);
    }

    public static ResultMessage<RothConversionResult> rothOptimizerComplete(RothConversionResult result) {
        return new ResultMessage<>("roth-optimizer-complete", result);
    }

    public static ResultMessage<OptimizationResult> optimizeComplete(OptimizationResult result) {
        return new ResultMessage<>("optimize-complete", result);
    }

    @Override
    public String toString() {
        return "ResultMessage(" + getType() + ")";
    }
}
