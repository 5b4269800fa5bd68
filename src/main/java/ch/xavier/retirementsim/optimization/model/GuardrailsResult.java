package ch.xavier.retirementsim.optimization.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class GuardrailsResult {
    private final int totalFailures;
    private final int preventableFailures;
    private final double newSuccessRate;
    private final double baselineSuccessRate;
    private final double improvement;
}
