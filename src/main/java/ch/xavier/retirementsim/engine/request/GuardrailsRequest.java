package ch.xavier.retirementsim.engine.request;

import ch.xavier.retirementsim.simulation.model.PathSummary;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Path summaries from an earlier {@code run}, sent back by the host.
 */
@Getter
@ToString(exclude = "allRuns")
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GuardrailsRequest implements EngineRequest {
    private final List<PathSummary> allRuns;

    // Fraction of spending cut in bad years, 0.10 when absent
    private final Double spendingReduction;
}
