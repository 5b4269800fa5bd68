package ch.xavier.retirementsim.simulation.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Per-year trimmed percentiles of a balance trajectory across all paths of a batch.
 */
@Builder
@Getter
public class PercentileBands {
    private final double[] p10;
    private final double[] p25;
    private final double[] p50;
    private final double[] p75;
    private final double[] p90;
}
